package works.tagtree.mapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import works.tagtree.mapper.exceptions.TagRecursionException;

/**
 * State for a single top-level mapping operation:
 * the path from the root to the current position, and the objects being serialized.
 * Never shared between operations, so concurrent operations don't interfere.
 */
final class WalkContext {
	private final TagMapperSettings settings;
	private final List<String> path = new ArrayList<>();
	private final Set<Object> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());

	WalkContext(TagMapperSettings settings) {
		this.settings = settings;
	}

	TagMapperSettings settings() {
		return settings;
	}

	/**
	 * Descends into a compound child.
	 */
	void enter(String name) {
		push(name);
	}

	/**
	 * Descends into a list element.
	 */
	void enter(int index) {
		push("[" + index + "]");
	}

	void exit() {
		path.remove(path.size() - 1);
	}

	private void push(String segment) {
		path.add(segment);
		if (path.size() > settings.getMaxDepth()) {
			throw new TagRecursionException("Maximum depth of " + settings.getMaxDepth() + " exceeded at " + path());
		}
	}

	/**
	 * Records that {@code value} is being serialized.
	 * Must be balanced by {@link #endValue}.
	 *
	 * @throws TagRecursionException if {@code value} is already being serialized
	 */
	void beginValue(Object value) {
		if (settings.isDetectCycles() && !inProgress.add(value)) {
			throw new TagRecursionException("Cycle detected: " + value.getClass().getSimpleName() + " at " + path() + " contains itself");
		}
	}

	void endValue(Object value) {
		if (settings.isDetectCycles()) {
			inProgress.remove(value);
		}
	}

	/**
	 * @return a description of the current position, like {@code inventory.items[3]}
	 */
	String path() {
		if (path.isEmpty()) {
			return "<root>";
		}
		StringBuilder sb = new StringBuilder();
		for (String segment : path) {
			if (sb.length() > 0 && !segment.startsWith("[")) {
				sb.append('.');
			}
			sb.append(segment);
		}
		return sb.toString();
	}
}
