package works.tagtree.tags;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableCollection;
import static java.util.Collections.unmodifiableSet;

/**
 * A tag holding uniquely named children in insertion order.
 */
public final class CompoundTag extends Tag implements Iterable<Tag> {
	private final Map<String, Tag> children = new LinkedHashMap<>();

	public CompoundTag() {
		super(null);
	}

	public CompoundTag(@Nullable String name) {
		super(name);
	}

	@Override
	public TagType tagType() {
		return TagType.COMPOUND;
	}

	/**
	 * @throws IllegalArgumentException if {@code child} has no name,
	 * or if this compound already has a child with that name
	 */
	public CompoundTag add(Tag child) {
		String childName = child.getName();
		if (childName == null) {
			throw new IllegalArgumentException("Compound children must be named: " + child);
		}
		if (child == this) {
			throw new IllegalArgumentException("Compound cannot contain itself");
		}
		Tag existing = children.putIfAbsent(childName, child);
		if (existing != null) {
			throw new IllegalArgumentException("Compound already contains a child named \"" + childName + "\"");
		}
		return this;
	}

	@Override
	public CompoundTag copy() {
		CompoundTag result = new CompoundTag(getName());
		for (Map.Entry<String, Tag> entry : children.entrySet()) {
			Tag child = entry.getValue().copy();
			child.setName(entry.getKey());
			result.add(child);
		}
		return result;
	}

	public @Nullable Tag get(String childName) {
		return children.get(childName);
	}

	public Optional<Tag> find(String childName) {
		return Optional.ofNullable(children.get(childName));
	}

	public boolean contains(String childName) {
		return children.containsKey(childName);
	}

	public @Nullable Tag remove(String childName) {
		return children.remove(childName);
	}

	public int size() {
		return children.size();
	}

	public boolean isEmpty() {
		return children.isEmpty();
	}

	/**
	 * @return the child names in insertion order
	 */
	public Set<String> names() {
		return unmodifiableSet(children.keySet());
	}

	public Collection<Tag> children() {
		return unmodifiableCollection(children.values());
	}

	@Override
	public @NotNull Iterator<Tag> iterator() {
		return children().iterator();
	}

	@Override
	void appendValue(StringBuilder sb) {
		sb.append('{');
		boolean first = true;
		for (Map.Entry<String, Tag> entry : children.entrySet()) {
			if (!first) {
				sb.append(',');
			}
			first = false;
			appendKey(sb, entry.getKey());
			sb.append(':');
			entry.getValue().appendValue(sb);
		}
		sb.append('}');
	}

	@Override
	boolean valueEquals(Tag other) {
		// Child order is not significant for equality, just as for any map
		return children.equals(((CompoundTag) other).children);
	}

	@Override
	int valueHashCode() {
		return children.hashCode();
	}
}
