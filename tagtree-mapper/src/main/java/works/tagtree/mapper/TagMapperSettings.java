package works.tagtree.mapper;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TagMapperSettings {
	/**
	 * The deepest nesting of records, collections, and tags that any one operation will follow.
	 * Exceeding it throws {@link works.tagtree.mapper.exceptions.TagRecursionException TagRecursionException}
	 * rather than overflowing the stack.
	 */
	@Default int maxDepth = 512;

	/**
	 * When serializing, throw {@link works.tagtree.mapper.exceptions.TagRecursionException TagRecursionException}
	 * as soon as an object is encountered inside itself.
	 * Without this, cyclic graphs are caught only by {@link #maxDepth}.
	 */
	@Default boolean detectCycles = true;

	/**
	 * Empty sequences and mappings produce no tag, so their members are omitted entirely.
	 * When false, they produce empty list and compound tags instead.
	 */
	@Default boolean omitEmptyCollections = true;

	public static TagMapperSettings defaults() {
		return DEFAULTS;
	}

	public void validate() {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
	}

	private static final TagMapperSettings DEFAULTS = TagMapperSettings.builder().build();
}
