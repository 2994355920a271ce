package works.tagtree.mapper.types;

/**
 * The structural category that decides how a value is mapped.
 * Computed once per type by {@link TypeDescriptor}.
 */
public enum Shape {
	/**
	 * A {@link works.tagtree.tags.Tag Tag}, passed through unchanged.
	 */
	ALREADY_TAG,

	/**
	 * A value with a direct tag representation; see {@link ScalarKind}.
	 */
	SCALAR,

	/**
	 * A {@link java.util.Collection Collection} or a non-scalar array, mapped to a list tag.
	 */
	SEQUENCE,

	/**
	 * A {@link java.util.Map Map} with string keys, mapped to a compound tag.
	 */
	MAPPING,

	/**
	 * Any other type, mapped member by member to a compound tag.
	 */
	RECORD,

	/**
	 * A declared type of {@link Object} (or a type variable bounded only by it).
	 * Deserializing yields the natural Java value of whatever tag is found.
	 */
	UNTYPED,
}
