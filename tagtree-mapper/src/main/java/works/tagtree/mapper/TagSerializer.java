package works.tagtree.mapper;

import works.tagtree.mapper.types.TypeReference;
import works.tagtree.tags.CompoundTag;
import works.tagtree.tags.Tag;

/**
 * Static shortcuts to a shared {@link TagMapper} with {@link TagMapperSettings#defaults() default settings}
 * and no registered mappings.
 * Use a {@link TagMapper} directly for anything else.
 */
public final class TagSerializer {
	private TagSerializer() { }

	private static final TagMapper MAPPER = TagMapper.withDefaults();

	/**
	 * @see TagMapper#serializeObject
	 */
	public static CompoundTag serializeObject(Object value) {
		return MAPPER.serializeObject(value);
	}

	/**
	 * @see TagMapper#deserializeObject(Class, Tag)
	 */
	public static <T> T deserializeObject(Class<T> type, Tag tag) {
		return MAPPER.deserializeObject(type, tag);
	}

	public static <T> T deserializeObject(TypeReference<T> type, Tag tag) {
		return MAPPER.deserializeObject(type, tag);
	}

	/**
	 * @see TagMapper#fillObject
	 */
	public static <T> void fillObject(T value, Tag tag) {
		MAPPER.fillObject(value, tag);
	}

	public static <T> void fillObject(TypeReference<T> type, T value, Tag tag) {
		MAPPER.fillObject(type, value, tag);
	}
}
