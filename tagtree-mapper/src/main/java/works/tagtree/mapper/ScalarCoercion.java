package works.tagtree.mapper;

import org.jetbrains.annotations.Nullable;
import works.tagtree.mapper.exceptions.TagTypeMismatchException;
import works.tagtree.mapper.types.ScalarKind;
import works.tagtree.tags.ScalarTag;
import works.tagtree.tags.Tag;

/**
 * Converts between scalar values and scalar tags according to {@link ScalarKind}.
 */
public final class ScalarCoercion {
	private ScalarCoercion() { }

	/**
	 * @return a tag for {@code value}, or null if its runtime class has no scalar representation,
	 * in which case the caller should try collection or record handling instead
	 */
	public static @Nullable ScalarTag toTag(@Nullable String name, Object value) {
		ScalarKind kind = ScalarKind.forClass(value.getClass());
		if (kind == null) {
			return null;
		}
		return kind.toTag(name, value);
	}

	/**
	 * Interprets the stored value of {@code tag} as the given kind.
	 * Kinds sharing a storage type reinterpret the same bits;
	 * for example, a short tag holding {@code -1} reads as the character {@code 0xFFFF} for {@link ScalarKind#CHAR CHAR}.
	 *
	 * @throws TagTypeMismatchException if {@code tag} is not of the kind's storage type
	 */
	public static Object fromTag(Tag tag, ScalarKind kind) {
		if (tag.tagType() != kind.storage()) {
			throw new TagTypeMismatchException("Expected " + kind.storage() + " tag for " + kind + " but found " + tag.tagType() + " tag " + tag);
		}
		return kind.fromTag((ScalarTag) tag);
	}
}
