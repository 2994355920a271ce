package works.tagtree.tags;

import java.util.Arrays;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Holds an {@code int[]} without copying it; callers that share the array share its contents.
 */
public final class IntArrayTag extends ScalarTag {
	private final int[] value;

	public IntArrayTag(int[] value) {
		this(null, value);
	}

	public IntArrayTag(@Nullable String name, int[] value) {
		super(name);
		this.value = requireNonNull(value, "value");
	}

	public int[] getValue() {
		return value;
	}

	@Override
	public int[] value() {
		return value;
	}

	@Override
	public IntArrayTag copy() {
		return new IntArrayTag(getName(), value.clone());
	}

	@Override
	public TagType tagType() {
		return TagType.INT_ARRAY;
	}

	@Override
	void appendValue(StringBuilder sb) {
		sb.append("[I;");
		for (int i = 0; i < value.length; i++) {
			if (i > 0) {
				sb.append(',');
			}
			sb.append(value[i]);
		}
		sb.append(']');
	}

	@Override
	boolean valueEquals(Tag other) {
		return Arrays.equals(value, ((IntArrayTag) other).value);
	}

	@Override
	int valueHashCode() {
		return Arrays.hashCode(value);
	}
}
