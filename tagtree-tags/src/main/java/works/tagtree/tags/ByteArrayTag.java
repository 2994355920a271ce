package works.tagtree.tags;

import java.util.Arrays;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Holds a {@code byte[]} without copying it; callers that share the array share its contents.
 */
public final class ByteArrayTag extends ScalarTag {
	private final byte[] value;

	public ByteArrayTag(byte[] value) {
		this(null, value);
	}

	public ByteArrayTag(@Nullable String name, byte[] value) {
		super(name);
		this.value = requireNonNull(value, "value");
	}

	public byte[] getValue() {
		return value;
	}

	@Override
	public byte[] value() {
		return value;
	}

	@Override
	public ByteArrayTag copy() {
		return new ByteArrayTag(getName(), value.clone());
	}

	@Override
	public TagType tagType() {
		return TagType.BYTE_ARRAY;
	}

	@Override
	void appendValue(StringBuilder sb) {
		sb.append("[B;");
		for (int i = 0; i < value.length; i++) {
			if (i > 0) {
				sb.append(',');
			}
			sb.append(value[i]).append('b');
		}
		sb.append(']');
	}

	@Override
	boolean valueEquals(Tag other) {
		return Arrays.equals(value, ((ByteArrayTag) other).value);
	}

	@Override
	int valueHashCode() {
		return Arrays.hashCode(value);
	}
}
