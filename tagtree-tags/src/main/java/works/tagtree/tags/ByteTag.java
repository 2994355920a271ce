package works.tagtree.tags;

import org.jetbrains.annotations.Nullable;

public final class ByteTag extends ScalarTag {
	private final byte value;

	public ByteTag(byte value) {
		this(null, value);
	}

	public ByteTag(@Nullable String name, byte value) {
		super(name);
		this.value = value;
	}

	public byte getValue() {
		return value;
	}

	@Override
	public Byte value() {
		return value;
	}

	@Override
	public ByteTag copy() {
		return new ByteTag(getName(), value);
	}

	@Override
	public TagType tagType() {
		return TagType.BYTE;
	}

	@Override
	void appendValue(StringBuilder sb) {
		sb.append(value).append('b');
	}
}
