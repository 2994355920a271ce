package works.tagtree.tags;

import org.jetbrains.annotations.Nullable;

public final class ShortTag extends ScalarTag {
	private final short value;

	public ShortTag(short value) {
		this(null, value);
	}

	public ShortTag(@Nullable String name, short value) {
		super(name);
		this.value = value;
	}

	public short getValue() {
		return value;
	}

	@Override
	public Short value() {
		return value;
	}

	@Override
	public ShortTag copy() {
		return new ShortTag(getName(), value);
	}

	@Override
	public TagType tagType() {
		return TagType.SHORT;
	}

	@Override
	void appendValue(StringBuilder sb) {
		sb.append(value).append('s');
	}
}
