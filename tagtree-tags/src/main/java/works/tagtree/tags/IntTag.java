package works.tagtree.tags;

import org.jetbrains.annotations.Nullable;

public final class IntTag extends ScalarTag {
	private final int value;

	public IntTag(int value) {
		this(null, value);
	}

	public IntTag(@Nullable String name, int value) {
		super(name);
		this.value = value;
	}

	public int getValue() {
		return value;
	}

	@Override
	public Integer value() {
		return value;
	}

	@Override
	public IntTag copy() {
		return new IntTag(getName(), value);
	}

	@Override
	public TagType tagType() {
		return TagType.INT;
	}

	@Override
	void appendValue(StringBuilder sb) {
		sb.append(value);
	}
}
