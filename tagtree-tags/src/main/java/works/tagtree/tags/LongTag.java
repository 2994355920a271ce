package works.tagtree.tags;

import org.jetbrains.annotations.Nullable;

public final class LongTag extends ScalarTag {
	private final long value;

	public LongTag(long value) {
		this(null, value);
	}

	public LongTag(@Nullable String name, long value) {
		super(name);
		this.value = value;
	}

	public long getValue() {
		return value;
	}

	@Override
	public Long value() {
		return value;
	}

	@Override
	public LongTag copy() {
		return new LongTag(getName(), value);
	}

	@Override
	public TagType tagType() {
		return TagType.LONG;
	}

	@Override
	void appendValue(StringBuilder sb) {
		sb.append(value).append('L');
	}
}
