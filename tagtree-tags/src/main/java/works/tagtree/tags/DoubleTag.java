package works.tagtree.tags;

import org.jetbrains.annotations.Nullable;

public final class DoubleTag extends ScalarTag {
	private final double value;

	public DoubleTag(double value) {
		this(null, value);
	}

	public DoubleTag(@Nullable String name, double value) {
		super(name);
		this.value = value;
	}

	public double getValue() {
		return value;
	}

	@Override
	public Double value() {
		return value;
	}

	@Override
	public DoubleTag copy() {
		return new DoubleTag(getName(), value);
	}

	@Override
	public TagType tagType() {
		return TagType.DOUBLE;
	}

	@Override
	void appendValue(StringBuilder sb) {
		sb.append(value).append('d');
	}
}
