package works.tagtree.tags;

import org.jetbrains.annotations.Nullable;

public final class FloatTag extends ScalarTag {
	private final float value;

	public FloatTag(float value) {
		this(null, value);
	}

	public FloatTag(@Nullable String name, float value) {
		super(name);
		this.value = value;
	}

	public float getValue() {
		return value;
	}

	@Override
	public Float value() {
		return value;
	}

	@Override
	public FloatTag copy() {
		return new FloatTag(getName(), value);
	}

	@Override
	public TagType tagType() {
		return TagType.FLOAT;
	}

	@Override
	void appendValue(StringBuilder sb) {
		sb.append(value).append('f');
	}
}
