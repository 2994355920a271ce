package works.tagtree.tags;

import org.jetbrains.annotations.Nullable;

/**
 * A leaf tag holding exactly one typed value.
 */
public sealed abstract class ScalarTag extends Tag permits
	ByteTag,
	ShortTag,
	IntTag,
	LongTag,
	FloatTag,
	DoubleTag,
	StringTag,
	ByteArrayTag,
	IntArrayTag
{
	protected ScalarTag(@Nullable String name) {
		super(name);
	}

	/**
	 * @return the value, boxed if primitive. Arrays are returned without copying.
	 */
	public abstract Object value();

	@Override
	public abstract ScalarTag copy();

	@Override
	boolean valueEquals(Tag other) {
		return value().equals(((ScalarTag) other).value());
	}

	@Override
	int valueHashCode() {
		return value().hashCode();
	}
}
