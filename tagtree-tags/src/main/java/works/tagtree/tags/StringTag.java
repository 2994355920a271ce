package works.tagtree.tags;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

public final class StringTag extends ScalarTag {
	private final @NotNull String value;

	public StringTag(String value) {
		this(null, value);
	}

	public StringTag(@Nullable String name, String value) {
		super(name);
		this.value = requireNonNull(value, "value");
	}

	public String getValue() {
		return value;
	}

	@Override
	public String value() {
		return value;
	}

	@Override
	public StringTag copy() {
		return new StringTag(getName(), value);
	}

	@Override
	public TagType tagType() {
		return TagType.STRING;
	}

	@Override
	void appendValue(StringBuilder sb) {
		appendQuoted(sb, value);
	}
}
