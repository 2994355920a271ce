package works.tagtree.tags;

import java.util.Objects;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * One node of a tag tree.
 * <p>
 * A tag's {@link #getName() name} is meaningful only when the tag is a direct child
 * of a {@link CompoundTag}; list children and the root of a tree are normally unnamed.
 * Names are mutable so that a pre-built tag can be embedded under a new name.
 * <p>
 * Equality is structural: two tags are equal if they have the same type, name, and contents.
 */
public sealed abstract class Tag permits CompoundTag, ListTag, ScalarTag {
	private @Nullable String name;

	protected Tag(@Nullable String name) {
		this.name = name;
	}

	public final @Nullable String getName() {
		return name;
	}

	public final void setName(@Nullable String name) {
		this.name = name;
	}

	public abstract TagType tagType();

	/**
	 * @return a deep copy of this tag, with the same name, sharing no mutable state with it
	 */
	public abstract Tag copy();

	/**
	 * Appends the textual form of this tag's value, without its name.
	 */
	abstract void appendValue(StringBuilder sb);

	abstract boolean valueEquals(Tag other);

	abstract int valueHashCode();

	@Override
	public final boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Tag other = (Tag) o;
		return Objects.equals(name, other.name) && valueEquals(other);
	}

	@Override
	public final int hashCode() {
		return 31 * Objects.hashCode(name) + valueHashCode();
	}

	/**
	 * @return a compact SNBT-like rendering, such as {@code score:{a:1,b:2L}}
	 */
	@Override
	public final String toString() {
		StringBuilder sb = new StringBuilder();
		if (name != null) {
			appendKey(sb, name);
			sb.append(':');
		}
		appendValue(sb);
		return sb.toString();
	}

	static void appendKey(StringBuilder sb, String key) {
		if (BARE_KEY.matcher(key).matches()) {
			sb.append(key);
		} else {
			appendQuoted(sb, key);
		}
	}

	static void appendQuoted(StringBuilder sb, String s) {
		sb.append('"');
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				case '\t' -> sb.append("\\t");
				default -> sb.append(c);
			}
		}
		sb.append('"');
	}

	private static final Pattern BARE_KEY = Pattern.compile("[A-Za-z0-9_.+-]+");
}
