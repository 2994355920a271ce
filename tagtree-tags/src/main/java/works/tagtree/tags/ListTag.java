package works.tagtree.tags;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableList;

/**
 * A tag holding an ordered sequence of unnamed children.
 * Children are expected to share a {@link TagType}, though this is not enforced.
 */
public final class ListTag extends Tag implements Iterable<Tag> {
	private final List<Tag> children = new ArrayList<>();

	public ListTag() {
		super(null);
	}

	public ListTag(@Nullable String name) {
		super(name);
	}

	@Override
	public TagType tagType() {
		return TagType.LIST;
	}

	/**
	 * @throws IllegalArgumentException if {@code child} is named
	 */
	public ListTag add(Tag child) {
		if (child.getName() != null) {
			throw new IllegalArgumentException("List children must be unnamed: " + child);
		}
		if (child == this) {
			throw new IllegalArgumentException("List cannot contain itself");
		}
		children.add(child);
		return this;
	}

	@Override
	public ListTag copy() {
		ListTag result = new ListTag(getName());
		for (Tag child : children) {
			Tag copy = child.copy();
			copy.setName(null);
			result.add(copy);
		}
		return result;
	}

	public Tag get(int index) {
		return children.get(index);
	}

	public int size() {
		return children.size();
	}

	public boolean isEmpty() {
		return children.isEmpty();
	}

	public List<Tag> children() {
		return unmodifiableList(children);
	}

	@Override
	public @NotNull Iterator<Tag> iterator() {
		return children().iterator();
	}

	@Override
	void appendValue(StringBuilder sb) {
		sb.append('[');
		for (int i = 0; i < children.size(); i++) {
			if (i > 0) {
				sb.append(',');
			}
			children.get(i).appendValue(sb);
		}
		sb.append(']');
	}

	@Override
	boolean valueEquals(Tag other) {
		return children.equals(((ListTag) other).children);
	}

	@Override
	int valueHashCode() {
		return children.hashCode();
	}
}
