package works.tagtree.mapper.types;

import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.tagtree.tags.ByteArrayTag;
import works.tagtree.tags.ByteTag;
import works.tagtree.tags.DoubleTag;
import works.tagtree.tags.FloatTag;
import works.tagtree.tags.IntArrayTag;
import works.tagtree.tags.IntTag;
import works.tagtree.tags.LongTag;
import works.tagtree.tags.ScalarTag;
import works.tagtree.tags.ShortTag;
import works.tagtree.tags.StringTag;
import works.tagtree.tags.TagType;

/**
 * The Java value kinds that have a direct scalar tag representation.
 * <p>
 * Several kinds may share one {@link #storage() storage} tag type;
 * the kind of the destination decides how the stored bits are interpreted.
 * In particular, {@link #CHAR} is Java's unsigned 16-bit kind
 * and shares {@link ShortTag} storage with the signed {@link #SHORT}.
 */
public enum ScalarKind {
	BOOLEAN(boolean.class, Boolean.class, TagType.BYTE, false) {
		@Override
		public ScalarTag toTag(@Nullable String name, Object value) {
			return new ByteTag(name, (Boolean) value ? (byte) 1 : (byte) 0);
		}

		@Override
		public Object fromTag(ScalarTag tag) {
			return ((ByteTag) tag).getValue() != 0;
		}
	},
	BYTE(byte.class, Byte.class, TagType.BYTE, (byte) 0) {
		@Override
		public ScalarTag toTag(@Nullable String name, Object value) {
			return new ByteTag(name, (Byte) value);
		}

		@Override
		public Object fromTag(ScalarTag tag) {
			return ((ByteTag) tag).getValue();
		}
	},
	SHORT(short.class, Short.class, TagType.SHORT, (short) 0) {
		@Override
		public ScalarTag toTag(@Nullable String name, Object value) {
			return new ShortTag(name, (Short) value);
		}

		@Override
		public Object fromTag(ScalarTag tag) {
			return ((ShortTag) tag).getValue();
		}
	},
	CHAR(char.class, Character.class, TagType.SHORT, '\0') {
		@Override
		public ScalarTag toTag(@Nullable String name, Object value) {
			return new ShortTag(name, (short) ((Character) value).charValue());
		}

		@Override
		public Object fromTag(ScalarTag tag) {
			return (char) ((ShortTag) tag).getValue();
		}
	},
	INT(int.class, Integer.class, TagType.INT, 0) {
		@Override
		public ScalarTag toTag(@Nullable String name, Object value) {
			return new IntTag(name, (Integer) value);
		}

		@Override
		public Object fromTag(ScalarTag tag) {
			return ((IntTag) tag).getValue();
		}
	},
	LONG(long.class, Long.class, TagType.LONG, 0L) {
		@Override
		public ScalarTag toTag(@Nullable String name, Object value) {
			return new LongTag(name, (Long) value);
		}

		@Override
		public Object fromTag(ScalarTag tag) {
			return ((LongTag) tag).getValue();
		}
	},
	FLOAT(float.class, Float.class, TagType.FLOAT, 0f) {
		@Override
		public ScalarTag toTag(@Nullable String name, Object value) {
			return new FloatTag(name, (Float) value);
		}

		@Override
		public Object fromTag(ScalarTag tag) {
			return ((FloatTag) tag).getValue();
		}
	},
	DOUBLE(double.class, Double.class, TagType.DOUBLE, 0d) {
		@Override
		public ScalarTag toTag(@Nullable String name, Object value) {
			return new DoubleTag(name, (Double) value);
		}

		@Override
		public Object fromTag(ScalarTag tag) {
			return ((DoubleTag) tag).getValue();
		}
	},
	STRING(null, String.class, TagType.STRING, null) {
		@Override
		public ScalarTag toTag(@Nullable String name, Object value) {
			return new StringTag(name, (String) value);
		}

		@Override
		public Object fromTag(ScalarTag tag) {
			return ((StringTag) tag).getValue();
		}
	},
	BYTE_ARRAY(null, byte[].class, TagType.BYTE_ARRAY, null) {
		@Override
		public ScalarTag toTag(@Nullable String name, Object value) {
			return new ByteArrayTag(name, (byte[]) value);
		}

		@Override
		public Object fromTag(ScalarTag tag) {
			return ((ByteArrayTag) tag).getValue();
		}
	},
	INT_ARRAY(null, int[].class, TagType.INT_ARRAY, null) {
		@Override
		public ScalarTag toTag(@Nullable String name, Object value) {
			return new IntArrayTag(name, (int[]) value);
		}

		@Override
		public Object fromTag(ScalarTag tag) {
			return ((IntArrayTag) tag).getValue();
		}
	};

	private final @Nullable Class<?> primitiveClass;
	private final Class<?> referenceClass;
	private final TagType storage;
	private final @Nullable Object defaultValue;

	ScalarKind(@Nullable Class<?> primitiveClass, Class<?> referenceClass, TagType storage, @Nullable Object defaultValue) {
		this.primitiveClass = primitiveClass;
		this.referenceClass = referenceClass;
		this.storage = storage;
		this.defaultValue = defaultValue;
	}

	/**
	 * @param value must be an instance of {@link #referenceClass()}
	 */
	public abstract ScalarTag toTag(@Nullable String name, Object value);

	/**
	 * @param tag must have {@link #storage()} as its type
	 */
	public abstract Object fromTag(ScalarTag tag);

	public @Nullable Class<?> primitiveClass() {
		return primitiveClass;
	}

	/**
	 * @return the boxed class for primitive kinds; otherwise the value class itself
	 */
	public Class<?> referenceClass() {
		return referenceClass;
	}

	public TagType storage() {
		return storage;
	}

	/**
	 * @return the value that {@link works.tagtree.annotations.TagProperty#hideDefault() hideDefault}
	 * elides, or null if no value of this kind is ever elided
	 */
	public @Nullable Object defaultValue() {
		return defaultValue;
	}

	public boolean isDefault(Object value) {
		return defaultValue != null && defaultValue.equals(value);
	}

	/**
	 * @return the kind for the given primitive, box, or value class; or null if it has no scalar representation
	 */
	public static @Nullable ScalarKind forClass(Class<?> c) {
		return BY_CLASS.get(c);
	}

	private static final Map<Class<?>, ScalarKind> BY_CLASS = new HashMap<>();

	static {
		for (ScalarKind kind : values()) {
			BY_CLASS.put(kind.referenceClass, kind);
			if (kind.primitiveClass != null) {
				BY_CLASS.put(kind.primitiveClass, kind);
			}
		}
	}
}
