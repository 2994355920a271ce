package works.tagtree.mapper;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tagtree.mapper.exceptions.TagMappingException;
import works.tagtree.mapper.exceptions.TagTypeMismatchException;
import works.tagtree.mapper.types.ScalarKind;
import works.tagtree.mapper.types.TypeDescriptor;
import works.tagtree.mapper.types.TypeReference;
import works.tagtree.tags.CompoundTag;
import works.tagtree.tags.Tag;

import static java.util.Arrays.asList;
import static java.util.Objects.requireNonNull;

/**
 * Converts objects to and from tag trees.
 * <p>
 * Only members annotated with {@link works.tagtree.annotations.TagProperty TagProperty},
 * or listed in a {@link #builder() registered} {@link TypeMapping}, take part.
 * Each member's tag is named after the member, or after the annotation's explicit name.
 * Values with no tag representation (nulls, empty collections, records with nothing to say)
 * are omitted from their parent rather than causing an error.
 * <p>
 * Members of a {@link Tag} type pass through unconverted, but as copies:
 * the tags held by the caller's objects and the trees passed in keep their names.
 * <p>
 * Instances are immutable and safe to share between threads.
 * Per-type reflection results are computed once and cached.
 */
public final class TagMapper {
	private final TagMapperSettings settings;
	private final TreeSerializer serializer;
	private final TreeDeserializer deserializer;

	private TagMapper(TagMapperSettings settings, MemberSelector selector) {
		this.settings = settings;
		CollectionAdapter collections = new CollectionAdapter();
		this.serializer = new TreeSerializer(selector, collections);
		this.deserializer = new TreeDeserializer(selector, collections);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static TagMapper withDefaults() {
		return builder().build();
	}

	public TagMapperSettings settings() {
		return settings;
	}

	/**
	 * @return an unnamed compound holding the mapped members of {@code value};
	 * empty if none of them produced a tag
	 * @throws TagTypeMismatchException if {@code value} maps to something other than a compound,
	 * such as a scalar or a list
	 */
	public @NotNull CompoundTag serializeObject(Object value) {
		requireNonNull(value, "value");
		LOGGER.debug("Serializing {}", value.getClass().getName());
		Tag result;
		try {
			result = serializer.serialize(null, value, TypeDescriptor.ofValue(value), newContext());
		} catch (TagMappingException e) {
			throw TagMappingException.wrap(e, "Unable to serialize " + value.getClass().getSimpleName());
		}
		if (result == null) {
			LOGGER.debug("{} produced no tag; returning empty compound", value.getClass().getSimpleName());
			return new CompoundTag();
		} else if (result instanceof CompoundTag compound) {
			return compound;
		} else {
			throw new TagTypeMismatchException("Unable to serialize " + value.getClass().getSimpleName()
				+ ": expected a COMPOUND tag but produced " + result.tagType());
		}
	}

	public <T> T deserializeObject(Class<T> type, Tag tag) {
		requireNonNull(type, "type");
		@SuppressWarnings("unchecked")
		T result = (T) deserialize(TypeDescriptor.of(type), tag);
		return result;
	}

	/**
	 * For generic targets: {@code deserializeObject(new TypeReference<List<Item>>() {}, tag)}.
	 */
	public <T> T deserializeObject(TypeReference<T> type, Tag tag) {
		requireNonNull(type, "type");
		@SuppressWarnings("unchecked")
		T result = (T) deserialize(TypeDescriptor.of(type), tag);
		return result;
	}

	private Object deserialize(TypeDescriptor target, Tag tag) {
		requireNonNull(tag, "tag");
		LOGGER.debug("Deserializing {} from {} tag", target, tag.tagType());
		try {
			return deserializer.deserialize(target, tag, newContext());
		} catch (TagMappingException e) {
			throw TagMappingException.wrap(e, "Unable to deserialize " + target.type().getTypeName());
		}
	}

	/**
	 * Populates {@code value} from {@code tag} in place.
	 * Members are assigned where possible;
	 * members that can't be assigned are themselves filled in place.
	 * Members absent from {@code tag} are left unchanged.
	 *
	 * @throws IllegalArgumentException if {@code value} is a scalar such as a boxed number or string,
	 * which has no state to populate
	 */
	public <T> void fillObject(T value, Tag tag) {
		requireNonNull(value, "value");
		fill(TypeDescriptor.ofValue(value), value, tag);
	}

	/**
	 * Like {@link #fillObject(Object, Tag)}, for values whose runtime class has lost type arguments
	 * that determine how their contents are deserialized:
	 * {@code fillObject(new TypeReference<List<Item>>() {}, items, tag)}.
	 *
	 * @throws IllegalArgumentException if {@code value} is not an instance of {@code type}
	 */
	public <T> void fillObject(TypeReference<T> type, T value, Tag tag) {
		requireNonNull(type, "type");
		requireNonNull(value, "value");
		TypeDescriptor declared = TypeDescriptor.of(type);
		if (!declared.rawClass().isInstance(value)) {
			throw new IllegalArgumentException("Cannot fill " + value.getClass().getSimpleName() + " as " + declared.type().getTypeName());
		}
		fill(declared, value, tag);
	}

	private void fill(TypeDescriptor declared, Object value, Tag tag) {
		requireNonNull(tag, "tag");
		if (ScalarKind.forClass(value.getClass()) != null) {
			throw new IllegalArgumentException("Cannot fill scalar value of " + value.getClass().getSimpleName());
		}
		LOGGER.debug("Filling {} from {} tag", declared.type().getTypeName(), tag.tagType());
		try {
			deserializer.fill(value, declared, tag, newContext());
		} catch (TagMappingException e) {
			throw TagMappingException.wrap(e, "Unable to fill " + value.getClass().getSimpleName());
		}
	}

	private WalkContext newContext() {
		return new WalkContext(settings);
	}

	public static final class Builder {
		private TagMapperSettings settings = TagMapperSettings.defaults();
		private final List<TypeMapping> registered = new ArrayList<>();

		private Builder() { }

		public Builder settings(TagMapperSettings settings) {
			this.settings = requireNonNull(settings);
			return this;
		}

		/**
		 * Use these mappings instead of scanning their types for annotations.
		 */
		public Builder register(TypeMapping... mappings) {
			registered.addAll(asList(mappings));
			return this;
		}

		/**
		 * @throws IllegalArgumentException if the settings are invalid,
		 * or if more than one mapping is registered for the same type
		 */
		public TagMapper build() {
			settings.validate();
			return new TagMapper(settings, new MemberSelector(registered));
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TagMapper.class);
}
