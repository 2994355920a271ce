package works.tagtree.mapper;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tagtree.mapper.TypeMapping.Canonical;
import works.tagtree.mapper.TypeMapping.Factory;
import works.tagtree.mapper.TypeMapping.Instantiator;
import works.tagtree.mapper.TypeMapping.Unavailable;
import works.tagtree.mapper.exceptions.InvalidMappingException;
import works.tagtree.mapper.exceptions.TagMappingException;
import works.tagtree.mapper.exceptions.TagTypeMismatchException;
import works.tagtree.mapper.types.ScalarKind;
import works.tagtree.mapper.types.Shape;
import works.tagtree.mapper.types.TypeDescriptor;
import works.tagtree.tags.CompoundTag;
import works.tagtree.tags.ListTag;
import works.tagtree.tags.ScalarTag;
import works.tagtree.tags.Tag;

/**
 * Converts tags to objects, either creating new ones or filling existing ones in place.
 * <p>
 * Members whose tags are absent are left alone.
 * A tag whose kind is incompatible with the type it must become
 * aborts the whole operation with a {@link TagTypeMismatchException}.
 */
final class TreeDeserializer {
	private final MemberSelector selector;
	private final CollectionAdapter collections;

	TreeDeserializer(MemberSelector selector, CollectionAdapter collections) {
		this.selector = selector;
		this.collections = collections;
	}

	/**
	 * @return a new value of the {@code target} type built from {@code tag}
	 */
	@Nullable Object deserialize(TypeDescriptor target, Tag tag, WalkContext context) {
		switch (target.shape()) {
			case ALREADY_TAG: {
				if (!target.rawClass().isInstance(tag)) {
					throw new TagTypeMismatchException("Expected " + target.rawClass().getSimpleName() + " but found " + tag.tagType() + " tag at " + context.path());
				}
				// Copied so the caller's tree keeps its names
				Tag result = tag.copy();
				result.setName(null);
				return result;
			}
			case SCALAR:
				return deserializeScalar(target, tag, context);
			case SEQUENCE:
				return collections.sequenceFromTag(target, tag, context, (t, child) -> deserialize(t, child, context));
			case MAPPING:
				return collections.mappingFromTag(target, tag, context, (t, child) -> deserialize(t, child, context));
			case RECORD:
				return deserializeRecord(target, tag, context);
			default:
				return naturalValue(tag);
		}
	}

	/**
	 * Populates {@code existing} from {@code tag} without replacing it.
	 * Scalars have no structure to populate, so filling them does nothing.
	 *
	 * @param declared the static type through which {@code existing} was reached
	 */
	void fill(Object existing, TypeDescriptor declared, Tag tag, WalkContext context) {
		TypeDescriptor actual = TypeDescriptor.ofValue(existing);
		switch (actual.shape()) {
			case SEQUENCE:
				collections.fillSequence(existing, matching(declared, actual), tag, context, (t, child) -> deserialize(t, child, context));
				break;
			case MAPPING: {
				@SuppressWarnings("unchecked")
				Map<Object, Object> map = (Map<Object, Object>) existing;
				collections.fillMapping(map, matching(declared, actual), tag, context, (t, child) -> deserialize(t, child, context));
				break;
			}
			case RECORD:
				populateMembers(existing, TypeDescriptor.ownerType(declared, actual), expectCompound(tag, actual, context), context);
				break;
			default:
				LOGGER.trace("Nothing to fill for {} at {}", actual, context.path());
		}
	}

	private Object deserializeScalar(TypeDescriptor target, Tag tag, WalkContext context) {
		ScalarKind kind = requireScalarKind(target);
		try {
			return ScalarCoercion.fromTag(tag, kind);
		} catch (TagTypeMismatchException e) {
			throw TagMappingException.wrap(e, "At " + context.path());
		}
	}

	private Object deserializeRecord(TypeDescriptor target, Tag tag, WalkContext context) {
		CompoundTag compound = expectCompound(tag, target, context);
		TypeMapping mapping = selector.mappingFor(target.rawClass());
		Instantiator instantiator = mapping.instantiator();
		if (instantiator instanceof Factory f) {
			Object result = f.supplier().get();
			populateMembers(result, target.type(), compound, context);
			return result;
		} else if (instantiator instanceof Canonical c) {
			return construct(mapping, c, target.type(), compound, context);
		} else {
			throw new InvalidMappingException("Cannot deserialize " + target + " at " + context.path() + ": " + ((Unavailable) instantiator).reason());
		}
	}

	/**
	 * Assigns each member whose tag is present in {@code compound}.
	 * Members that can't be assigned are filled in place from their current value instead.
	 *
	 * @param owner the type of {@code instance}, possibly parameterized, against which member types are resolved
	 */
	private void populateMembers(Object instance, Type owner, CompoundTag compound, WalkContext context) {
		TypeMapping mapping = selector.mappingFor(instance.getClass());
		for (MemberBinding member : mapping.members()) {
			Tag child = compound.get(member.exportedName());
			if (child == null) {
				continue;
			}
			context.enter(member.exportedName());
			try {
				switch (member.capability()) {
					case REPLACEABLE:
						requireWriter(member).write(instance, deserialize(member.declaredDescriptor(owner), child, context));
						break;
					case IN_PLACE_ONLY: {
						Object current = member.reader().read(instance);
						if (current == null) {
							LOGGER.trace("Skipping in-place member {} at {}: current value is null", member.memberName(), context.path());
						} else {
							fill(current, member.declaredDescriptor(owner), child, context);
						}
						break;
					}
				}
			} finally {
				context.exit();
			}
		}
	}

	private Object construct(TypeMapping mapping, Canonical canonical, Type owner, CompoundTag compound, WalkContext context) {
		List<Class<?>> componentTypes = canonical.componentTypes();
		Object[] arguments = new Object[componentTypes.size()];
		for (int i = 0; i < arguments.length; i++) {
			arguments[i] = defaultValueOf(componentTypes.get(i));
		}
		for (MemberBinding member : mapping.members()) {
			Tag child = compound.get(member.exportedName());
			if (child == null) {
				continue;
			}
			int index = canonical.componentIndexes().get(member.memberName());
			context.enter(member.exportedName());
			try {
				Object value = deserialize(member.declaredDescriptor(owner), child, context);
				if (value != null || !componentTypes.get(index).isPrimitive()) {
					arguments[index] = value;
				}
			} finally {
				context.exit();
			}
		}
		try {
			return canonical.constructor().invokeWithArguments(arguments);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Unable to construct " + mapping.type().getSimpleName() + " at " + context.path(), e);
		}
	}

	private static @Nullable Object defaultValueOf(Class<?> type) {
		if (type.isPrimitive()) {
			return requireScalarKind(TypeDescriptor.of(type)).defaultValue();
		}
		return null;
	}

	/**
	 * For an {@link Shape#UNTYPED UNTYPED} target, the closest Java equivalent of whatever tag is found.
	 */
	private static Object naturalValue(Tag tag) {
		if (tag instanceof ScalarTag s) {
			return s.value();
		} else if (tag instanceof ListTag list) {
			List<Object> result = new ArrayList<>(list.size());
			for (Tag child : list) {
				result.add(naturalValue(child));
			}
			return result;
		} else {
			Map<String, Object> result = new LinkedHashMap<>();
			CompoundTag compound = (CompoundTag) tag;
			for (String key : compound.names()) {
				result.put(key, naturalValue(compound.get(key)));
			}
			return result;
		}
	}

	private static TypeDescriptor matching(TypeDescriptor declared, TypeDescriptor actual) {
		return (declared.shape() == actual.shape()) ? declared : actual;
	}

	private static ScalarKind requireScalarKind(TypeDescriptor target) {
		ScalarKind kind = target.scalarKind();
		if (kind == null) {
			throw new IllegalStateException("Not a scalar type: " + target);
		}
		return kind;
	}

	private static MemberBinding.Writer requireWriter(MemberBinding member) {
		MemberBinding.Writer writer = member.writer();
		if (writer == null) {
			throw new IllegalStateException("Member " + member.memberName() + " is not replaceable");
		}
		return writer;
	}

	private static CompoundTag expectCompound(Tag tag, TypeDescriptor target, WalkContext context) {
		if (tag instanceof CompoundTag compound) {
			return compound;
		}
		throw new TagTypeMismatchException("Expected COMPOUND tag for " + target + " but found " + tag.tagType() + " tag at " + context.path());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeDeserializer.class);
}
