package works.tagtree.mapper;

import java.lang.reflect.Type;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tagtree.mapper.types.ScalarKind;
import works.tagtree.mapper.types.Shape;
import works.tagtree.mapper.types.TypeDescriptor;
import works.tagtree.tags.CompoundTag;
import works.tagtree.tags.Tag;

/**
 * Converts objects to tags.
 * <p>
 * A value that has no tag representation produces null rather than an exception,
 * and its parent simply omits it.
 * This applies transitively: a record whose members all produce null
 * itself produces null.
 */
final class TreeSerializer {
	private final MemberSelector selector;
	private final CollectionAdapter collections;

	TreeSerializer(MemberSelector selector, CollectionAdapter collections) {
		this.selector = selector;
		this.collections = collections;
	}

	/**
	 * @param name the name for the resulting tag, or null for list elements and the root
	 * @param declared the static type through which {@code value} was reached,
	 *                 which supplies collection element types that the runtime class can't
	 * @return the tag, or null if {@code value} has no tag representation
	 */
	@Nullable Tag serialize(@Nullable String name, Object value, TypeDescriptor declared, WalkContext context) {
		TypeDescriptor actual = TypeDescriptor.ofValue(value);
		switch (actual.shape()) {
			case ALREADY_TAG: {
				// Copied so the tag embedded in the caller's object keeps its own name
				Tag tag = ((Tag) value).copy();
				if (name != null) {
					tag.setName(name);
				}
				return tag;
			}
			case SCALAR:
				return ScalarCoercion.toTag(name, value);
			case SEQUENCE: {
				context.beginValue(value);
				try {
					return collections.sequenceToTag(name, value, matching(declared, Shape.SEQUENCE), context,
						(n, v, d) -> serialize(n, v, d, context));
				} finally {
					context.endValue(value);
				}
			}
			case MAPPING: {
				context.beginValue(value);
				try {
					return collections.mappingToTag(name, (Map<?, ?>) value, matching(declared, Shape.MAPPING), context,
						(n, v, d) -> serialize(n, v, d, context));
				} finally {
					context.endValue(value);
				}
			}
			case RECORD: {
				context.beginValue(value);
				try {
					return serializeRecord(name, value, TypeDescriptor.ownerType(declared, actual), context);
				} finally {
					context.endValue(value);
				}
			}
			default:
				// Only a bare Object has this shape, and it has nothing to serialize
				return null;
		}
	}

	private @Nullable Tag serializeRecord(@Nullable String name, Object value, Type owner, WalkContext context) {
		TypeMapping mapping = selector.mappingFor(value.getClass());
		if (mapping.members().isEmpty()) {
			LOGGER.debug("Omitting {} at {}: no mappable members", value.getClass().getName(), context.path());
			return null;
		}
		CompoundTag result = new CompoundTag(name);
		for (MemberBinding member : mapping.members()) {
			Object memberValue = member.reader().read(value);
			if (memberValue == null) {
				LOGGER.trace("Omitting null member {} at {}", member.memberName(), context.path());
				continue;
			}
			if (member.hideDefault() && isDefault(memberValue)) {
				LOGGER.trace("Omitting default member {} at {}", member.memberName(), context.path());
				continue;
			}
			context.enter(member.exportedName());
			try {
				Tag child = serialize(member.exportedName(), memberValue, member.declaredDescriptor(owner), context);
				if (child == null) {
					LOGGER.trace("Omitting member {} at {}: no tag produced", member.memberName(), context.path());
				} else {
					result.add(child);
				}
			} finally {
				context.exit();
			}
		}
		if (result.isEmpty()) {
			LOGGER.trace("Omitting {} at {}: every member was omitted", value.getClass().getSimpleName(), context.path());
			return null;
		}
		return result;
	}

	private static boolean isDefault(Object value) {
		ScalarKind kind = ScalarKind.forClass(value.getClass());
		return kind != null && kind.isDefault(value);
	}

	/**
	 * The declared type is only informative if it has the same shape as the value.
	 * A member declared as {@code Object} holding a list, for instance, has untyped elements.
	 */
	private static TypeDescriptor matching(TypeDescriptor declared, Shape shape) {
		if (declared.shape() == shape) {
			return declared;
		} else {
			return TypeDescriptor.of(Object.class);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeSerializer.class);
}
