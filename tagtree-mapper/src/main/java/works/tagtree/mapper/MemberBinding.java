package works.tagtree.mapper;

import java.lang.reflect.Type;
import org.jetbrains.annotations.Nullable;
import works.tagtree.mapper.types.TypeDescriptor;

import static java.util.Objects.requireNonNull;

/**
 * One mappable member of a type, as selected by {@link MemberSelector}
 * or registered through {@link TypeMapping.Builder}.
 *
 * @param memberName the member's name in Java, for diagnostics
 * @param exportedName the name of the member's tag within the enclosing compound
 * @param hideDefault if true, a value equal to the default for its scalar kind produces no tag
 * @param declaredType the member's declared (generic) type, which governs deserialization
 * @param reader returns the member's value given the enclosing instance (ignored for static members)
 * @param writer assigns the member's value, or null if the member can only be populated in place
 */
public record MemberBinding(
	String memberName,
	String exportedName,
	boolean hideDefault,
	Type declaredType,
	Reader reader,
	@Nullable Writer writer
) {
	public MemberBinding {
		requireNonNull(memberName);
		requireNonNull(exportedName);
		requireNonNull(declaredType);
		requireNonNull(reader);
		if (exportedName.isEmpty()) {
			throw new IllegalArgumentException("Exported name of " + memberName + " must not be empty");
		}
	}

	@FunctionalInterface
	public interface Reader {
		@Nullable Object read(@Nullable Object instance);
	}

	@FunctionalInterface
	public interface Writer {
		void write(@Nullable Object instance, @Nullable Object value);
	}

	public MemberCapability capability() {
		return (writer == null) ? MemberCapability.IN_PLACE_ONLY : MemberCapability.REPLACEABLE;
	}

	public TypeDescriptor declaredDescriptor() {
		return TypeDescriptor.of(declaredType);
	}

	/**
	 * @param owner the possibly parameterized type of the instance holding this member,
	 *              which binds any type variables that remain in {@link #declaredType()}
	 */
	public TypeDescriptor declaredDescriptor(Type owner) {
		if (owner instanceof Class<?>) {
			return declaredDescriptor();
		}
		return TypeDescriptor.of(TypeDescriptor.resolve(declaredType, owner));
	}
}
