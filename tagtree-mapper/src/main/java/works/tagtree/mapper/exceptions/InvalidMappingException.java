package works.tagtree.mapper.exceptions;

/**
 * A type or member cannot take part in mapping as declared:
 * for example, an annotated method that takes parameters,
 * two members exporting the same name,
 * or a type that must be instantiated but has no no-argument constructor.
 */
public final class InvalidMappingException extends TagMappingException {
	public InvalidMappingException(String message) {
		super(message);
	}

	public InvalidMappingException(String message, Throwable cause) {
		super(message, cause);
	}

	public static InvalidMappingException forMember(Class<?> containingClass, String memberName, String message) {
		return new InvalidMappingException("Invalid member " + containingClass.getSimpleName() + "." + memberName + ": " + message);
	}

	public static InvalidMappingException forMember(Class<?> containingClass, String memberName, String message, Throwable cause) {
		return new InvalidMappingException("Invalid member " + containingClass.getSimpleName() + "." + memberName + ": " + message, cause);
	}
}
