package works.tagtree.mapper.exceptions;

/**
 * A tag's kind is incompatible with the type it is being mapped to or from,
 * such as a scalar tag where a record's compound was expected.
 * Indicates that the tag tree and the target type disagree on their schema.
 */
public final class TagTypeMismatchException extends TagMappingException {
	public TagTypeMismatchException(String message) {
		super(message);
	}

	public TagTypeMismatchException(String message, Throwable cause) {
		super(message, cause);
	}
}
