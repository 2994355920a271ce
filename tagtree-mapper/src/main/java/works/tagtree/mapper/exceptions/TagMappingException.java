package works.tagtree.mapper.exceptions;

/**
 * Base of the exceptions that abort a mapping operation.
 * <p>
 * Values that merely have no tag representation are not errors:
 * they produce no tag and are omitted from their parent.
 */
public sealed abstract class TagMappingException extends RuntimeException permits
	InvalidMappingException,
	TagRecursionException,
	TagTypeMismatchException
{
	protected TagMappingException(String message) {
		super(message);
	}

	protected TagMappingException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return an exception of the same type as {@code exception}
	 * whose message is prefixed by {@code context}
	 */
	@SuppressWarnings("unchecked")
	public static <T extends TagMappingException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		if (exception instanceof TagTypeMismatchException) {
			return (T) new TagTypeMismatchException(newMessage, exception);
		} else if (exception instanceof InvalidMappingException) {
			return (T) new InvalidMappingException(newMessage, exception);
		} else {
			return (T) new TagRecursionException(newMessage, exception);
		}
	}
}
