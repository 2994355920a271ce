package works.tagtree.mapper.exceptions;

/**
 * The object graph contains a cycle, or nesting exceeded
 * {@link works.tagtree.mapper.TagMapperSettings#getMaxDepth() maxDepth}.
 */
public final class TagRecursionException extends TagMappingException {
	public TagRecursionException(String message) {
		super(message);
	}

	public TagRecursionException(String message, Throwable cause) {
		super(message, cause);
	}
}
