package works.tagtree.mapper.types;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Captures a generic type for deserialization:
 * {@code new TypeReference<List<Item>>() {}}.
 */
@SuppressWarnings("unused") // The type parameter is used only via reflection
public abstract class TypeReference<T> {
	protected TypeReference() {
		if (!(getClass().getGenericSuperclass() instanceof ParameterizedType)) {
			throw new IllegalStateException("TypeReference must be created with an actual type argument");
		}
	}

	public Type reflectionType() {
		return ((ParameterizedType) getClass()
			.getGenericSuperclass()).getActualTypeArguments()[0];
	}
}
