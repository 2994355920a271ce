package works.tagtree.mapper.types;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import works.tagtree.tags.Tag;

import static java.util.stream.Collectors.joining;

/**
 * Describes a Java type in the terms the mapper cares about:
 * its {@link Shape}, its {@link ScalarKind} if any,
 * and the element, key, and value types of collections.
 * <p>
 * Generic type arguments are resolved through the supertype hierarchy,
 * so {@code class Names extends ArrayList<String>} has element type {@code String}
 * just as {@code List<String>} does.
 * Arguments that can't be resolved (raw types, free type variables) resolve to {@link Object},
 * which has the {@link Shape#UNTYPED UNTYPED} shape.
 * <p>
 * Instances are cached and safe to share between threads.
 */
public final class TypeDescriptor {
	private final Type type;
	private final Class<?> rawClass;
	private final Shape shape;
	private final @Nullable ScalarKind scalarKind;

	private TypeDescriptor(Type type) {
		this.type = type;
		this.rawClass = erase(type);
		this.scalarKind = ScalarKind.forClass(rawClass);
		this.shape = shapeOf(rawClass, scalarKind);
	}

	public static TypeDescriptor of(Type type) {
		return CACHE.computeIfAbsent(type, TypeDescriptor::new);
	}

	public static TypeDescriptor of(TypeReference<?> ref) {
		return of(ref.reflectionType());
	}

	/**
	 * Describes the runtime class of {@code value}.
	 * Generic arguments are unavailable, so collection elements are {@link Shape#UNTYPED UNTYPED}.
	 */
	public static TypeDescriptor ofValue(Object value) {
		return of(value.getClass());
	}

	private static Shape shapeOf(Class<?> rawClass, @Nullable ScalarKind scalarKind) {
		if (Tag.class.isAssignableFrom(rawClass)) {
			return Shape.ALREADY_TAG;
		} else if (scalarKind != null) {
			return Shape.SCALAR;
		} else if (rawClass.isArray() || Collection.class.isAssignableFrom(rawClass)) {
			return Shape.SEQUENCE;
		} else if (Map.class.isAssignableFrom(rawClass)) {
			return Shape.MAPPING;
		} else if (rawClass == Object.class) {
			return Shape.UNTYPED;
		} else {
			return Shape.RECORD;
		}
	}

	public Type type() {
		return type;
	}

	public Class<?> rawClass() {
		return rawClass;
	}

	public Shape shape() {
		return shape;
	}

	/**
	 * @return the scalar kind, or null unless this has the {@link Shape#SCALAR SCALAR} shape
	 */
	public @Nullable ScalarKind scalarKind() {
		return scalarKind;
	}

	public boolean isArray() {
		return rawClass.isArray();
	}

	/**
	 * @throws IllegalStateException unless this has the {@link Shape#SEQUENCE SEQUENCE} shape
	 */
	public TypeDescriptor elementType() {
		if (shape != Shape.SEQUENCE) {
			throw new IllegalStateException("Not a sequence type: " + this);
		}
		if (type instanceof GenericArrayType g) {
			return of(g.getGenericComponentType());
		} else if (rawClass.isArray()) {
			return of(rawClass.getComponentType());
		} else {
			return of(typeArgument(type, Collection.class, 0));
		}
	}

	/**
	 * @throws IllegalStateException unless this has the {@link Shape#MAPPING MAPPING} shape
	 */
	public TypeDescriptor keyType() {
		if (shape != Shape.MAPPING) {
			throw new IllegalStateException("Not a mapping type: " + this);
		}
		return of(typeArgument(type, Map.class, 0));
	}

	/**
	 * @throws IllegalStateException unless this has the {@link Shape#MAPPING MAPPING} shape
	 */
	public TypeDescriptor valueType() {
		if (shape != Shape.MAPPING) {
			throw new IllegalStateException("Not a mapping type: " + this);
		}
		return of(typeArgument(type, Map.class, 1));
	}

	/**
	 * @return the erasure of {@code type}, as defined by the Java language
	 */
	public static Class<?> erase(Type type) {
		if (type instanceof Class<?> c) {
			return c;
		} else if (type instanceof ParameterizedType pt) {
			return (Class<?>) pt.getRawType();
		} else if (type instanceof GenericArrayType g) {
			return Array.newInstance(erase(g.getGenericComponentType()), 0).getClass();
		} else if (type instanceof TypeVariable<?> tv) {
			return erase(tv.getBounds()[0]);
		} else if (type instanceof WildcardType w) {
			return erase(w.getUpperBounds()[0]);
		} else {
			throw new IllegalArgumentException("Unsupported type: " + type);
		}
	}

	/**
	 * Determines the actual type argument that {@code type} supplies
	 * to the parameter at {@code index} of the generic class {@code target}.
	 *
	 * @return the argument, or {@link Object Object.class} if it can't be determined
	 */
	public static Type typeArgument(Type type, Class<?> target, int index) {
		Type[] arguments = typeArgumentsFor(type, target);
		if (arguments == null) {
			return Object.class;
		}
		Type result = arguments[index];
		if (result instanceof TypeVariable<?> || result instanceof WildcardType) {
			// Erasure handles bounds: List<? extends Foo> has elements of type Foo
			return erase(result);
		}
		return result;
	}

	/**
	 * @return the type of the value being mapped: {@code declared}, which may carry type arguments,
	 * if it describes exactly the runtime class of {@code actual}; otherwise {@code actual}
	 */
	public static Type ownerType(TypeDescriptor declared, TypeDescriptor actual) {
		return (declared.rawClass() == actual.rawClass()) ? declared.type() : actual.type();
	}

	/**
	 * Resolves the type variables in {@code memberType} as they are bound when viewed from {@code owner}.
	 * For {@code class Concrete extends Base<Item>}, a member of {@code Base<T>} declared as {@code List<T>}
	 * resolves to {@code List<Item>} with {@code Concrete} as its owner.
	 * Variables that {@code owner} leaves unbound are left as they are.
	 *
	 * @param owner a class, or a parameterized type such as one captured by a {@link TypeReference}
	 */
	public static Type resolve(Type memberType, Type owner) {
		return substitute(memberType, variable -> bindingOf(variable, owner));
	}

	private static Type bindingOf(TypeVariable<?> variable, Type owner) {
		if (!(variable.getGenericDeclaration() instanceof Class<?> declaringClass)) {
			// Method type variables are never bound by the owner
			return variable;
		}
		Type[] arguments = typeArgumentsFor(owner, declaringClass);
		if (arguments == null) {
			return variable;
		}
		TypeVariable<?>[] parameters = declaringClass.getTypeParameters();
		for (int i = 0; i < parameters.length; i++) {
			if (parameters[i].equals(variable)) {
				return arguments[i];
			}
		}
		return variable;
	}

	private static @Nullable Type[] typeArgumentsFor(Type type, Class<?> target) {
		Class<?> raw = erase(type);
		if (!target.isAssignableFrom(raw)) {
			return null;
		}
		Map<TypeVariable<?>, Type> bindings = new HashMap<>();
		if (type instanceof ParameterizedType pt) {
			TypeVariable<?>[] parameters = raw.getTypeParameters();
			Type[] arguments = pt.getActualTypeArguments();
			for (int i = 0; i < parameters.length; i++) {
				bindings.put(parameters[i], arguments[i]);
			}
		}
		if (raw == target) {
			if (type instanceof ParameterizedType pt) {
				return pt.getActualTypeArguments();
			} else {
				// Raw usage of the target class
				return null;
			}
		}
		List<Type> supertypes = new ArrayList<>();
		if (raw.getGenericSuperclass() != null) {
			supertypes.add(raw.getGenericSuperclass());
		}
		supertypes.addAll(Arrays.asList(raw.getGenericInterfaces()));
		for (Type supertype : supertypes) {
			Type[] result = typeArgumentsFor(substitute(supertype, v -> bindings.getOrDefault(v, v)), target);
			if (result != null) {
				return result;
			}
		}
		return null;
	}

	private static Type substitute(Type type, Function<TypeVariable<?>, Type> bindings) {
		if (type instanceof TypeVariable<?> tv) {
			return bindings.apply(tv);
		} else if (type instanceof ParameterizedType pt) {
			Type[] arguments = pt.getActualTypeArguments().clone();
			for (int i = 0; i < arguments.length; i++) {
				arguments[i] = substitute(arguments[i], bindings);
			}
			return new ResolvedParameterizedType((Class<?>) pt.getRawType(), arguments, pt.getOwnerType());
		} else if (type instanceof GenericArrayType g) {
			Type component = substitute(g.getGenericComponentType(), bindings);
			if (component instanceof Class<?> c) {
				return Array.newInstance(c, 0).getClass();
			}
			return new ResolvedGenericArrayType(component);
		} else if (type instanceof WildcardType w && w.getLowerBounds().length == 0) {
			// Only the upper bound matters for reading values
			Type bound = substitute(w.getUpperBounds()[0], bindings);
			return (bound == w.getUpperBounds()[0]) ? w : bound;
		} else {
			return type;
		}
	}

	/**
	 * Equal to any other {@link ParameterizedType} with the same components,
	 * including the JDK's own implementation.
	 */
	private static final class ResolvedParameterizedType implements ParameterizedType {
		private final Class<?> rawType;
		private final Type[] arguments;
		private final @Nullable Type ownerType;

		ResolvedParameterizedType(Class<?> rawType, Type[] arguments, @Nullable Type ownerType) {
			this.rawType = rawType;
			this.arguments = arguments;
			this.ownerType = ownerType;
		}

		@Override
		public Type[] getActualTypeArguments() {
			return arguments.clone();
		}

		@Override
		public Type getRawType() {
			return rawType;
		}

		@Override
		public @Nullable Type getOwnerType() {
			return ownerType;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof ParameterizedType other)) {
				return false;
			}
			return rawType.equals(other.getRawType())
				&& Objects.equals(ownerType, other.getOwnerType())
				&& Arrays.equals(arguments, other.getActualTypeArguments());
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(arguments) ^ Objects.hashCode(ownerType) ^ rawType.hashCode();
		}

		@Override
		public String toString() {
			return rawType.getName() + Arrays.stream(arguments)
				.map(Type::getTypeName)
				.collect(joining(", ", "<", ">"));
		}
	}

	/**
	 * Equal to any other {@link GenericArrayType} with the same component type.
	 */
	private static final class ResolvedGenericArrayType implements GenericArrayType {
		private final Type componentType;

		ResolvedGenericArrayType(Type componentType) {
			this.componentType = componentType;
		}

		@Override
		public Type getGenericComponentType() {
			return componentType;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof GenericArrayType other && componentType.equals(other.getGenericComponentType());
		}

		@Override
		public int hashCode() {
			return componentType.hashCode();
		}

		@Override
		public String toString() {
			return componentType.getTypeName() + "[]";
		}
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof TypeDescriptor other && type.equals(other.type);
	}

	@Override
	public int hashCode() {
		return type.hashCode();
	}

	@Override
	public String toString() {
		return type.getTypeName() + "(" + shape + ")";
	}

	private static final Map<Type, TypeDescriptor> CACHE = new ConcurrentHashMap<>();
}
