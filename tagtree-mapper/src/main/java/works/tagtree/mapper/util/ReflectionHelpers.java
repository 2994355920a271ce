package works.tagtree.mapper.util;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import works.tagtree.mapper.MemberBinding.Reader;
import works.tagtree.mapper.MemberBinding.Writer;
import works.tagtree.mapper.exceptions.InvalidMappingException;

import static java.lang.invoke.MethodType.methodType;
import static java.lang.reflect.Modifier.isStatic;

/**
 * Turns reflective members into {@link MethodHandle}-backed readers, writers, and constructors.
 * Members are made accessible regardless of their visibility.
 */
public final class ReflectionHelpers {
	private ReflectionHelpers() { }

	private static final MethodHandles.Lookup LOOKUP = MethodHandles.lookup();

	/**
	 * @return the methods declared by {@code c}, excluding synthetic and bridge methods,
	 * sorted by name and then by parameter count so the order is stable across JVMs
	 */
	public static List<Method> getDeclaredMethodsInOrder(Class<?> c) {
		return Arrays.stream(c.getDeclaredMethods())
			.filter(m -> !m.isSynthetic() && !m.isBridge())
			.sorted(Comparator.comparing(Method::getName).thenComparing(Method::getParameterCount))
			.toList();
	}

	/**
	 * @return the fields declared by {@code c} in declaration order, excluding synthetic fields
	 */
	public static List<Field> getDeclaredFieldsInOrder(Class<?> c) {
		return Arrays.stream(c.getDeclaredFields())
			.filter(f -> !f.isSynthetic())
			.toList();
	}

	public static Reader fieldReader(Field field) {
		MethodHandle getter;
		try {
			getter = LOOKUP.unreflectGetter(accessible(field, field.getName()));
		} catch (IllegalAccessException e) {
			throw InvalidMappingException.forMember(field.getDeclaringClass(), field.getName(), "field is not readable", e);
		}
		MethodHandle handle = uniformReader(getter, isStatic(field.getModifiers()));
		return instance -> invokeReader(handle, instance, field);
	}

	public static Writer fieldWriter(Field field) {
		MethodHandle setter;
		try {
			setter = LOOKUP.unreflectSetter(accessible(field, field.getName()));
		} catch (IllegalAccessException e) {
			throw InvalidMappingException.forMember(field.getDeclaringClass(), field.getName(), "field is not writable", e);
		}
		MethodHandle handle = uniformWriter(setter, isStatic(field.getModifiers()));
		return (instance, value) -> invokeWriter(handle, instance, value, field);
	}

	public static Reader methodReader(Method method) {
		MethodHandle getter;
		try {
			getter = LOOKUP.unreflect(accessible(method, method.getName()));
		} catch (IllegalAccessException e) {
			throw InvalidMappingException.forMember(method.getDeclaringClass(), method.getName(), "method is not accessible", e);
		}
		MethodHandle handle = uniformReader(getter, isStatic(method.getModifiers()));
		return instance -> invokeReader(handle, instance, method);
	}

	public static Writer methodWriter(Method method) {
		MethodHandle setter;
		try {
			setter = LOOKUP.unreflect(accessible(method, method.getName()));
		} catch (IllegalAccessException e) {
			throw InvalidMappingException.forMember(method.getDeclaringClass(), method.getName(), "method is not accessible", e);
		}
		MethodHandle handle = uniformWriter(setter, isStatic(method.getModifiers()));
		return (instance, value) -> invokeWriter(handle, instance, value, method);
	}

	public static Reader componentReader(RecordComponent component) {
		return methodReader(component.getAccessor());
	}

	/**
	 * @return a handle of type {@code ()Object} that invokes the no-argument constructor of {@code type}
	 * @throws NoSuchMethodException if there is no such constructor
	 */
	public static MethodHandle noArgConstructor(Class<?> type) throws NoSuchMethodException {
		Constructor<?> constructor = type.getDeclaredConstructor();
		try {
			return LOOKUP.unreflectConstructor(accessible(constructor, "<init>"))
				.asType(methodType(Object.class));
		} catch (IllegalAccessException e) {
			throw InvalidMappingException.forMember(type, "<init>", "constructor is not accessible", e);
		}
	}

	/**
	 * @return a handle to the canonical constructor of {@code recordClass},
	 * taking the component values in order and returning {@code Object}
	 */
	public static MethodHandle canonicalConstructor(Class<?> recordClass) {
		Class<?>[] parameterTypes = Arrays.stream(recordClass.getRecordComponents())
			.map(RecordComponent::getType)
			.toArray(Class<?>[]::new);
		try {
			Constructor<?> constructor = recordClass.getDeclaredConstructor(parameterTypes);
			return LOOKUP.unreflectConstructor(accessible(constructor, "<init>"))
				.asType(methodType(Object.class, parameterTypes));
		} catch (NoSuchMethodException | IllegalAccessException e) {
			throw new IllegalStateException("Unexpected error accessing record constructor for " + recordClass, e);
		}
	}

	private static <T extends AccessibleObject & Member> T accessible(T member, String name) {
		try {
			member.setAccessible(true);
		} catch (RuntimeException e) {
			// Typically InaccessibleObjectException, when the declaring module doesn't open its package
			throw InvalidMappingException.forMember(member.getDeclaringClass(), name, "cannot be made accessible", e);
		}
		return member;
	}

	/**
	 * @return a handle of type {@code (Object)Object}
	 */
	private static MethodHandle uniformReader(MethodHandle handle, boolean isStatic) {
		if (isStatic) {
			handle = MethodHandles.dropArguments(handle, 0, Object.class);
		}
		return handle.asType(methodType(Object.class, Object.class));
	}

	/**
	 * @return a handle of type {@code (Object,Object)void}
	 */
	private static MethodHandle uniformWriter(MethodHandle handle, boolean isStatic) {
		if (isStatic) {
			handle = MethodHandles.dropArguments(handle, 0, Object.class);
		}
		return handle.asType(methodType(void.class, Object.class, Object.class));
	}

	private static Object invokeReader(MethodHandle handle, Object instance, Member member) {
		try {
			return (Object) handle.invokeExact(instance);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Unable to read " + describe(member), e);
		}
	}

	private static void invokeWriter(MethodHandle handle, Object instance, Object value, Member member) {
		try {
			handle.invokeExact(instance, value);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Unable to write " + describe(member), e);
		}
	}

	private static String describe(Member member) {
		return member.getDeclaringClass().getSimpleName() + "." + member.getName();
	}
}
