package works.tagtree.mapper;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tagtree.annotations.TagProperty;
import works.tagtree.mapper.TypeMapping.Canonical;
import works.tagtree.mapper.exceptions.InvalidMappingException;
import works.tagtree.mapper.types.TypeDescriptor;
import works.tagtree.mapper.util.ReflectionHelpers;

import static java.lang.reflect.Modifier.isFinal;
import static java.lang.reflect.Modifier.isStatic;
import static works.tagtree.mapper.util.ReflectionHelpers.getDeclaredFieldsInOrder;
import static works.tagtree.mapper.util.ReflectionHelpers.getDeclaredMethodsInOrder;

/**
 * Determines which members of a type take part in mapping, and in what order.
 * <p>
 * Only members annotated with {@link TagProperty} are selected.
 * Instance and static members of any visibility are included,
 * as are members inherited from superclasses.
 * The order is:
 *
 * <ol>
 *     <li>
 *         annotated accessor methods, sorted by name within each class,
 *         starting with the type itself and proceeding up through its superclasses; then
 *     </li>
 *     <li>
 *         annotated fields, in declaration order within each class,
 *         again starting with the type itself.
 *     </li>
 * </ol>
 *
 * For a Java {@link Record}, only annotated record components are selected, in component order.
 * <p>
 * Declared types of inherited members are resolved against the scanned type,
 * so a {@code List<T>} field of {@code Base<T>} has type {@code List<Item>}
 * when scanned as part of {@code class Concrete extends Base<Item>}.
 * <p>
 * Each type is scanned once and the result is cached; explicitly registered
 * {@link TypeMapping}s take the place of scanning for their types.
 * Instances are safe to share between threads.
 */
public final class MemberSelector {
	private final Map<Class<?>, TypeMapping> mappings = new ConcurrentHashMap<>();

	public MemberSelector() {
		this(List.of());
	}

	/**
	 * @param registered mappings to use instead of scanning their types
	 */
	public MemberSelector(Collection<TypeMapping> registered) {
		for (TypeMapping mapping : registered) {
			TypeMapping old = mappings.putIfAbsent(mapping.type(), mapping);
			if (old != null) {
				throw new IllegalArgumentException("Multiple mappings registered for " + mapping.type());
			}
			LOGGER.debug("Registered mapping for {} with {} member(s)", mapping.type().getSimpleName(), mapping.members().size());
		}
	}

	public TypeMapping mappingFor(Class<?> type) {
		return mappings.computeIfAbsent(type, MemberSelector::scan);
	}

	public List<MemberBinding> membersOf(Class<?> type) {
		return mappingFor(type).members();
	}

	/**
	 * @return the mapping directive on {@code member}, or null if it doesn't take part in mapping
	 */
	public static @Nullable TagProperty directiveFor(AnnotatedElement member) {
		return member.getAnnotation(TagProperty.class);
	}

	static TypeMapping scan(Class<?> type) {
		TypeMapping result;
		if (type.isRecord()) {
			result = scanRecord(type);
		} else {
			result = new TypeMapping(type, scanClass(type), TypeMapping.defaultInstantiator(type));
		}
		LOGGER.debug("Scanned {}: {} mappable member(s) {}", type.getSimpleName(), result.members().size(),
			result.members().stream().map(MemberBinding::exportedName).toList());
		return result;
	}

	private static List<MemberBinding> scanClass(Class<?> type) {
		List<MemberBinding> result = new ArrayList<>();
		Set<String> overridden = new HashSet<>();
		for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
			for (Method method : getDeclaredMethodsInOrder(c)) {
				TagProperty directive = directiveFor(method);
				if (directive == null) {
					continue;
				}
				if (!overridden.add(method.getName())) {
					LOGGER.trace("Skipping {}.{}: overridden by a subclass", c.getSimpleName(), method.getName());
					continue;
				}
				result.add(scanAccessor(type, method, directive));
			}
		}
		for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
			for (Field field : getDeclaredFieldsInOrder(c)) {
				TagProperty directive = directiveFor(field);
				if (directive != null) {
					result.add(scanField(type, field, directive));
				}
			}
		}
		return result;
	}

	private static MemberBinding scanField(Class<?> type, Field field, TagProperty directive) {
		MemberBinding.Writer writer = isFinal(field.getModifiers())
			? null
			: ReflectionHelpers.fieldWriter(field);
		return new MemberBinding(
			field.getName(),
			exportedName(directive, field.getName()),
			directive.hideDefault(),
			TypeDescriptor.resolve(field.getGenericType(), type),
			ReflectionHelpers.fieldReader(field),
			writer);
	}

	private static MemberBinding scanAccessor(Class<?> type, Method method, TagProperty directive) {
		Class<?> declaringClass = method.getDeclaringClass();
		if (method.getParameterCount() != 0) {
			throw InvalidMappingException.forMember(declaringClass, method.getName(), "annotated method must not take parameters");
		}
		if (method.getReturnType() == void.class) {
			throw InvalidMappingException.forMember(declaringClass, method.getName(), "annotated method must return a value");
		}
		String propertyName = propertyName(method);
		Method setter = findSetter(type, propertyName, method);
		return new MemberBinding(
			propertyName,
			exportedName(directive, propertyName),
			directive.hideDefault(),
			TypeDescriptor.resolve(method.getGenericReturnType(), type),
			ReflectionHelpers.methodReader(method),
			(setter == null) ? null : ReflectionHelpers.methodWriter(setter));
	}

	private static TypeMapping scanRecord(Class<?> recordClass) {
		RecordComponent[] components = recordClass.getRecordComponents();
		List<MemberBinding> members = new ArrayList<>();
		List<Class<?>> componentTypes = new ArrayList<>();
		Map<String, Integer> componentIndexes = new HashMap<>();
		for (int i = 0; i < components.length; i++) {
			RecordComponent component = components[i];
			componentTypes.add(component.getType());
			TagProperty directive = directiveFor(component);
			if (directive == null) {
				continue;
			}
			componentIndexes.put(component.getName(), i);
			members.add(new MemberBinding(
				component.getName(),
				exportedName(directive, component.getName()),
				directive.hideDefault(),
				component.getGenericType(),
				ReflectionHelpers.componentReader(component),
				null));
		}
		return new TypeMapping(
			recordClass,
			members,
			new Canonical(ReflectionHelpers.canonicalConstructor(recordClass), componentTypes, componentIndexes));
	}

	private static String exportedName(TagProperty directive, String memberName) {
		return directive.value().isEmpty() ? memberName : directive.value();
	}

	/**
	 * Follows the bean convention: {@code getFoo} and {@code isFoo} are named {@code foo}.
	 * Any other method is named after itself.
	 */
	static String propertyName(Method accessor) {
		String name = accessor.getName();
		if (hasPrefix(name, "get")) {
			return decapitalize(name.substring(3));
		} else if (hasPrefix(name, "is") && (accessor.getReturnType() == boolean.class || accessor.getReturnType() == Boolean.class)) {
			return decapitalize(name.substring(2));
		} else {
			return name;
		}
	}

	private static boolean hasPrefix(String name, String prefix) {
		return name.length() > prefix.length()
			&& name.startsWith(prefix)
			&& Character.isUpperCase(name.charAt(prefix.length()));
	}

	private static String decapitalize(String s) {
		if (s.length() > 1 && Character.isUpperCase(s.charAt(1))) {
			// Like java.beans.Introspector: "getURL" is named "URL"
			return s;
		}
		return Character.toLowerCase(s.charAt(0)) + s.substring(1);
	}

	private static @Nullable Method findSetter(Class<?> type, String propertyName, Method accessor) {
		String setterName = "set" + Character.toUpperCase(propertyName.charAt(0)) + propertyName.substring(1);
		boolean wantStatic = isStatic(accessor.getModifiers());
		for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
			for (Method candidate : getDeclaredMethodsInOrder(c)) {
				if (candidate.getName().equals(setterName)
					&& candidate.getParameterCount() == 1
					&& candidate.getParameterTypes()[0] == accessor.getReturnType()
					&& isStatic(candidate.getModifiers()) == wantStatic
				) {
					return candidate;
				}
			}
		}
		return null;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MemberSelector.class);
}
