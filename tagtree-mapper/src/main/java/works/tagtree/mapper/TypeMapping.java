package works.tagtree.mapper;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import works.tagtree.mapper.exceptions.InvalidMappingException;
import works.tagtree.mapper.types.TypeReference;
import works.tagtree.mapper.util.ReflectionHelpers;

import static java.util.Objects.requireNonNull;

/**
 * Everything the mapper needs to know about one record-shaped type:
 * its mappable members in order, and how to create an instance.
 * <p>
 * Usually computed by {@link MemberSelector} from {@link works.tagtree.annotations.TagProperty TagProperty}
 * annotations, but can be {@link #builder registered} explicitly to avoid reflection
 * or to map types whose source can't be annotated.
 *
 * @param type the mapped class
 * @param members in the order their tags are emitted
 * @param instantiator creates fresh instances during deserialization
 */
public record TypeMapping(
	Class<?> type,
	List<MemberBinding> members,
	Instantiator instantiator
) {
	public TypeMapping {
		requireNonNull(type);
		requireNonNull(instantiator);
		members = List.copyOf(members);
		Set<String> names = new HashSet<>();
		for (MemberBinding member : members) {
			if (!names.add(member.exportedName())) {
				throw InvalidMappingException.forMember(type, member.memberName(),
					"another member is already exported as \"" + member.exportedName() + "\"");
			}
		}
	}

	/**
	 * A means of creating instances of a mapped type.
	 */
	public sealed interface Instantiator permits Factory, Canonical, Unavailable { }

	/**
	 * Creates an empty instance whose members are then populated one by one.
	 */
	public record Factory(Supplier<?> supplier) implements Instantiator { }

	/**
	 * Creates a record from all its component values at once.
	 *
	 * @param constructor takes the component values in order and returns {@code Object}
	 * @param componentTypes the declared types of the components, used for their default values
	 * @param componentIndexes the position of each mapped component, by {@link MemberBinding#memberName() member name}
	 */
	public record Canonical(
		MethodHandle constructor,
		List<Class<?>> componentTypes,
		Map<String, Integer> componentIndexes
	) implements Instantiator {
		public Canonical {
			componentTypes = List.copyOf(componentTypes);
			componentIndexes = Map.copyOf(componentIndexes);
		}
	}

	/**
	 * The type can be serialized and filled, but not instantiated.
	 */
	public record Unavailable(String reason) implements Instantiator { }

	/**
	 * @return an {@link Instantiator} that uses the no-argument constructor of {@code type}, if it has one
	 */
	public static Instantiator defaultInstantiator(Class<?> type) {
		if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
			return new Unavailable(type.getSimpleName() + " is abstract");
		}
		MethodHandle constructor;
		try {
			constructor = ReflectionHelpers.noArgConstructor(type);
		} catch (NoSuchMethodException e) {
			return new Unavailable(type.getSimpleName() + " has no no-argument constructor");
		} catch (InvalidMappingException e) {
			// Only fatal if an instance is actually needed
			return new Unavailable(e.getMessage());
		}
		return new Factory(() -> {
			try {
				return (Object) constructor.invokeExact();
			} catch (RuntimeException | Error e) {
				throw e;
			} catch (Throwable e) {
				throw new IllegalStateException("Unable to construct " + type.getSimpleName(), e);
			}
		});
	}

	public static <T> Builder<T> builder(Class<T> type) {
		return new Builder<>(type);
	}

	/**
	 * Registers a mapping by hand.
	 * Members are emitted in the order they are added.
	 *
	 * <pre>
	 *  TypeMapping.builder(Player.class)
	 *      .factory(Player::new)
	 *      .member("id", long.class, Player::getId, Player::setId)
	 *      .member("score", int.class, Player::getScore, Player::setScore).hideDefault()
	 *      .inPlaceMember("inventory", new TypeReference&lt;List&lt;Item&gt;&gt;() {}, Player::getInventory)
	 *      .build();
	 * </pre>
	 */
	public static final class Builder<T> {
		private final Class<T> type;
		private final List<MemberBinding> members = new ArrayList<>();
		private @Nullable Supplier<? extends T> factory;

		private Builder(Class<T> type) {
			this.type = requireNonNull(type);
		}

		/**
		 * If not called, the type's no-argument constructor is used.
		 */
		public Builder<T> factory(Supplier<? extends T> factory) {
			this.factory = requireNonNull(factory);
			return this;
		}

		public <V> Builder<T> member(String exportedName, Class<V> valueType, Function<? super T, ? extends V> getter, BiConsumer<? super T, ? super V> setter) {
			return add(exportedName, valueType, getter, setter);
		}

		public <V> Builder<T> member(String exportedName, TypeReference<V> valueType, Function<? super T, ? extends V> getter, BiConsumer<? super T, ? super V> setter) {
			return add(exportedName, valueType.reflectionType(), getter, setter);
		}

		public <V> Builder<T> inPlaceMember(String exportedName, Class<V> valueType, Function<? super T, ? extends V> getter) {
			return add(exportedName, valueType, getter, null);
		}

		public <V> Builder<T> inPlaceMember(String exportedName, TypeReference<V> valueType, Function<? super T, ? extends V> getter) {
			return add(exportedName, valueType.reflectionType(), getter, null);
		}

		/**
		 * Applies {@link works.tagtree.annotations.TagProperty#hideDefault() hideDefault} to the most recently added member.
		 */
		public Builder<T> hideDefault() {
			if (members.isEmpty()) {
				throw new IllegalStateException("No member to apply hideDefault to");
			}
			MemberBinding last = members.remove(members.size() - 1);
			members.add(new MemberBinding(last.memberName(), last.exportedName(), true, last.declaredType(), last.reader(), last.writer()));
			return this;
		}

		@SuppressWarnings("unchecked")
		private <V> Builder<T> add(String exportedName, Type valueType, Function<? super T, ? extends V> getter, @Nullable BiConsumer<? super T, ? super V> setter) {
			requireNonNull(getter);
			MemberBinding.Writer writer = (setter == null) ? null
				: (instance, value) -> setter.accept(type.cast(instance), (V) value);
			members.add(new MemberBinding(
				exportedName,
				exportedName,
				false,
				valueType,
				instance -> getter.apply(type.cast(instance)),
				writer));
			return this;
		}

		public TypeMapping build() {
			Instantiator instantiator = (factory == null)
				? defaultInstantiator(type)
				: new Factory(factory);
			return new TypeMapping(type, members, instantiator);
		}
	}
}
