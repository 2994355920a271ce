package works.tagtree.mapper;

import java.lang.reflect.Array;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tagtree.mapper.TypeMapping.Factory;
import works.tagtree.mapper.TypeMapping.Instantiator;
import works.tagtree.mapper.TypeMapping.Unavailable;
import works.tagtree.mapper.exceptions.InvalidMappingException;
import works.tagtree.mapper.exceptions.TagTypeMismatchException;
import works.tagtree.mapper.types.Shape;
import works.tagtree.mapper.types.TypeDescriptor;
import works.tagtree.tags.CompoundTag;
import works.tagtree.tags.ListTag;
import works.tagtree.tags.Tag;

/**
 * Converts sequences (collections and non-scalar arrays) to and from list tags,
 * and string-keyed maps to and from compound tags.
 * Element values are handed back to the tree walkers through callbacks.
 */
final class CollectionAdapter {
	private final Map<Class<?>, Supplier<?>> factories = new ConcurrentHashMap<>();

	@FunctionalInterface
	interface ElementSerializer {
		@Nullable Tag serialize(@Nullable String name, Object value, TypeDescriptor declared);
	}

	@FunctionalInterface
	interface ElementDeserializer {
		@Nullable Object deserialize(TypeDescriptor target, Tag tag);
	}

	/**
	 * @param declared the sequence's declared type, consulted only for its element type
	 * @return a list tag, or null if the sequence is empty and empty collections are omitted
	 */
	@Nullable Tag sequenceToTag(@Nullable String name, Object sequence, TypeDescriptor declared, WalkContext context, ElementSerializer elements) {
		List<?> values = asList(sequence);
		TypeDescriptor elementType = (declared.shape() == Shape.SEQUENCE)
			? declared.elementType()
			: TypeDescriptor.of(Object.class);
		ListTag result = new ListTag(name);
		for (int i = 0; i < values.size(); i++) {
			Object element = values.get(i);
			if (element == null) {
				LOGGER.trace("Skipping null element at {}[{}]", context.path(), i);
				continue;
			}
			context.enter(i);
			try {
				Tag child = elements.serialize(null, element, elementType);
				if (child == null) {
					LOGGER.trace("Element produced no tag at {}", context.path());
				} else {
					// A passed-through tag may still carry the name it had elsewhere
					child.setName(null);
					result.add(child);
				}
			} finally {
				context.exit();
			}
		}
		if (result.isEmpty() && context.settings().isOmitEmptyCollections()) {
			return null;
		}
		return result;
	}

	/**
	 * @param declared the mapping's declared type, consulted for its key and value types
	 * @return a compound tag, or null if the map is empty (and empty collections are omitted)
	 * or has keys other than strings
	 */
	@Nullable Tag mappingToTag(@Nullable String name, Map<?, ?> map, TypeDescriptor declared, WalkContext context, ElementSerializer values) {
		TypeDescriptor valueType = TypeDescriptor.of(Object.class);
		if (declared.shape() == Shape.MAPPING) {
			TypeDescriptor keyType = declared.keyType();
			if (keyType.rawClass() != String.class && keyType.shape() != Shape.UNTYPED) {
				LOGGER.debug("Omitting map at {}: key type {} is not String", context.path(), keyType);
				return null;
			}
			valueType = declared.valueType();
		}
		CompoundTag result = new CompoundTag(name);
		for (Map.Entry<?, ?> entry : map.entrySet()) {
			if (!(entry.getKey() instanceof String key)) {
				LOGGER.debug("Omitting map at {}: key {} is not a String", context.path(), entry.getKey());
				return null;
			}
			Object value = entry.getValue();
			if (value == null) {
				LOGGER.trace("Skipping null value for key \"{}\" at {}", key, context.path());
				continue;
			}
			context.enter(key);
			try {
				Tag child = values.serialize(key, value, valueType);
				if (child == null) {
					LOGGER.trace("Value produced no tag at {}", context.path());
				} else {
					result.add(child);
				}
			} finally {
				context.exit();
			}
		}
		if (result.isEmpty() && context.settings().isOmitEmptyCollections()) {
			return null;
		}
		return result;
	}

	/**
	 * @return a new collection or array of the {@code target} type holding the deserialized elements of {@code tag}
	 */
	Object sequenceFromTag(TypeDescriptor target, Tag tag, WalkContext context, ElementDeserializer elements) {
		ListTag list = expectList(tag, target, context);
		if (target.isArray()) {
			TypeDescriptor elementType = target.elementType();
			Object array = Array.newInstance(elementType.rawClass(), list.size());
			populateArray(array, elementType, list, context, elements);
			return array;
		}
		@SuppressWarnings("unchecked")
		Collection<Object> result = (Collection<Object>) newInstance(target);
		populateCollection(result, target.elementType(), list, context, elements);
		return result;
	}

	/**
	 * @return a new map of the {@code target} type holding the deserialized children of {@code tag}, keyed by name
	 */
	Object mappingFromTag(TypeDescriptor target, Tag tag, WalkContext context, ElementDeserializer values) {
		CompoundTag compound = expectCompound(tag, target, context);
		@SuppressWarnings("unchecked")
		Map<Object, Object> result = (Map<Object, Object>) newInstance(target);
		populateMap(result, target, compound, context, values);
		return result;
	}

	/**
	 * Replaces the contents of {@code existing} with the deserialized elements of {@code tag},
	 * preserving its identity.
	 * Arrays can't be resized, so an array must already have as many elements as the tag.
	 */
	void fillSequence(Object existing, TypeDescriptor declared, Tag tag, WalkContext context, ElementDeserializer elements) {
		ListTag list = expectList(tag, declared, context);
		if (existing.getClass().isArray()) {
			int length = Array.getLength(existing);
			if (length != list.size()) {
				throw new TagTypeMismatchException("Cannot fill array of length " + length + " with " + list.size() + " elements at " + context.path());
			}
			populateArray(existing, TypeDescriptor.of(existing.getClass().getComponentType()), list, context, elements);
			return;
		}
		@SuppressWarnings("unchecked")
		Collection<Object> collection = (Collection<Object>) existing;
		collection.clear();
		populateCollection(collection, declared.elementType(), list, context, elements);
	}

	/**
	 * Replaces the contents of {@code existing} with the deserialized children of {@code tag},
	 * preserving its identity.
	 */
	void fillMapping(Map<Object, Object> existing, TypeDescriptor declared, Tag tag, WalkContext context, ElementDeserializer values) {
		CompoundTag compound = expectCompound(tag, declared, context);
		existing.clear();
		populateMap(existing, declared, compound, context, values);
	}

	private void populateArray(Object array, TypeDescriptor elementType, ListTag list, WalkContext context, ElementDeserializer elements) {
		for (int i = 0; i < list.size(); i++) {
			context.enter(i);
			try {
				Array.set(array, i, elements.deserialize(elementType, list.get(i)));
			} finally {
				context.exit();
			}
		}
	}

	private void populateCollection(Collection<Object> collection, TypeDescriptor elementType, ListTag list, WalkContext context, ElementDeserializer elements) {
		for (int i = 0; i < list.size(); i++) {
			context.enter(i);
			try {
				collection.add(elements.deserialize(elementType, list.get(i)));
			} finally {
				context.exit();
			}
		}
	}

	private void populateMap(Map<Object, Object> map, TypeDescriptor declared, CompoundTag compound, WalkContext context, ElementDeserializer values) {
		TypeDescriptor keyType = declared.keyType();
		if (keyType.rawClass() != String.class && keyType.shape() != Shape.UNTYPED) {
			throw new InvalidMappingException("Map keys must be strings; cannot deserialize " + declared + " at " + context.path());
		}
		TypeDescriptor valueType = declared.valueType();
		// Keys come from the compound, not from the children's own names
		for (String key : compound.names()) {
			context.enter(key);
			try {
				map.put(key, values.deserialize(valueType, compound.get(key)));
			} finally {
				context.exit();
			}
		}
	}

	private Object newInstance(TypeDescriptor target) {
		return factories.computeIfAbsent(target.rawClass(), CollectionAdapter::factoryFor).get();
	}

	private static Supplier<?> factoryFor(Class<?> type) {
		if (!type.isInterface() && !Modifier.isAbstract(type.getModifiers())) {
			Instantiator instantiator = TypeMapping.defaultInstantiator(type);
			if (instantiator instanceof Factory f) {
				return f.supplier();
			} else {
				throw new InvalidMappingException("Cannot instantiate " + type.getName() + ": " + ((Unavailable) instantiator).reason());
			}
		}
		// The most natural implementation of each abstract collection type, preserving insertion order where possible
		if (type.isAssignableFrom(ArrayList.class)) {
			return ArrayList::new;
		} else if (type.isAssignableFrom(LinkedHashSet.class)) {
			return LinkedHashSet::new;
		} else if (type.isAssignableFrom(TreeSet.class)) {
			return TreeSet::new;
		} else if (type.isAssignableFrom(ArrayDeque.class)) {
			return ArrayDeque::new;
		} else if (type.isAssignableFrom(LinkedHashMap.class)) {
			return LinkedHashMap::new;
		} else if (type.isAssignableFrom(TreeMap.class)) {
			return TreeMap::new;
		} else if (type.isAssignableFrom(ConcurrentHashMap.class)) {
			return ConcurrentHashMap::new;
		} else if (type.isAssignableFrom(ConcurrentSkipListMap.class)) {
			return ConcurrentSkipListMap::new;
		}
		throw new InvalidMappingException("No known implementation of " + type.getName());
	}

	private static List<?> asList(Object sequence) {
		if (sequence instanceof Collection<?> c) {
			return new ArrayList<>(c);
		}
		int length = Array.getLength(sequence);
		List<Object> result = new ArrayList<>(length);
		for (int i = 0; i < length; i++) {
			result.add(Array.get(sequence, i));
		}
		return result;
	}

	private static ListTag expectList(Tag tag, TypeDescriptor target, WalkContext context) {
		if (tag instanceof ListTag list) {
			return list;
		}
		throw new TagTypeMismatchException("Expected LIST tag for " + target + " but found " + tag.tagType() + " tag at " + context.path());
	}

	private static CompoundTag expectCompound(Tag tag, TypeDescriptor target, WalkContext context) {
		if (tag instanceof CompoundTag compound) {
			return compound;
		}
		throw new TagTypeMismatchException("Expected COMPOUND tag for " + target + " but found " + tag.tagType() + " tag at " + context.path());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CollectionAdapter.class);
}
