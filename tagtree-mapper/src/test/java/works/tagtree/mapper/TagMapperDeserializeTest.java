package works.tagtree.mapper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;
import works.tagtree.annotations.TagProperty;
import works.tagtree.mapper.exceptions.InvalidMappingException;
import works.tagtree.mapper.exceptions.TagTypeMismatchException;
import works.tagtree.mapper.types.TypeReference;
import works.tagtree.tags.ByteArrayTag;
import works.tagtree.tags.ByteTag;
import works.tagtree.tags.CompoundTag;
import works.tagtree.tags.IntTag;
import works.tagtree.tags.ListTag;
import works.tagtree.tags.LongTag;
import works.tagtree.tags.ShortTag;
import works.tagtree.tags.StringTag;
import works.tagtree.tags.Tag;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TagMapperDeserializeTest {
	final TagMapper mapper = TagMapper.withDefaults();

	@Test
	void missingMember_leftAtDefault() {
		Player player = mapper.deserializeObject(Player.class, new CompoundTag().add(new LongTag("id", 42)));
		assertEquals(42, player.id);
		assertTrue(player.tags.isEmpty());
	}

	@Test
	void roundTrip() {
		Player original = new Player();
		original.id = 9;
		original.tags.add("x");
		original.tags.add("y");
		original.notes = "not mapped";
		Player copy = mapper.deserializeObject(Player.class, mapper.serializeObject(original));
		assertEquals(original.id, copy.id);
		assertEquals(original.tags, copy.tags);
		assertNull(copy.notes);
	}

	@Test
	void map_preservesTagOrder() {
		CompoundTag tag = new CompoundTag().add(new CompoundTag("scores")
			.add(new IntTag("b", 2))
			.add(new IntTag("a", 1)));
		Scoreboard board = mapper.deserializeObject(Scoreboard.class, tag);
		assertThat(board.scores.keySet(), contains("b", "a"));
		assertEquals(1, board.scores.get("a"));
	}

	@Test
	void unannotatedMember_ignored() {
		CompoundTag tag = new CompoundTag()
			.add(new LongTag("id", 1))
			.add(new StringTag("notes", "sneaky"));
		assertNull(mapper.deserializeObject(Player.class, tag).notes);
	}

	@Test
	void collectionInterfaces_instantiated() {
		CompoundTag tag = new CompoundTag()
			.add(strings("list", "b", "a"))
			.add(strings("set", "b", "a"))
			.add(strings("sorted", "b", "a"))
			.add(strings("deque", "b", "a"))
			.add(new CompoundTag("navigable").add(new IntTag("z", 1)).add(new IntTag("y", 2)));
		Collections result = mapper.deserializeObject(Collections.class, tag);
		assertThat(result.list, instanceOf(ArrayList.class));
		assertThat(result.list, contains("b", "a"));
		assertThat(result.set, instanceOf(LinkedHashSet.class));
		assertThat(result.set, contains("b", "a"));
		assertThat(result.sorted, instanceOf(TreeSet.class));
		assertThat(result.sorted, contains("a", "b"));
		assertThat(result.deque, instanceOf(ArrayDeque.class));
		assertThat(result.navigable, instanceOf(TreeMap.class));
		assertThat(result.navigable.keySet(), contains("y", "z"));
	}

	@Test
	void nestedGenerics() {
		CompoundTag tag = new CompoundTag().add(new CompoundTag("grid")
			.add(new ListTag("row")
				.add(new ListTag().add(new IntTag(1)).add(new IntTag(2)))));
		Nested result = mapper.deserializeObject(Nested.class, tag);
		assertEquals(Map.of("row", List.of(List.of(1, 2))), result.grid);
	}

	@Test
	void arrays() {
		CompoundTag tag = new CompoundTag()
			.add(new ByteArrayTag("bytes", new byte[]{1, 2}))
			.add(strings("names", "p", "q"));
		WithArrays result = mapper.deserializeObject(WithArrays.class, tag);
		assertArrayEquals(new byte[]{1, 2}, result.bytes);
		assertArrayEquals(new String[]{"p", "q"}, result.names);
	}

	@Test
	void javaRecord_missingComponentsDefaulted() {
		CompoundTag tag = new CompoundTag().add(new IntTag("x", 5));
		Point point = mapper.deserializeObject(Point.class, tag);
		assertEquals(new Point(5, 0, null), point);
	}

	@Test
	void signedAndUnsigned_shareStorage() {
		CompoundTag tag = new CompoundTag()
			.add(new ShortTag("signed", (short) -2))
			.add(new ShortTag("unsigned", (short) -2))
			.add(new ByteTag("flag", (byte) 1));
		Widths result = mapper.deserializeObject(Widths.class, tag);
		assertEquals(-2, result.signed);
		assertEquals((char) 0xFFFE, result.unsigned);
		assertTrue(result.flag);
	}

	@Test
	void passThrough_clearsName() {
		CompoundTag payload = new CompoundTag("payload").add(new IntTag("raw", 1));
		Holder holder = mapper.deserializeObject(Holder.class, new CompoundTag().add(payload));
		assertEquals(new CompoundTag().add(new IntTag("raw", 1)), holder.payload);
		assertNull(holder.payload.getName());
	}

	@Test
	void passThrough_leavesInputUntouched() {
		CompoundTag input = new CompoundTag()
			.add(new CompoundTag("payload").add(new IntTag("raw", 1)));
		CompoundTag before = input.copy();
		Holder holder = mapper.deserializeObject(Holder.class, input);

		assertEquals(before, input);
		assertEquals("payload", input.get("payload").getName());
		assertThat(holder.payload, not(sameInstance(input.get("payload"))));

		holder.payload.add(new IntTag("later", 2));
		assertFalse(((CompoundTag) input.get("payload")).contains("later"));
	}

	@Test
	void passThrough_insideList_leavesInputUntouched() {
		CompoundTag input = new CompoundTag()
			.add(new ListTag("tags").add(new StringTag("a")));
		CompoundTag before = input.copy();
		TagList result = mapper.deserializeObject(TagList.class, input);
		assertEquals(List.of(new StringTag("a")), result.tags);
		assertEquals(before, input);
	}

	@Test
	void passThrough_anyTagType() {
		AnyTag result = mapper.deserializeObject(AnyTag.class, new CompoundTag().add(new LongTag("any", 5)));
		assertEquals(new LongTag(5), result.any);
	}

	@Test
	void passThrough_wrongTagClass_throws() {
		CompoundTag tag = new CompoundTag().add(new IntTag("payload", 3));
		assertThrows(TagTypeMismatchException.class, () -> mapper.deserializeObject(Holder.class, tag));
	}

	@Test
	void untypedTarget_yieldsNaturalValues() {
		CompoundTag tag = new CompoundTag().add(new CompoundTag("anything")
			.add(new IntTag("n", 1))
			.add(new ListTag("l").add(new StringTag("s"))));
		Untyped result = mapper.deserializeObject(Untyped.class, tag);
		Map<String, Object> expected = new LinkedHashMap<>();
		expected.put("n", 1);
		expected.put("l", List.of("s"));
		assertEquals(expected, result.anything);
	}

	@Test
	void typeReference_target() {
		ListTag tag = new ListTag()
			.add(new CompoundTag().add(new IntTag("x", 1)))
			.add(new CompoundTag().add(new IntTag("y", 2)));
		List<Point> points = mapper.deserializeObject(new TypeReference<List<Point>>() {}, tag);
		assertEquals(List.of(new Point(1, 0, null), new Point(0, 2, null)), points);
	}

	@Test
	void inheritedGenericMembers_resolvedAgainstSubclass() {
		Concrete original = new Concrete();
		original.items.add(item(3));
		original.single = item(7);
		Concrete copy = mapper.deserializeObject(Concrete.class, mapper.serializeObject(original));
		assertThat(copy.items, contains(instanceOf(Item.class)));
		assertEquals(3, copy.items.get(0).count);
		assertThat(copy.single, instanceOf(Item.class));
		assertEquals(7, copy.single.count);
	}

	@Test
	void genericMembers_resolvedThroughIntermediateClass() {
		Deep original = new Deep();
		original.single = List.of(item(1), item(2));
		Deep copy = mapper.deserializeObject(Deep.class, mapper.serializeObject(original));
		assertEquals(2, copy.single.size());
		assertEquals(2, copy.single.get(1).count);
	}

	@Test
	void parameterizedRootTarget_bindsTypeVariables() {
		CompoundTag tag = new CompoundTag()
			.add(new CompoundTag("content").add(new IntTag("count", 4)))
			.add(new ListTag("contents").add(new CompoundTag().add(new IntTag("count", 5))));
		Box<Item> box = mapper.deserializeObject(new TypeReference<Box<Item>>() {}, tag);
		assertEquals(4, box.content.count);
		assertEquals(5, box.contents.get(0).count);
	}

	@Test
	void parameterizedMemberType_bindsTypeVariables() {
		CompoundTag tag = new CompoundTag()
			.add(new CompoundTag("box").add(new CompoundTag("content").add(new IntTag("count", 6))))
			.add(new CompoundTag("pair").add(new CompoundTag("first").add(new IntTag("count", 8))));
		Shelf shelf = mapper.deserializeObject(Shelf.class, tag);
		assertEquals(6, shelf.box.content.count);
		assertEquals(8, shelf.pair.first().count);
	}

	@Test
	void typeMismatch_isFatal_withPath() {
		CompoundTag tag = new CompoundTag().add(new CompoundTag("inventory")
			.add(new ListTag("items")
				.add(new CompoundTag().add(new IntTag("count", 1)))
				.add(new CompoundTag().add(new StringTag("count", "two")))));
		TagTypeMismatchException e = assertThrows(TagTypeMismatchException.class, () -> mapper.deserializeObject(Chest.class, tag));
		assertThat(e.getMessage(), containsString("inventory.items[1].count"));
	}

	@Test
	void listExpected_compoundFound_throws() {
		CompoundTag tag = new CompoundTag().add(new CompoundTag("tags").add(new StringTag("a", "b")));
		assertThrows(TagTypeMismatchException.class, () -> mapper.deserializeObject(Player.class, tag));
	}

	@Test
	void recordExpected_scalarFound_throws() {
		assertThrows(TagTypeMismatchException.class, () -> mapper.deserializeObject(Player.class, new IntTag(1)));
	}

	@Test
	void noDefaultConstructor_throws() {
		CompoundTag tag = new CompoundTag().add(new IntTag("value", 1));
		assertThrows(InvalidMappingException.class, () -> mapper.deserializeObject(NoDefaultConstructor.class, tag));
	}

	@Test
	void nonStringMapKeys_throws() {
		CompoundTag tag = new CompoundTag().add(new CompoundTag("byNumber").add(new StringTag("1", "one")));
		assertThrows(InvalidMappingException.class, () -> mapper.deserializeObject(NumberKeys.class, tag));
	}

	@Test
	void readOnlyMember_filledInPlace() {
		CompoundTag tag = new CompoundTag().add(strings("fixed", "a", "b"));
		ReadOnly result = mapper.deserializeObject(ReadOnly.class, tag);
		assertThat(result.fixed, contains("a", "b"));
	}

	@Test
	void registeredMapping() {
		TagMapper registered = TagMapper.builder()
			.register(TypeMapping.builder(Unannotated.class)
				.factory(Unannotated::new)
				.member("n", String.class, Unannotated::getName, Unannotated::setName)
				.member("lvl", int.class, Unannotated::getLevel, Unannotated::setLevel).hideDefault()
				.inPlaceMember("items", new TypeReference<List<String>>() {}, Unannotated::getItems)
				.build())
			.build();
		Unannotated original = new Unannotated();
		original.setName("bob");
		original.getItems().add("sword");
		CompoundTag tag = registered.serializeObject(original);
		assertEquals(new CompoundTag()
			.add(new StringTag("n", "bob"))
			.add(new ListTag("items").add(new StringTag("sword"))), tag);

		tag.add(new IntTag("lvl", 3));
		Unannotated copy = registered.deserializeObject(Unannotated.class, tag);
		assertEquals("bob", copy.getName());
		assertEquals(3, copy.getLevel());
		assertEquals(List.of("sword"), copy.getItems());
	}

	@Test
	void nullArguments_throw() {
		assertThrows(NullPointerException.class, () -> mapper.deserializeObject(Player.class, null));
		assertThrows(NullPointerException.class, () -> mapper.deserializeObject((Class<Player>) null, new CompoundTag()));
	}

	@Test
	void staticFacade() {
		Player player = TagSerializer.deserializeObject(Player.class, new CompoundTag().add(new LongTag("id", 3)));
		assertEquals(3, player.id);
	}

	private static Item item(int count) {
		Item result = new Item();
		result.count = count;
		return result;
	}

	private static ListTag strings(String name, String... values) {
		ListTag result = new ListTag(name);
		for (String value : values) {
			result.add(new StringTag(value));
		}
		return result;
	}

	static class Player {
		@TagProperty("id") long id;
		@TagProperty(value = "tags", hideDefault = true) List<String> tags = new ArrayList<>();
		String notes;
	}

	static class Scoreboard {
		@TagProperty Map<String, Integer> scores;
	}

	static class Collections {
		@TagProperty List<String> list;
		@TagProperty Set<String> set;
		@TagProperty SortedSet<String> sorted;
		@TagProperty Deque<String> deque;
		@TagProperty NavigableMap<String, Integer> navigable;
	}

	static class Nested {
		@TagProperty Map<String, List<List<Integer>>> grid;
	}

	static class WithArrays {
		@TagProperty byte[] bytes;
		@TagProperty String[] names;
	}

	record Point(@TagProperty int x, @TagProperty int y, String note) { }

	static class Widths {
		@TagProperty short signed;
		@TagProperty char unsigned;
		@TagProperty boolean flag;
	}

	static class Holder {
		@TagProperty CompoundTag payload;
	}

	static class TagList {
		@TagProperty List<Tag> tags;
	}

	static class Untyped {
		@TagProperty Object anything;
	}

	static class Chest {
		@TagProperty Inventory inventory;
	}

	static class Inventory {
		@TagProperty List<Item> items;
	}

	static class Item {
		@TagProperty int count;
	}

	static class Base<T> {
		@TagProperty List<T> items = new ArrayList<>();
		@TagProperty T single;
	}

	static class Concrete extends Base<Item> { }

	static class Middle<U> extends Base<List<U>> { }

	static class Deep extends Middle<Item> { }

	static class Box<T> {
		@TagProperty T content;
		@TagProperty List<T> contents = new ArrayList<>();
	}

	record GenericPair<A>(@TagProperty A first) { }

	static class Shelf {
		@TagProperty Box<Item> box;
		@TagProperty GenericPair<Item> pair;
	}

	static class NoDefaultConstructor {
		@TagProperty int value;

		NoDefaultConstructor(int value) {
			this.value = value;
		}
	}

	static class NumberKeys {
		@TagProperty Map<Integer, String> byNumber;
	}

	static class ReadOnly {
		@TagProperty final List<String> fixed = new ArrayList<>();
	}

	static class Unannotated {
		private String name;
		private int level;
		private final List<String> items = new ArrayList<>();

		String getName() {
			return name;
		}

		void setName(String name) {
			this.name = name;
		}

		int getLevel() {
			return level;
		}

		void setLevel(int level) {
			this.level = level;
		}

		List<String> getItems() {
			return items;
		}
	}

	/**
	 * A tag reaching a member of type {@link Tag} needs no conversion at all.
	 */
	static class AnyTag {
		@TagProperty Tag any;
	}
}
