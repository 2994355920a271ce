package works.tagtree.mapper;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.tagtree.mapper.TypeMapping.Factory;
import works.tagtree.mapper.TypeMapping.Unavailable;
import works.tagtree.mapper.exceptions.InvalidMappingException;
import works.tagtree.mapper.types.TypeReference;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TypeMappingTest {

	@Test
	void builder_membersInOrder() {
		TypeMapping mapping = TypeMapping.builder(Bag.class)
			.member("size", int.class, Bag::getSize, Bag::setSize).hideDefault()
			.inPlaceMember("contents", new TypeReference<List<String>>() {}, Bag::getContents)
			.build();
		assertThat(mapping.members().stream().map(MemberBinding::exportedName).toList(), contains("size", "contents"));

		MemberBinding size = mapping.members().get(0);
		assertTrue(size.hideDefault());
		assertEquals(MemberCapability.REPLACEABLE, size.capability());
		assertEquals(int.class, size.declaredType());

		MemberBinding contents = mapping.members().get(1);
		assertFalse(contents.hideDefault());
		assertEquals(MemberCapability.IN_PLACE_ONLY, contents.capability());
		assertEquals(String.class, contents.declaredDescriptor().elementType().rawClass());
	}

	@Test
	void builder_accessorsWork() {
		TypeMapping mapping = TypeMapping.builder(Bag.class)
			.member("size", int.class, Bag::getSize, Bag::setSize)
			.build();
		Bag bag = new Bag();
		MemberBinding size = mapping.members().get(0);
		size.writer().write(bag, 3);
		assertEquals(3, size.reader().read(bag));
	}

	@Test
	void builder_defaultFactory() {
		assertThat(TypeMapping.builder(Bag.class).build().instantiator(), instanceOf(Factory.class));
		assertThat(TypeMapping.builder(Runnable.class).build().instantiator(), instanceOf(Unavailable.class));
	}

	@Test
	void builder_explicitFactory() {
		TypeMapping mapping = TypeMapping.builder(Bag.class).factory(() -> new Bag(5)).build();
		Bag bag = (Bag) ((Factory) mapping.instantiator()).supplier().get();
		assertEquals(5, bag.getSize());
	}

	@Test
	void hideDefault_withoutMember_throws() {
		assertThrows(IllegalStateException.class, () -> TypeMapping.builder(Bag.class).hideDefault());
	}

	@Test
	void duplicateExportedName_throws() {
		var builder = TypeMapping.builder(Bag.class)
			.member("x", int.class, Bag::getSize, Bag::setSize)
			.inPlaceMember("x", new TypeReference<List<String>>() {}, Bag::getContents);
		assertThrows(InvalidMappingException.class, builder::build);
	}

	@Test
	void emptyExportedName_throws() {
		var builder = TypeMapping.builder(Bag.class);
		assertThrows(IllegalArgumentException.class, () -> builder.member("", int.class, Bag::getSize, Bag::setSize));
	}

	static class Bag {
		private int size;
		private final List<String> contents = new ArrayList<>();

		Bag() { }

		Bag(int size) {
			this.size = size;
		}

		int getSize() {
			return size;
		}

		void setSize(int size) {
			this.size = size;
		}

		List<String> getContents() {
			return contents;
		}
	}
}
