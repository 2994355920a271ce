package works.tagtree.tags;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class ScalarTagTest {

	static Stream<Arguments> renderings() {
		return Stream.of(
			arguments(new ByteTag((byte) -3), "-3b", TagType.BYTE),
			arguments(new ShortTag((short) 300), "300s", TagType.SHORT),
			arguments(new IntTag(70000), "70000", TagType.INT),
			arguments(new LongTag(1L << 40), "1099511627776L", TagType.LONG),
			arguments(new FloatTag(1.5f), "1.5f", TagType.FLOAT),
			arguments(new DoubleTag(2.25), "2.25d", TagType.DOUBLE),
			arguments(new StringTag("say \"hi\""), "\"say \\\"hi\\\"\"", TagType.STRING),
			arguments(new ByteArrayTag(new byte[]{1, 2}), "[B;1b,2b]", TagType.BYTE_ARRAY),
			arguments(new IntArrayTag(new int[]{3, 4}), "[I;3,4]", TagType.INT_ARRAY)
		);
	}

	@ParameterizedTest
	@MethodSource("renderings")
	void toString_andType(ScalarTag tag, String expected, TagType expectedType) {
		assertEquals(expected, tag.toString());
		assertEquals(expectedType, tag.tagType());
		assertTrue(expectedType.isScalar());
	}

	@Test
	void arrayTags_compareByContent() {
		assertEquals(new ByteArrayTag("b", new byte[]{1, 2}), new ByteArrayTag("b", new byte[]{1, 2}));
		assertEquals(new IntArrayTag(new int[]{1, 2}).hashCode(), new IntArrayTag(new int[]{1, 2}).hashCode());
		assertNotEquals(new IntArrayTag(new int[]{1, 2}), new IntArrayTag(new int[]{2, 1}));
	}

	@Test
	void differentTypes_notEqual() {
		assertNotEquals(new IntTag("x", 1), new LongTag("x", 1L));
		assertNotEquals(new ShortTag((short) 0), new ByteTag((byte) 0));
	}

	@Test
	void rename() {
		IntTag tag = new IntTag("old", 5);
		tag.setName("new");
		assertEquals("new:5", tag.toString());
		assertEquals(new IntTag("new", 5), tag);
	}

	@Test
	void value_isBoxedOrArray() {
		assertEquals(5, new IntTag(5).value());
		assertEquals(Short.valueOf((short) 120), new ShortTag((short) 120).value());
		assertArrayEquals(new int[]{9}, new IntArrayTag(new int[]{9}).value());
	}

	@ParameterizedTest
	@MethodSource("renderings")
	void copy_equalButDistinct(ScalarTag tag) {
		tag.setName("named");
		ScalarTag copy = tag.copy();
		assertEquals(tag, copy);
		assertNotSame(tag, copy);
	}

	@Test
	void copy_doesNotShareArrays() {
		int[] values = {1, 2};
		IntArrayTag copy = new IntArrayTag(values).copy();
		values[0] = 9;
		assertArrayEquals(new int[]{1, 2}, copy.getValue());
	}
}
