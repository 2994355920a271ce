package works.tagtree.mapper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TagMapperSettingsTest {

	@Test
	void defaults() {
		TagMapperSettings settings = TagMapperSettings.defaults();
		assertEquals(512, settings.getMaxDepth());
		assertTrue(settings.isDetectCycles());
		assertTrue(settings.isOmitEmptyCollections());
		assertEquals(settings, TagMapperSettings.builder().build());
	}

	@Test
	void toBuilder_changesOnlyWhatIsSet() {
		TagMapperSettings settings = TagMapperSettings.defaults().toBuilder()
			.omitEmptyCollections(false)
			.build();
		assertFalse(settings.isOmitEmptyCollections());
		assertEquals(512, settings.getMaxDepth());
	}

	@Test
	void validate() {
		assertDoesNotThrow(() -> TagMapperSettings.builder().maxDepth(1).build().validate());
		assertThrows(IllegalArgumentException.class, () -> TagMapperSettings.builder().maxDepth(0).build().validate());
		assertThrows(IllegalArgumentException.class, () -> TagMapperSettings.builder().maxDepth(-5).build().validate());
	}

	@Test
	void mapperExposesSettings() {
		TagMapperSettings settings = TagMapperSettings.builder().maxDepth(10).build();
		assertEquals(settings, TagMapper.builder().settings(settings).build().settings());
	}
}
