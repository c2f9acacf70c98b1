package io.evitadb.lexicon;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineConfig should validate and normalize settings")
public class PipelineConfigTest {

	@Test
	@DisplayName("shouldApplyDefaults")
	void shouldApplyDefaults() {
		final PipelineConfig config = PipelineConfig.builder().languages("es").build();

		assertEquals(8, config.parallelism());
		assertEquals(3, config.maxQaAttempts());
		assertTrue(config.retryOnFail());
		assertTrue(config.includeFailures());
		assertTrue(config.retryTranslationErrors());
		assertFalse(config.skipTranslation());
		assertFalse(config.skipRefinement());
		assertFalse(config.skipQa());
	}

	@Test
	@DisplayName("shouldTrimAndDeduplicateLanguages")
	void shouldTrimAndDeduplicateLanguages() {
		final PipelineConfig config = PipelineConfig.builder().languages(" es", "pt-BR", "es ").build();

		assertEquals(List.of("es", "pt-BR"), config.languages());
	}

	@Test
	@DisplayName("shouldRejectInvalidValues")
	void shouldRejectInvalidValues() {
		assertThrows(IllegalArgumentException.class, () -> PipelineConfig.builder().languages("es").parallelism(0).build());
		assertThrows(IllegalArgumentException.class, () -> PipelineConfig.builder().languages("es").maxQaAttempts(0).build());
		assertThrows(IllegalArgumentException.class, () -> PipelineConfig.builder().languages(Arrays.asList("es", " ")).build());
	}

	@Test
	@DisplayName("shouldRejectLanguageCodesUnfitForFileNames")
	void shouldRejectLanguageCodesUnfitForFileNames() {
		for (final String code : List.of("../es", "es/fr", "..", "e s", "es.json")) {
			final IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
				() -> PipelineConfig.builder().languages(code).build());
			assertTrue(exception.getMessage().contains("Invalid language code"), code);
		}
		assertEquals(List.of("zh_Hant", "pt-BR"), PipelineConfig.builder().languages("zh_Hant", "pt-BR").build().languages());
	}
}
