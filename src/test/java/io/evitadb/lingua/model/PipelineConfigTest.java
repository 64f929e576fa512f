package io.evitadb.lingua.model;

import io.evitadb.lingua.glossary.GlossaryRule;
import io.evitadb.lingua.schedule.SchedulerSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineConfig should validate the run configuration")
class PipelineConfigTest {

	@Test
	@DisplayName("uses documented defaults")
	void shouldApplyDefaults() throws Exception {
		final PipelineConfig config = PipelineConfig.builder().targets("es").build();

		config.validate();
		assertEquals(10, config.getBatchSize());
		assertEquals(100, config.getSuperBatchSize());
		assertEquals(2, config.getOuterConcurrency());
		assertEquals(4, config.getInnerConcurrency());
		assertTrue(config.isCacheEnabled());
		assertFalse(config.isDiffMode());
		assertEquals(Optional.empty(), config.getSourceLanguage());
		assertEquals(new SchedulerSettings(10, 100, 2, 4, true), config.toSchedulerSettings());
	}

	@Test
	@DisplayName("resolves languages and removes duplicate targets")
	void shouldResolveLanguages() throws Exception {
		final PipelineConfig config = PipelineConfig.builder()
			.sourceLanguage(" EN ")
			.targets("es", "zh_cn", "ES")
			.build();

		assertEquals(Optional.of(Language.ENGLISH), config.getSourceLanguage());
		assertEquals(List.of(Language.SPANISH, Language.CHINESE_SIMPLIFIED), config.getTargetLanguages());
	}

	@Test
	@DisplayName("treats a blank source language as auto-detect")
	void shouldTreatBlankSourceAsDetect() throws Exception {
		assertEquals(Optional.empty(), PipelineConfig.builder().sourceLanguage("  ").targets("es").build().getSourceLanguage());
	}

	@Test
	@DisplayName("rejects invalid sizes, missing or unknown languages")
	void shouldRejectInvalidConfiguration() {
		assertThrows(ConfigurationException.class, () -> PipelineConfig.builder().targets("es").batchSize(0).build().validate());
		assertThrows(ConfigurationException.class, () -> PipelineConfig.builder().targets("es").superBatchSize(-1).build().validate());
		assertThrows(ConfigurationException.class, () -> PipelineConfig.builder().targets("es").outerConcurrency(0).build().validate());
		assertThrows(ConfigurationException.class, () -> PipelineConfig.builder().targets("es").innerConcurrency(0).build().validate());
		assertThrows(ConfigurationException.class, () -> PipelineConfig.builder().build().validate());
		assertThrows(ConfigurationException.class, () -> PipelineConfig.builder().targets("klingon").build().validate());
		assertThrows(ConfigurationException.class, () -> PipelineConfig.builder().sourceLanguage("xx").targets("es").build().validate());
	}

	@Test
	@DisplayName("returns glossary rules per target")
	void shouldReturnGlossaryRules() {
		final PipelineConfig config = PipelineConfig.builder()
			.targets("es", "de")
			.glossary(Map.of(Language.SPANISH, List.of(new GlossaryRule("car", "coche"))))
			.build();

		assertEquals(List.of(new GlossaryRule("car", "coche")), config.getGlossaryRules(Language.SPANISH));
		assertEquals(List.of(), config.getGlossaryRules(Language.GERMAN));
	}
}
