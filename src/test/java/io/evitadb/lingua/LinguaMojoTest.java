package io.evitadb.lingua;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.evitadb.lingua.model.Language;
import io.evitadb.lingua.provider.StubProviderClientFactory;
import org.apache.maven.plugin.MojoExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LinguaMojo should run the configured action")
public class LinguaMojoTest {

	@TempDir
	Path tempDir;

	private TestLog log;
	private LinguaMojo mojo;
	private Path input;
	private Path outputDir;

	@BeforeEach
	void setUp() throws Exception {
		log = new TestLog();
		mojo = new LinguaMojo();
		mojo.setLog(log);
		input = tempDir.resolve("messages.json");
		Files.writeString(input, "{\"title\": \"Welcome, {{user}}!\", \"items\": [\"Save\", \"Cancel\"], \"limit\": 3}");
		outputDir = tempDir.resolve("out");
		mojo.setInputFile(input.toString());
		mojo.setOutputDir(outputDir.toString());
		mojo.setCacheFile(tempDir.resolve("cache.db").toString());
		mojo.setSourceLanguage("en");
		mojo.setTargets(List.of("es", "de"));
	}

	@Test
	@DisplayName("shows configuration and warns about missing settings")
	public void shouldShowConfig() throws Exception {
		final LinguaMojo bare = new LinguaMojo();
		bare.setLog(log);
		bare.setAction("show-config");
		bare.setTargets(List.of("es", "xx"));

		bare.execute();

		assertTrue(log.hasInfo("Lingua Plugin Configuration:"));
		assertTrue(log.hasInfo(" - batchSize: 10"));
		assertTrue(log.hasInfo(" - sourceLanguage: <auto-detect>"));
		assertTrue(log.hasWarn("LLM url is not set"));
		assertTrue(log.hasWarn("LLM token is not set"));
		assertTrue(log.hasWarn("Input file is not set"));
		assertTrue(log.hasWarn("Unsupported target language: xx"));
	}

	@Test
	@DisplayName("masks the token in the configuration output")
	public void shouldMaskToken() throws Exception {
		mojo.setAction("show-config");
		mojo.setLlmToken("sk-secret-1234");

		mojo.execute();

		assertTrue(log.hasInfo(" - llmToken: ****1234"));
		assertFalse(log.getInfos().stream().anyMatch(s -> s.contains("secret")));
	}

	@Test
	@DisplayName("lists every supported language")
	public void shouldListLanguages() throws Exception {
		mojo.setAction("list-languages");

		mojo.execute();

		assertTrue(log.hasInfo("Supported Languages:"));
		assertEquals(Language.values().length + 1, log.getInfos().size());
		assertTrue(log.hasInfo("  zh-CN    - Chinese (Simplified)"));
	}

	@Test
	@DisplayName("writes a translated file and a source snapshot per target")
	public void shouldTranslateIntoEveryTarget() throws Exception {
		final StubProviderClientFactory provider = StubProviderClientFactory.prefixing();
		mojo.setAction("translate");
		mojo.setProviderClientFactory(provider);

		mojo.execute();

		final Path spanish = outputDir.resolve("messages.es.json");
		assertEquals(
			"{\n" +
				"  \"title\": \"[es] Welcome, {{user}}!\",\n" +
				"  \"items\": [\n" +
				"    \"[es] Save\",\n" +
				"    \"[es] Cancel\"\n" +
				"  ],\n" +
				"  \"limit\": 3\n" +
				"}\n",
			Files.readString(spanish, StandardCharsets.UTF_8)
		);
		assertTrue(Files.isRegularFile(outputDir.resolve("messages.de.json")));
		assertEquals(
			new ObjectMapper().readTree(input.toFile()),
			new ObjectMapper().readTree(outputDir.resolve(".lingua/messages.es.source.json").toFile())
		);
		assertEquals(6, provider.callCount());
		assertTrue(log.hasInfo("Saved to: " + spanish));
		assertTrue(log.hasInfo("All translations completed"));
	}

	@Test
	@DisplayName("retranslates only changed strings in diff mode")
	public void shouldRetranslateChangedStringsInDiffMode() throws Exception {
		mojo.setAction("translate");
		mojo.setTargets(List.of("es"));
		mojo.setProviderClientFactory(StubProviderClientFactory.prefixing());
		mojo.execute();

		Files.writeString(input, "{\"title\": \"Welcome, {{user}}!\", \"items\": [\"Save\", \"Close\"], \"limit\": 3}");
		final StubProviderClientFactory provider = new StubProviderClientFactory(text -> "Cerrar");
		final LinguaMojo rerun = new LinguaMojo();
		rerun.setLog(log);
		rerun.setAction("translate");
		rerun.setInputFile(input.toString());
		rerun.setOutputDir(outputDir.toString());
		rerun.setCacheFile(tempDir.resolve("cache.db").toString());
		rerun.setSourceLanguage("en");
		rerun.setTargets(List.of("es"));
		rerun.setDiff(true);
		rerun.setProviderClientFactory(provider);

		rerun.execute();

		final String translated = Files.readString(outputDir.resolve("messages.es.json"), StandardCharsets.UTF_8);
		assertTrue(translated.contains("\"[es] Save\""));
		assertTrue(translated.contains("\"Cerrar\""));
		assertTrue(translated.contains("\"[es] Welcome, {{user}}!\""));
		assertEquals(1, provider.callCount());
	}

	@Test
	@DisplayName("reports the plan without contacting the provider or writing files in dry run")
	public void shouldOnlyPlanInDryRun() throws Exception {
		final StubProviderClientFactory provider = StubProviderClientFactory.prefixing();
		mojo.setAction("translate");
		mojo.setDryRun(true);
		mojo.setSourceLanguage(null);
		mojo.setProviderClientFactory(provider);

		mojo.execute();

		assertTrue(log.hasInfo("--- Dry-run Summary ---"));
		assertTrue(log.hasInfo("[PLAN] Spanish (es): 3 strings to translate"));
		assertTrue(log.hasInfo("[PLAN] German (de): 3 strings to translate"));
		assertEquals(0, provider.clientCount());
		assertFalse(Files.exists(outputDir));
		assertFalse(Files.exists(tempDir.resolve("cache.db")));
	}

	@Test
	@DisplayName("fails on a missing input file")
	public void shouldFailOnMissingInput() {
		mojo.setAction("translate");
		mojo.setInputFile(tempDir.resolve("missing.json").toString());

		final MojoExecutionException ex = assertThrows(MojoExecutionException.class, mojo::execute);
		assertTrue(ex.getMessage().contains("Input file not found"));
	}

	@Test
	@DisplayName("fails on invalid JSON input")
	public void shouldFailOnInvalidJson() throws Exception {
		Files.writeString(input, "{\"title\": ");
		mojo.setAction("translate");
		mojo.setProviderClientFactory(StubProviderClientFactory.prefixing());

		assertThrows(MojoExecutionException.class, mojo::execute);
		assertFalse(Files.exists(outputDir));
	}

	@Test
	@DisplayName("fails on an unsupported target before translating")
	public void shouldFailOnUnsupportedTarget() {
		final StubProviderClientFactory provider = StubProviderClientFactory.prefixing();
		mojo.setAction("translate");
		mojo.setTargets(List.of("es", "klingon"));
		mojo.setProviderClientFactory(provider);

		assertThrows(MojoExecutionException.class, mojo::execute);
		assertEquals(0, provider.callCount());
	}

	@Test
	@DisplayName("requires the LLM url when no provider is injected")
	public void shouldRequireLlmUrl() {
		mojo.setAction("translate");

		final MojoExecutionException ex = assertThrows(MojoExecutionException.class, mojo::execute);
		assertTrue(ex.getMessage().contains("LLM URL"));
	}

	@Test
	@DisplayName("rejects an unknown action")
	public void shouldRejectUnknownAction() {
		mojo.setAction("publish");

		final MojoExecutionException ex = assertThrows(MojoExecutionException.class, mojo::execute);
		assertTrue(ex.getMessage().contains("Unknown action: publish"));
	}

	@Test
	@DisplayName("names output and snapshot files after the input stem")
	public void shouldNameOutputFiles() {
		final Path root = Path.of("out");

		assertEquals(root.resolve("app.zh-CN.json"), LinguaMojo.outputFile(root, "app", Language.CHINESE_SIMPLIFIED));
		assertEquals(root.resolve(".lingua").resolve("app.fr.source.json"), LinguaMojo.snapshotFile(root, "app", Language.FRENCH));
	}
}
