package io.evitadb.lexicon;

import dev.langchain4j.exception.AuthenticationException;
import io.evitadb.lexicon.cache.ProjectLayout;
import io.evitadb.lexicon.cache.ProjectLock;
import io.evitadb.lexicon.cache.ProjectLockedException;
import io.evitadb.lexicon.cache.ProjectState;
import io.evitadb.lexicon.llm.LlmClient;
import io.evitadb.lexicon.llm.PromptTemplates;
import io.evitadb.lexicon.model.QaSlot;
import io.evitadb.lexicon.model.QaStatus;
import io.evitadb.lexicon.stage.ProgressListener;
import io.evitadb.lexicon.testing.FakeMachineTranslator;
import io.evitadb.lexicon.testing.ScriptedChatModel;
import io.evitadb.lexicon.testing.TestLog;
import io.evitadb.lexicon.testing.TestProjects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineOrchestrator should run the stages as barriers and resume from caches")
public class PipelineOrchestratorTest {

	private static final String ORIGINAL = "Hello, adventurer!";
	private static final String SPANISH = "¡Hola, aventurero!";
	private static final Map<String, String> INPUT = Map.of("greet", ORIGINAL);

	@TempDir
	Path tempDir;

	private TestLog testLog;
	private FakeMachineTranslator translator;
	private ScriptedChatModel refineModel;
	private ScriptedChatModel qaModel;

	@BeforeEach
	void setUp() {
		testLog = new TestLog();
		translator = new FakeMachineTranslator().stub(ORIGINAL, "es", SPANISH);
		refineModel = new ScriptedChatModel().otherwise(prompt -> SPANISH);
		qaModel = new ScriptedChatModel().otherwise(prompt -> "OK");
	}

	private PipelineOrchestrator orchestrator(PipelineConfig config) {
		return new PipelineOrchestrator(
			new ProjectLayout(tempDir), config, translator,
			new LlmClient(refineModel), new LlmClient(qaModel),
			new PromptTemplates(), ProgressListener.none(), testLog
		);
	}

	private PipelineOrchestrator orchestrator() {
		return orchestrator(PipelineConfig.builder().languages("es").build());
	}

	private String exported(String language) throws Exception {
		return Files.readString(new ProjectLayout(tempDir).exportFile(language));
	}

	private QaSlot qaSlot() {
		return TestProjects.load(tempDir, testLog).qa().getSlot("greet", "es").orElseThrow();
	}

	@Test
	@DisplayName("shouldTranslateRefineReviewAndExport")
	void shouldTranslateRefineReviewAndExport() throws Exception {
		final PipelineSummary summary = orchestrator().run(INPUT);

		final ProjectState state = TestProjects.load(tempDir, testLog);
		assertEquals(SPANISH, state.google().getSlot("greet", "es").orElseThrow());
		assertEquals(SPANISH, state.refined().getSlot("greet", "es").orElseThrow().refined());
		assertEquals(QaStatus.OK, state.qa().getSlot("greet", "es").orElseThrow().status());
		assertEquals(SPANISH, state.getStore().readTree(state.getLayout().exportFile("es")).get("greet").asText());
		assertEquals(1, state.getStore().readTree(state.getLayout().exportFile("es")).size());

		assertEquals(1, summary.translation().processed());
		assertEquals(1, summary.refinement().processed());
		assertEquals(1, summary.qa().processed());
		assertEquals(1, summary.export().getExportedCount());
		assertEquals(0, summary.awaitingReview());
		assertFalse(summary.isAborted());
		assertTrue(summary.inputTokens() > 0);
	}

	@Test
	@DisplayName("shouldPropagateCorrectionOnRepairPath")
	void shouldPropagateCorrectionOnRepairPath() throws Exception {
		qaModel.reply("¡Saludos, aventurero!", "OK");

		orchestrator().run(INPUT);

		assertEquals(new QaSlot(QaStatus.OK, "¡Saludos, aventurero!", 2), qaSlot());
		final ProjectState state = TestProjects.load(tempDir, testLog);
		assertEquals("¡Saludos, aventurero!", state.refined().getSlot("greet", "es").orElseThrow().refined());
		assertEquals("¡Saludos, aventurero!",
			state.getStore().readTree(state.getLayout().exportFile("es")).get("greet").asText());
	}

	@Test
	@DisplayName("shouldExportLastCorrectionWhenAttemptsAreExhausted")
	void shouldExportLastCorrectionWhenAttemptsAreExhausted() throws Exception {
		qaModel.otherwise(prompt -> "¡Salve, aventurero!");

		final PipelineSummary summary = orchestrator(PipelineConfig.builder().languages("es").maxQaAttempts(1).build())
			.run(INPUT);

		assertEquals(new QaSlot(QaStatus.FAIL, "¡Salve, aventurero!", 1), qaSlot());
		assertEquals(1, summary.awaitingReview());
		assertTrue(exported("es").contains("¡Salve, aventurero!"));
	}

	@Test
	@DisplayName("shouldBeIdempotent")
	void shouldBeIdempotent() throws Exception {
		qaModel.otherwise(prompt -> "¡Salve, aventurero!");
		final PipelineConfig config = PipelineConfig.builder().languages("es", "fr").maxQaAttempts(2).build();

		orchestrator(config).run(Map.of("greet", ORIGINAL, "bye", "Farewell"));
		final String firstEs = exported("es");
		final String firstFr = exported("fr");
		final int translations = translator.getCallCount();
		final int refinements = refineModel.getCallCount();
		final int reviews = qaModel.getCallCount();

		final PipelineSummary second = orchestrator(config).run(Map.of("greet", ORIGINAL, "bye", "Farewell"));

		assertEquals(translations, translator.getCallCount());
		assertEquals(refinements, refineModel.getCallCount());
		assertEquals(reviews, qaModel.getCallCount());
		assertEquals(firstEs, exported("es"));
		assertEquals(firstFr, exported("fr"));
		assertEquals(0, second.translation().processed() + second.refinement().processed() + second.qa().processed());
	}

	@Test
	@DisplayName("shouldResumeAfterTranslationStage")
	void shouldResumeAfterTranslationStage() throws Exception {
		orchestrator(PipelineConfig.builder().languages("es").skipRefinement(true).skipQa(true).build()).run(INPUT);
		assertEquals(1, translator.getCallCount());
		assertEquals(0, refineModel.getCallCount());

		orchestrator().run(INPUT);

		assertEquals(1, translator.getCallCount());
		assertEquals(1, refineModel.getCallCount());
		assertEquals(QaStatus.OK, qaSlot().status());
	}

	@Test
	@DisplayName("shouldSkipLaterStagesAfterPermanentFailureButStillExport")
	void shouldSkipLaterStagesAfterPermanentFailureButStillExport() throws Exception {
		refineModel.fail(new AuthenticationException("Invalid API key"));

		final PipelineSummary summary = orchestrator().run(INPUT);

		assertTrue(summary.isAborted());
		assertTrue(summary.refinement().aborted());
		assertEquals(0, qaModel.getCallCount());
		assertNotNull(summary.export());
		assertTrue(testLog.hasWarn("[QA] Skipped after a permanent provider failure"));
	}

	@Test
	@DisplayName("shouldFailFastWhenProjectIsLocked")
	void shouldFailFastWhenProjectIsLocked() throws Exception {
		try (ProjectLock ignored = ProjectLock.acquire(new ProjectLayout(tempDir).lockFile())) {
			assertThrows(ProjectLockedException.class, () -> orchestrator().run(INPUT));
			assertThrows(ProjectLockedException.class, () -> orchestrator().export());
		}
		assertEquals(0, translator.getCallCount());
	}

	@Test
	@DisplayName("shouldRequireProvidersOfEnabledStages")
	void shouldRequireProvidersOfEnabledStages() {
		final PipelineOrchestrator withoutProviders = new PipelineOrchestrator(
			new ProjectLayout(tempDir), PipelineConfig.builder().languages("es").build(),
			null, null, null, new PromptTemplates(), ProgressListener.none(), testLog
		);

		assertThrows(IllegalStateException.class, () -> withoutProviders.run(INPUT));
		assertThrows(IllegalStateException.class, withoutProviders::revalidate);
	}

	@Test
	@DisplayName("shouldRequireTargetLanguage")
	void shouldRequireTargetLanguage() {
		assertThrows(IllegalArgumentException.class, () -> orchestrator(PipelineConfig.builder().build()).run(INPUT));
	}

	@Test
	@DisplayName("shouldApplyCorrectionsAndRevalidate")
	void shouldApplyCorrectionsAndRevalidate() throws Exception {
		qaModel.otherwise(prompt -> "¡Salve, aventurero!");
		final PipelineOrchestrator orchestrator =
			orchestrator(PipelineConfig.builder().languages("es").maxQaAttempts(1).build());
		orchestrator.run(INPUT);
		assertEquals(1, orchestrator.listFailures().size());
		final int reviews = qaModel.getCallCount();

		final Path reviewFile = orchestrator.writeReview();
		assertTrue(Files.exists(reviewFile));

		final PipelineSummary summary = orchestrator.applyCorrections(Map.of("greet", Map.of("es", "¡Hola, viajero!")), true);

		assertEquals(reviews, qaModel.getCallCount());
		assertEquals(0, summary.awaitingReview());
		assertEquals(new QaSlot(QaStatus.OK_MANUAL, "¡Hola, viajero!", 1), qaSlot());
		assertTrue(exported("es").contains("¡Hola, viajero!"));
	}

	@Test
	@DisplayName("shouldRevalidateWithoutRetries")
	void shouldRevalidateWithoutRetries() throws Exception {
		orchestrator(PipelineConfig.builder().languages("es").skipQa(true).build()).run(INPUT);
		final AtomicInteger counter = new AtomicInteger();
		qaModel.otherwise(prompt -> "Variante " + counter.incrementAndGet());

		final PipelineSummary summary = orchestrator().revalidate();

		assertEquals(1, qaModel.getCallCount());
		assertEquals(new QaSlot(QaStatus.FAIL, "Variante 1", 1), qaSlot());
		assertEquals(1, summary.awaitingReview());
	}
}
