package io.evitadb.lexicon.stage;

import dev.langchain4j.exception.AuthenticationException;
import io.evitadb.lexicon.cache.ProjectState;
import io.evitadb.lexicon.llm.LlmClient;
import io.evitadb.lexicon.llm.PromptTemplates;
import io.evitadb.lexicon.model.QaStatus;
import io.evitadb.lexicon.model.RefinedSlot;
import io.evitadb.lexicon.testing.ScriptedChatModel;
import io.evitadb.lexicon.testing.TestLog;
import io.evitadb.lexicon.testing.TestProjects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RefinementStage should refine machine translations one by one")
public class RefinementStageTest {

	@TempDir
	Path tempDir;

	private TestLog testLog;
	private ScriptedChatModel model;
	private ProjectState state;

	@BeforeEach
	void setUp() {
		testLog = new TestLog();
		model = new ScriptedChatModel();
		state = TestProjects.load(tempDir, testLog);
		state.google().putSlot("greet", "Hello, adventurer!", "es", "Hola, aventurero!");
		state.google().putSlot("greet", "Hello, adventurer!", "fr", "Bonjour, aventurier !");
	}

	private RefinementStage stage() {
		return new RefinementStage(new LlmClient(model), new PromptTemplates(), testLog);
	}

	@Test
	@DisplayName("shouldStoreRefinedTextAsPending")
	void shouldStoreRefinedTextAsPending() throws Exception {
		model.reply("¡Hola, aventurero!", "Bonjour, aventurier !");

		final StageSummary summary = stage().run(state, ProgressListener.none());

		assertEquals(2, summary.processed());
		final RefinedSlot slot = state.refined().getSlot("greet", "es").orElseThrow();
		assertEquals("Hola, aventurero!", slot.google());
		assertEquals("¡Hola, aventurero!", slot.refined());
		assertEquals(1, slot.attempts());
		assertEquals(QaStatus.PENDING, slot.qaStatus());
		assertEquals("Hello, adventurer!", state.refined().getOriginal("greet"));
		assertTrue(model.getPrompts().get(0).contains("Hola, aventurero!"));
		assertTrue(model.getPrompts().get(0).contains("Target Language: es"));
	}

	@Test
	@DisplayName("shouldPersistAfterEveryUpdate")
	void shouldPersistAfterEveryUpdate() throws Exception {
		model.reply("¡Hola, aventurero!").fail(new RuntimeException("connection reset"));

		stage().run(state, ProgressListener.none());

		final ProjectState reloaded = TestProjects.load(tempDir, testLog);
		assertEquals("¡Hola, aventurero!", reloaded.refined().getSlot("greet", "es").orElseThrow().refined());
		assertTrue(reloaded.refined().getSlot("greet", "fr").isEmpty());
	}

	@Test
	@DisplayName("shouldSkipRefinedSlotsOnRerun")
	void shouldSkipRefinedSlotsOnRerun() throws Exception {
		stage().run(state, ProgressListener.none());
		final int calls = model.getCallCount();

		final StageSummary summary = stage().run(state, ProgressListener.none());

		assertEquals(2, calls);
		assertEquals(2, model.getCallCount());
		assertEquals(2, summary.skipped());
	}

	@Test
	@DisplayName("shouldSkipSlotsWithoutMachineTranslation")
	void shouldSkipSlotsWithoutMachineTranslation() throws Exception {
		state.google().putSlot("greet", null, "de", "");

		final StageSummary summary = stage().run(state, ProgressListener.none());

		assertEquals(2, summary.processed());
		assertEquals(1, summary.skipped());
		assertTrue(state.refined().getSlot("greet", "de").isEmpty());
	}

	@Test
	@DisplayName("shouldLeaveSlotOpenOnTransientError")
	void shouldLeaveSlotOpenOnTransientError() throws Exception {
		model.fail(new RuntimeException("timeout")).reply("Bonjour !");

		final StageSummary summary = stage().run(state, ProgressListener.none());

		assertEquals(1, summary.failed());
		assertEquals(1, summary.processed());
		assertFalse(summary.aborted());
		assertTrue(state.refined().getSlot("greet", "es").map(s -> !s.hasRefined()).orElse(true));
		assertTrue(TestProjects.auditLines(state).stream().anyMatch(l -> l.contains("\"refine_error\"")));
	}

	@Test
	@DisplayName("shouldAbortOnPermanentFailure")
	void shouldAbortOnPermanentFailure() throws Exception {
		model.fail(new AuthenticationException("Invalid API key"));

		final StageSummary summary = stage().run(state, ProgressListener.none());

		assertTrue(summary.aborted());
		assertEquals(1, model.getCallCount());
		assertTrue(testLog.hasError("failed permanently"));
	}
}
