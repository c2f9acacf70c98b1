package io.evitadb.lexicon.mt;

import io.evitadb.lexicon.llm.LlmClient;
import io.evitadb.lexicon.llm.PromptTemplates;
import io.evitadb.lexicon.testing.ScriptedChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LlmMachineTranslator should translate through the language model")
public class LlmMachineTranslatorTest {

	@Test
	@DisplayName("shouldReturnModelReply")
	void shouldReturnModelReply() {
		final ScriptedChatModel model = new ScriptedChatModel().reply("Hallo, Abenteurer!");
		final LlmMachineTranslator translator = new LlmMachineTranslator(new LlmClient(model), new PromptTemplates());

		assertEquals("Hallo, Abenteurer!", translator.translate("Hello, adventurer!", "de"));
		assertTrue(model.getPrompts().get(0).contains("Hello, adventurer!"));
		assertTrue(model.getPrompts().get(0).contains("\"de\""));
	}

	@Test
	@DisplayName("shouldWrapModelFailures")
	void shouldWrapModelFailures() {
		final ScriptedChatModel model = new ScriptedChatModel().fail(new RuntimeException("timeout"));
		final LlmMachineTranslator translator = new LlmMachineTranslator(new LlmClient(model), new PromptTemplates());

		final MachineTranslationException exception =
			assertThrows(MachineTranslationException.class, () -> translator.translate("Hello", "de"));
		assertTrue(exception.getMessage().contains("timeout"));
	}

	@Test
	@DisplayName("shouldRejectEmptyReply")
	void shouldRejectEmptyReply() {
		final ScriptedChatModel model = new ScriptedChatModel().reply("   ");
		final LlmMachineTranslator translator = new LlmMachineTranslator(new LlmClient(model), new PromptTemplates());

		assertThrows(MachineTranslationException.class, () -> translator.translate("Hello", "de"));
	}
}
