package io.evitadb.lexicon.mt;

import io.evitadb.lexicon.llm.LlmClient;
import io.evitadb.lexicon.llm.PromptTemplates;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Uses the language model for the machine pass, for setups without access to a translation service.
 * Errors of the model are reported as {@link MachineTranslationException} like any provider error.
 */
public final class LlmMachineTranslator implements MachineTranslator {

	@Nonnull
	private final LlmClient llmClient;
	@Nonnull
	private final PromptTemplates prompts;

	public LlmMachineTranslator(@Nonnull LlmClient llmClient, @Nonnull PromptTemplates prompts) {
		this.llmClient = Objects.requireNonNull(llmClient, "llmClient must not be null");
		this.prompts = Objects.requireNonNull(prompts, "prompts must not be null");
	}

	@Nonnull
	@Override
	public String translate(@Nonnull String text, @Nonnull String targetLanguage) {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");

		final String translation;
		try {
			translation = this.llmClient.complete(this.prompts.machineTranslatePrompt(text, targetLanguage));
		} catch (RuntimeException e) {
			throw new MachineTranslationException("LLM translation failed: " + e.getMessage(), e);
		}
		if (translation.isEmpty()) {
			throw new MachineTranslationException("LLM returned an empty translation");
		}
		return translation;
	}
}
