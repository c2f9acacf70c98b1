package io.evitadb.lexicon.mt;

import javax.annotation.Nonnull;

/**
 * Machine-translation provider of the first pipeline stage. The source language is detected by the provider.
 * Implementations must be safe to call from several threads at once.
 */
public interface MachineTranslator {

	/**
	 * Translates a text.
	 *
	 * @param text           source text
	 * @param targetLanguage target language code (e.g. `es`, `pt-BR`)
	 * @return the translation
	 * @throws MachineTranslationException if the provider fails
	 */
	@Nonnull
	String translate(@Nonnull String text, @Nonnull String targetLanguage);
}
