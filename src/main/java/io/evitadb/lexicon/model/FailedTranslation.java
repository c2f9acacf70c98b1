package io.evitadb.lexicon.model;

import javax.annotation.Nonnull;

/**
 * A translation that failed automated review and waits for a human.
 *
 * @param key         entry key
 * @param language    target language code
 * @param original    source text
 * @param translation best known translation (the last correction proposed by the reviewer)
 */
public record FailedTranslation(
	@Nonnull String key,
	@Nonnull String language,
	@Nonnull String original,
	@Nonnull String translation
) {
}
