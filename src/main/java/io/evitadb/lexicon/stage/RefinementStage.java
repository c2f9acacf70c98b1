package io.evitadb.lexicon.stage;

import dev.langchain4j.exception.NonRetriableException;
import io.evitadb.lexicon.cache.AuditEvent;
import io.evitadb.lexicon.cache.ProjectState;
import io.evitadb.lexicon.cache.TranslationCache;
import io.evitadb.lexicon.llm.LlmClient;
import io.evitadb.lexicon.llm.PromptTemplates;
import io.evitadb.lexicon.model.RefinedSlot;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Second stage: asks the language model to improve every machine translation.
 *
 * Runs sequentially, one request at a time, over all slots of the Google cache. Slots that already
 * hold a refined text are skipped, so an interrupted run resumes where it stopped. The refined cache
 * is saved after every update.
 */
public final class RefinementStage {

	@Nonnull
	private final LlmClient llmClient;
	@Nonnull
	private final PromptTemplates prompts;
	@Nonnull
	private final Log log;

	public RefinementStage(@Nonnull LlmClient llmClient, @Nonnull PromptTemplates prompts, @Nonnull Log log) {
		this.llmClient = Objects.requireNonNull(llmClient, "llmClient must not be null");
		this.prompts = Objects.requireNonNull(prompts, "prompts must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Refines all open slots.
	 *
	 * @param state    project caches
	 * @param progress progress callback, invoked per slot
	 * @return stage summary; `aborted` is set when the model failed permanently
	 * @throws IOException if the cache or audit log cannot be written
	 */
	@Nonnull
	public StageSummary run(@Nonnull ProjectState state, @Nonnull ProgressListener progress) throws IOException {
		Objects.requireNonNull(state, "state must not be null");
		Objects.requireNonNull(progress, "progress must not be null");

		final TranslationCache<String> google = state.google();
		final TranslationCache<RefinedSlot> refined = state.refined();
		final int total = google.slotCount();
		int done = 0;
		StageSummary summary = StageSummary.empty();

		for (final String key : google.keys()) {
			final String original = google.getOriginal(key);
			refined.ensureEntry(key, original);

			for (final Map.Entry<String, String> slot : google.slotsOf(key)) {
				final String language = slot.getKey();
				final String machineTranslation = slot.getValue();
				final Optional<RefinedSlot> existing = refined.getSlot(key, language);

				if (existing.map(RefinedSlot::hasRefined).orElse(false)) {
					this.log.debug("[SKIP] refine " + key + " (" + language + ") - cached");
					summary = summary.withSkipped();
				} else if (machineTranslation.isBlank()) {
					// nothing to refine until the machine pass succeeds
					summary = summary.withSkipped();
				} else {
					try {
						summary = refine(state, key, original, language, machineTranslation, existing, summary);
					} catch (NonRetriableException e) {
						this.log.error("[REFINE] Stopping refinement, the model failed permanently: " + e.getMessage());
						state.audit(AuditEvent.of("refine_abort", key, language).with("error", e.getMessage()));
						return summary.withFailure().withAbort();
					}
				}
				progress.onProgress(++done, total, language);
			}
		}
		return summary;
	}

	@Nonnull
	private StageSummary refine(
		@Nonnull ProjectState state,
		@Nonnull String key,
		@Nonnull String original,
		@Nonnull String language,
		@Nonnull String machineTranslation,
		@Nonnull Optional<RefinedSlot> existing,
		@Nonnull StageSummary summary
	) throws IOException {
		final String refinedText;
		try {
			refinedText = this.llmClient.complete(this.prompts.refinePrompt(original, machineTranslation, language));
		} catch (NonRetriableException e) {
			throw e;
		} catch (RuntimeException e) {
			this.log.warn("[REFINE] Failed " + key + " (" + language + "): " + e.getMessage());
			state.audit(AuditEvent.of("refine_error", key, language).with("error", e.getMessage()));
			return summary.withFailure();
		}

		if (refinedText.isEmpty()) {
			this.log.warn("[REFINE] Empty reply for " + key + " (" + language + "), will retry on the next run");
			state.audit(AuditEvent.of("refine_error", key, language).with("error", "empty reply"));
			return summary.withFailure();
		}

		final int previousAttempts = existing.map(RefinedSlot::attempts).orElse(0);
		state.refined().putSlot(key, original, language, RefinedSlot.refined(machineTranslation, refinedText, previousAttempts));
		state.saveRefined();
		state.audit(AuditEvent.of("refine", key, language).with("refined", refinedText));
		this.log.info("[REFINE] " + key + " (" + language + "): " + refinedText);
		return summary.withProcessed();
	}
}
