package io.evitadb.lexicon.stage;

import dev.langchain4j.exception.NonRetriableException;
import io.evitadb.lexicon.cache.AuditEvent;
import io.evitadb.lexicon.cache.ProjectState;
import io.evitadb.lexicon.cache.TranslationCache;
import io.evitadb.lexicon.llm.LlmClient;
import io.evitadb.lexicon.llm.PromptTemplates;
import io.evitadb.lexicon.model.QaSlot;
import io.evitadb.lexicon.model.QaStatus;
import io.evitadb.lexicon.model.RefinedSlot;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Third stage: automated quality review with a single repair retry.
 *
 * For every refined slot the reviewer model answers "OK" or proposes a corrected translation.
 * A correction different from the reviewed text is adopted (`FIXED`) and written back into the
 * refined cache. While retries are enabled and the attempt budget lasts, the correction is validated
 * once more: a second "OK" promotes it to `OK`, any other answer ends in `FAIL`. Outcomes:
 * - `OK` the reviewer accepted the text,
 * - `OK_IDENTICAL` the reviewer echoed the reviewed text back,
 * - `FAIL` the correction was not confirmed or no retry was allowed; the correction is kept.
 *
 * A slot whose status is terminal and whose translation equals the current refined text is not
 * reviewed again, which also protects human corrections (`OK_MANUAL`). Both caches are saved after
 * every review step.
 */
public final class QaStage {

	private static final String OK_REPLY = "OK";

	@Nonnull
	private final LlmClient llmClient;
	@Nonnull
	private final PromptTemplates prompts;
	private final int maxAttempts;
	@Nonnull
	private final Log log;

	/**
	 * Creates the stage.
	 *
	 * @param llmClient   reviewer model
	 * @param prompts     prompt templates
	 * @param maxAttempts review cycles allowed per slot and refined text
	 * @param log         Maven log for output
	 */
	public QaStage(
		@Nonnull LlmClient llmClient,
		@Nonnull PromptTemplates prompts,
		int maxAttempts,
		@Nonnull Log log
	) {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1");
		}
		this.llmClient = Objects.requireNonNull(llmClient, "llmClient must not be null");
		this.prompts = Objects.requireNonNull(prompts, "prompts must not be null");
		this.maxAttempts = maxAttempts;
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	public int getMaxAttempts() {
		return this.maxAttempts;
	}

	/**
	 * Reviews every refined slot that is not settled yet.
	 *
	 * @param state       project caches
	 * @param retryOnFail true to review adopted corrections again within the attempt budget
	 * @param progress    progress callback, invoked per slot
	 * @return stage summary; `aborted` is set when the model failed permanently
	 * @throws IOException if a cache or the audit log cannot be written
	 */
	@Nonnull
	public StageSummary run(
		@Nonnull ProjectState state,
		boolean retryOnFail,
		@Nonnull ProgressListener progress
	) throws IOException {
		Objects.requireNonNull(state, "state must not be null");
		Objects.requireNonNull(progress, "progress must not be null");

		final TranslationCache<RefinedSlot> refined = state.refined();
		final int total = refined.slotCount();
		int done = 0;
		StageSummary summary = StageSummary.empty();

		for (final String key : refined.keys()) {
			final String original = refined.getOriginal(key);
			state.qa().ensureEntry(key, original);

			for (final Map.Entry<String, RefinedSlot> slot : refined.slotsOf(key)) {
				final String language = slot.getKey();
				final String refinedText = slot.getValue().refined();
				final QaSlot current = state.qa().getSlot(key, language).orElse(null);

				if (refinedText.isBlank() || (current != null && current.isSettledFor(refinedText))) {
					this.log.debug("[SKIP] qa " + key + " (" + language + ") - settled");
					summary = summary.withSkipped();
				} else {
					try {
						review(state, key, original, language, refinedText, current, retryOnFail);
						summary = summary.withProcessed();
					} catch (NonRetriableException e) {
						this.log.error("[QA] Stopping review, the model failed permanently: " + e.getMessage());
						state.audit(AuditEvent.of("qa_abort", key, language).with("error", e.getMessage()));
						return summary.withFailure().withAbort();
					} catch (RuntimeException e) {
						this.log.warn("[QA] Failed " + key + " (" + language + "): " + e.getMessage());
						state.audit(AuditEvent.of("qa_error", key, language).with("error", e.getMessage()));
						summary = summary.withFailure();
					}
				}
				progress.onProgress(++done, total, language);
			}
		}
		return summary;
	}

	/**
	 * Reviews one slot: a validation and, after an adopted correction, at most one re-validation.
	 *
	 * The attempt budget is continued when the slot was interrupted on the same text (a `FIXED` slot
	 * whose correction already sits in the refined cache) and restarts when the refined text changed.
	 */
	private void review(
		@Nonnull ProjectState state,
		@Nonnull String key,
		@Nonnull String original,
		@Nonnull String language,
		@Nonnull String refinedText,
		@Nullable QaSlot current,
		boolean retryOnFail
	) throws IOException {
		int attempts = current != null && current.translation().equals(refinedText) ? current.attempts() : 0;
		final String candidate = refinedText.trim();

		if (attempts >= this.maxAttempts) {
			decide(state, key, original, language, QaStatus.FAIL, candidate, attempts, "attempts exhausted");
			return;
		}

		final String reply = validate(original, candidate, language);
		attempts++;

		if (OK_REPLY.equalsIgnoreCase(reply)) {
			decide(state, key, original, language, QaStatus.OK, candidate, attempts, null);
			return;
		}
		if (reply.equals(candidate)) {
			decide(state, key, original, language, QaStatus.OK_IDENTICAL, candidate, attempts, null);
			return;
		}

		decide(state, key, original, language, QaStatus.FIXED, reply, attempts, null);

		if (!retryOnFail || attempts >= this.maxAttempts) {
			decide(state, key, original, language, QaStatus.FAIL, reply, attempts,
				retryOnFail ? "attempts exhausted" : "retries disabled");
			return;
		}

		this.log.info("[QA] Reviewing correction of " + key + " (" + language + "), attempt " + (attempts + 1));
		final String retryReply = validate(original, reply, language);
		attempts++;
		if (OK_REPLY.equalsIgnoreCase(retryReply)) {
			decide(state, key, original, language, QaStatus.OK, reply, attempts, null);
		} else {
			// the correction stays the best known text, the second answer only goes to the audit log
			state.audit(AuditEvent.of("qa_retry", key, language).with("reply", retryReply));
			decide(state, key, original, language, QaStatus.FAIL, reply, attempts, "correction not confirmed");
		}
	}

	@Nonnull
	private String validate(@Nonnull String original, @Nonnull String text, @Nonnull String language) {
		final String reply = this.llmClient.complete(this.prompts.validatePrompt(original, text, language));
		if (reply.isEmpty()) {
			throw new IllegalStateException("empty review reply");
		}
		return reply;
	}

	/**
	 * Records one review decision in both caches and persists them.
	 * A `FIXED` decision replaces the refined text with the correction.
	 */
	private void decide(
		@Nonnull ProjectState state,
		@Nonnull String key,
		@Nonnull String original,
		@Nonnull String language,
		@Nonnull QaStatus status,
		@Nonnull String translation,
		int attempts,
		@Nullable String reason
	) throws IOException {
		state.qa().putSlot(key, original, language, new QaSlot(status, translation, attempts));

		final TranslationCache<RefinedSlot> refined = state.refined();
		final RefinedSlot refinedSlot = refined.getSlot(key, language)
			.orElseThrow(() -> new IllegalStateException("No refined slot for " + key + " (" + language + ")"));
		refined.putSlot(key, original, language,
			status == QaStatus.FIXED
				? refinedSlot.withCorrection(translation, status)
				: refinedSlot.withQaStatus(status));

		state.saveQa();
		state.saveRefined();

		AuditEvent event = AuditEvent.of("qa", key, language)
			.with("status", status.name())
			.with("attempts", attempts);
		if (status == QaStatus.FIXED || status == QaStatus.FAIL) {
			event = event.with("translation", translation);
		}
		if (reason != null) {
			event = event.with("reason", reason);
		}
		state.audit(event);

		final String message = "[QA] " + status + " " + key + " (" + language + ")" +
			(status == QaStatus.FIXED ? ": " + translation : "") +
			(reason != null ? " - " + reason : "");
		if (status == QaStatus.FAIL) {
			this.log.warn(message);
		} else {
			this.log.info(message);
		}
	}
}
