package io.evitadb.lexicon.stage;

import io.evitadb.lexicon.cache.AuditEvent;
import io.evitadb.lexicon.cache.ProjectState;
import io.evitadb.lexicon.model.FailedTranslation;
import io.evitadb.lexicon.model.QaSlot;
import io.evitadb.lexicon.model.QaStatus;
import io.evitadb.lexicon.model.RefinedSlot;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Human side of the QA loop: lists translations that failed automated review and applies
 * corrections supplied by a reviewer.
 *
 * A corrected slot gets status `OK_MANUAL`, which is terminal, so no later QA run touches it.
 */
public final class ManualReview {

	@Nonnull
	private final Log log;

	public ManualReview(@Nonnull Log log) {
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Lists every QA slot in `FAIL` state, in cache order.
	 *
	 * @param state project caches
	 * @return failed translations, never null
	 */
	@Nonnull
	public List<FailedTranslation> listFailures(@Nonnull ProjectState state) {
		Objects.requireNonNull(state, "state must not be null");
		final List<FailedTranslation> failures = new ArrayList<>();
		for (final String key : state.qa().keys()) {
			final String original = state.qa().getOriginal(key);
			for (final Map.Entry<String, QaSlot> slot : state.qa().slotsOf(key)) {
				if (slot.getValue().status() == QaStatus.FAIL) {
					failures.add(new FailedTranslation(key, slot.getKey(), original, slot.getValue().translation()));
				}
			}
		}
		return failures;
	}

	/**
	 * Writes the failures as a `key -> language -> best known text` document a reviewer can edit
	 * and feed back through {@link #applyCorrections(ProjectState, Map)}. The source texts go to a
	 * separate context document (`key -> {original, translations}`) so the editable file keeps the
	 * correction shape, and every failure is logged with its source text.
	 *
	 * @param state       project caches
	 * @param file        target file of the editable document
	 * @param contextFile target file of the context document
	 * @return number of failures written
	 * @throws IOException if a file cannot be written
	 */
	public int writeReviewFile(@Nonnull ProjectState state, @Nonnull Path file, @Nonnull Path contextFile) throws IOException {
		Objects.requireNonNull(file, "file must not be null");
		Objects.requireNonNull(contextFile, "contextFile must not be null");
		final Map<String, Map<String, String>> document = new LinkedHashMap<>();
		final Map<String, ReviewContext> context = new LinkedHashMap<>();
		final List<FailedTranslation> failures = listFailures(state);
		for (final FailedTranslation failure : failures) {
			document.computeIfAbsent(failure.key(), k -> new LinkedHashMap<>())
				.put(failure.language(), failure.translation());
			context.computeIfAbsent(failure.key(), k -> new ReviewContext(failure.original(), new LinkedHashMap<>()))
				.translations().put(failure.language(), failure.translation());

			this.log.info("[MANUAL] " + failure.key() + " (" + failure.language() + ")");
			this.log.info("[MANUAL]   original:    " + failure.original());
			this.log.info("[MANUAL]   translation: " + failure.translation());
		}
		state.getStore().write(file, document);
		state.getStore().write(contextFile, context);
		this.log.info("[MANUAL] " + failures.size() + " translation(s) awaiting review written to " + file +
			" (source texts in " + contextFile + ")");
		return failures.size();
	}

	/**
	 * Applies a human correction to one slot.
	 *
	 * @param state    project caches
	 * @param key      entry key
	 * @param language target language
	 * @param text     corrected translation, must not be blank
	 * @throws IllegalArgumentException if the text is blank or the key or its language slot is unknown
	 * @throws IOException              if a cache or the audit log cannot be written
	 */
	public void applyCorrection(
		@Nonnull ProjectState state,
		@Nonnull String key,
		@Nonnull String language,
		@Nonnull String text
	) throws IOException {
		Objects.requireNonNull(state, "state must not be null");
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(language, "language must not be null");
		Objects.requireNonNull(text, "text must not be null");
		if (text.isBlank()) {
			throw new IllegalArgumentException("Correction for " + key + " (" + language + ") must not be blank");
		}
		if (!state.qa().containsKey(key) && !state.refined().containsKey(key)) {
			throw new IllegalArgumentException("Unknown entry key: " + key);
		}
		if (state.qa().getSlot(key, language).isEmpty() && state.refined().getSlot(key, language).isEmpty()) {
			throw new IllegalArgumentException("Unknown language " + language + " for entry key: " + key);
		}

		final String original = state.qa().containsKey(key)
			? state.qa().getOriginal(key)
			: state.refined().getOriginal(key);
		final int attempts = state.qa().getSlot(key, language).map(QaSlot::attempts).orElse(0);
		state.qa().putSlot(key, original, language, new QaSlot(QaStatus.OK_MANUAL, text, attempts));

		final Optional<RefinedSlot> refinedSlot = state.refined().getSlot(key, language);
		state.refined().putSlot(key, original, language,
			refinedSlot.map(slot -> slot.withManualText(text))
				.orElseGet(() -> new RefinedSlot("", text, 0, QaStatus.OK_MANUAL)));

		state.saveQa();
		state.saveRefined();
		state.audit(AuditEvent.of("manual_edit", key, language).with("translation", text));
		this.log.info("[MANUAL] " + key + " (" + language + "): " + text);
	}

	/**
	 * Applies a batch of corrections in the shape written by {@link #writeReviewFile(ProjectState, Path, Path)}.
	 * Invalid corrections (blank text, unknown key or language) are reported and skipped.
	 *
	 * @param state       project caches
	 * @param corrections `key -> language -> text`
	 * @return number of corrections applied
	 * @throws IOException if a cache or the audit log cannot be written
	 */
	public int applyCorrections(
		@Nonnull ProjectState state,
		@Nonnull Map<String, Map<String, String>> corrections
	) throws IOException {
		Objects.requireNonNull(corrections, "corrections must not be null");
		int applied = 0;
		for (final Map.Entry<String, Map<String, String>> entry : corrections.entrySet()) {
			if (entry.getValue() == null) {
				continue;
			}
			for (final Map.Entry<String, String> correction : entry.getValue().entrySet()) {
				try {
					applyCorrection(state, entry.getKey(), correction.getKey(),
						correction.getValue() == null ? "" : correction.getValue());
					applied++;
				} catch (IllegalArgumentException e) {
					this.log.warn("[MANUAL] Skipping correction: " + e.getMessage());
				}
			}
		}
		return applied;
	}

	/**
	 * Entry of the review context document.
	 *
	 * @param original     source text
	 * @param translations language -> best known translation
	 */
	public record ReviewContext(@Nonnull String original, @Nonnull Map<String, String> translations) {
	}
}
