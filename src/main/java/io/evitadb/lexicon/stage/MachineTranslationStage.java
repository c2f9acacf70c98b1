package io.evitadb.lexicon.stage;

import io.evitadb.lexicon.cache.AuditEvent;
import io.evitadb.lexicon.cache.ProjectState;
import io.evitadb.lexicon.cache.TranslationCache;
import io.evitadb.lexicon.mt.MachineTranslator;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * First stage: fills the Google cache with machine translations.
 *
 * Languages are processed one after another; within a language the open slots are translated on a
 * fixed thread pool, so at most `parallelism` requests are outstanding. Results are written to the
 * cache by the calling thread only, and the cache is saved after every language.
 *
 * A failed request never stops the batch. Depending on `retryErrors` the slot either stays empty
 * (and is retried by the next run) or receives an error-tagged text that downstream stages treat
 * like any other translation.
 */
public final class MachineTranslationStage {

	public static final String ERROR_TAG_PREFIX = "[translation error: ";

	private static final String LEGACY_ERROR_TAG_PREFIX = "[Google ERROR: ";
	private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

	@Nonnull
	private final MachineTranslator translator;
	private final int parallelism;
	private final boolean retryErrors;
	@Nonnull
	private final Log log;

	/**
	 * Creates the stage.
	 *
	 * @param translator  machine-translation provider
	 * @param parallelism number of concurrent requests within one language
	 * @param retryErrors true to leave failed slots empty, false to record an error-tagged text
	 * @param log         Maven log for output
	 */
	public MachineTranslationStage(
		@Nonnull MachineTranslator translator,
		int parallelism,
		boolean retryErrors,
		@Nonnull Log log
	) {
		if (parallelism < 1) {
			throw new IllegalArgumentException("parallelism must be at least 1");
		}
		this.translator = Objects.requireNonNull(translator, "translator must not be null");
		this.parallelism = parallelism;
		this.retryErrors = retryErrors;
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Returns true if a cached text is the record of a failed request rather than a translation.
	 *
	 * @param text cached text
	 * @return true for error-tagged texts
	 */
	public static boolean isErrorTagged(@Nonnull String text) {
		return text.startsWith(ERROR_TAG_PREFIX) || text.startsWith(LEGACY_ERROR_TAG_PREFIX);
	}

	/**
	 * Translates every entry into every language whose slot is still open.
	 *
	 * @param entries   merged input entries, key -> original text
	 * @param languages target language codes
	 * @param state     project caches
	 * @param progress  progress callback, invoked per slot with totals per language
	 * @return summary over all languages
	 * @throws IOException if the cache or audit log cannot be written
	 */
	@Nonnull
	public StageSummary run(
		@Nonnull Map<String, String> entries,
		@Nonnull List<String> languages,
		@Nonnull ProjectState state,
		@Nonnull ProgressListener progress
	) throws IOException {
		Objects.requireNonNull(entries, "entries must not be null");
		Objects.requireNonNull(languages, "languages must not be null");
		Objects.requireNonNull(state, "state must not be null");
		Objects.requireNonNull(progress, "progress must not be null");

		final ExecutorService executor = Executors.newFixedThreadPool(this.parallelism);
		try {
			StageSummary summary = StageSummary.empty();
			for (final String language : languages) {
				summary = summary.add(translateLanguage(entries, language, state, progress, executor));
			}
			return summary;
		} finally {
			shutdown(executor);
		}
	}

	@Nonnull
	private StageSummary translateLanguage(
		@Nonnull Map<String, String> entries,
		@Nonnull String language,
		@Nonnull ProjectState state,
		@Nonnull ProgressListener progress,
		@Nonnull ExecutorService executor
	) throws IOException {
		final TranslationCache<String> cache = state.google();
		StageSummary summary = StageSummary.empty();

		// submit open slots
		final Map<String, CompletableFuture<String>> pending = new LinkedHashMap<>();
		for (final Map.Entry<String, String> entry : entries.entrySet()) {
			final String key = entry.getKey();
			final String original = entry.getValue();
			cache.ensureEntry(key, original);

			final String cached = cache.getSlot(key, language).orElse("");
			if (!cached.isEmpty() && !(this.retryErrors && isErrorTagged(cached))) {
				this.log.debug("[SKIP] google " + key + " (" + language + ") - cached");
				summary = summary.withSkipped();
				continue;
			}
			pending.put(key, CompletableFuture.supplyAsync(() -> this.translator.translate(original, language), executor));
		}

		this.log.info("[TRANSLATE] " + language + ": " + pending.size() + " to translate, " +
			summary.skipped() + " cached");

		// collect in submission order, single writer
		int done = 0;
		for (final Map.Entry<String, CompletableFuture<String>> result : pending.entrySet()) {
			final String key = result.getKey();
			String translation;
			String error = null;
			try {
				translation = result.getValue().join();
				if (translation == null || translation.isBlank()) {
					translation = null;
					error = "empty translation";
				}
			} catch (CompletionException e) {
				translation = null;
				error = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
			}

			if (translation != null) {
				cache.putSlot(key, null, language, translation);
				state.audit(AuditEvent.of("google", key, language).with("translation", translation));
				this.log.debug("[TRANSLATE] " + key + " (" + language + "): " + translation);
				summary = summary.withProcessed();
			} else {
				this.log.warn("[TRANSLATE] Failed " + key + " (" + language + "): " + error);
				if (!this.retryErrors) {
					cache.putSlot(key, null, language, ERROR_TAG_PREFIX + error + "]");
				} else if (cache.getSlot(key, language).map(MachineTranslationStage::isErrorTagged).orElse(false)) {
					// drop the stale error record, the slot stays open
					cache.putSlot(key, null, language, "");
				}
				state.audit(AuditEvent.of("google_error", key, language).with("error", error));
				summary = summary.withFailure();
			}
			progress.onProgress(++done, pending.size(), language);
		}

		state.saveGoogle();
		return summary;
	}

	/**
	 * Shuts the pool down gracefully, waiting for pending tasks to complete.
	 */
	private void shutdown(@Nonnull ExecutorService executor) {
		executor.shutdown();
		try {
			if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				this.log.warn("Translation pool did not terminate in time, forcing shutdown");
				executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			executor.shutdownNow();
		}
	}
}
