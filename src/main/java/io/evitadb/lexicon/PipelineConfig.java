package io.evitadb.lexicon;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable settings of a pipeline run.
 *
 * @param languages              target language codes (letters, digits, `_` and `-`), trimmed and without duplicates
 * @param parallelism            concurrent machine translation requests
 * @param maxQaAttempts          review cycles allowed per slot
 * @param retryOnFail            validate an adopted correction once more within the attempt budget
 * @param includeFailures        export the best known text of failed slots
 * @param retryTranslationErrors leave failed machine translations empty so the next run retries them
 * @param skipTranslation        do not run the machine translation stage
 * @param skipRefinement         do not run the refinement stage
 * @param skipQa                 do not run the QA stage
 */
public record PipelineConfig(
	@Nonnull List<String> languages,
	int parallelism,
	int maxQaAttempts,
	boolean retryOnFail,
	boolean includeFailures,
	boolean retryTranslationErrors,
	boolean skipTranslation,
	boolean skipRefinement,
	boolean skipQa
) {

	public static final int DEFAULT_PARALLELISM = 8;
	public static final int DEFAULT_MAX_QA_ATTEMPTS = 3;
	/** Language codes become part of export file names. */
	private static final Pattern LANGUAGE_CODE = Pattern.compile("[A-Za-z0-9_-]+");

	public PipelineConfig {
		Objects.requireNonNull(languages, "languages must not be null");
		final Set<String> normalized = new LinkedHashSet<>();
		for (final String language : languages) {
			if (language == null || language.isBlank()) {
				throw new IllegalArgumentException("Language codes must not be blank");
			}
			final String code = language.trim();
			if (!LANGUAGE_CODE.matcher(code).matches()) {
				throw new IllegalArgumentException("Invalid language code: " + code);
			}
			normalized.add(code);
		}
		languages = List.copyOf(new ArrayList<>(normalized));
		if (parallelism < 1) {
			throw new IllegalArgumentException("parallelism must be at least 1");
		}
		if (maxQaAttempts < 1) {
			throw new IllegalArgumentException("maxQaAttempts must be at least 1");
		}
	}

	@Nonnull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder with the defaults of the Maven plugin.
	 */
	public static final class Builder {
		private final List<String> languages = new ArrayList<>();
		private int parallelism = DEFAULT_PARALLELISM;
		private int maxQaAttempts = DEFAULT_MAX_QA_ATTEMPTS;
		private boolean retryOnFail = true;
		private boolean includeFailures = true;
		private boolean retryTranslationErrors = true;
		private boolean skipTranslation;
		private boolean skipRefinement;
		private boolean skipQa;

		private Builder() {
		}

		@Nonnull
		public Builder languages(@Nonnull Collection<String> languages) {
			this.languages.clear();
			this.languages.addAll(languages);
			return this;
		}

		@Nonnull
		public Builder languages(@Nonnull String... languages) {
			return languages(List.of(languages));
		}

		@Nonnull
		public Builder parallelism(int parallelism) {
			this.parallelism = parallelism;
			return this;
		}

		@Nonnull
		public Builder maxQaAttempts(int maxQaAttempts) {
			this.maxQaAttempts = maxQaAttempts;
			return this;
		}

		@Nonnull
		public Builder retryOnFail(boolean retryOnFail) {
			this.retryOnFail = retryOnFail;
			return this;
		}

		@Nonnull
		public Builder includeFailures(boolean includeFailures) {
			this.includeFailures = includeFailures;
			return this;
		}

		@Nonnull
		public Builder retryTranslationErrors(boolean retryTranslationErrors) {
			this.retryTranslationErrors = retryTranslationErrors;
			return this;
		}

		@Nonnull
		public Builder skipTranslation(boolean skipTranslation) {
			this.skipTranslation = skipTranslation;
			return this;
		}

		@Nonnull
		public Builder skipRefinement(boolean skipRefinement) {
			this.skipRefinement = skipRefinement;
			return this;
		}

		@Nonnull
		public Builder skipQa(boolean skipQa) {
			this.skipQa = skipQa;
			return this;
		}

		/**
		 * Builds the configuration.
		 *
		 * @return validated configuration
		 * @throws IllegalArgumentException if a language is blank, parallelism or maxQaAttempts is below 1
		 */
		@Nonnull
		public PipelineConfig build() {
			return new PipelineConfig(
				this.languages, this.parallelism, this.maxQaAttempts, this.retryOnFail, this.includeFailures,
				this.retryTranslationErrors, this.skipTranslation, this.skipRefinement, this.skipQa
			);
		}
	}
}
