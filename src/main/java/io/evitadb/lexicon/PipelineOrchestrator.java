package io.evitadb.lexicon;

import io.evitadb.lexicon.cache.AuditEvent;
import io.evitadb.lexicon.cache.AuditLog;
import io.evitadb.lexicon.cache.JsonStore;
import io.evitadb.lexicon.cache.ProjectLayout;
import io.evitadb.lexicon.cache.ProjectLock;
import io.evitadb.lexicon.cache.ProjectState;
import io.evitadb.lexicon.llm.LlmClient;
import io.evitadb.lexicon.llm.PromptTemplates;
import io.evitadb.lexicon.model.FailedTranslation;
import io.evitadb.lexicon.mt.MachineTranslator;
import io.evitadb.lexicon.stage.ExportStage;
import io.evitadb.lexicon.stage.ExportSummary;
import io.evitadb.lexicon.stage.MachineTranslationStage;
import io.evitadb.lexicon.stage.ManualReview;
import io.evitadb.lexicon.stage.ProgressListener;
import io.evitadb.lexicon.stage.QaStage;
import io.evitadb.lexicon.stage.RefinementStage;
import io.evitadb.lexicon.stage.StageSummary;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drives the stages of a translation project: machine translation, refinement, QA and export.
 *
 * Stages run one after another; each starts only when the previous one finished for the whole batch.
 * Every operation holds the exclusive lock of the project directory and starts from the caches on
 * disk, so an interrupted run is resumed by simply running again. A stage whose language model failed
 * permanently stops early; the following model-driven stages are skipped while the export still runs.
 *
 * Providers are optional: a stage whose provider is missing must be skipped in the configuration.
 */
public final class PipelineOrchestrator {

	@Nonnull
	private final ProjectLayout layout;
	@Nonnull
	private final PipelineConfig config;
	@Nullable
	private final MachineTranslator machineTranslator;
	@Nullable
	private final LlmClient refineClient;
	@Nullable
	private final LlmClient qaClient;
	@Nonnull
	private final PromptTemplates prompts;
	@Nonnull
	private final ProgressListener progress;
	@Nonnull
	private final JsonStore store;
	@Nonnull
	private final Clock clock;
	@Nonnull
	private final Log log;

	/**
	 * Creates an orchestrator with the required services.
	 *
	 * @param layout            project directory layout
	 * @param config            pipeline settings
	 * @param machineTranslator machine translation provider, may be null when translation is skipped
	 * @param refineClient      refinement model, may be null when refinement is skipped
	 * @param qaClient          review model, may be null when QA is skipped
	 * @param prompts           prompt templates
	 * @param progress          progress callback
	 * @param log               Maven log for output
	 */
	public PipelineOrchestrator(
		@Nonnull ProjectLayout layout,
		@Nonnull PipelineConfig config,
		@Nullable MachineTranslator machineTranslator,
		@Nullable LlmClient refineClient,
		@Nullable LlmClient qaClient,
		@Nonnull PromptTemplates prompts,
		@Nonnull ProgressListener progress,
		@Nonnull Log log
	) {
		this(layout, config, machineTranslator, refineClient, qaClient, prompts, progress,
			new JsonStore(log), Clock.systemUTC(), log);
	}

	PipelineOrchestrator(
		@Nonnull ProjectLayout layout,
		@Nonnull PipelineConfig config,
		@Nullable MachineTranslator machineTranslator,
		@Nullable LlmClient refineClient,
		@Nullable LlmClient qaClient,
		@Nonnull PromptTemplates prompts,
		@Nonnull ProgressListener progress,
		@Nonnull JsonStore store,
		@Nonnull Clock clock,
		@Nonnull Log log
	) {
		this.layout = Objects.requireNonNull(layout, "layout must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.machineTranslator = machineTranslator;
		this.refineClient = refineClient;
		this.qaClient = qaClient;
		this.prompts = Objects.requireNonNull(prompts, "prompts must not be null");
		this.progress = Objects.requireNonNull(progress, "progress must not be null");
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	@Nonnull
	public ProjectLayout getLayout() {
		return this.layout;
	}

	@Nonnull
	public JsonStore getStore() {
		return this.store;
	}

	/**
	 * Runs the full pipeline for a batch and exports the result.
	 *
	 * @param entries source texts, key -> original
	 * @return run summary
	 * @throws IllegalArgumentException if no target language is configured
	 * @throws IllegalStateException    if an enabled stage has no provider
	 * @throws IOException              if the project is locked or its files cannot be written
	 */
	@Nonnull
	public PipelineSummary run(@Nonnull Map<String, String> entries) throws IOException {
		Objects.requireNonNull(entries, "entries must not be null");
		if (this.config.languages().isEmpty()) {
			throw new IllegalArgumentException("At least one target language is required");
		}
		requireProviders(!this.config.skipTranslation(), !this.config.skipRefinement(), !this.config.skipQa());

		try (ProjectLock ignored = ProjectLock.acquire(this.layout.lockFile())) {
			final ProjectState state = loadState();
			state.audit(AuditEvent.of("run_start", null, null)
				.with("entries", entries.size())
				.with("languages", String.join(",", this.config.languages())));

			StageSummary translation = StageSummary.empty();
			if (this.config.skipTranslation()) {
				this.log.info("[TRANSLATE] Skipped by configuration");
			} else {
				this.log.info("=== Machine translation: " + entries.size() + " entries into " + this.config.languages() + " ===");
				translation = new MachineTranslationStage(
					Objects.requireNonNull(this.machineTranslator), this.config.parallelism(),
					this.config.retryTranslationErrors(), this.log
				).run(entries, this.config.languages(), state, this.progress);
				this.log.info("[TRANSLATE] " + translation);
			}

			boolean aborted = translation.aborted();
			StageSummary refinement = StageSummary.empty();
			if (this.config.skipRefinement()) {
				this.log.info("[REFINE] Skipped by configuration");
			} else if (aborted) {
				this.log.warn("[REFINE] Skipped after a permanent provider failure");
			} else {
				this.log.info("=== Refinement ===");
				refinement = new RefinementStage(Objects.requireNonNull(this.refineClient), this.prompts, this.log)
					.run(state, this.progress);
				this.log.info("[REFINE] " + refinement);
				aborted = refinement.aborted();
			}

			StageSummary qa = StageSummary.empty();
			if (this.config.skipQa()) {
				this.log.info("[QA] Skipped by configuration");
			} else if (aborted) {
				this.log.warn("[QA] Skipped after a permanent provider failure");
			} else {
				this.log.info("=== Quality review ===");
				qa = runQa(state, this.config.retryOnFail());
			}

			final ExportSummary export = new ExportStage(this.log).export(state, this.config.includeFailures());
			return summarize(state, translation, refinement, qa, export);
		}
	}

	/**
	 * Reviews the whole batch again without retries (corrections are adopted but not re-reviewed)
	 * and exports the result. Settled slots, including manual corrections, are left untouched.
	 *
	 * @return run summary
	 * @throws IllegalStateException if no review model is configured
	 * @throws IOException           if the project is locked or its files cannot be written
	 */
	@Nonnull
	public PipelineSummary revalidate() throws IOException {
		requireProviders(false, false, true);
		try (ProjectLock ignored = ProjectLock.acquire(this.layout.lockFile())) {
			final ProjectState state = loadState();
			final StageSummary qa = runQa(state, false);
			final ExportSummary export = new ExportStage(this.log).export(state, this.config.includeFailures());
			return summarize(state, StageSummary.empty(), StageSummary.empty(), qa, export);
		}
	}

	/**
	 * Exports the current QA cache.
	 *
	 * @return export summary
	 * @throws IOException if the project is locked or a file cannot be written
	 */
	@Nonnull
	public ExportSummary export() throws IOException {
		try (ProjectLock ignored = ProjectLock.acquire(this.layout.lockFile())) {
			return new ExportStage(this.log).export(loadState(), this.config.includeFailures());
		}
	}

	/**
	 * Lists translations waiting for a human.
	 *
	 * @return failed translations
	 * @throws IOException if the project is locked
	 */
	@Nonnull
	public List<FailedTranslation> listFailures() throws IOException {
		try (ProjectLock ignored = ProjectLock.acquire(this.layout.lockFile())) {
			return new ManualReview(this.log).listFailures(loadState());
		}
	}

	/**
	 * Writes the review file listing all failed translations.
	 *
	 * @return the written file
	 * @throws IOException if the project is locked or the file cannot be written
	 */
	@Nonnull
	public Path writeReview() throws IOException {
		try (ProjectLock ignored = ProjectLock.acquire(this.layout.lockFile())) {
			final Path file = this.layout.reviewFile();
			new ManualReview(this.log).writeReviewFile(loadState(), file, this.layout.reviewContextFile());
			return file;
		}
	}

	/**
	 * Applies a single human correction.
	 *
	 * @param key      entry key
	 * @param language target language
	 * @param text     corrected translation
	 * @throws IllegalArgumentException if the text is blank or the key or its language slot is unknown
	 * @throws IOException              if the project is locked or its files cannot be written
	 */
	public void applyCorrection(@Nonnull String key, @Nonnull String language, @Nonnull String text) throws IOException {
		try (ProjectLock ignored = ProjectLock.acquire(this.layout.lockFile())) {
			new ManualReview(this.log).applyCorrection(loadState(), key, language, text);
		}
	}

	/**
	 * Applies human corrections and optionally revalidates and exports the batch.
	 *
	 * @param corrections `key -> language -> text`
	 * @param revalidate  true to run QA without retries and export afterwards
	 * @return run summary; the stage summaries are empty without revalidation
	 * @throws IOException if the project is locked or its files cannot be written
	 */
	@Nonnull
	public PipelineSummary applyCorrections(
		@Nonnull Map<String, Map<String, String>> corrections,
		boolean revalidate
	) throws IOException {
		Objects.requireNonNull(corrections, "corrections must not be null");
		requireProviders(false, false, revalidate);
		try (ProjectLock ignored = ProjectLock.acquire(this.layout.lockFile())) {
			final ProjectState state = loadState();
			final int applied = new ManualReview(this.log).applyCorrections(state, corrections);
			this.log.info("[MANUAL] " + applied + " correction(s) applied");
			if (!revalidate) {
				return summarize(state, StageSummary.empty(), StageSummary.empty(), StageSummary.empty(), null);
			}
			final StageSummary qa = runQa(state, false);
			final ExportSummary export = new ExportStage(this.log).export(state, this.config.includeFailures());
			return summarize(state, StageSummary.empty(), StageSummary.empty(), qa, export);
		}
	}

	@Nonnull
	private StageSummary runQa(@Nonnull ProjectState state, boolean retryOnFail) throws IOException {
		final StageSummary qa = new QaStage(
			Objects.requireNonNull(this.qaClient), this.prompts, this.config.maxQaAttempts(), this.log
		).run(state, retryOnFail, this.progress);
		this.log.info("[QA] " + qa);
		return qa;
	}

	@Nonnull
	private ProjectState loadState() {
		final AuditLog auditLog = new AuditLog(this.layout.auditLog(), this.store.getMapper(), this.clock);
		return ProjectState.load(this.layout, this.store, auditLog);
	}

	private void requireProviders(boolean translation, boolean refinement, boolean qa) {
		if (translation && this.machineTranslator == null) {
			throw new IllegalStateException("No machine translation provider configured");
		}
		if (refinement && this.refineClient == null) {
			throw new IllegalStateException("No refinement model configured");
		}
		if (qa && this.qaClient == null) {
			throw new IllegalStateException("No review model configured");
		}
	}

	@Nonnull
	private PipelineSummary summarize(
		@Nonnull ProjectState state,
		@Nonnull StageSummary translation,
		@Nonnull StageSummary refinement,
		@Nonnull StageSummary qa,
		@Nullable ExportSummary export
	) {
		final int awaitingReview = new ManualReview(this.log).listFailures(state).size();
		long inputTokens = 0;
		long outputTokens = 0;
		if (this.refineClient != null) {
			inputTokens += this.refineClient.getInputTokenCount();
			outputTokens += this.refineClient.getOutputTokenCount();
		}
		if (this.qaClient != null && this.qaClient != this.refineClient) {
			inputTokens += this.qaClient.getInputTokenCount();
			outputTokens += this.qaClient.getOutputTokenCount();
		}
		return new PipelineSummary(translation, refinement, qa, export, awaitingReview, inputTokens, outputTokens);
	}
}
