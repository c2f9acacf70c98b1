package io.evitadb.lexicon;

import dev.langchain4j.model.chat.ChatModel;
import io.evitadb.lexicon.cache.JsonStore;
import io.evitadb.lexicon.cache.ProjectLayout;
import io.evitadb.lexicon.cache.ProjectLockedException;
import io.evitadb.lexicon.llm.ChatModelFactory;
import io.evitadb.lexicon.llm.LlmClient;
import io.evitadb.lexicon.llm.PromptTemplates;
import io.evitadb.lexicon.mt.GoogleWebTranslator;
import io.evitadb.lexicon.mt.LlmMachineTranslator;
import io.evitadb.lexicon.mt.MachineTranslator;
import io.evitadb.lexicon.stage.ExportSummary;
import io.evitadb.lexicon.stage.StageSummary;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Main Mojo for the Lexicon plugin providing actions:
 * - show-config: prints current configuration
 * - translate: runs machine translation, refinement, QA and export for the input batch
 * - review: writes translations that failed QA into `review/failures.json`
 * - override: applies human corrections from a file, optionally revalidating
 * - revalidate: runs QA without retries over the batch and exports
 * - export: writes the export files from the current QA state
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class LexiconMojo extends AbstractMojo {

	private static final String MT_GOOGLE = "google";
	private static final String MT_LLM = "llm";

	/** Which action to perform: "show-config", "translate", "review", "override", "revalidate" or "export". */
	@Parameter(property = "lexicon.action", defaultValue = "show-config")
	private String action;

	/** Project directory holding caches, logs, exports and review files. */
	@Parameter(property = "lexicon.projectDir", defaultValue = "${project.basedir}/translation")
	private String projectDir;

	/** Directory with the source JSON documents (no default). */
	@Parameter(property = "lexicon.inputDir")
	private String inputDir;

	/** Additional source JSON documents, read after the input directory. */
	@Parameter(property = "lexicon.inputFiles")
	private List<String> inputFiles;

	/** Target language codes (no default). */
	@Parameter(property = "lexicon.languages")
	private List<String> languages;

	/** Machine translation provider: "google" or "llm". */
	@Parameter(property = "lexicon.mtProvider", defaultValue = MT_GOOGLE)
	private String mtProvider = MT_GOOGLE;

	/** LLM provider: "openai" or "anthropic". */
	@Parameter(property = "lexicon.llmProvider", defaultValue = ChatModelFactory.PROVIDER_OPENAI)
	private String llmProvider = ChatModelFactory.PROVIDER_OPENAI;

	/** LLM URL, a local OpenAI compatible server by default. */
	@Parameter(property = "lexicon.llmUrl", defaultValue = ChatModelFactory.DEFAULT_URL)
	private String llmUrl = ChatModelFactory.DEFAULT_URL;

	/** LLM token (no default). */
	@Parameter(property = "lexicon.llmToken")
	private String llmToken;

	/** Model refining the machine translations. */
	@Parameter(property = "lexicon.refineModel", defaultValue = ChatModelFactory.DEFAULT_MODEL)
	private String refineModel = ChatModelFactory.DEFAULT_MODEL;

	/** Model reviewing the refined translations. */
	@Parameter(property = "lexicon.qaModel", defaultValue = ChatModelFactory.DEFAULT_MODEL)
	private String qaModel = ChatModelFactory.DEFAULT_MODEL;

	/** Maximum tokens of a model reply. */
	@Parameter(property = "lexicon.maxTokens", defaultValue = "256")
	private int maxTokens = ChatModelFactory.DEFAULT_MAX_TOKENS;

	/** Sampling temperature. */
	@Parameter(property = "lexicon.temperature", defaultValue = "0.2")
	private double temperature = ChatModelFactory.DEFAULT_TEMPERATURE;

	/** Number of parallel machine translation requests (default 8). */
	@Parameter(property = "lexicon.parallelism", defaultValue = "8")
	private int parallelism = PipelineConfig.DEFAULT_PARALLELISM;

	/** Review cycles allowed per translation (default 3). */
	@Parameter(property = "lexicon.maxQaAttempts", defaultValue = "3")
	private int maxQaAttempts = PipelineConfig.DEFAULT_MAX_QA_ATTEMPTS;

	/** When true, a correction proposed by the reviewer is validated once more. */
	@Parameter(property = "lexicon.retryOnFail", defaultValue = "true")
	private boolean retryOnFail = true;

	/** When true, translations that failed review are exported with their best known text. */
	@Parameter(property = "lexicon.includeFailures", defaultValue = "true")
	private boolean includeFailures = true;

	/** When true, failed machine translations are left empty and retried by the next run. */
	@Parameter(property = "lexicon.retryTranslationErrors", defaultValue = "true")
	private boolean retryTranslationErrors = true;

	@Parameter(property = "lexicon.skipTranslation", defaultValue = "false")
	private boolean skipTranslation;

	@Parameter(property = "lexicon.skipRefinement", defaultValue = "false")
	private boolean skipRefinement;

	@Parameter(property = "lexicon.skipQa", defaultValue = "false")
	private boolean skipQa;

	/** Corrections file for the override action, `key -> language -> text`. */
	@Parameter(property = "lexicon.corrections")
	private String corrections;

	/** When true, the override action revalidates and exports after applying corrections. */
	@Parameter(property = "lexicon.revalidate", defaultValue = "false")
	private boolean revalidate;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "translate":
				translate(getLog());
				break;
			case "review":
				review(getLog());
				break;
			case "override":
				override(getLog());
				break;
			case "revalidate":
				revalidate(getLog());
				break;
			case "export":
				export(getLog());
				break;
			default:
				throw new MojoExecutionException("Unknown action: " + this.action +
					". Supported actions: show-config, translate, review, override, revalidate, export");
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("Lexicon Plugin Configuration:");
		log.info(" - projectDir: " + orNotSet(this.projectDir));
		if (isBlank(this.projectDir)) {
			log.warn("Project directory is not set");
		}
		log.info(" - inputDir: " + orNotSet(this.inputDir));
		log.info(" - inputFiles: " + (this.inputFiles == null || this.inputFiles.isEmpty() ? "<none>" : String.join(",", this.inputFiles)));
		if (isBlank(this.inputDir) && (this.inputFiles == null || this.inputFiles.isEmpty())) {
			log.warn("No input configured");
		}
		if (this.languages == null || this.languages.isEmpty()) {
			log.info(" - languages: <none>");
			log.warn("No target languages configured");
		} else {
			log.info(" - languages: " + String.join(",", this.languages));
		}
		log.info(" - mtProvider: " + this.mtProvider);
		log.info(" - llmProvider: " + this.llmProvider);
		log.info(" - llmUrl: " + orNotSet(this.llmUrl));
		log.info(" - llmToken: " + (isBlank(this.llmToken) ? "<not set>" : mask(this.llmToken)));
		log.info(" - refineModel: " + this.refineModel);
		log.info(" - qaModel: " + this.qaModel);
		log.info(" - maxTokens: " + this.maxTokens);
		log.info(" - temperature: " + this.temperature);
		log.info(" - parallelism: " + this.parallelism);
		log.info(" - maxQaAttempts: " + this.maxQaAttempts);
		log.info(" - retryOnFail: " + this.retryOnFail);
		log.info(" - includeFailures: " + this.includeFailures);
		log.info(" - retryTranslationErrors: " + this.retryTranslationErrors);
		log.info(" - skip: translation=" + this.skipTranslation + ", refinement=" + this.skipRefinement + ", qa=" + this.skipQa);
	}

	private void translate(@Nonnull final Log log) throws MojoExecutionException {
		if (this.languages == null || this.languages.isEmpty()) {
			throw new MojoExecutionException("At least one target language must be specified for translate action");
		}
		if (isBlank(this.inputDir) && (this.inputFiles == null || this.inputFiles.isEmpty())) {
			throw new MojoExecutionException("Input directory or input files must be specified for translate action");
		}

		final PipelineOrchestrator orchestrator = createOrchestrator(
			log, !this.skipTranslation, !this.skipRefinement, !this.skipQa
		);
		try {
			final Map<String, String> entries = new InputLoader(orchestrator.getStore(), log).load(
				isBlank(this.inputDir) ? null : Path.of(this.inputDir).toAbsolutePath().normalize(),
				toPaths(this.inputFiles)
			);
			if (entries.isEmpty()) {
				log.warn("No entries to translate");
			}
			logSummary(log, orchestrator.run(entries));
		} catch (IOException | RuntimeException ex) {
			throw failure("translate", ex);
		}
	}

	private void review(@Nonnull final Log log) throws MojoExecutionException {
		final PipelineOrchestrator orchestrator = createOrchestrator(log, false, false, false);
		try {
			final Path file = orchestrator.writeReview();
			log.info("Edit " + file + " and apply it with -Dlexicon.action=override -Dlexicon.corrections=" + file);
		} catch (IOException | RuntimeException ex) {
			throw failure("review", ex);
		}
	}

	private void override(@Nonnull final Log log) throws MojoExecutionException {
		if (isBlank(this.corrections)) {
			throw new MojoExecutionException("Corrections file must be specified for override action");
		}
		final PipelineOrchestrator orchestrator = createOrchestrator(log, false, false, this.revalidate);
		try {
			final Map<String, Map<String, String>> document =
				orchestrator.getStore().readNested(Path.of(this.corrections).toAbsolutePath().normalize());
			final PipelineSummary summary = orchestrator.applyCorrections(document, this.revalidate);
			if (this.revalidate) {
				logSummary(log, summary);
			} else {
				log.info("Translations awaiting review: " + summary.awaitingReview());
			}
		} catch (IOException | RuntimeException ex) {
			throw failure("override", ex);
		}
	}

	private void revalidate(@Nonnull final Log log) throws MojoExecutionException {
		final PipelineOrchestrator orchestrator = createOrchestrator(log, false, false, true);
		try {
			logSummary(log, orchestrator.revalidate());
		} catch (IOException | RuntimeException ex) {
			throw failure("revalidate", ex);
		}
	}

	private void export(@Nonnull final Log log) throws MojoExecutionException {
		final PipelineOrchestrator orchestrator = createOrchestrator(log, false, false, false);
		try {
			final ExportSummary summary = orchestrator.export();
			log.info("--- Export Summary ---");
			log.info(summary.toString());
		} catch (IOException | RuntimeException ex) {
			throw failure("export", ex);
		}
	}

	/**
	 * Creates the orchestrator, building only the providers the action needs.
	 */
	@Nonnull
	private PipelineOrchestrator createOrchestrator(
		@Nonnull final Log log,
		final boolean needsTranslator,
		final boolean needsRefinement,
		final boolean needsQa
	) throws MojoExecutionException {
		if (isBlank(this.projectDir)) {
			throw new MojoExecutionException("Project directory must be specified");
		}
		try {
			final PipelineConfig config = PipelineConfig.builder()
				.languages(this.languages == null ? List.of() : this.languages)
				.parallelism(this.parallelism)
				.maxQaAttempts(this.maxQaAttempts)
				.retryOnFail(this.retryOnFail)
				.includeFailures(this.includeFailures)
				.retryTranslationErrors(this.retryTranslationErrors)
				.skipTranslation(this.skipTranslation)
				.skipRefinement(this.skipRefinement)
				.skipQa(this.skipQa)
				.build();

			final PromptTemplates prompts = new PromptTemplates();
			final LlmClient refineClient = needsRefinement || (needsTranslator && MT_LLM.equals(this.mtProvider))
				? new LlmClient(createChatModel(this.refineModel))
				: null;
			final LlmClient qaClient = needsQa ? new LlmClient(createChatModel(this.qaModel)) : null;
			final MachineTranslator translator = needsTranslator ? createTranslator(refineClient, prompts) : null;

			return new PipelineOrchestrator(
				new ProjectLayout(Path.of(this.projectDir)),
				config, translator, refineClient, qaClient, prompts,
				new LoggingProgressListener(log), log
			);
		} catch (IllegalArgumentException ex) {
			throw new MojoExecutionException("Invalid configuration: " + ex.getMessage(), ex);
		}
	}

	@Nonnull
	private ChatModel createChatModel(@Nonnull final String model) {
		return ChatModelFactory.create(
			this.llmProvider, this.llmUrl, this.llmToken, model, this.maxTokens, this.temperature
		);
	}

	@Nonnull
	private MachineTranslator createTranslator(@Nullable final LlmClient llmClient, @Nonnull final PromptTemplates prompts) {
		if (MT_GOOGLE.equals(this.mtProvider)) {
			return new GoogleWebTranslator();
		}
		if (MT_LLM.equals(this.mtProvider) && llmClient != null) {
			return new LlmMachineTranslator(llmClient, prompts);
		}
		throw new IllegalArgumentException("Unknown machine translation provider: " + this.mtProvider +
			". Supported providers: google, llm");
	}

	private static void logSummary(@Nonnull final Log log, @Nonnull final PipelineSummary summary) {
		log.info("--- Translation Summary ---");
		logStage(log, "Machine translation", summary.translation());
		logStage(log, "Refinement", summary.refinement());
		logStage(log, "Quality review", summary.qa());
		if (summary.export() != null) {
			log.info("Export: " + summary.export());
		}
		log.info("Awaiting review: " + summary.awaitingReview());
		log.info("Input tokens: " + summary.inputTokens());
		log.info("Output tokens: " + summary.outputTokens());
		if (summary.isAborted()) {
			log.error("The run stopped early after a permanent provider failure, see the log above");
		}
	}

	private static void logStage(@Nonnull final Log log, @Nonnull final String name, @Nonnull final StageSummary stage) {
		log.info(name + ": processed " + stage.processed() + ", skipped " + stage.skipped() +
			", failed " + stage.failed() + (stage.aborted() ? " (aborted)" : ""));
	}

	@Nonnull
	private static MojoExecutionException failure(@Nonnull final String action, @Nonnull final Exception ex) {
		if (ex instanceof ProjectLockedException) {
			return new MojoExecutionException(ex.getMessage(), ex);
		}
		return new MojoExecutionException("Failed to execute " + action + " action: " + ex.getMessage(), ex);
	}

	@Nullable
	private static List<Path> toPaths(@Nullable final List<String> files) {
		if (files == null) {
			return null;
		}
		final List<Path> paths = new ArrayList<>(files.size());
		for (final String file : files) {
			if (!isBlank(file)) {
				paths.add(Path.of(file.trim()).toAbsolutePath().normalize());
			}
		}
		return paths;
	}

	private static boolean isBlank(@Nullable final String value) {
		return value == null || value.isBlank();
	}

	@Nonnull
	private static String orNotSet(@Nullable final String value) {
		return isBlank(value) ? "<not set>" : value;
	}

	@Nonnull
	private static String mask(@Nullable final String value) {
		if (value == null || value.length() <= 4) {
			return "****";
		}
		return "****" + value.substring(value.length() - 4);
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setProjectDir(@Nullable final String projectDir) { this.projectDir = projectDir; }
	void setInputDir(@Nullable final String inputDir) { this.inputDir = inputDir; }
	void setInputFiles(@Nullable final List<String> inputFiles) { this.inputFiles = inputFiles; }
	void setLanguages(@Nullable final List<String> languages) { this.languages = languages; }
	void setMtProvider(@Nonnull final String mtProvider) { this.mtProvider = mtProvider; }
	void setLlmProvider(@Nonnull final String llmProvider) { this.llmProvider = llmProvider; }
	void setLlmUrl(@Nullable final String llmUrl) { this.llmUrl = llmUrl; }
	void setLlmToken(@Nullable final String llmToken) { this.llmToken = llmToken; }
	void setRefineModel(@Nonnull final String refineModel) { this.refineModel = refineModel; }
	void setQaModel(@Nonnull final String qaModel) { this.qaModel = qaModel; }
	void setMaxTokens(final int maxTokens) { this.maxTokens = maxTokens; }
	void setParallelism(final int parallelism) { this.parallelism = parallelism; }
	void setMaxQaAttempts(final int maxQaAttempts) { this.maxQaAttempts = maxQaAttempts; }
	void setIncludeFailures(final boolean includeFailures) { this.includeFailures = includeFailures; }
	void setSkipTranslation(final boolean skipTranslation) { this.skipTranslation = skipTranslation; }
	void setSkipRefinement(final boolean skipRefinement) { this.skipRefinement = skipRefinement; }
	void setSkipQa(final boolean skipQa) { this.skipQa = skipQa; }
	void setCorrections(@Nullable final String corrections) { this.corrections = corrections; }
	void setRevalidate(final boolean revalidate) { this.revalidate = revalidate; }
}
