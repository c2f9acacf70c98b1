package io.evitadb.lexicon;

import io.evitadb.lexicon.stage.ExportSummary;
import io.evitadb.lexicon.stage.StageSummary;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Immutable record summarizing one pipeline run.
 *
 * @param translation    machine translation stage, empty when skipped
 * @param refinement     refinement stage, empty when skipped
 * @param qa             QA stage, empty when skipped
 * @param export         export result, null when nothing was exported
 * @param awaitingReview number of translations in `FAIL` state after the run
 * @param inputTokens    LLM input tokens used by the run
 * @param outputTokens   LLM output tokens used by the run
 */
public record PipelineSummary(
	@Nonnull StageSummary translation,
	@Nonnull StageSummary refinement,
	@Nonnull StageSummary qa,
	@Nullable ExportSummary export,
	int awaitingReview,
	long inputTokens,
	long outputTokens
) {

	/**
	 * Returns true if a stage stopped early because a provider failed permanently.
	 *
	 * @return true when any stage was aborted
	 */
	public boolean isAborted() {
		return this.translation.aborted() || this.refinement.aborted() || this.qa.aborted();
	}

	/**
	 * Returns true if any slot failed in any stage.
	 *
	 * @return true if at least one failure occurred
	 */
	public boolean hasFailures() {
		return this.translation.failed() > 0 || this.refinement.failed() > 0 || this.qa.failed() > 0;
	}
}
