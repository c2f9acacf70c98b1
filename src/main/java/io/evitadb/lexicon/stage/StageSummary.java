package io.evitadb.lexicon.stage;

import javax.annotation.Nonnull;

/**
 * Immutable counts of one stage run.
 *
 * @param processed slots for which the stage produced a new result
 * @param skipped   slots already complete (or with nothing to work on)
 * @param failed    slots where the provider failed; they stay open for the next run
 * @param aborted   true if the stage stopped early after a permanent provider failure
 */
public record StageSummary(
	int processed,
	int skipped,
	int failed,
	boolean aborted
) {

	@Nonnull
	public static StageSummary empty() {
		return new StageSummary(0, 0, 0, false);
	}

	public int getTotalCount() {
		return this.processed + this.skipped + this.failed;
	}

	@Nonnull
	public StageSummary withProcessed() {
		return new StageSummary(this.processed + 1, this.skipped, this.failed, this.aborted);
	}

	@Nonnull
	public StageSummary withSkipped() {
		return new StageSummary(this.processed, this.skipped + 1, this.failed, this.aborted);
	}

	@Nonnull
	public StageSummary withFailure() {
		return new StageSummary(this.processed, this.skipped, this.failed + 1, this.aborted);
	}

	@Nonnull
	public StageSummary withAbort() {
		return new StageSummary(this.processed, this.skipped, this.failed, true);
	}

	/**
	 * Combines two summaries, e.g. of several languages.
	 *
	 * @param other the summary to add
	 * @return combined summary
	 */
	@Nonnull
	public StageSummary add(@Nonnull StageSummary other) {
		return new StageSummary(
			this.processed + other.processed,
			this.skipped + other.skipped,
			this.failed + other.failed,
			this.aborted || other.aborted
		);
	}

	@Override
	public String toString() {
		return String.format(
			"StageSummary[processed=%d, skipped=%d, failed=%d%s]",
			this.processed, this.skipped, this.failed, this.aborted ? ", aborted" : ""
		);
	}
}
