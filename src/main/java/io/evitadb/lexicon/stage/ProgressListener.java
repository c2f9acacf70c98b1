package io.evitadb.lexicon.stage;

import javax.annotation.Nonnull;

/**
 * Receives progress after each unit of work of a stage. Called on the pipeline thread,
 * so implementations must return quickly.
 */
@FunctionalInterface
public interface ProgressListener {

	/**
	 * @param done     units finished so far in the current stage (and language, for the translation stage)
	 * @param total    units of the current stage
	 * @param language language of the unit just finished
	 */
	void onProgress(int done, int total, @Nonnull String language);

	@Nonnull
	static ProgressListener none() {
		return (done, total, language) -> {
		};
	}
}
