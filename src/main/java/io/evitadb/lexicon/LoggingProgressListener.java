package io.evitadb.lexicon;

import io.evitadb.lexicon.stage.ProgressListener;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Renders progress as a textual bar in the Maven log, one line per ten percent:
 *
 * ```
 * [=====     ]  50% es (5/10)
 * ```
 */
public final class LoggingProgressListener implements ProgressListener {

	private static final int BAR_WIDTH = 10;

	@Nonnull
	private final Log log;
	private int lastDone = -1;
	private int lastTotal = -1;
	private int lastStep;

	public LoggingProgressListener(@Nonnull Log log) {
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	@Override
	public synchronized void onProgress(int done, int total, @Nonnull String language) {
		if (total <= 0) {
			return;
		}
		// a new stage or language starts counting again
		if (total != this.lastTotal || done <= this.lastDone) {
			this.lastStep = 0;
		}
		this.lastDone = done;
		this.lastTotal = total;

		final int percent = (int) Math.min(100, (long) done * 100 / total);
		final int step = percent / 10;
		if (step > this.lastStep) {
			this.lastStep = step;
			this.log.info(render(done, total, language));
		}
	}

	@Nonnull
	static String render(int done, int total, @Nonnull String language) {
		final int percent = (int) Math.min(100, (long) done * 100 / total);
		final int filled = percent * BAR_WIDTH / 100;
		return "[" + "=".repeat(filled) + " ".repeat(BAR_WIDTH - filled) + "] " +
			String.format("%3d%%", percent) + " " + language + " (" + done + "/" + total + ")";
	}
}
