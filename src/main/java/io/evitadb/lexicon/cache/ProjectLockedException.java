package io.evitadb.lexicon.cache;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when another pipeline run already holds the lock of a project directory.
 */
public class ProjectLockedException extends IOException {

	private static final long serialVersionUID = 1L;

	@Nonnull
	private final Path lockFile;

	public ProjectLockedException(@Nonnull Path lockFile) {
		super("Project is locked by another run: " + lockFile);
		this.lockFile = lockFile;
	}

	@Nonnull
	public Path getLockFile() {
		return this.lockFile;
	}
}
