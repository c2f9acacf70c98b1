package io.evitadb.lexicon.cache;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exclusive lock of a project directory, held for the duration of a pipeline run.
 *
 * Combines an in-process guard (file locks are held per JVM, not per thread) with an OS file lock
 * on `cache/.lock`, which keeps other processes out. The lock file itself is left in place.
 */
public final class ProjectLock implements AutoCloseable {

	private static final Set<Path> HELD = ConcurrentHashMap.newKeySet();

	@Nonnull
	private final Path lockFile;
	@Nonnull
	private final FileChannel channel;
	@Nonnull
	private final FileLock fileLock;

	private ProjectLock(@Nonnull Path lockFile, @Nonnull FileChannel channel, @Nonnull FileLock fileLock) {
		this.lockFile = lockFile;
		this.channel = channel;
		this.fileLock = fileLock;
	}

	/**
	 * Acquires the lock without waiting.
	 *
	 * @param lockFile the lock file, created when missing
	 * @return the held lock, to be closed by the caller
	 * @throws ProjectLockedException if the lock is held by this or another process
	 * @throws IOException            if the lock file cannot be created
	 */
	@Nonnull
	public static ProjectLock acquire(@Nonnull Path lockFile) throws IOException {
		Objects.requireNonNull(lockFile, "lockFile must not be null");
		final Path normalized = lockFile.toAbsolutePath().normalize();
		if (!HELD.add(normalized)) {
			throw new ProjectLockedException(normalized);
		}

		FileChannel channel = null;
		try {
			final Path parent = normalized.getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			channel = FileChannel.open(normalized, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
			FileLock fileLock;
			try {
				fileLock = channel.tryLock();
			} catch (OverlappingFileLockException e) {
				fileLock = null;
			}
			if (fileLock == null) {
				throw new ProjectLockedException(normalized);
			}
			return new ProjectLock(normalized, channel, fileLock);
		} catch (IOException | RuntimeException e) {
			HELD.remove(normalized);
			if (channel != null) {
				try {
					channel.close();
				} catch (IOException closeFailure) {
					e.addSuppressed(closeFailure);
				}
			}
			throw e;
		}
	}

	@Nonnull
	public Path getLockFile() {
		return this.lockFile;
	}

	@Override
	public void close() throws IOException {
		try {
			if (this.fileLock.isValid()) {
				this.fileLock.release();
			}
			this.channel.close();
		} finally {
			HELD.remove(this.lockFile);
		}
	}
}
