package io.evitadb.lexicon.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProjectLock should guard a project directory")
public class ProjectLockTest {

	@TempDir
	Path tempDir;

	@Test
	@DisplayName("shouldCreateLockFile")
	void shouldCreateLockFile() throws Exception {
		final Path lockFile = new ProjectLayout(tempDir).lockFile();

		try (ProjectLock lock = ProjectLock.acquire(lockFile)) {
			assertTrue(Files.exists(lockFile));
			assertEquals(lockFile, lock.getLockFile());
		}
	}

	@Test
	@DisplayName("shouldRejectSecondRunWhileHeld")
	void shouldRejectSecondRunWhileHeld() throws Exception {
		final Path lockFile = new ProjectLayout(tempDir).lockFile();

		try (ProjectLock ignored = ProjectLock.acquire(lockFile)) {
			final ProjectLockedException exception =
				assertThrows(ProjectLockedException.class, () -> ProjectLock.acquire(lockFile));
			assertEquals(lockFile, exception.getLockFile());
			assertTrue(exception.getMessage().contains("locked"));
		}
	}

	@Test
	@DisplayName("shouldAllowReacquireAfterRelease")
	void shouldAllowReacquireAfterRelease() throws Exception {
		final Path lockFile = new ProjectLayout(tempDir).lockFile();

		ProjectLock.acquire(lockFile).close();

		try (ProjectLock lock = ProjectLock.acquire(lockFile)) {
			assertNotNull(lock);
		}
	}

	@Test
	@DisplayName("shouldLockProjectsIndependently")
	void shouldLockProjectsIndependently() throws Exception {
		try (ProjectLock first = ProjectLock.acquire(new ProjectLayout(tempDir.resolve("a")).lockFile());
		     ProjectLock second = ProjectLock.acquire(new ProjectLayout(tempDir.resolve("b")).lockFile())) {
			assertNotEquals(first.getLockFile(), second.getLockFile());
		}
	}
}
