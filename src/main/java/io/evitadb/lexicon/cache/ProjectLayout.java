package io.evitadb.lexicon.cache;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * File layout of a translation project directory.
 *
 * ```
 * cache/google.json  cache/refined.json  cache/qa.json  cache/.lock
 * logs/translation_log.jsonl
 * final/translated_<lang>.json
 * review/failures.json
 * ```
 *
 * @param projectDir the project root
 */
public record ProjectLayout(@Nonnull Path projectDir) {

	public ProjectLayout {
		Objects.requireNonNull(projectDir, "projectDir must not be null");
		projectDir = projectDir.toAbsolutePath().normalize();
	}

	@Nonnull
	public Path cacheDir() {
		return this.projectDir.resolve("cache");
	}

	@Nonnull
	public Path googleCache() {
		return cacheDir().resolve("google.json");
	}

	@Nonnull
	public Path refinedCache() {
		return cacheDir().resolve("refined.json");
	}

	@Nonnull
	public Path qaCache() {
		return cacheDir().resolve("qa.json");
	}

	@Nonnull
	public Path lockFile() {
		return cacheDir().resolve(".lock");
	}

	@Nonnull
	public Path auditLog() {
		return this.projectDir.resolve("logs").resolve("translation_log.jsonl");
	}

	@Nonnull
	public Path finalDir() {
		return this.projectDir.resolve("final");
	}

	@Nonnull
	public Path exportFile(@Nonnull String language) {
		return finalDir().resolve("translated_" + language + ".json");
	}

	@Nonnull
	public Path reviewFile() {
		return this.projectDir.resolve("review").resolve("failures.json");
	}

	/** Read-only companion of {@link #reviewFile()} with the source text of every failure. */
	@Nonnull
	public Path reviewContextFile() {
		return this.projectDir.resolve("review").resolve("failures-context.json");
	}
}
