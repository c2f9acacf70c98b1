package io.evitadb.lexicon.stage;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of an export.
 *
 * @param files    written file per language
 * @param counts   number of exported entries per language
 * @param excluded slots left out (pending, empty or failed when failures are excluded)
 */
public record ExportSummary(
	@Nonnull Map<String, Path> files,
	@Nonnull Map<String, Integer> counts,
	int excluded
) {

	public ExportSummary {
		files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
		counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
	}

	public int getExportedCount() {
		return this.counts.values().stream().mapToInt(Integer::intValue).sum();
	}

	@Override
	public String toString() {
		return "exported " + getExportedCount() + " in " + this.files.size() + " language(s), excluded " + this.excluded;
	}
}
