package io.evitadb.lexicon.stage;

import io.evitadb.lexicon.cache.AuditEvent;
import io.evitadb.lexicon.cache.ProjectState;
import io.evitadb.lexicon.cache.TranslationCache;
import io.evitadb.lexicon.model.QaSlot;
import io.evitadb.lexicon.model.QaStatus;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Final stage: writes one flat `key -> translation` document per language from the QA cache.
 * Caches are only read.
 */
public final class ExportStage {

	@Nonnull
	private final Log log;

	public ExportStage(@Nonnull Log log) {
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Collects exportable translations per language. Every language present in the cache gets an
	 * entry, even when none of its translations qualifies.
	 *
	 * @param qa              QA cache
	 * @param includeFailures true to export the best known text of `FAIL` slots
	 * @return `language -> key -> translation`
	 */
	@Nonnull
	public static Map<String, Map<String, String>> collect(@Nonnull TranslationCache<QaSlot> qa, boolean includeFailures) {
		Objects.requireNonNull(qa, "qa must not be null");
		final Map<String, Map<String, String>> result = new LinkedHashMap<>();
		for (final String key : qa.keys()) {
			for (final Map.Entry<String, QaSlot> slot : qa.slotsOf(key)) {
				final Map<String, String> language = result.computeIfAbsent(slot.getKey(), l -> new LinkedHashMap<>());
				if (isExported(slot.getValue(), includeFailures)) {
					language.put(key, slot.getValue().translation());
				}
			}
		}
		return result;
	}

	static boolean isExported(@Nonnull QaSlot slot, boolean includeFailures) {
		if (slot.translation().isEmpty()) {
			return false;
		}
		return slot.status().isAccepted() || (includeFailures && slot.status() == QaStatus.FAIL);
	}

	/**
	 * Writes the export files into the project's `final` directory.
	 *
	 * @param state           project caches
	 * @param includeFailures true to export the best known text of `FAIL` slots
	 * @return export summary
	 * @throws IOException if a file cannot be written
	 */
	@Nonnull
	public ExportSummary export(@Nonnull ProjectState state, boolean includeFailures) throws IOException {
		Objects.requireNonNull(state, "state must not be null");
		final Map<String, Map<String, String>> collected = collect(state.qa(), includeFailures);
		final Map<String, Path> files = new LinkedHashMap<>();
		final Map<String, Integer> counts = new LinkedHashMap<>();

		for (final Map.Entry<String, Map<String, String>> language : collected.entrySet()) {
			final Path file = state.getLayout().exportFile(language.getKey());
			state.getStore().write(file, language.getValue());
			files.put(language.getKey(), file);
			counts.put(language.getKey(), language.getValue().size());
			this.log.info("[EXPORT] " + language.getKey() + ": " + language.getValue().size() + " entries -> " + file);
		}

		final int excluded = state.qa().slotCount() - counts.values().stream().mapToInt(Integer::intValue).sum();
		state.audit(AuditEvent.of("export", null, null)
			.with("languages", String.join(",", files.keySet()))
			.with("exported", state.qa().slotCount() - excluded)
			.with("excluded", excluded));
		return new ExportSummary(files, counts, excluded);
	}
}
