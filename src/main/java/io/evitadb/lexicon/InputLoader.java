package io.evitadb.lexicon;

import com.fasterxml.jackson.databind.JsonNode;
import io.evitadb.lexicon.cache.JsonStore;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Reads the source texts of a batch from flat `key -> text` JSON documents.
 *
 * - Files of the input directory ending with `.json` are read in lexicographical order of their
 *   names, followed by the explicitly listed files in the given order.
 * - A key defined by several files takes the value of the last one.
 * - Files that cannot be parsed or are not JSON objects are reported and skipped, as are values
 *   that are not strings.
 */
public final class InputLoader {

	private static final String JSON_SUFFIX = ".json";

	@Nonnull
	private final JsonStore store;
	@Nonnull
	private final Log log;

	public InputLoader(@Nonnull JsonStore store, @Nonnull Log log) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Lists the files a batch is read from.
	 *
	 * @param inputDir   directory with input documents, may be null
	 * @param inputFiles explicit input documents, may be null
	 * @return files in reading order
	 * @throws IOException if the input directory does not exist or cannot be listed
	 */
	@Nonnull
	public List<Path> listInputs(@Nullable Path inputDir, @Nullable List<Path> inputFiles) throws IOException {
		final List<Path> files = new ArrayList<>();
		if (inputDir != null) {
			if (!Files.isDirectory(inputDir)) {
				throw new IOException("Input directory does not exist or is not a directory: " + inputDir);
			}
			try (Stream<Path> stream = Files.list(inputDir)) {
				stream
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(JSON_SUFFIX))
					.sorted(Comparator.comparing(p -> p.getFileName().toString()))
					.forEach(files::add);
			}
		}
		if (inputFiles != null) {
			files.addAll(inputFiles);
		}
		return files;
	}

	/**
	 * Reads and merges the batch.
	 *
	 * @param inputDir   directory with input documents, may be null
	 * @param inputFiles explicit input documents, may be null
	 * @return merged entries, key -> original text
	 * @throws IOException if the input directory does not exist or cannot be listed
	 */
	@Nonnull
	public Map<String, String> load(@Nullable Path inputDir, @Nullable List<Path> inputFiles) throws IOException {
		final Map<String, String> entries = new LinkedHashMap<>();
		for (final Path file : listInputs(inputDir, inputFiles)) {
			readInto(file, entries);
		}
		this.log.info("[INPUT] " + entries.size() + " entries loaded");
		return entries;
	}

	private void readInto(@Nonnull Path file, @Nonnull Map<String, String> entries) {
		final JsonNode root;
		try {
			root = this.store.readTree(file);
		} catch (IOException e) {
			this.log.error("[ERROR] Skipping unreadable input " + file + ": " + e.getMessage());
			return;
		}
		if (!root.isObject()) {
			this.log.error("[ERROR] Skipping input " + file + ": top level is not a JSON object");
			return;
		}

		int count = 0;
		final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
		while (fields.hasNext()) {
			final Map.Entry<String, JsonNode> field = fields.next();
			if (!field.getValue().isTextual()) {
				this.log.warn("[WARN] Skipping non-string value of '" + field.getKey() + "' in " + file);
				continue;
			}
			entries.put(field.getKey(), field.getValue().asText());
			count++;
		}
		this.log.info("[INPUT] " + file.getFileName() + ": " + count + " entries");
	}
}
