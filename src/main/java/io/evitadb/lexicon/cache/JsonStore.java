package io.evitadb.lexicon.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes the JSON documents of a project: stage caches, exports and review files.
 *
 * Writes go to a temporary sibling first and are then moved over the target, so a reader never
 * sees a half-written document. Caches that cannot be read are reported and treated as empty:
 * their content can always be re-derived by running the pipeline forward.
 */
public final class JsonStore {

	static final String ORIGINAL_FIELD = "original";
	private static final String TEMP_SUFFIX = ".tmp";

	@Nonnull
	private final ObjectMapper mapper;
	@Nonnull
	private final Log log;

	public JsonStore(@Nonnull Log log) {
		this(createObjectMapper(), log);
	}

	public JsonStore(@Nonnull ObjectMapper mapper, @Nonnull Log log) {
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Creates the mapper used for all project files: pretty printed output, map entries in insertion order.
	 *
	 * @return new mapper
	 */
	@Nonnull
	public static ObjectMapper createObjectMapper() {
		return new ObjectMapper()
			.enable(SerializationFeature.INDENT_OUTPUT)
			.disable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
	}

	@Nonnull
	public ObjectMapper getMapper() {
		return this.mapper;
	}

	/**
	 * Parses a JSON file.
	 *
	 * @param file the file to read
	 * @return the parsed tree
	 * @throws IOException if the file cannot be read or is not valid JSON
	 */
	@Nonnull
	public JsonNode readTree(@Nonnull Path file) throws IOException {
		Objects.requireNonNull(file, "file must not be null");
		final JsonNode node = this.mapper.readTree(file.toFile());
		if (node == null || node.isMissingNode()) {
			throw new IOException("Empty JSON document: " + file);
		}
		return node;
	}

	/**
	 * Loads a stage cache. A missing file yields an empty cache, an unreadable one is logged and
	 * also yields an empty cache. Slots that cannot be mapped to the slot type are dropped.
	 *
	 * @param file     cache file
	 * @param slotType slot type of the stage
	 * @param <S>      slot type
	 * @return the loaded cache, never null
	 */
	@Nonnull
	public <S> TranslationCache<S> loadCache(@Nonnull Path file, @Nonnull Class<S> slotType) {
		Objects.requireNonNull(file, "file must not be null");
		final TranslationCache<S> cache = new TranslationCache<>(slotType);
		if (!Files.exists(file)) {
			return cache;
		}

		final JsonNode root;
		try {
			root = readTree(file);
		} catch (IOException e) {
			this.log.warn("[CACHE] Ignoring unreadable cache " + file + ": " + e.getMessage());
			return cache;
		}
		if (!root.isObject()) {
			this.log.warn("[CACHE] Ignoring cache " + file + ": top level is not a JSON object");
			return cache;
		}

		final Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
		while (entries.hasNext()) {
			final Map.Entry<String, JsonNode> entry = entries.next();
			final String key = entry.getKey();
			final JsonNode value = entry.getValue();
			if (!value.isObject()) {
				this.log.warn("[CACHE] Skipping malformed entry '" + key + "' in " + file);
				continue;
			}
			cache.ensureEntry(key, value.path(ORIGINAL_FIELD).asText(""));

			final Iterator<Map.Entry<String, JsonNode>> slots = value.fields();
			while (slots.hasNext()) {
				final Map.Entry<String, JsonNode> slot = slots.next();
				if (ORIGINAL_FIELD.equals(slot.getKey()) || slot.getValue().isNull()) {
					continue;
				}
				try {
					cache.putSlot(key, null, slot.getKey(), this.mapper.treeToValue(slot.getValue(), slotType));
				} catch (JsonProcessingException | IllegalArgumentException e) {
					this.log.warn("[CACHE] Skipping malformed slot " + key + " (" + slot.getKey() + ") in " + file +
						": " + e.getMessage());
				}
			}
		}
		return cache;
	}

	/**
	 * Saves a stage cache.
	 *
	 * @param file  target file
	 * @param cache the cache to write
	 * @throws IOException if writing fails
	 */
	public void saveCache(@Nonnull Path file, @Nonnull TranslationCache<?> cache) throws IOException {
		Objects.requireNonNull(cache, "cache must not be null");
		write(file, toTree(cache));
	}

	/**
	 * Converts a cache to its document form: every entry holds `original` followed by its language slots.
	 *
	 * @param cache the cache to convert
	 * @return the JSON tree
	 */
	@Nonnull
	public ObjectNode toTree(@Nonnull TranslationCache<?> cache) {
		final ObjectNode root = this.mapper.createObjectNode();
		for (final String key : cache.keys()) {
			final ObjectNode entry = root.putObject(key);
			entry.put(ORIGINAL_FIELD, cache.getOriginal(key));
			for (final Map.Entry<String, ?> slot : cache.slotsOf(key)) {
				entry.set(slot.getKey(), this.mapper.valueToTree(slot.getValue()));
			}
		}
		return root;
	}

	/**
	 * Reads a two-level `key -> language -> text` document, the shape of review and correction files.
	 *
	 * @param file the file to read
	 * @return parsed mapping
	 * @throws IOException if the file cannot be read or has another shape
	 */
	@Nonnull
	public Map<String, Map<String, String>> readNested(@Nonnull Path file) throws IOException {
		Objects.requireNonNull(file, "file must not be null");
		return this.mapper.readValue(file.toFile(), new TypeReference<>() {});
	}

	/**
	 * Writes any Jackson-serializable value as a JSON document.
	 *
	 * @param file  target file
	 * @param value the value to write
	 * @throws IOException if writing fails
	 */
	public void write(@Nonnull Path file, @Nonnull Object value) throws IOException {
		Objects.requireNonNull(file, "file must not be null");
		Objects.requireNonNull(value, "value must not be null");

		final Path absolute = file.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}

		final Path temp = absolute.resolveSibling(absolute.getFileName() + TEMP_SUFFIX);
		Files.write(temp, this.mapper.writeValueAsBytes(value));
		try {
			Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
		}
	}
}
