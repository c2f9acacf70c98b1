package io.evitadb.lexicon.cache;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory form of one stage cache: entry key -> (original text, language -> slot).
 * Iteration order is insertion order, which keeps saved files and exports stable across runs.
 *
 * Not thread-safe; stages write to it from a single thread.
 *
 * @param <S> the slot type of the stage
 */
public final class TranslationCache<S> {

	@Nonnull
	private final Class<S> slotType;
	@Nonnull
	private final Map<String, Entry<S>> entries = new LinkedHashMap<>();

	public TranslationCache(@Nonnull Class<S> slotType) {
		this.slotType = Objects.requireNonNull(slotType, "slotType must not be null");
	}

	@Nonnull
	public Class<S> getSlotType() {
		return this.slotType;
	}

	/**
	 * Returns the entry keys in insertion order.
	 *
	 * @return unmodifiable snapshot of the keys in insertion order
	 */
	@Nonnull
	public Set<String> keys() {
		return Collections.unmodifiableSet(new LinkedHashSet<>(this.entries.keySet()));
	}

	public boolean containsKey(@Nonnull String key) {
		return this.entries.containsKey(key);
	}

	/**
	 * Returns the original text of an entry or an empty string if the entry is unknown.
	 *
	 * @param key entry key
	 * @return the source text
	 */
	@Nonnull
	public String getOriginal(@Nonnull String key) {
		final Entry<S> entry = this.entries.get(key);
		return entry == null ? "" : entry.original;
	}

	/**
	 * Returns the slot of a (key, language) pair.
	 *
	 * @param key      entry key
	 * @param language language code
	 * @return the slot if present
	 */
	@Nonnull
	public Optional<S> getSlot(@Nonnull String key, @Nonnull String language) {
		final Entry<S> entry = this.entries.get(key);
		return entry == null ? Optional.empty() : Optional.ofNullable(entry.slots.get(language));
	}

	/**
	 * Returns a snapshot of an entry's slots, safe to iterate while the cache is being updated.
	 *
	 * @param key entry key
	 * @return language -> slot pairs in insertion order
	 */
	@Nonnull
	public List<Map.Entry<String, S>> slotsOf(@Nonnull String key) {
		final Entry<S> entry = this.entries.get(key);
		return entry == null ? List.of() : new ArrayList<>(entry.slots.entrySet());
	}

	/**
	 * Registers an entry without slots. The original text of an existing entry is kept unless it is empty.
	 *
	 * @param key      entry key
	 * @param original source text
	 */
	public void ensureEntry(@Nonnull String key, @Nullable String original) {
		Objects.requireNonNull(key, "key must not be null");
		final Entry<S> entry = this.entries.computeIfAbsent(key, k -> new Entry<>());
		if (entry.original.isEmpty() && original != null) {
			entry.original = original;
		}
	}

	/**
	 * Stores a slot, creating the entry when needed.
	 *
	 * @param key      entry key
	 * @param original source text, used only when the entry has none yet
	 * @param language language code
	 * @param slot     the new slot value
	 */
	public void putSlot(@Nonnull String key, @Nullable String original, @Nonnull String language, @Nonnull S slot) {
		Objects.requireNonNull(language, "language must not be null");
		Objects.requireNonNull(slot, "slot must not be null");
		ensureEntry(key, original);
		this.entries.get(key).slots.put(language, slot);
	}

	/**
	 * Counts all slots of all entries.
	 *
	 * @return number of (key, language) pairs
	 */
	public int slotCount() {
		int count = 0;
		for (final Entry<S> entry : this.entries.values()) {
			count += entry.slots.size();
		}
		return count;
	}

	public boolean isEmpty() {
		return this.entries.isEmpty();
	}

	private static final class Entry<S> {
		private String original = "";
		private final Map<String, S> slots = new LinkedHashMap<>();
	}
}
