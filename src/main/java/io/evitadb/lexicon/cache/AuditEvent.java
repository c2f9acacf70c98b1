package io.evitadb.lexicon.cache;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One line of the translation audit log.
 *
 * @param step     pipeline step that produced the event (e.g. `google`, `refine`, `qa`)
 * @param key      entry key, null for batch-level events
 * @param language language code, null for events spanning languages
 * @param payload  additional fields, written after the standard ones
 */
public record AuditEvent(
	@Nonnull String step,
	@Nullable String key,
	@Nullable String language,
	@Nonnull Map<String, String> payload
) {

	public AuditEvent {
		Objects.requireNonNull(step, "step must not be null");
		payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
	}

	@Nonnull
	public static AuditEvent of(@Nonnull String step, @Nullable String key, @Nullable String language) {
		return new AuditEvent(step, key, language, Map.of());
	}

	/**
	 * Returns a copy with one more payload field.
	 *
	 * @param name  field name
	 * @param value field value
	 * @return new event
	 */
	@Nonnull
	public AuditEvent with(@Nonnull String name, @Nullable Object value) {
		final Map<String, String> extended = new LinkedHashMap<>(this.payload);
		extended.put(name, value == null ? "" : String.valueOf(value));
		return new AuditEvent(this.step, this.key, this.language, extended);
	}
}
