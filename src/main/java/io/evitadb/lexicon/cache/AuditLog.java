package io.evitadb.lexicon.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only JSON Lines log of every cache mutation. The file is never truncated.
 */
public final class AuditLog {

	@Nonnull
	private final Path logFile;
	@Nonnull
	private final ObjectMapper mapper;
	@Nonnull
	private final ObjectWriter lineWriter;
	@Nonnull
	private final Clock clock;

	public AuditLog(@Nonnull Path logFile, @Nonnull ObjectMapper mapper, @Nonnull Clock clock) {
		this.logFile = Objects.requireNonNull(logFile, "logFile must not be null").toAbsolutePath().normalize();
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
		this.lineWriter = mapper.writer().without(SerializationFeature.INDENT_OUTPUT);
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	@Nonnull
	public Path getLogFile() {
		return this.logFile;
	}

	/**
	 * Appends one event as a single line: `timestamp`, `step`, `key`, `lang`, then the payload fields.
	 *
	 * @param event the event to record
	 * @throws IOException if the log cannot be written
	 */
	public synchronized void append(@Nonnull AuditEvent event) throws IOException {
		Objects.requireNonNull(event, "event must not be null");

		final ObjectNode line = this.mapper.createObjectNode();
		line.put("timestamp", this.clock.instant().toString());
		line.put("step", event.step());
		if (event.key() != null) {
			line.put("key", event.key());
		}
		if (event.language() != null) {
			line.put("lang", event.language());
		}
		for (final Map.Entry<String, String> field : event.payload().entrySet()) {
			line.put(field.getKey(), field.getValue());
		}

		final Path parent = this.logFile.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(
			this.logFile,
			this.lineWriter.writeValueAsString(line) + "\n",
			StandardCharsets.UTF_8,
			StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE
		);
	}
}
