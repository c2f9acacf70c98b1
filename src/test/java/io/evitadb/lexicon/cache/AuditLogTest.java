package io.evitadb.lexicon.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AuditLog should append one JSON line per event")
public class AuditLogTest {

	@TempDir
	Path tempDir;

	@Test
	@DisplayName("shouldAppendEventsAsJsonLines")
	void shouldAppendEventsAsJsonLines() throws Exception {
		final ObjectMapper mapper = JsonStore.createObjectMapper();
		final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);
		final AuditLog auditLog = new AuditLog(tempDir.resolve("logs/translation_log.jsonl"), mapper, clock);

		auditLog.append(AuditEvent.of("google", "greeting", "es").with("translation", "Hola"));
		auditLog.append(AuditEvent.of("qa", "greeting", "es").with("status", "OK").with("attempts", 1));
		auditLog.append(AuditEvent.of("export", null, null).with("languages", "es"));

		final List<String> lines = Files.readAllLines(auditLog.getLogFile(), StandardCharsets.UTF_8);
		assertEquals(3, lines.size());

		final JsonNode first = mapper.readTree(lines.get(0));
		assertEquals("2024-05-01T10:15:30Z", first.get("timestamp").asText());
		assertEquals("google", first.get("step").asText());
		assertEquals("greeting", first.get("key").asText());
		assertEquals("es", first.get("lang").asText());
		assertEquals("Hola", first.get("translation").asText());

		final JsonNode second = mapper.readTree(lines.get(1));
		assertEquals("OK", second.get("status").asText());
		assertEquals("1", second.get("attempts").asText());

		final JsonNode third = mapper.readTree(lines.get(2));
		assertFalse(third.has("key"));
		assertFalse(third.has("lang"));
	}

	@Test
	@DisplayName("shouldNotAllowPayloadMutation")
	void shouldNotAllowPayloadMutation() {
		final AuditEvent event = AuditEvent.of("qa", "greeting", "es").with("status", "OK");

		assertThrows(UnsupportedOperationException.class, () -> event.payload().put("status", "FAIL"));
		assertEquals("OK", event.payload().get("status"));
	}
}
