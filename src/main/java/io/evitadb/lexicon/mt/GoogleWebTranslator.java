package io.evitadb.lexicon.mt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Machine translation through the public Google Translate web endpoint (the one used by the browser
 * widget, no API key). The response is a nested JSON array whose first element lists the translated
 * sentences.
 */
public final class GoogleWebTranslator implements MachineTranslator {

	public static final URI DEFAULT_ENDPOINT = URI.create("https://translate.googleapis.com/translate_a/single");

	private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

	@Nonnull
	private final HttpClient httpClient;
	@Nonnull
	private final URI endpoint;
	@Nonnull
	private final ObjectMapper mapper;
	@Nonnull
	private final Duration timeout;

	public GoogleWebTranslator() {
		this(
			HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build(),
			DEFAULT_ENDPOINT,
			new ObjectMapper(),
			DEFAULT_TIMEOUT
		);
	}

	public GoogleWebTranslator(
		@Nonnull HttpClient httpClient,
		@Nonnull URI endpoint,
		@Nonnull ObjectMapper mapper,
		@Nonnull Duration timeout
	) {
		this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
		this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
		this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
	}

	@Nonnull
	@Override
	public String translate(@Nonnull String text, @Nonnull String targetLanguage) {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
		if (text.isBlank()) {
			return text;
		}

		final HttpRequest request = HttpRequest.newBuilder(buildUri(text, targetLanguage))
			.timeout(this.timeout)
			.header("Accept", "application/json")
			.GET()
			.build();

		final HttpResponse<String> response;
		try {
			response = this.httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new MachineTranslationException("Request to " + this.endpoint.getHost() + " failed: " + e.getMessage(), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new MachineTranslationException("Interrupted while waiting for translation", e);
		}

		if (response.statusCode() != 200) {
			throw new MachineTranslationException("Unexpected HTTP status " + response.statusCode());
		}
		return parseResponse(response.body());
	}

	/**
	 * Joins the translated sentences of a response: `[[["Hola","Hello",...],["mundo","world",...]],...]`.
	 *
	 * @param body response body
	 * @return the translation
	 * @throws MachineTranslationException if the body has an unexpected shape
	 */
	@Nonnull
	String parseResponse(@Nonnull String body) {
		final JsonNode root;
		try {
			root = this.mapper.readTree(body);
		} catch (IOException e) {
			throw new MachineTranslationException("Malformed translation response: " + e.getMessage(), e);
		}

		final JsonNode sentences = root == null ? null : root.path(0);
		if (sentences == null || !sentences.isArray()) {
			throw new MachineTranslationException("Translation response contains no sentences");
		}
		final StringBuilder translation = new StringBuilder();
		for (final JsonNode sentence : sentences) {
			final JsonNode translated = sentence.path(0);
			if (translated.isTextual()) {
				translation.append(translated.asText());
			}
		}
		if (translation.length() == 0) {
			throw new MachineTranslationException("Translation response is empty");
		}
		return translation.toString();
	}

	@Nonnull
	private URI buildUri(@Nonnull String text, @Nonnull String targetLanguage) {
		return URI.create(this.endpoint +
			"?client=gtx&sl=auto&dt=t" +
			"&tl=" + URLEncoder.encode(targetLanguage, StandardCharsets.UTF_8) +
			"&q=" + URLEncoder.encode(text, StandardCharsets.UTF_8));
	}
}
