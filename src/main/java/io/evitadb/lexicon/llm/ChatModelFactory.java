package io.evitadb.lexicon.llm;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;

/**
 * Factory for LangChain4j ChatModel instances.
 *
 * The `openai` provider covers every OpenAI-compatible server, including a local llama-server or
 * Ollama, which is the default endpoint. `anthropic` talks to the Anthropic API.
 */
public final class ChatModelFactory {

	public static final String PROVIDER_OPENAI = "openai";
	public static final String PROVIDER_ANTHROPIC = "anthropic";

	public static final String DEFAULT_URL = "http://localhost:11434/v1";
	public static final String DEFAULT_MODEL = "llama-3.2-3B-Instruct-uncensored";
	public static final int DEFAULT_MAX_TOKENS = 256;
	public static final double DEFAULT_TEMPERATURE = 0.2;

	private static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);
	private static final String DEFAULT_ANTHROPIC_MODEL = "claude-sonnet-4-5-20250929";

	private ChatModelFactory() {
		// Utility class - prevent instantiation
	}

	/**
	 * Creates a ChatModel with the default token limit and temperature.
	 *
	 * @param provider  the provider name ("openai" or "anthropic")
	 * @param llmUrl    the base URL of the LLM endpoint
	 * @param llmToken  the API key, may be null for local endpoints
	 * @param modelName the model name, null or blank selects the provider default
	 * @return configured ChatModel instance
	 */
	@Nonnull
	public static ChatModel create(
		@Nonnull String provider,
		@Nonnull String llmUrl,
		@Nullable String llmToken,
		@Nullable String modelName
	) {
		return create(provider, llmUrl, llmToken, modelName, DEFAULT_MAX_TOKENS, DEFAULT_TEMPERATURE);
	}

	/**
	 * Creates a ChatModel for the given provider, endpoint and generation settings.
	 *
	 * @param provider    the provider name ("openai" or "anthropic")
	 * @param llmUrl      the base URL of the LLM endpoint
	 * @param llmToken    the API key, may be null for local endpoints
	 * @param modelName   the model name, null or blank selects the provider default
	 * @param maxTokens   maximum tokens of a reply
	 * @param temperature sampling temperature
	 * @return configured ChatModel instance
	 * @throws IllegalArgumentException if provider is unknown, llmUrl is blank or maxTokens is not positive
	 */
	@Nonnull
	public static ChatModel create(
		@Nonnull String provider,
		@Nonnull String llmUrl,
		@Nullable String llmToken,
		@Nullable String modelName,
		int maxTokens,
		double temperature
	) {
		Objects.requireNonNull(provider, "provider must not be null");
		Objects.requireNonNull(llmUrl, "llmUrl must not be null");
		if (llmUrl.isBlank()) {
			throw new IllegalArgumentException("llmUrl must not be blank");
		}
		if (maxTokens < 1) {
			throw new IllegalArgumentException("maxTokens must be at least 1");
		}

		final String normalizedUrl = normalizeUrl(llmUrl);
		final String normalizedProvider = provider.toLowerCase().trim();

		return switch (normalizedProvider) {
			case PROVIDER_OPENAI -> createOpenAiModel(normalizedUrl, llmToken, modelName, maxTokens, temperature);
			case PROVIDER_ANTHROPIC -> createAnthropicModel(normalizedUrl, llmToken, modelName, maxTokens, temperature);
			default -> throw new IllegalArgumentException(
				"Unknown provider: " + provider + ". Supported providers: " + PROVIDER_OPENAI + ", " + PROVIDER_ANTHROPIC
			);
		};
	}

	@Nonnull
	private static ChatModel createOpenAiModel(
		@Nonnull String baseUrl,
		@Nullable String apiKey,
		@Nullable String modelName,
		int maxTokens,
		double temperature
	) {
		return OpenAiChatModel.builder()
			.baseUrl(baseUrl)
			// local servers ignore the key, but the client refuses to start without one
			.apiKey(apiKey != null && !apiKey.isBlank() ? apiKey : "none")
			.modelName(modelName != null && !modelName.isBlank() ? modelName : DEFAULT_MODEL)
			.maxTokens(maxTokens)
			.temperature(temperature)
			.timeout(DEFAULT_TIMEOUT)
			.logRequests(false)
			.logResponses(false)
			.build();
	}

	@Nonnull
	private static ChatModel createAnthropicModel(
		@Nonnull String baseUrl,
		@Nullable String apiKey,
		@Nullable String modelName,
		int maxTokens,
		double temperature
	) {
		final AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder()
			.baseUrl(baseUrl)
			.modelName(modelName != null && !modelName.isBlank() ? modelName : DEFAULT_ANTHROPIC_MODEL)
			.maxTokens(maxTokens)
			.temperature(temperature)
			.timeout(DEFAULT_TIMEOUT)
			.logRequests(false)
			.logResponses(false);

		if (apiKey != null && !apiKey.isBlank()) {
			builder.apiKey(apiKey);
		}

		return builder.build();
	}

	@Nonnull
	private static String normalizeUrl(@Nonnull String url) {
		String normalized = url.trim();
		while (normalized.endsWith("/")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return normalized;
	}
}
