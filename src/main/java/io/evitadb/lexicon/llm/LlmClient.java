package io.evitadb.lexicon.llm;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The language-model completion provider used by the refinement and QA stages.
 *
 * Wraps a LangChain4j {@link ChatModel}, which already retries transient failures with backoff.
 * On top of that the client:
 * - remembers permanent failures (authentication, invalid request) and fast-fails every later call,
 *   so a stage can stop instead of burning through the whole batch,
 * - counts the tokens consumed for the run summary.
 *
 * Model name, token limit and temperature are fixed when the underlying model is built,
 * see {@link ChatModelFactory}.
 */
public final class LlmClient {

	@Nonnull
	private final ChatModel model;
	@Nonnull
	private final AtomicBoolean permanentFailure = new AtomicBoolean(false);
	@Nonnull
	private final AtomicReference<NonRetriableException> failureCause = new AtomicReference<>();
	private final AtomicLong inputTokenCount = new AtomicLong(0);
	private final AtomicLong outputTokenCount = new AtomicLong(0);

	public LlmClient(@Nonnull ChatModel model) {
		this.model = Objects.requireNonNull(model, "model must not be null");
	}

	/**
	 * Sends a single user prompt and returns the trimmed reply text.
	 *
	 * @param prompt the prompt
	 * @return reply text, empty when the model returned no text
	 * @throws NonRetriableException if a permanent failure occurs
	 * @throws LangChain4jException  for other LLM errors, including calls after a permanent failure
	 */
	@Nonnull
	public String complete(@Nonnull String prompt) {
		Objects.requireNonNull(prompt, "prompt must not be null");
		final ChatResponse response = chat(List.of(UserMessage.from(prompt)));
		final String text = response.aiMessage() == null ? null : response.aiMessage().text();
		return text == null ? "" : text.trim();
	}

	/**
	 * Sends messages to the LLM.
	 *
	 * @param messages the messages to send
	 * @return the chat response
	 * @throws NonRetriableException if a permanent failure occurs
	 * @throws LangChain4jException  for other LLM errors
	 */
	@Nonnull
	public ChatResponse chat(@Nonnull List<ChatMessage> messages) {
		Objects.requireNonNull(messages, "messages must not be null");

		if (this.permanentFailure.get()) {
			final NonRetriableException cause = this.failureCause.get();
			throw new LangChain4jException(
				"LLM client shutdown due to previous permanent failure" +
					(cause != null ? ": " + cause.getMessage() : ""),
				cause
			);
		}

		final ChatResponse response;
		try {
			response = this.model.chat(messages);
		} catch (NonRetriableException e) {
			this.failureCause.set(e);
			this.permanentFailure.set(true);
			throw e;
		}

		final TokenUsage tokenUsage = response.tokenUsage();
		if (tokenUsage != null) {
			this.inputTokenCount.addAndGet(tokenUsage.inputTokenCount() == null ? 0 : tokenUsage.inputTokenCount());
			this.outputTokenCount.addAndGet(tokenUsage.outputTokenCount() == null ? 0 : tokenUsage.outputTokenCount());
		}
		return response;
	}

	/**
	 * Returns true once a permanent failure occurred; every later call fails immediately.
	 *
	 * @return true after a permanent failure
	 */
	public boolean hasPermanentFailure() {
		return this.permanentFailure.get();
	}

	@Nullable
	public NonRetriableException getFailureCause() {
		return this.failureCause.get();
	}

	public long getInputTokenCount() {
		return this.inputTokenCount.get();
	}

	public long getOutputTokenCount() {
		return this.outputTokenCount.get();
	}
}
