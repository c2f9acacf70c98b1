package io.evitadb.lexicon.llm;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prompt templates of the pipeline, loaded from `META-INF/prompts/` on the classpath and cached.
 * Placeholders have the form `{{name}}`; a placeholder without a value is left untouched.
 */
public final class PromptTemplates {

	public static final String REFINE_TEMPLATE = "refine.txt";
	public static final String VALIDATE_TEMPLATE = "validate.txt";
	public static final String MACHINE_TRANSLATE_TEMPLATE = "machine-translate.txt";

	private static final String PROMPTS_PATH = "META-INF/prompts/";
	private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{(\\w+)}}");

	private final Map<String, String> templateCache = new ConcurrentHashMap<>();

	/**
	 * Builds the refinement prompt asking the model to improve a machine translation.
	 *
	 * @param original           source text
	 * @param machineTranslation output of the machine-translation provider
	 * @param targetLanguage     target language code
	 * @return the prompt
	 */
	@Nonnull
	public String refinePrompt(
		@Nonnull String original,
		@Nonnull String machineTranslation,
		@Nonnull String targetLanguage
	) {
		return render(REFINE_TEMPLATE, Map.of(
			"original", original,
			"machineTranslation", machineTranslation,
			"targetLanguage", targetLanguage
		));
	}

	/**
	 * Builds the review prompt. The model answers "OK" or a corrected translation.
	 *
	 * @param original       source text
	 * @param translation    the translation under review
	 * @param targetLanguage target language code
	 * @return the prompt
	 */
	@Nonnull
	public String validatePrompt(
		@Nonnull String original,
		@Nonnull String translation,
		@Nonnull String targetLanguage
	) {
		return render(VALIDATE_TEMPLATE, Map.of(
			"original", original,
			"translation", translation,
			"targetLanguage", targetLanguage
		));
	}

	@Nonnull
	public String machineTranslatePrompt(@Nonnull String text, @Nonnull String targetLanguage) {
		return render(MACHINE_TRANSLATE_TEMPLATE, Map.of(
			"text", text,
			"targetLanguage", targetLanguage
		));
	}

	/**
	 * Loads a template and replaces its placeholders.
	 *
	 * @param templateName template file name under `META-INF/prompts/`
	 * @param values       placeholder values
	 * @return the rendered prompt
	 * @throws IllegalArgumentException if the template does not exist
	 */
	@Nonnull
	public String render(@Nonnull String templateName, @Nonnull Map<String, String> values) {
		Objects.requireNonNull(templateName, "templateName must not be null");
		Objects.requireNonNull(values, "values must not be null");
		return interpolate(this.templateCache.computeIfAbsent(templateName, this::loadFromClasspath), values);
	}

	/**
	 * Replaces `{{name}}` placeholders with values; unknown placeholders stay as they are.
	 *
	 * @param template template text
	 * @param values   placeholder values
	 * @return interpolated text
	 */
	@Nonnull
	static String interpolate(@Nonnull String template, @Nonnull Map<String, String> values) {
		final Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
		final StringBuilder result = new StringBuilder();
		while (matcher.find()) {
			final String value = values.get(matcher.group(1));
			if (value != null) {
				matcher.appendReplacement(result, Matcher.quoteReplacement(value));
			}
		}
		matcher.appendTail(result);
		return result.toString();
	}

	@Nonnull
	private String loadFromClasspath(@Nonnull String templateName) {
		final String resourcePath = PROMPTS_PATH + templateName;
		try (final InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourcePath)) {
			if (inputStream == null) {
				throw new IllegalArgumentException("Prompt template not found: " + resourcePath);
			}
			return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8).replace("\r\n", "\n").strip();
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read prompt template: " + resourcePath, e);
		}
	}
}
