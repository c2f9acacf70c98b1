package io.evitadb.lexicon.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import javax.annotation.Nonnull;

/**
 * QA-cache slot for one (entry, language) pair.
 *
 * @param status      review state
 * @param translation the best known translation, this is what gets exported
 * @param attempts    review cycles consumed against the attempt budget
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"status", "translation", "attempts"})
public record QaSlot(
	@JsonProperty("status") @Nonnull QaStatus status,
	@JsonProperty("translation") @Nonnull String translation,
	@JsonProperty("attempts") int attempts
) {

	public QaSlot {
		status = status == null ? QaStatus.PENDING : status;
		translation = translation == null ? "" : translation;
		attempts = Math.max(0, attempts);
	}

	/**
	 * Returns true if the automated review has nothing left to do for the given refined text.
	 *
	 * @param refinedText the current refined text of the slot
	 * @return true when the status is terminal and refers to the same text
	 */
	public boolean isSettledFor(@Nonnull String refinedText) {
		return this.status.isTerminal() && this.translation.equals(refinedText);
	}
}
