package io.evitadb.lexicon.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Refined-cache slot for one (entry, language) pair.
 *
 * @param google   the machine translation the refinement was based on
 * @param refined  the current refined text; replaced when QA adopts a correction or a human edits it
 * @param attempts number of times the refined text was (re)written
 * @param qaStatus mirror of the QA status, for readers of the refined cache alone
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"google", "refined", "attempts", "qa_status"})
public record RefinedSlot(
	@JsonProperty("google") @Nonnull String google,
	@JsonProperty("refined") @Nonnull String refined,
	@JsonProperty("attempts") int attempts,
	@JsonProperty("qa_status") @Nonnull QaStatus qaStatus
) {

	public RefinedSlot {
		// older or hand-edited cache files may lack fields
		google = google == null ? "" : google;
		refined = refined == null ? "" : refined;
		attempts = Math.max(0, attempts);
		qaStatus = qaStatus == null ? QaStatus.PENDING : qaStatus;
	}

	/**
	 * Creates the slot written by the refinement stage.
	 *
	 * @param google           machine translation
	 * @param refined          the model output
	 * @param previousAttempts attempts recorded before, 0 for a fresh slot
	 * @return new slot in PENDING state
	 */
	@Nonnull
	public static RefinedSlot refined(@Nonnull String google, @Nonnull String refined, int previousAttempts) {
		return new RefinedSlot(google, refined, previousAttempts + 1, QaStatus.PENDING);
	}

	@JsonIgnore
	public boolean hasRefined() {
		return !this.refined.isBlank();
	}

	/**
	 * Returns a copy carrying a correction adopted by QA.
	 *
	 * @param correction the adopted text
	 * @param status     the QA status to mirror
	 * @return updated slot
	 */
	@Nonnull
	public RefinedSlot withCorrection(@Nonnull String correction, @Nonnull QaStatus status) {
		Objects.requireNonNull(correction, "correction must not be null");
		return new RefinedSlot(this.google, correction, this.attempts + 1, status);
	}

	@Nonnull
	public RefinedSlot withManualText(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		return new RefinedSlot(this.google, text, this.attempts, QaStatus.OK_MANUAL);
	}

	@Nonnull
	public RefinedSlot withQaStatus(@Nonnull QaStatus status) {
		return new RefinedSlot(this.google, this.refined, this.attempts, status);
	}
}
