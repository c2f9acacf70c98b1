package io.evitadb.lexicon.model;

/**
 * Quality-review state of a single (entry, language) slot.
 *
 * `PENDING` is assigned by the refinement stage, `OK_MANUAL` only by a human correction.
 * All other states are produced by the automated QA review.
 */
public enum QaStatus {

	/** Refined, not reviewed yet. */
	PENDING(false),
	/** The reviewer accepted the translation as is. */
	OK(true),
	/** The reviewer echoed the translation back instead of answering "OK". */
	OK_IDENTICAL(true),
	/** The reviewer proposed a correction that was adopted; a further review may follow. */
	FIXED(false),
	/** The attempt budget ran out without acceptance. Left for human review. */
	FAIL(true),
	/** Corrected by a human. */
	OK_MANUAL(true);

	private final boolean terminal;

	QaStatus(boolean terminal) {
		this.terminal = terminal;
	}

	/**
	 * Returns true if the automated pipeline leaves a slot in this state alone as long as its
	 * refined text does not change.
	 *
	 * @return true for terminal states
	 */
	public boolean isTerminal() {
		return this.terminal;
	}

	/**
	 * Returns true if a translation in this state is exported regardless of the failure policy.
	 *
	 * @return true for accepted states
	 */
	public boolean isAccepted() {
		return this == OK || this == OK_IDENTICAL || this == FIXED || this == OK_MANUAL;
	}
}
