package io.evitadb.lexicon.mt;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Raised when a machine-translation provider cannot translate a text.
 * The translation stage records it against the affected slot and carries on with the batch.
 */
public class MachineTranslationException extends RuntimeException {

	public MachineTranslationException(@Nonnull String message) {
		super(message);
	}

	public MachineTranslationException(@Nonnull String message, @Nullable Throwable cause) {
		super(message, cause);
	}
}
