package io.evitadb.lexicon.cache;

import io.evitadb.lexicon.model.QaSlot;
import io.evitadb.lexicon.model.RefinedSlot;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.Objects;

/**
 * The three stage caches of a project together with the means to persist them and to audit changes.
 * One instance is owned by one pipeline run.
 */
public final class ProjectState {

	@Nonnull
	private final ProjectLayout layout;
	@Nonnull
	private final JsonStore store;
	@Nonnull
	private final AuditLog auditLog;
	@Nonnull
	private final TranslationCache<String> google;
	@Nonnull
	private final TranslationCache<RefinedSlot> refined;
	@Nonnull
	private final TranslationCache<QaSlot> qa;

	private ProjectState(
		@Nonnull ProjectLayout layout,
		@Nonnull JsonStore store,
		@Nonnull AuditLog auditLog,
		@Nonnull TranslationCache<String> google,
		@Nonnull TranslationCache<RefinedSlot> refined,
		@Nonnull TranslationCache<QaSlot> qa
	) {
		this.layout = layout;
		this.store = store;
		this.auditLog = auditLog;
		this.google = google;
		this.refined = refined;
		this.qa = qa;
	}

	/**
	 * Loads all caches of a project. Missing or unreadable cache files yield empty caches.
	 *
	 * @param layout   project layout
	 * @param store    JSON store
	 * @param auditLog audit log of the project
	 * @return loaded state
	 */
	@Nonnull
	public static ProjectState load(
		@Nonnull ProjectLayout layout,
		@Nonnull JsonStore store,
		@Nonnull AuditLog auditLog
	) {
		Objects.requireNonNull(layout, "layout must not be null");
		Objects.requireNonNull(store, "store must not be null");
		Objects.requireNonNull(auditLog, "auditLog must not be null");
		return new ProjectState(
			layout, store, auditLog,
			store.loadCache(layout.googleCache(), String.class),
			store.loadCache(layout.refinedCache(), RefinedSlot.class),
			store.loadCache(layout.qaCache(), QaSlot.class)
		);
	}

	@Nonnull
	public ProjectLayout getLayout() {
		return this.layout;
	}

	@Nonnull
	public JsonStore getStore() {
		return this.store;
	}

	@Nonnull
	public TranslationCache<String> google() {
		return this.google;
	}

	@Nonnull
	public TranslationCache<RefinedSlot> refined() {
		return this.refined;
	}

	@Nonnull
	public TranslationCache<QaSlot> qa() {
		return this.qa;
	}

	public void saveGoogle() throws IOException {
		this.store.saveCache(this.layout.googleCache(), this.google);
	}

	public void saveRefined() throws IOException {
		this.store.saveCache(this.layout.refinedCache(), this.refined);
	}

	public void saveQa() throws IOException {
		this.store.saveCache(this.layout.qaCache(), this.qa);
	}

	public void audit(@Nonnull AuditEvent event) throws IOException {
		this.auditLog.append(event);
	}
}
