package de.bsommerfeld.jwlsync.db;

/**
 * A {@link ForeignKey} tied to the translation table of the run, ready to
 * rewrite source-side ids into destination-side ids.
 */
public record ForeignKeyBinding(ForeignKey foreignKey, IdTranslationTable translations) {

    public String column() {
        return foreignKey.column();
    }

    public EntityKind target() {
        return foreignKey.references();
    }

    /** Destination id for a source id of the referenced kind, or {@code null}. */
    public Long translate(long sourceId) {
        return translations.lookup(foreignKey.references(), sourceId);
    }
}
