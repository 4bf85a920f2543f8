package de.bsommerfeld.jwlsync.db;

/**
 * A column of one entity kind holding the surrogate id of another.
 *
 * @param column     column name in the referencing table
 * @param references the kind whose surrogate id the column stores
 */
public record ForeignKey(String column, EntityKind references) {
}
