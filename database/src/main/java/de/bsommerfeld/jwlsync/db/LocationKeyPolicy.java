package de.bsommerfeld.jwlsync.db;

import java.util.List;

/**
 * Detection key for {@link EntityKind#LOCATION}. The store's uniqueness rules
 * for locations depend on the {@code Type} discriminant, so the key does too:
 *
 * <pre>
 * Type = 3 (document with track)  KeySymbol, IssueTagNumber, MepsLanguage, DocumentId, Track, Type
 * DocumentId present              BookNumber, ChapterNumber, KeySymbol, MepsLanguage, Type, DocumentId
 * otherwise                       BookNumber, ChapterNumber, KeySymbol, MepsLanguage, Type
 * </pre>
 */
final class LocationKeyPolicy implements DuplicateKeyPolicy {

    static final int TYPE_DOCUMENT_WITH_TRACK = 3;

    private static final List<String> TRACK_KEY = List.of(
            "KeySymbol", "IssueTagNumber", "MepsLanguage", "DocumentId", "Track", "Type");
    private static final List<String> DOCUMENT_KEY = List.of(
            "BookNumber", "ChapterNumber", "KeySymbol", "MepsLanguage", "Type", "DocumentId");
    private static final List<String> BIBLE_KEY = List.of(
            "BookNumber", "ChapterNumber", "KeySymbol", "MepsLanguage", "Type");

    @Override
    public List<String> keyColumns(Row row) {
        Object type = row.get("Type");
        if (type instanceof Number n && n.longValue() == TYPE_DOCUMENT_WITH_TRACK) {
            return TRACK_KEY;
        }
        if (row.get("DocumentId") != null) {
            return DOCUMENT_KEY;
        }
        return BIBLE_KEY;
    }
}
