package de.bsommerfeld.jwlsync.db;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Merges every source record of one {@link EntityKind} into the destination
 * store.
 *
 * <h3>Per record, in source order</h3>
 * <ol>
 * <li>Read all columns except the surrogate id.</li>
 * <li>Rewrite foreign keys through the run's {@link IdTranslationTable}. NULL
 * stays NULL. An id without a mapping is kept as is and reported as an
 * {@link MergeWarning.Type#UNRESOLVED_REFERENCE} warning.</li>
 * <li>Look for an existing destination record matching the kind's
 * duplicate-detection key, comparing NULLs with {@code IS NULL}.</li>
 * <li>Insert if none exists. When the store rejects the insert with a
 * uniqueness violation, the record counts as a duplicate and the conflicting
 * row is looked up through the kind's unique constraints.</li>
 * <li>Record old id → destination id, for inserted and duplicate records
 * alike.</li>
 * </ol>
 *
 * <p>
 * The merger never commits or rolls back; the transaction belongs to
 * {@link MergeOrchestrator}. It keeps no state between calls.
 */
@Singleton
public class TableMerger {

    private static final Logger LOG = LoggerFactory.getLogger(TableMerger.class);

    /**
     * Merges all source records of {@code kind} and extends {@code translations}
     * with the kind's id mappings.
     *
     * @param bindings foreign keys of {@code kind} bound to {@code translations}
     * @throws ConstraintViolationException if the store rejects a record for a
     *                                      reason other than uniqueness
     * @throws MergeFailureException        on any other store error
     */
    public TableMergeResult merge(Connection source, Connection destination, EntityKind kind,
            List<ForeignKeyBinding> bindings, IdTranslationTable translations)
            throws MergeFailureException, ConstraintViolationException {
        try {
            return mergeRows(source, destination, kind, bindings, translations);
        } catch (SQLException e) {
            if (SqliteErrors.isConstraintViolation(e)) {
                throw new ConstraintViolationException(kind, e);
            }
            throw new MergeFailureException(kind, e);
        }
    }

    private TableMergeResult mergeRows(Connection source, Connection destination, EntityKind kind,
            List<ForeignKeyBinding> bindings, IdTranslationTable translations) throws SQLException {
        List<Row> rows = readSource(source, kind);
        LOG.debug("Found {} records in {}", rows.size(), kind);

        List<MergeWarning> warnings = new ArrayList<>();
        int inserted = 0;
        int duplicates = 0;
        int conflicts = 0;

        try (StatementCache statements = new StatementCache(destination);
                PreparedStatement insert = destination.prepareStatement(insertSql(kind))) {

            for (Row row : rows) {
                remapForeignKeys(row, bindings, warnings);
                List<String> key = kind.duplicateKeyPolicy().keyColumns(row);

                Optional<Long> existing = find(statements, row, key);
                if (existing.isPresent()) {
                    duplicates++;
                    LOG.debug("  Skipping existing {} record: {}", kind, row.asMap());
                    recordMapping(translations, row, existing.get());
                    continue;
                }

                bindValues(insert, row);
                try {
                    insert.executeUpdate();
                } catch (SQLException e) {
                    if (!SqliteErrors.isUniqueViolation(e)) {
                        throw e;
                    }
                    conflicts++;
                    LOG.warn("Skipping duplicate record in {}", kind);
                    LOG.debug("  Skipped values: {} Reason: {}", row.asMap(), e.getMessage());
                    resolveConflict(statements, row, key, translations, warnings);
                    continue;
                }

                inserted++;
                if (kind.hasSurrogateId()) {
                    recordMapping(translations, row, lastInsertRowId(statements));
                }
            }
        }

        LOG.info("Merged {}: {} read, {} inserted, {} duplicates, {} conflicts",
                kind, rows.size(), inserted, duplicates, conflicts);
        return new TableMergeResult(kind, rows.size(), inserted, duplicates, conflicts, warnings);
    }

    // =====================================================================
    // Reading & remapping
    // =====================================================================

    private List<Row> readSource(Connection source, EntityKind kind) throws SQLException {
        StringJoiner select = new StringJoiner(", ");
        if (kind.hasSurrogateId()) {
            select.add(quote(kind.idColumn()));
        }
        kind.columns().forEach(c -> select.add(quote(c)));

        String sql = "SELECT " + select + " FROM " + quote(kind.tableName())
                + (kind.hasSurrogateId() ? " ORDER BY " + quote(kind.idColumn()) : "");

        List<Row> rows = new ArrayList<>();
        int offset = kind.hasSurrogateId() ? 1 : 0;
        try (PreparedStatement ps = source.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Long sourceId = kind.hasSurrogateId() ? rs.getLong(1) : null;
                Object[] values = new Object[kind.columns().size()];
                for (int i = 0; i < values.length; i++) {
                    values[i] = rs.getObject(i + 1 + offset);
                }
                rows.add(new Row(kind, sourceId, values));
            }
        }
        return rows;
    }

    private void remapForeignKeys(Row row, List<ForeignKeyBinding> bindings, List<MergeWarning> warnings) {
        for (ForeignKeyBinding binding : bindings) {
            Object value = row.get(binding.column());
            if (value == null) {
                continue;
            }
            Long translated = value instanceof Number n ? binding.translate(n.longValue()) : null;
            if (translated == null) {
                MergeWarning warning = MergeWarning.unresolved(row, binding, value);
                LOG.warn("  {}", warning.detail());
                warnings.add(warning);
            } else {
                LOG.debug("  {}.{}: Mapping {} -> {}", row.kind(), binding.column(), value, translated);
                row.set(binding.column(), translated);
            }
        }
    }

    private void recordMapping(IdTranslationTable translations, Row row, long destinationId) {
        if (row.kind().hasSurrogateId()) {
            translations.record(row.kind(), row.sourceId(), destinationId);
            LOG.debug("  {} mapping: {} -> {}", row.kind(), row.sourceId(), destinationId);
        }
    }

    // =====================================================================
    // Duplicate lookup
    // =====================================================================

    /**
     * Finds the destination row matching {@code row} on {@code columns}.
     * Returns its surrogate id, or a placeholder value for kinds without one.
     */
    private Optional<Long> find(StatementCache statements, Row row, List<String> columns) throws SQLException {
        EntityKind kind = row.kind();
        List<Object> params = new ArrayList<>();
        String where = whereClause(row, columns, params);
        String target = kind.hasSurrogateId() ? quote(kind.idColumn()) : "1";
        String order = kind.hasSurrogateId() ? " ORDER BY " + quote(kind.idColumn()) : "";
        String sql = "SELECT " + target + " FROM " + quote(kind.tableName()) + " WHERE " + where + order + " LIMIT 1";

        PreparedStatement ps = statements.get(sql);
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
        }
    }

    /**
     * The store rejected an insert the detection key let through. Locates the
     * row that holds the violated constraint; SQLite never reports a
     * uniqueness conflict on NULL values, so constraints with a NULL column
     * are skipped. Falls back to the detection key itself.
     */
    private void resolveConflict(StatementCache statements, Row row, List<String> key,
            IdTranslationTable translations, List<MergeWarning> warnings) throws SQLException {
        EntityKind kind = row.kind();
        if (!kind.hasSurrogateId()) {
            return;
        }
        for (List<String> constraint : kind.uniqueConstraints()) {
            if (constraint.stream().anyMatch(column -> row.get(column) == null)) {
                continue;
            }
            Optional<Long> conflicting = find(statements, row, constraint);
            if (conflicting.isPresent()) {
                recordMapping(translations, row, conflicting.get());
                return;
            }
        }
        Optional<Long> byKey = find(statements, row, key);
        if (byKey.isPresent()) {
            recordMapping(translations, row, byKey.get());
            return;
        }
        MergeWarning warning = MergeWarning.conflictUnmapped(row);
        LOG.warn("  {}", warning.detail());
        warnings.add(warning);
    }

    private static String whereClause(Row row, List<String> columns, List<Object> params) {
        StringJoiner where = new StringJoiner(" AND ");
        for (String column : columns) {
            Object value = row.get(column);
            if (value == null) {
                where.add(quote(column) + " IS NULL");
            } else {
                where.add(quote(column) + " = ?");
                params.add(value);
            }
        }
        return where.toString();
    }

    // =====================================================================
    // Insert
    // =====================================================================

    private static String insertSql(EntityKind kind) {
        StringJoiner columns = new StringJoiner(", ");
        StringJoiner placeholders = new StringJoiner(", ");
        for (String column : kind.columns()) {
            columns.add(quote(column));
            placeholders.add("?");
        }
        return "INSERT INTO " + quote(kind.tableName()) + " (" + columns + ") VALUES (" + placeholders + ")";
    }

    private static void bindValues(PreparedStatement ps, Row row) throws SQLException {
        for (int i = 0; i < row.size(); i++) {
            ps.setObject(i + 1, row.get(i));
        }
    }

    private static long lastInsertRowId(StatementCache statements) throws SQLException {
        try (ResultSet rs = statements.get("SELECT last_insert_rowid()").executeQuery()) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() returned no row");
            }
            return rs.getLong(1);
        }
    }

    private static String quote(String identifier) {
        return '"' + identifier + '"';
    }

    /**
     * Prepared statements keyed by SQL text. Lookups differ per record only in
     * which columns are NULL, so a handful of statements serve a whole table.
     */
    private static final class StatementCache implements AutoCloseable {

        private final Connection connection;
        private final Map<String, PreparedStatement> statements = new HashMap<>();

        StatementCache(Connection connection) {
            this.connection = connection;
        }

        PreparedStatement get(String sql) throws SQLException {
            PreparedStatement ps = statements.get(sql);
            if (ps == null) {
                ps = connection.prepareStatement(sql);
                statements.put(sql, ps);
            }
            return ps;
        }

        @Override
        public void close() throws SQLException {
            SQLException failure = null;
            for (PreparedStatement ps : statements.values()) {
                try {
                    ps.close();
                } catch (SQLException e) {
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
            statements.clear();
            if (failure != null) {
                throw failure;
            }
        }
    }
}
