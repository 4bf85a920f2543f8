package de.bsommerfeld.jwlsync.db;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Scans a store for foreign keys that point at no row of the referenced kind.
 * Runs after the merge has committed, so findings are reported, not repaired.
 */
@Singleton
public class ReferenceVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceVerifier.class);

    public List<MergeWarning> verify(Connection store) throws SQLException {
        List<MergeWarning> dangling = new ArrayList<>();
        for (EntityKind kind : EntityKind.values()) {
            for (ForeignKey fk : kind.foreignKeys()) {
                collectDangling(store, kind, fk, dangling);
            }
        }
        if (!dangling.isEmpty()) {
            LOG.warn("Found {} dangling references after merge", dangling.size());
        }
        return dangling;
    }

    private void collectDangling(Connection store, EntityKind kind, ForeignKey fk, List<MergeWarning> out)
            throws SQLException {
        EntityKind target = fk.references();
        String rowId = kind.hasSurrogateId() ? "c.\"" + kind.idColumn() + "\"" : "NULL";
        String sql = "SELECT " + rowId + ", c.\"" + fk.column() + "\""
                + " FROM \"" + kind.tableName() + "\" c"
                + " LEFT JOIN \"" + target.tableName() + "\" p ON p.\"" + target.idColumn() + "\" = c.\"" + fk.column() + "\""
                + " WHERE c.\"" + fk.column() + "\" IS NOT NULL AND p.\"" + target.idColumn() + "\" IS NULL";

        try (PreparedStatement ps = store.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                long id = rs.getLong(1);
                Long rowIdValue = rs.wasNull() ? null : id;
                MergeWarning warning = MergeWarning.dangling(kind, rowIdValue, fk, rs.getObject(2));
                LOG.debug("  {}", warning.detail());
                out.add(warning);
            }
        }
    }
}
