package de.bsommerfeld.jwlsync.db;

import com.google.inject.Singleton;
import de.bsommerfeld.jwlsync.core.error.IncompatibleInputException;
import de.bsommerfeld.jwlsync.core.error.MergePhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens JDBC connections to the SQLite store file of a workspace.
 *
 * <h3>Connection strategy</h3>
 * One connection per store per run. The destination connection is held for the
 * whole merge transaction; the source connection is opened read-only so the
 * source workspace cannot be modified by accident.
 *
 * <p>
 * SQLite silently creates a new database when the file is missing, so both
 * methods check for the file first.
 */
@Singleton
public class SqliteStores {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteStores.class);

    public Connection open(Path store) throws IncompatibleInputException, SQLException {
        requireStore(store);
        LOG.debug("Opening store {}", store);
        return DriverManager.getConnection(url(store));
    }

    public Connection openReadOnly(Path store) throws IncompatibleInputException, SQLException {
        requireStore(store);
        LOG.debug("Opening store {} read-only", store);
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        return DriverManager.getConnection(url(store), config.toProperties());
    }

    private static String url(Path store) {
        return "jdbc:sqlite:" + store.toAbsolutePath();
    }

    private static void requireStore(Path store) throws IncompatibleInputException {
        if (!Files.isRegularFile(store)) {
            throw new IncompatibleInputException(MergePhase.MERGE, "Database file not found: " + store.getFileName());
        }
    }
}
