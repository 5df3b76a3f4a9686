package uz.legalclinic.bot.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import uz.legalclinic.bot.config.Config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

public final class Database {

    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final int BUSY_TIMEOUT_MS = 5000;

    private final Config cfg;
    private final String jdbcUrl;

    public Database(Config cfg) throws IOException {
        this.cfg = Objects.requireNonNull(cfg);
        Path parent = cfg.dbPath().toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        this.jdbcUrl = "jdbc:sqlite:" + cfg.dbPath().toAbsolutePath();
    }

    public Connection getConnection() throws SQLException {
        // WAL lets readers proceed while one writer holds the lock; busy_timeout queues writers.
        // Transactions begin IMMEDIATE so a read-then-write transaction never fails on lock upgrade.
        SQLiteConfig sc = new SQLiteConfig();
        sc.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sc.enforceForeignKeys(true);
        sc.setBusyTimeout(BUSY_TIMEOUT_MS);
        sc.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        Connection c = DriverManager.getConnection(jdbcUrl, sc.toProperties());
        log.trace("Opened connection to {}", jdbcUrl);
        return c;
    }

    /**
     * Runs {@code work} in one transaction. Commits when it returns, rolls back when it throws.
     */
    public <T> T inTransaction(TransactionWork<T> work) throws SQLException {
        try (Connection c = getConnection()) {
            c.setAutoCommit(false);
            try {
                T result = work.run(c);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        }
    }

    public Config config() {
        return cfg;
    }

    @FunctionalInterface
    public interface TransactionWork<T> {
        T run(Connection c) throws SQLException;
    }
}
