package uz.legalclinic.bot.db;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Schema {

    private Schema() {}

    public static void migrate(Database db) throws SQLException {
        try (Connection c = db.getConnection()) {
            try (Statement st = c.createStatement()) {

                st.execute("CREATE TABLE IF NOT EXISTS actors (" +
                        "tg_id INTEGER PRIMARY KEY," +
                        "role TEXT NOT NULL DEFAULT 'REQUESTER'," +
                        "username TEXT," +
                        "first_name TEXT," +
                        "last_name TEXT," +
                        "language TEXT NOT NULL DEFAULT 'ru'," +
                        "banned INTEGER NOT NULL DEFAULT 0," +
                        "offer_accepted INTEGER NOT NULL DEFAULT 0," +
                        "current_assignment_id INTEGER," +
                        "created_at TEXT NOT NULL," +
                        "updated_at TEXT NOT NULL" +
                        ");");

                addColumnIfMissing(c, "actors", "offer_accepted", "INTEGER NOT NULL DEFAULT 0");

                st.execute("CREATE TABLE IF NOT EXISTS categories (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT," +
                        "name TEXT NOT NULL UNIQUE," +
                        "hashtag TEXT NOT NULL," +
                        "created_at TEXT NOT NULL," +
                        "updated_at TEXT NOT NULL" +
                        ");");

                st.execute("CREATE TABLE IF NOT EXISTS requests (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT," +
                        "requester_id INTEGER NOT NULL," +
                        "category_id INTEGER NOT NULL," +
                        "text TEXT NOT NULL," +
                        "status TEXT NOT NULL DEFAULT 'PENDING'," +
                        "fulfiller_id INTEGER," +
                        "answer_text TEXT," +
                        "reviewer_comment TEXT," +
                        "answered_by INTEGER," +
                        "created_at TEXT NOT NULL," +
                        "updated_at TEXT NOT NULL" +
                        ");");

                st.execute("CREATE INDEX IF NOT EXISTS idx_requests_status ON requests(status);");
                st.execute("CREATE INDEX IF NOT EXISTS idx_requests_requester ON requests(requester_id);");
                st.execute("CREATE INDEX IF NOT EXISTS idx_requests_fulfiller ON requests(fulfiller_id);");
                st.execute("CREATE INDEX IF NOT EXISTS idx_requests_answered_by ON requests(answered_by);");
                st.execute("CREATE INDEX IF NOT EXISTS idx_requests_category ON requests(category_id);");
            }
        }
    }

    // databases created before a column existed
    private static void addColumnIfMissing(Connection c, String table, String column, String definition) throws SQLException {
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                if (column.equalsIgnoreCase(rs.getString("name"))) return;
            }
        }
        try (Statement st = c.createStatement()) {
            st.execute("ALTER TABLE " + table + " ADD COLUMN " + column + " " + definition);
        }
    }
}
