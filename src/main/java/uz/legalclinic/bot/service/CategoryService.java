package uz.legalclinic.bot.service;

import uz.legalclinic.bot.db.Database;
import uz.legalclinic.bot.model.Category;
import uz.legalclinic.bot.util.TimeUtil;

import java.sql.*;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class CategoryService {

    private static final int MIN_NAME_LENGTH = 2;

    private final Database db;
    private final ZoneId zone;

    public CategoryService(Database db) {
        this.db = db;
        this.zone = db.config().zoneId();
    }

    public List<Category> listCategories() {
        List<Category> out = new ArrayList<>();
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT * FROM categories ORDER BY name")) {
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list categories", e);
        }
        return out;
    }

    public Optional<Category> findById(long id) {
        return findOne("SELECT * FROM categories WHERE id=?", ps -> ps.setLong(1, id));
    }

    public Optional<Category> findByName(String name) {
        if (name == null) return Optional.empty();
        return findOne("SELECT * FROM categories WHERE name=?", ps -> ps.setString(1, name.trim()));
    }

    public Category createCategory(String name, String hashtag) {
        String cleanName = validateName(name);
        String cleanTag = validateHashtag(hashtag);
        String now = TimeUtil.nowIso(zone);
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT OR IGNORE INTO categories(name, hashtag, created_at, updated_at) VALUES(?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, cleanName);
                ps.setString(2, cleanTag);
                ps.setString(3, now);
                ps.setString(4, now);
                if (ps.executeUpdate() == 0) {
                    throw new ValidationException("category_exists", "Category '" + cleanName + "' already exists");
                }
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) throw new SQLException("No id returned");
                    Category cat = new Category();
                    cat.id = keys.getLong(1);
                    cat.name = cleanName;
                    cat.hashtag = cleanTag;
                    cat.createdAt = now;
                    cat.updatedAt = now;
                    return cat;
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to create category", e);
        }
    }

    public void renameCategory(long id, String newName) {
        String cleanName = validateName(newName);
        if (findByName(cleanName).filter(other -> other.id != id).isPresent()) {
            throw new ValidationException("category_exists", "Category '" + cleanName + "' already exists");
        }
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("UPDATE categories SET name=?, updated_at=? WHERE id=?")) {
                ps.setString(1, cleanName);
                ps.setString(2, TimeUtil.nowIso(zone));
                ps.setLong(3, id);
                if (ps.executeUpdate() == 0) throw new NotFoundException("Category " + id + " not found");
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to rename category " + id, e);
        }
    }

    /**
     * Deletes an unreferenced category. The reference check and the delete are one statement.
     */
    public void deleteCategory(long id) {
        if (findById(id).isEmpty()) throw new NotFoundException("Category " + id + " not found");
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM categories WHERE id=? AND NOT EXISTS (SELECT 1 FROM requests WHERE category_id=?)")) {
                ps.setLong(1, id);
                ps.setLong(2, id);
                if (ps.executeUpdate() == 0) {
                    throw new ConflictException(ConflictException.Reason.CATEGORY_IN_USE,
                            "Category " + id + " is referenced by requests");
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to delete category " + id, e);
        }
    }

    private static String validateName(String name) {
        String clean = name == null ? "" : name.trim();
        if (clean.length() < MIN_NAME_LENGTH) {
            throw new ValidationException("category_name_too_short", "Category name is too short");
        }
        return clean;
    }

    private static String validateHashtag(String hashtag) {
        String clean = hashtag == null ? "" : hashtag.trim();
        if (!clean.startsWith("#") || clean.length() < 2 || clean.contains(" ")) {
            throw new ValidationException("invalid_hashtag", "Hashtag must look like #tag");
        }
        return clean;
    }

    private Optional<Category> findOne(String sql, Binder binder) {
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                binder.bind(ps);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) return Optional.empty();
                    return Optional.of(map(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load category", e);
        }
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private static Category map(ResultSet rs) throws SQLException {
        Category c = new Category();
        c.id = rs.getLong("id");
        c.name = rs.getString("name");
        c.hashtag = rs.getString("hashtag");
        c.createdAt = rs.getString("created_at");
        c.updatedAt = rs.getString("updated_at");
        return c;
    }
}
