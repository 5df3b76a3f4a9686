package uz.legalclinic.bot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uz.legalclinic.bot.db.Database;
import uz.legalclinic.bot.model.Actor;
import uz.legalclinic.bot.model.Role;
import uz.legalclinic.bot.util.TimeUtil;

import java.sql.*;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public final class ActorService {

    private static final Logger log = LoggerFactory.getLogger(ActorService.class);

    private final Database db;
    private final ZoneId zone;
    private final Set<Long> reviewerIds;
    private final String defaultLocale;

    public ActorService(Database db) {
        this.db = db;
        this.zone = db.config().zoneId();
        this.reviewerIds = db.config().reviewerIds();
        this.defaultLocale = db.config().defaultLocale();
    }

    public Actor getOrCreate(long tgId, String username, String firstName, String lastName) {
        Optional<Actor> existing = findById(tgId);
        if (existing.isPresent()) {
            Actor a = existing.get();
            // keep the profile fresh, users rename themselves
            if (!same(a.username, username) || !same(a.firstName, firstName) || !same(a.lastName, lastName)) {
                updateProfile(tgId, username, firstName, lastName);
                a.username = username;
                a.firstName = firstName;
                a.lastName = lastName;
            }
            if (reviewerIds.contains(tgId) && a.role != Role.REVIEWER) {
                setRole(tgId, Role.REVIEWER);
                a.role = Role.REVIEWER;
                log.info("actor_became_reviewer tgId={}", tgId);
            }
            return a;
        }

        String now = TimeUtil.nowIso(zone);
        Actor na = new Actor();
        na.tgId = tgId;
        na.role = reviewerIds.contains(tgId) ? Role.REVIEWER : Role.REQUESTER;
        na.username = username;
        na.firstName = firstName;
        na.lastName = lastName;
        na.language = defaultLocale;
        na.banned = false;
        na.currentAssignmentId = null;
        na.createdAt = now;
        na.updatedAt = now;

        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT OR IGNORE INTO actors(tg_id, role, username, first_name, last_name, language, banned, created_at, updated_at) " +
                            "VALUES(?,?,?,?,?,?,0,?,?)"
            )) {
                ps.setLong(1, tgId);
                ps.setString(2, na.role.name());
                setNullableString(ps, 3, username);
                setNullableString(ps, 4, firstName);
                setNullableString(ps, 5, lastName);
                ps.setString(6, na.language);
                ps.setString(7, now);
                ps.setString(8, now);
                if (ps.executeUpdate() == 0) {
                    // a concurrent delivery registered the same actor first
                    return findById(tgId).orElse(na);
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to register actor " + tgId, e);
        }
        log.info("actor_registered tgId={} role={}", tgId, na.role);
        return na;
    }

    public Optional<Actor> findById(long tgId) {
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT * FROM actors WHERE tg_id=?")) {
                ps.setLong(1, tgId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) return Optional.empty();
                    return Optional.of(map(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load actor " + tgId, e);
        }
    }

    public List<Actor> listByRole(Role role) {
        List<Actor> out = new ArrayList<>();
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT * FROM actors WHERE role=? ORDER BY tg_id")) {
                ps.setString(1, role.name());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list actors by role " + role, e);
        }
        return out;
    }

    public void setLanguage(long tgId, String language) {
        updateField(tgId, "language", language);
    }

    public void setBanned(long tgId, boolean banned) {
        updateField(tgId, "banned", banned ? 1 : 0);
    }

    public void acceptOffer(long tgId) {
        updateField(tgId, "offer_accepted", 1);
    }

    public void setRole(long tgId, Role role) {
        updateField(tgId, "role", role.name());
    }

    /**
     * Drops a dangling back-reference, but only if it still points at {@code requestId}.
     */
    public boolean clearAssignmentIf(long tgId, long requestId) {
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE actors SET current_assignment_id=NULL, updated_at=? WHERE tg_id=? AND current_assignment_id=?")) {
                ps.setString(1, TimeUtil.nowIso(zone));
                ps.setLong(2, tgId);
                ps.setLong(3, requestId);
                return ps.executeUpdate() == 1;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to clear assignment of actor " + tgId, e);
        }
    }

    private void updateProfile(long tgId, String username, String firstName, String lastName) {
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE actors SET username=?, first_name=?, last_name=?, updated_at=? WHERE tg_id=?")) {
                setNullableString(ps, 1, username);
                setNullableString(ps, 2, firstName);
                setNullableString(ps, 3, lastName);
                ps.setString(4, TimeUtil.nowIso(zone));
                ps.setLong(5, tgId);
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update profile of actor " + tgId, e);
        }
    }

    private void updateField(long tgId, String field, Object value) {
        String sql = "UPDATE actors SET " + field + "=?, updated_at=? WHERE tg_id=?";
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                if (value == null) ps.setNull(1, Types.VARCHAR);
                else if (value instanceof String s) ps.setString(1, s);
                else if (value instanceof Integer i) ps.setInt(1, i);
                else if (value instanceof Long l) ps.setLong(1, l);
                else ps.setString(1, value.toString());
                ps.setString(2, TimeUtil.nowIso(zone));
                ps.setLong(3, tgId);
                if (ps.executeUpdate() == 0) {
                    throw new NotFoundException("Actor " + tgId + " not found");
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update " + field + " of actor " + tgId, e);
        }
    }

    private static void setNullableString(PreparedStatement ps, int idx, String v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.VARCHAR);
        else ps.setString(idx, v);
    }

    private static boolean same(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }

    static Actor map(ResultSet rs) throws SQLException {
        Actor a = new Actor();
        a.tgId = rs.getLong("tg_id");
        a.role = Role.fromDb(rs.getString("role"));
        a.username = rs.getString("username");
        a.firstName = rs.getString("first_name");
        a.lastName = rs.getString("last_name");
        a.language = rs.getString("language");
        a.banned = rs.getInt("banned") == 1;
        a.offerAccepted = rs.getInt("offer_accepted") == 1;
        long assignment = rs.getLong("current_assignment_id");
        a.currentAssignmentId = rs.wasNull() ? null : assignment;
        a.createdAt = rs.getString("created_at");
        a.updatedAt = rs.getString("updated_at");
        return a;
    }
}
