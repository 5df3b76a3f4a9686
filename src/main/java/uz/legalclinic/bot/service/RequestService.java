package uz.legalclinic.bot.service;

import uz.legalclinic.bot.db.Database;
import uz.legalclinic.bot.model.FulfillerStats;
import uz.legalclinic.bot.model.Request;
import uz.legalclinic.bot.model.RequestStatus;
import uz.legalclinic.bot.model.Role;
import uz.legalclinic.bot.util.TimeUtil;

import java.sql.*;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the request rows. Every status change is one guarded write: the UPDATE names the
 * status it expects (and the fulfiller, where one is bound), and an affected-row count of
 * zero means somebody else got there first. Writes touching the actor back-reference run
 * in one transaction with the request write.
 */
public final class RequestService {

    private final Database db;
    private final ZoneId zone;

    public RequestService(Database db) {
        this.db = db;
        this.zone = db.config().zoneId();
    }

    public Request create(long requesterId, long categoryId, String text) {
        String now = TimeUtil.nowIso(zone);
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO requests(requester_id, category_id, text, status, created_at, updated_at) VALUES(?,?,?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setLong(1, requesterId);
                ps.setLong(2, categoryId);
                ps.setString(3, text);
                ps.setString(4, RequestStatus.PENDING.name());
                ps.setString(5, now);
                ps.setString(6, now);
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) throw new SQLException("No id returned");
                    Request r = new Request();
                    r.id = keys.getLong(1);
                    r.requesterId = requesterId;
                    r.categoryId = categoryId;
                    r.text = text;
                    r.status = RequestStatus.PENDING;
                    r.createdAt = now;
                    r.updatedAt = now;
                    return r;
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to create request", e);
        }
    }

    public Optional<Request> findById(long id) {
        try (Connection c = db.getConnection()) {
            return findById(c, id);
        } catch (SQLException e) {
            throw new StoreException("Failed to load request " + id, e);
        }
    }

    public Request require(long id) {
        return findById(id).orElseThrow(() -> new NotFoundException("Request " + id + " not found"));
    }

    public List<Request> findByRequester(long requesterId) {
        return findWhere("requester_id=? ORDER BY created_at DESC, id DESC", ps -> ps.setLong(1, requesterId));
    }

    public List<Request> findAnsweredBy(long actorId) {
        return findWhere("answered_by=? ORDER BY updated_at DESC, id DESC", ps -> ps.setLong(1, actorId));
    }

    public List<Request> findHeldBy(long fulfillerId) {
        return findWhere("fulfiller_id=? ORDER BY id", ps -> ps.setLong(1, fulfillerId));
    }

    public Map<RequestStatus, Integer> countByStatus() {
        Map<RequestStatus, Integer> out = new EnumMap<>(RequestStatus.class);
        for (RequestStatus s : RequestStatus.values()) out.put(s, 0);
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT status, COUNT(*) AS n FROM requests GROUP BY status")) {
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.put(RequestStatus.fromDb(rs.getString("status")), rs.getInt("n"));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count requests", e);
        }
        return out;
    }

    public FulfillerStats statsFor(long actorId) {
        FulfillerStats st = new FulfillerStats();
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " +
                            "SUM(CASE WHEN fulfiller_id=? OR answered_by=? THEN 1 ELSE 0 END) AS total," +
                            "SUM(CASE WHEN status='ASSIGNED' AND fulfiller_id=? THEN 1 ELSE 0 END) AS in_progress," +
                            "SUM(CASE WHEN status='ANSWERED' AND fulfiller_id=? THEN 1 ELSE 0 END) AS awaiting," +
                            "SUM(CASE WHEN status='CLOSED' AND answered_by=? THEN 1 ELSE 0 END) AS completed " +
                            "FROM requests")) {
                for (int i = 1; i <= 5; i++) ps.setLong(i, actorId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        st.total = rs.getInt("total");
                        st.inProgress = rs.getInt("in_progress");
                        st.awaitingReview = rs.getInt("awaiting");
                        st.completed = rs.getInt("completed");
                    }
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to compute stats for " + actorId, e);
        }
        return st;
    }

    /**
     * Moves a request between two statuses that carry no fulfiller, e.g. PENDING to APPROVED.
     */
    public void transition(long id, RequestStatus expected, RequestStatus next) {
        requireEdge(expected, next);
        if (expected.holdsFulfiller() || next.holdsFulfiller()) {
            throw new ConflictException(ConflictException.Reason.INVALID_TRANSITION,
                    expected + " -> " + next + " binds a fulfiller and needs its dedicated operation");
        }
        run("Failed to move request " + id + " to " + next, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE requests SET status=?, updated_at=? WHERE id=? AND status=?")) {
                ps.setString(1, next.name());
                ps.setString(2, TimeUtil.nowIso(zone));
                ps.setLong(3, id);
                ps.setString(4, expected.name());
                if (ps.executeUpdate() == 0) throw miss(c, id, expected);
            }
            return null;
        });
    }

    public void approve(long id) {
        transition(id, RequestStatus.PENDING, RequestStatus.APPROVED);
    }

    public void decline(long id, String reason) {
        requireEdge(RequestStatus.PENDING, RequestStatus.DECLINED);
        run("Failed to decline request " + id, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE requests SET status='DECLINED', reviewer_comment=?, updated_at=? WHERE id=? AND status='PENDING'")) {
                ps.setString(1, reason);
                ps.setString(2, TimeUtil.nowIso(zone));
                ps.setLong(3, id);
                if (ps.executeUpdate() == 0) throw miss(c, id, RequestStatus.PENDING);
            }
            return null;
        });
    }

    /**
     * Binds {@code actorId} to an APPROVED request and sets the actor's back-reference in the
     * same transaction. A requester is promoted to fulfiller on the way.
     *
     * @return true if the actor was promoted
     */
    public boolean assign(long id, long actorId) {
        requireEdge(RequestStatus.APPROVED, RequestStatus.ASSIGNED);
        return inTransaction("Failed to assign request " + id, c -> {
            String now = TimeUtil.nowIso(zone);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE requests SET status='ASSIGNED', fulfiller_id=?, updated_at=? WHERE id=? AND status='APPROVED'")) {
                ps.setLong(1, actorId);
                ps.setString(2, now);
                ps.setLong(3, id);
                if (ps.executeUpdate() == 0) throw miss(c, id, RequestStatus.APPROVED);
            }

            Role role = roleOf(c, actorId);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE actors SET current_assignment_id=?, role=?, updated_at=? " +
                            "WHERE tg_id=? AND current_assignment_id IS NULL")) {
                ps.setLong(1, id);
                ps.setString(2, (role == Role.REQUESTER ? Role.FULFILLER : role).name());
                ps.setString(3, now);
                ps.setLong(4, actorId);
                if (ps.executeUpdate() == 0) {
                    throw new ConflictException(ConflictException.Reason.ASSIGNMENT_CONFLICT,
                            "Actor " + actorId + " already holds an assignment");
                }
            }
            return role == Role.REQUESTER;
        });
    }

    /**
     * The holder gives the request back: ASSIGNED to APPROVED, fulfiller and back-reference cleared.
     */
    public void release(long id, long actorId) {
        requireEdge(RequestStatus.ASSIGNED, RequestStatus.APPROVED);
        inTransaction("Failed to release request " + id, c -> {
            String now = TimeUtil.nowIso(zone);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE requests SET status='APPROVED', fulfiller_id=NULL, updated_at=? " +
                            "WHERE id=? AND status='ASSIGNED' AND fulfiller_id=?")) {
                ps.setString(1, now);
                ps.setLong(2, id);
                ps.setLong(3, actorId);
                if (ps.executeUpdate() == 0) throw miss(c, id, RequestStatus.ASSIGNED);
            }
            if (clearBackReference(c, actorId, id, now) == 0) {
                throw new ConflictException(ConflictException.Reason.NO_ACTIVE_ASSIGNMENT,
                        "Actor " + actorId + " does not hold request " + id);
            }
            return null;
        });
    }

    public void submitAnswer(long id, long actorId, String answer) {
        requireEdge(RequestStatus.ASSIGNED, RequestStatus.ANSWERED);
        run("Failed to submit answer for request " + id, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE requests SET status='ANSWERED', answer_text=?, answered_by=?, updated_at=? " +
                            "WHERE id=? AND status='ASSIGNED' AND fulfiller_id=?")) {
                ps.setString(1, answer);
                ps.setLong(2, actorId);
                ps.setString(3, TimeUtil.nowIso(zone));
                ps.setLong(4, id);
                ps.setLong(5, actorId);
                if (ps.executeUpdate() == 0) throw miss(c, id, RequestStatus.ASSIGNED);
            }
            return null;
        });
    }

    /**
     * Reviewer accepts the answer: ANSWERED to CLOSED, the fulfiller is released.
     *
     * @return id of the fulfiller who held the request
     */
    public long close(long id) {
        requireEdge(RequestStatus.ANSWERED, RequestStatus.CLOSED);
        return inTransaction("Failed to close request " + id, c -> {
            long fulfillerId = heldBy(c, id, RequestStatus.ANSWERED);
            String now = TimeUtil.nowIso(zone);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE requests SET status='CLOSED', fulfiller_id=NULL, updated_at=? WHERE id=? AND status='ANSWERED'")) {
                ps.setString(1, now);
                ps.setLong(2, id);
                if (ps.executeUpdate() == 0) throw miss(c, id, RequestStatus.ANSWERED);
            }
            clearBackReference(c, fulfillerId, id, now);
            return fulfillerId;
        });
    }

    /**
     * Reviewer rejects the answer: ANSWERED to APPROVED, answer and fulfiller cleared, comment kept.
     *
     * @return id of the fulfiller who held the request
     */
    public long returnToPool(long id, String comment) {
        requireEdge(RequestStatus.ANSWERED, RequestStatus.APPROVED);
        return inTransaction("Failed to return request " + id + " to the pool", c -> {
            long fulfillerId = heldBy(c, id, RequestStatus.ANSWERED);
            String now = TimeUtil.nowIso(zone);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE requests SET status='APPROVED', fulfiller_id=NULL, answer_text=NULL, reviewer_comment=?, updated_at=? " +
                            "WHERE id=? AND status='ANSWERED'")) {
                ps.setString(1, comment);
                ps.setString(2, now);
                ps.setLong(3, id);
                if (ps.executeUpdate() == 0) throw miss(c, id, RequestStatus.ANSWERED);
            }
            clearBackReference(c, fulfillerId, id, now);
            return fulfillerId;
        });
    }

    private static void requireEdge(RequestStatus from, RequestStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new ConflictException(ConflictException.Reason.INVALID_TRANSITION, from + " -> " + to + " is not allowed");
        }
    }

    private static int clearBackReference(Connection c, long actorId, long requestId, String now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE actors SET current_assignment_id=NULL, updated_at=? WHERE tg_id=? AND current_assignment_id=?")) {
            ps.setString(1, now);
            ps.setLong(2, actorId);
            ps.setLong(3, requestId);
            return ps.executeUpdate();
        }
    }

    private static long heldBy(Connection c, long id, RequestStatus expected) throws SQLException {
        Request r = findById(c, id).orElseThrow(() -> new NotFoundException("Request " + id + " not found"));
        if (r.status != expected || r.fulfillerId == null) throw miss(c, id, expected);
        return r.fulfillerId;
    }

    private static Role roleOf(Connection c, long actorId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT role FROM actors WHERE tg_id=?")) {
            ps.setLong(1, actorId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) throw new NotFoundException("Actor " + actorId + " not found");
                return Role.fromDb(rs.getString("role"));
            }
        }
    }

    /**
     * Explains why a guarded write matched no row.
     */
    private static RuntimeException miss(Connection c, long id, RequestStatus expected) throws SQLException {
        Optional<Request> current = findById(c, id);
        if (current.isEmpty()) return new NotFoundException("Request " + id + " not found");
        return new ConflictException(ConflictException.Reason.ALREADY_HANDLED,
                "Request " + id + " is " + current.get().status + ", expected " + expected);
    }

    private <T> T run(String failure, Database.TransactionWork<T> work) {
        try (Connection c = db.getConnection()) {
            return work.run(c);
        } catch (SQLException e) {
            throw new StoreException(failure, e);
        }
    }

    private <T> T inTransaction(String failure, Database.TransactionWork<T> work) {
        try {
            return db.inTransaction(work);
        } catch (SQLException e) {
            throw new StoreException(failure, e);
        }
    }

    private List<Request> findWhere(String where, Binder binder) {
        List<Request> out = new ArrayList<>();
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT * FROM requests WHERE " + where)) {
                binder.bind(ps);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to query requests", e);
        }
        return out;
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private static Optional<Request> findById(Connection c, long id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT * FROM requests WHERE id=?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(map(rs));
            }
        }
    }

    private static Request map(ResultSet rs) throws SQLException {
        Request r = new Request();
        r.id = rs.getLong("id");
        r.requesterId = rs.getLong("requester_id");
        r.categoryId = rs.getLong("category_id");
        r.text = rs.getString("text");
        r.status = RequestStatus.fromDb(rs.getString("status"));
        long fulfiller = rs.getLong("fulfiller_id");
        r.fulfillerId = rs.wasNull() ? null : fulfiller;
        r.answerText = rs.getString("answer_text");
        r.reviewerComment = rs.getString("reviewer_comment");
        long answeredBy = rs.getLong("answered_by");
        r.answeredBy = rs.wasNull() ? null : answeredBy;
        r.createdAt = rs.getString("created_at");
        r.updatedAt = rs.getString("updated_at");
        return r;
    }
}
