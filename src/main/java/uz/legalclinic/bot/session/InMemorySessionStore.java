package uz.legalclinic.bot.session;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemorySessionStore implements SessionStore {

    private final Map<Long, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<Session> get(long actorId) {
        return Optional.ofNullable(sessions.get(actorId));
    }

    @Override
    public void set(long actorId, Session session) {
        if (session == null) sessions.remove(actorId);
        else sessions.put(actorId, session);
    }

    @Override
    public void clear(long actorId) {
        sessions.remove(actorId);
    }

    @Override
    public boolean compareAndSet(long actorId, Session expected, Session next) {
        if (expected == null) {
            if (next == null) return !sessions.containsKey(actorId);
            return sessions.putIfAbsent(actorId, next) == null;
        }
        if (next == null) return sessions.remove(actorId, expected);
        return sessions.replace(actorId, expected, next);
    }

    public int size() {
        return sessions.size();
    }
}
