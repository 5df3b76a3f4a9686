package uz.legalclinic.bot.session;

import java.util.Optional;

/**
 * Per-actor conversation state. Nothing here is durable; losing a session only means the actor
 * starts over from the menu.
 */
public interface SessionStore {

    Optional<Session> get(long actorId);

    void set(long actorId, Session session);

    void clear(long actorId);

    /**
     * Atomically replaces the session of {@code actorId} if it currently equals {@code expected}.
     * A null {@code expected} means "no session", a null {@code next} removes it.
     *
     * @return false when another task changed the session first
     */
    boolean compareAndSet(long actorId, Session expected, Session next);
}
