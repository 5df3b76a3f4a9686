package uz.legalclinic.bot.conversation;

import uz.legalclinic.bot.session.Session;

/**
 * The session points at a request whose status or fulfiller no longer match the state.
 */
final class StaleSessionException extends RuntimeException {

    private final Session session;

    StaleSessionException(Session session, String message) {
        super(message);
        this.session = session;
    }

    Session session() {
        return session;
    }
}
