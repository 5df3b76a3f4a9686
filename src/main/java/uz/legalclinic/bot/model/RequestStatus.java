package uz.legalclinic.bot.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Request lifecycle. The allowed edges are the only transitions any writer may apply:
 * <pre>
 * PENDING  -> APPROVED | DECLINED
 * APPROVED -> ASSIGNED
 * ASSIGNED -> ANSWERED | APPROVED
 * ANSWERED -> CLOSED   | APPROVED
 * </pre>
 * DECLINED and CLOSED are terminal.
 */
public enum RequestStatus {
    PENDING,
    APPROVED,
    DECLINED,
    ASSIGNED,
    ANSWERED,
    CLOSED;

    public Set<RequestStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(APPROVED, DECLINED);
            case APPROVED -> EnumSet.of(ASSIGNED);
            case ASSIGNED -> EnumSet.of(ANSWERED, APPROVED);
            case ANSWERED -> EnumSet.of(CLOSED, APPROVED);
            case DECLINED, CLOSED -> EnumSet.noneOf(RequestStatus.class);
        };
    }

    public boolean canTransitionTo(RequestStatus next) {
        return next != null && successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    /**
     * Statuses in which the request is bound to a fulfiller.
     */
    public boolean holdsFulfiller() {
        return this == ASSIGNED || this == ANSWERED;
    }

    public String key() {
        return name().toLowerCase();
    }

    public static RequestStatus fromDb(String v) {
        return RequestStatus.valueOf(v.trim().toUpperCase());
    }
}
