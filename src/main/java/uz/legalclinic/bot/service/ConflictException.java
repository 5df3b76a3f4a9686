package uz.legalclinic.bot.service;

/**
 * A precondition no longer holds: another task changed the record first, or the requested
 * transition is not an edge of the lifecycle. Nothing was written.
 */
public class ConflictException extends RuntimeException {

    public enum Reason {
        ALREADY_HANDLED,
        ASSIGNMENT_CONFLICT,
        NO_ACTIVE_ASSIGNMENT,
        INVALID_TRANSITION,
        CATEGORY_IN_USE;

        public String key() {
            return name().toLowerCase();
        }
    }

    private final Reason reason;

    public ConflictException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
