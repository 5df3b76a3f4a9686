package uz.legalclinic.bot.service;

/**
 * Input rejected before any state change.
 */
public class ValidationException extends RuntimeException {

    private final String reason;

    public ValidationException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    /**
     * Short machine-readable reason, e.g. {@code too_short}.
     */
    public String reason() {
        return reason;
    }
}
