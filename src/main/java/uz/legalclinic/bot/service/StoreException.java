package uz.legalclinic.bot.service;

/**
 * The persistence layer failed. Nothing was written: the enclosing transaction was rolled back.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
