package redislite.db;

/**
 * A store refused a write. Reported to the client as an error reply.
 */
public class StoreException extends Exception {
    public StoreException(String message) {
        super(message);
    }
}
