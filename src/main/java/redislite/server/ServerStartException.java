package redislite.server;

/**
 * The listening socket could not be bound. The server stays STOPPED.
 */
public class ServerStartException extends Exception {
    public ServerStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
