package redislite.protocol;

/**
 * Thrown by the typed accessors on {@link Message} when the variant does not match.
 */
public class RespTypeMismatchException extends RuntimeException {
    public RespTypeMismatchException(String message) {
        super(message);
    }
}
