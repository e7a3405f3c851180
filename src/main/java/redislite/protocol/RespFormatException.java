package redislite.protocol;

/**
 * A numeric field (integer payload or length header) that is not a base-10 number.
 */
public class RespFormatException extends RespProtocolException {
    public RespFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
