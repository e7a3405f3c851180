package redislite.protocol;

/**
 * Malformed frame: bad marker, bad terminator, negative length.
 */
public class RespProtocolException extends RespException {
    public RespProtocolException(String message) {
        super(message);
    }

    public RespProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
