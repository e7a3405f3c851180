package redislite.protocol;

/**
 * The stream ended before a complete frame was read. On a live connection this
 * means the client went away (or, inside the Netty decoder, that more bytes are needed).
 */
public class RespEndOfStreamException extends RespException {
    public RespEndOfStreamException(String message) {
        super(message);
    }
}
