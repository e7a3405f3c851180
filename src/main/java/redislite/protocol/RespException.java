package redislite.protocol;

import java.io.IOException;

/**
 * Base class for every failure raised by the RESP codec.
 */
public class RespException extends IOException {
    public RespException(String message) {
        super(message);
    }

    public RespException(String message, Throwable cause) {
        super(message, cause);
    }
}
