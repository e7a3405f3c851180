package redislite.protocol;

public class RespValidationException extends RespException {
    public RespValidationException(String message) {
        super(message);
    }

    public RespValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
