package redislite.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes {@link Message}s as RESP frames. Does not flush; the caller owns the stream.
 */
public class RespSerializer {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_ARRAY = "*-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private final OutputStream out;

    public RespSerializer(OutputStream out) {
        this.out = out;
    }

    public static byte[] toBytes(Message message) throws RespException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try {
            new RespSerializer(bos).serialize(message);
        } catch (RespException e) {
            throw e;
        } catch (IOException e) {
            // ByteArrayOutputStream never throws
            throw new IllegalStateException(e);
        }
        return bos.toByteArray();
    }

    public static String toString(Message message) throws RespException {
        return new String(toBytes(message), StandardCharsets.UTF_8);
    }

    public void serialize(Message message) throws IOException {
        switch (message.getType()) {
            case SIMPLE_STRING:
                writeLine('+', checkLine(message.asString(), "simple string"));
                break;
            case ERROR:
                writeLine('-', checkLine(message.asString(), "error message"));
                break;
            case INTEGER:
                writeLine(':', Long.toString(message.asLong()));
                break;
            case BULK_STRING:
                writeBulkString(message);
                break;
            case ARRAY:
                writeArray(message);
                break;
            default:
                throw new RespValidationException("unsupported message type: " + message.getType());
        }
    }

    private void writeBulkString(Message message) throws IOException {
        if (message.isNull()) {
            out.write(NULL_BULK);
            return;
        }
        writeLine('$', Integer.toString(message.bulkLength()));
        out.write(message.rawBytes());
        out.write(CRLF);
    }

    private void writeArray(Message message) throws IOException {
        if (message.isNull()) {
            out.write(NULL_ARRAY);
            return;
        }
        List<Message> elements = message.asArray();
        writeLine('*', Integer.toString(elements.size()));
        for (int i = 0; i < elements.size(); i++) {
            try {
                serialize(elements.get(i));
            } catch (RespValidationException e) {
                throw new RespValidationException("failed to serialize array element " + i + ": " + e.getMessage(), e);
            }
        }
    }

    private void writeLine(char marker, String s) throws IOException {
        out.write(marker);
        out.write(s.getBytes(StandardCharsets.UTF_8));
        out.write(CRLF);
    }

    private static String checkLine(String s, String what) throws RespValidationException {
        if (s.indexOf('\r') >= 0 || s.indexOf('\n') >= 0) {
            throw new RespValidationException(what + " cannot contain CR or LF characters");
        }
        return s;
    }
}
