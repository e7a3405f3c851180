package redislite.protocol;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads RESP frames from a blocking stream. Each {@link #parse()} call consumes exactly one
 * top-level frame and leaves the stream at the first byte of the next one.
 * The stream is not buffered here; wrap sockets in a BufferedInputStream.
 */
public class RespParser {

    // Same ceiling Redis uses for proto-max-bulk-len
    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    // Header and simple-string lines; Redis caps inline requests at the same size
    public static final int MAX_LINE_LENGTH = 64 * 1024;
    public static final int MAX_NESTING_DEPTH = 32;

    private final InputStream in;

    public RespParser(InputStream in) {
        this.in = in;
    }

    public static Message parse(byte[] input) throws IOException {
        return new RespParser(new ByteArrayInputStream(input)).parse();
    }

    public static Message parse(String input) throws IOException {
        return parse(input.getBytes(StandardCharsets.UTF_8));
    }

    public Message parse() throws IOException {
        return parse(0);
    }

    private Message parse(int depth) throws IOException {
        int b = in.read();
        if (b == -1) throw new RespEndOfStreamException("end of stream while reading message type");

        switch (b) {
            case '+':
                return Message.simpleString(readLine());
            case '-':
                return Message.error(readLine());
            case ':':
                return Message.integer(parseLong(readLine(), "integer"));
            case '$':
                return readBulkString();
            case '*':
                return readArray(depth);
            default:
                throw new RespProtocolException("invalid message type: " + printable(b));
        }
    }

    private Message readBulkString() throws IOException {
        long len = parseLong(readLine(), "bulk string length");
        if (len == -1) return Message.nullBulkString();
        if (len < -1) throw new RespProtocolException("invalid bulk string length: " + len);
        if (len > MAX_BULK_LENGTH) throw new RespProtocolException("bulk string length exceeds limit: " + len);

        byte[] data = in.readNBytes((int) len);
        if (data.length < len) {
            throw new RespEndOfStreamException("end of stream in bulk string (" + data.length + " of " + len + " bytes)");
        }
        expectCRLF();
        return Message.bulkString(data);
    }

    private Message readArray(int depth) throws IOException {
        if (depth >= MAX_NESTING_DEPTH) {
            throw new RespProtocolException("arrays nested deeper than " + MAX_NESTING_DEPTH);
        }
        long len = parseLong(readLine(), "array length");
        if (len == -1) return Message.nullArray();
        if (len < -1) throw new RespProtocolException("invalid array length: " + len);
        if (len > Integer.MAX_VALUE) throw new RespProtocolException("array length exceeds limit: " + len);

        List<Message> elements = new ArrayList<>((int) Math.min(len, 1024));
        for (int i = 0; i < len; i++) {
            try {
                elements.add(parse(depth + 1));
            } catch (RespEndOfStreamException e) {
                throw e;
            } catch (RespFormatException e) {
                throw new RespFormatException("failed to parse array element " + i + ": " + e.getMessage(), e);
            } catch (RespProtocolException e) {
                throw new RespProtocolException("failed to parse array element " + i + ": " + e.getMessage(), e);
            }
        }
        return Message.array(elements);
    }

    // Line = bytes up to CRLF. Bare CR or bare LF is a framing error.
    private String readLine() throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(32);
        while (true) {
            int b = in.read();
            if (b == -1) throw new RespEndOfStreamException("end of stream while reading line");
            if (b == '\r') {
                int next = in.read();
                if (next == -1) throw new RespEndOfStreamException("end of stream after CR");
                if (next != '\n') throw new RespProtocolException("line not terminated with CRLF: CR followed by " + printable(next));
                return buf.toString(StandardCharsets.UTF_8);
            }
            if (b == '\n') throw new RespProtocolException("line not terminated with CRLF: bare LF");
            if (buf.size() >= MAX_LINE_LENGTH) throw new RespProtocolException("line exceeds " + MAX_LINE_LENGTH + " bytes");
            buf.write(b);
        }
    }

    private void expectCRLF() throws IOException {
        int cr = in.read();
        if (cr == -1) throw new RespEndOfStreamException("end of stream while reading CRLF");
        if (cr != '\r') throw new RespProtocolException("missing CRLF after bulk string: expected \\r, got " + printable(cr));
        int lf = in.read();
        if (lf == -1) throw new RespEndOfStreamException("end of stream while reading CRLF");
        if (lf != '\n') throw new RespProtocolException("missing CRLF after bulk string: expected \\n, got " + printable(lf));
    }

    private static long parseLong(String line, String what) throws RespFormatException {
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new RespFormatException("invalid " + what + ": " + line, e);
        }
    }

    private static String printable(int b) {
        if (b >= 0x20 && b < 0x7f) return "'" + (char) b + "'";
        return String.format("0x%02x", b);
    }
}
