package redislite.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One RESP value. Exactly one of the five {@link Type} variants, immutable once built.
 * Only BULK_STRING and ARRAY can be null.
 */
public final class Message {

    public enum Type {
        SIMPLE_STRING('+'),
        ERROR('-'),
        INTEGER(':'),
        BULK_STRING('$'),
        ARRAY('*');

        private final char marker;

        Type(char marker) {
            this.marker = marker;
        }

        public char marker() {
            return marker;
        }
    }

    private static final Message NULL_BULK_STRING = new Message(Type.BULK_STRING, null, 0, null, null);
    private static final Message NULL_ARRAY = new Message(Type.ARRAY, null, 0, null, null);

    private final Type type;
    private final String text;      // SIMPLE_STRING, ERROR
    private final long number;      // INTEGER
    private final byte[] bytes;     // BULK_STRING
    private final List<Message> elements; // ARRAY

    private Message(Type type, String text, long number, byte[] bytes, List<Message> elements) {
        this.type = type;
        this.text = text;
        this.number = number;
        this.bytes = bytes;
        this.elements = elements;
    }

    // --- FACTORIES ---
    public static Message simpleString(String s) {
        return new Message(Type.SIMPLE_STRING, Objects.requireNonNull(s, "simple string"), 0, null, null);
    }

    public static Message error(String s) {
        return new Message(Type.ERROR, Objects.requireNonNull(s, "error"), 0, null, null);
    }

    public static Message integer(long i) {
        return new Message(Type.INTEGER, null, i, null, null);
    }

    public static Message bulkString(byte[] b) {
        if (b == null) return NULL_BULK_STRING;
        return new Message(Type.BULK_STRING, null, 0, b.clone(), null);
    }

    public static Message bulkString(String s) {
        if (s == null) return NULL_BULK_STRING;
        return new Message(Type.BULK_STRING, null, 0, s.getBytes(StandardCharsets.UTF_8), null);
    }

    public static Message nullBulkString() {
        return NULL_BULK_STRING;
    }

    public static Message array(List<Message> list) {
        if (list == null) return NULL_ARRAY;
        for (Message m : list) {
            Objects.requireNonNull(m, "array element");
        }
        return new Message(Type.ARRAY, null, 0, null, Collections.unmodifiableList(new ArrayList<>(list)));
    }

    public static Message array(Message... items) {
        return array(Arrays.asList(items));
    }

    public static Message nullArray() {
        return NULL_ARRAY;
    }

    // --- INSPECTION ---
    public Type getType() {
        return type;
    }

    public boolean isNull() {
        switch (type) {
            case BULK_STRING:
                return bytes == null;
            case ARRAY:
                return elements == null;
            default:
                return false;
        }
    }

    public boolean isString() {
        return type == Type.SIMPLE_STRING || (type == Type.BULK_STRING && bytes != null);
    }

    /**
     * Text payload of a SIMPLE_STRING, ERROR or non-null BULK_STRING (decoded as UTF-8).
     */
    public String asString() {
        switch (type) {
            case SIMPLE_STRING:
            case ERROR:
                return text;
            case BULK_STRING:
                if (bytes == null) throw new RespTypeMismatchException("null bulk string");
                return new String(bytes, StandardCharsets.UTF_8);
            default:
                throw new RespTypeMismatchException("message type " + type + " cannot be converted to string");
        }
    }

    /**
     * Raw payload of a non-null BULK_STRING, or the UTF-8 bytes of a SIMPLE_STRING / ERROR.
     */
    public byte[] asBytes() {
        switch (type) {
            case SIMPLE_STRING:
            case ERROR:
                return text.getBytes(StandardCharsets.UTF_8);
            case BULK_STRING:
                if (bytes == null) throw new RespTypeMismatchException("null bulk string");
                return bytes.clone();
            default:
                throw new RespTypeMismatchException("message type " + type + " cannot be converted to bytes");
        }
    }

    public long asLong() {
        if (type != Type.INTEGER) {
            throw new RespTypeMismatchException("message type " + type + " cannot be converted to integer");
        }
        return number;
    }

    public List<Message> asArray() {
        if (type != Type.ARRAY) {
            throw new RespTypeMismatchException("message type " + type + " cannot be converted to array");
        }
        if (elements == null) throw new RespTypeMismatchException("null array");
        return elements;
    }

    // Length of the bulk payload without copying it; serializer hot path
    int bulkLength() {
        return bytes == null ? -1 : bytes.length;
    }

    byte[] rawBytes() {
        return bytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        Message other = (Message) o;
        if (type != other.type) return false;
        switch (type) {
            case SIMPLE_STRING:
            case ERROR:
                return text.equals(other.text);
            case INTEGER:
                return number == other.number;
            case BULK_STRING:
                return Arrays.equals(bytes, other.bytes);
            case ARRAY:
                return Objects.equals(elements, other.elements);
            default:
                throw new IllegalStateException("unhandled type " + type);
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case SIMPLE_STRING:
            case ERROR:
                return 31 * type.hashCode() + text.hashCode();
            case INTEGER:
                return 31 * type.hashCode() + Long.hashCode(number);
            case BULK_STRING:
                return 31 * type.hashCode() + Arrays.hashCode(bytes);
            case ARRAY:
                return 31 * type.hashCode() + Objects.hashCode(elements);
            default:
                throw new IllegalStateException("unhandled type " + type);
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case SIMPLE_STRING:
                return "SimpleString(\"" + text + "\")";
            case ERROR:
                return "Error(\"" + text + "\")";
            case INTEGER:
                return "Integer(" + number + ")";
            case BULK_STRING:
                if (bytes == null) return "BulkString(null)";
                return "BulkString(\"" + new String(bytes, StandardCharsets.UTF_8) + "\")";
            case ARRAY:
                if (elements == null) return "Array(null)";
                return "Array(" + elements.size() + " elements)";
            default:
                throw new IllegalStateException("unhandled type " + type);
        }
    }
}
