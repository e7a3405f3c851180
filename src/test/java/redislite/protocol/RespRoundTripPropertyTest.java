package redislite.protocol;

import net.jqwik.api.*;

import static org.junit.jupiter.api.Assertions.*;

public class RespRoundTripPropertyTest {

    @Property
    void parseReproducesSerializedMessage(@ForAll("messages") Message m) throws Exception {
        byte[] wire = RespSerializer.toBytes(m);
        Message parsed = RespParser.parse(wire);
        assertEquals(m, parsed);
        assertArrayEquals(wire, RespSerializer.toBytes(parsed));
    }

    @Property
    void bulkStringsAreBinarySafe(@ForAll byte[] payload) throws Exception {
        Message parsed = RespParser.parse(RespSerializer.toBytes(Message.bulkString(payload)));
        assertArrayEquals(payload, parsed.asBytes());
    }

    @Property
    void integersSurviveRoundTrip(@ForAll long value) throws Exception {
        assertEquals(value, RespParser.parse(RespSerializer.toBytes(Message.integer(value))).asLong());
    }

    @Provide
    Arbitrary<Message> messages() {
        return Arbitraries.lazyOf(
                this::leaves,
                this::leaves,
                this::arrays);
    }

    private Arbitrary<Message> arrays() {
        return messages().list().ofMaxSize(4).map(list -> Message.array(list));
    }

    private Arbitrary<Message> leaves() {
        Arbitrary<String> text = Arbitraries.strings().alpha().numeric().withChars(" _-:.éü€").ofMaxLength(16);
        return Arbitraries.oneOf(
                text.map(Message::simpleString),
                text.map(Message::error),
                Arbitraries.longs().map(Message::integer),
                Arbitraries.bytes().array(byte[].class).ofMaxSize(24).map(b -> Message.bulkString(b)),
                Arbitraries.just(Message.nullBulkString()),
                Arbitraries.just(Message.nullArray()));
    }
}
