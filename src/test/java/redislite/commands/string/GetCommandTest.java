package redislite.commands.string;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import redislite.commands.CommandException;
import redislite.db.MemoryStore;
import redislite.protocol.Message;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class GetCommandTest {

    private GetCommand cmd;
    private MemoryStore store;

    @BeforeEach
    public void setup() throws Exception {
        cmd = new GetCommand();
        store = new MemoryStore();
        store.set("mykey", "myvalue");
    }

    @Test
    public void testArity() {
        assertThrows(CommandException.class, () -> cmd.validate(new ArrayList<>()));
        CommandException e = assertThrows(CommandException.class,
                () -> cmd.validate(Arrays.asList(Message.bulkString("a"), Message.bulkString("b"))));
        assertEquals("wrong number of arguments for 'get' command", e.getMessage());
    }

    @Test
    public void testExistingKey() {
        assertEquals(Message.bulkString("myvalue"), cmd.execute(Collections.singletonList(Message.bulkString("mykey")), store));
        assertEquals(Message.bulkString("myvalue"), cmd.execute(Collections.singletonList(Message.simpleString("mykey")), store));
    }

    @Test
    public void testMissingKey() {
        assertEquals(Message.nullBulkString(), cmd.execute(Collections.singletonList(Message.bulkString("nope")), store));
    }

    @Test
    public void testInvalidKeys() {
        assertEquals(Message.error("ERR key cannot be null"),
                cmd.execute(Collections.singletonList(Message.nullBulkString()), store));
        assertEquals(Message.error("ERR invalid key type"),
                cmd.execute(Collections.singletonList(Message.integer(1)), store));
        assertEquals(Message.error("ERR invalid key type"),
                cmd.execute(Collections.singletonList(Message.array()), store));
    }

    @Test
    public void testNonUtf8ValueReturnedByteForByte() throws Exception {
        // Store strings hold one char per byte
        store.set("bin", new String(new byte[]{(byte) 0xff, (byte) 0xfe}, StandardCharsets.ISO_8859_1));
        Message reply = cmd.execute(Collections.singletonList(Message.bulkString("bin")), store);
        assertArrayEquals(new byte[]{(byte) 0xff, (byte) 0xfe}, reply.asBytes());
    }
}
