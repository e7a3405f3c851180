package redislite.commands.generic;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import redislite.commands.CommandException;
import redislite.db.MemoryStore;
import redislite.protocol.Message;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class DelCommandTest {

    private DelCommand cmd;
    private MemoryStore store;

    @BeforeEach
    public void setup() throws Exception {
        cmd = new DelCommand();
        store = new MemoryStore();
        store.set("a", "1");
        store.set("b", "2");
    }

    @Test
    public void testArity() {
        CommandException e = assertThrows(CommandException.class, () -> cmd.validate(new ArrayList<>()));
        assertEquals("wrong number of arguments for 'del' command", e.getMessage());
    }

    @Test
    public void testDeleteCountsRemovedKeys() {
        Message reply = cmd.execute(Arrays.asList(Message.bulkString("a"), Message.bulkString("b"), Message.bulkString("missing")), store);
        assertEquals(Message.integer(2), reply);
        assertEquals(0, store.size());
    }

    @Test
    public void testRepeatedKeyCountsOnce() {
        Message reply = cmd.execute(Arrays.asList(Message.bulkString("a"), Message.bulkString("a")), store);
        assertEquals(Message.integer(1), reply);
    }

    @Test
    public void testMissingKey() {
        assertEquals(Message.integer(0), cmd.execute(Collections.singletonList(Message.bulkString("zzz")), store));
    }

    @Test
    public void testInvalidKeyDeletesNothing() {
        Message reply = cmd.execute(Arrays.asList(Message.bulkString("a"), Message.integer(7)), store);
        assertEquals(Message.error("ERR invalid key type"), reply);
        assertTrue(store.exists("a"));
        assertEquals(2, store.size());
    }
}
