package redislite.commands;

import org.junit.jupiter.api.Test;
import redislite.db.MemoryStore;
import redislite.db.Store;
import redislite.protocol.Message;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CommandRegistryTest {

    static class RecordingCommand implements Command {
        final String name;
        final Message reply;
        int validated = 0;
        int executed = 0;

        RecordingCommand(String name, Message reply) {
            this.name = name;
            this.reply = reply;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void validate(List<Message> args) throws CommandException {
            validated++;
            if (args.size() > 1) throw new CommandException("too many for " + name);
        }

        @Override
        public Message execute(List<Message> args, Store store) {
            executed++;
            return reply;
        }
    }

    @Test
    public void testDefaultsRegistered() {
        CommandRegistry registry = CommandRegistry.withDefaults();
        assertEquals(Arrays.asList("DBSIZE", "DEL", "ECHO", "EXISTS", "FLUSHDB", "GET", "PING", "SET"),
                new ArrayList<>(registry.names()));
        assertEquals(8, registry.size());
        assertTrue(registry.contains("PING"));
        assertFalse(registry.contains("ping"));
    }

    @Test
    public void testUnknownCommand() {
        CommandRegistry registry = new CommandRegistry();
        Message reply = registry.dispatch("UNKNOWN", new ArrayList<>(), new MemoryStore());
        assertEquals(Message.error("ERR unknown command 'UNKNOWN'"), reply);
    }

    @Test
    public void testValidationFailureSkipsExecute() {
        CommandRegistry registry = new CommandRegistry();
        RecordingCommand cmd = new RecordingCommand("FOO", Message.simpleString("done"));
        registry.register(cmd);

        Message reply = registry.dispatch("FOO", Arrays.asList(Message.integer(1), Message.integer(2)), new MemoryStore());
        assertEquals(Message.error("ERR too many for FOO"), reply);
        assertEquals(1, cmd.validated);
        assertEquals(0, cmd.executed);
    }

    @Test
    public void testExecuteResultReturnedVerbatim() {
        CommandRegistry registry = new CommandRegistry();
        Message result = Message.array(Message.integer(1), Message.nullBulkString());
        RecordingCommand cmd = new RecordingCommand("FOO", result);
        registry.register(cmd);

        assertSame(result, registry.dispatch("FOO", new ArrayList<>(), new MemoryStore()));
        assertEquals(1, cmd.executed);
    }

    @Test
    public void testLastRegistrationWins() {
        CommandRegistry registry = new CommandRegistry();
        registry.register(new RecordingCommand("FOO", Message.simpleString("first")));
        registry.register(new RecordingCommand("FOO", Message.simpleString("second")));

        assertEquals(1, registry.size());
        assertEquals(Message.simpleString("second"), registry.dispatch("FOO", new ArrayList<>(), new MemoryStore()));
    }

    @Test
    public void testRegistriesAreIndependent() {
        CommandRegistry a = new CommandRegistry();
        CommandRegistry b = new CommandRegistry();
        a.register(new RecordingCommand("ONLY_A", Message.simpleString("a")));

        assertTrue(a.contains("ONLY_A"));
        assertFalse(b.contains("ONLY_A"));
    }
}
