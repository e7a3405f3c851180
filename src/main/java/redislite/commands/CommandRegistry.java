package redislite.commands;

import redislite.commands.connection.EchoCommand;
import redislite.commands.connection.PingCommand;
import redislite.commands.generic.DelCommand;
import redislite.commands.generic.ExistsCommand;
import redislite.commands.server.DbSizeCommand;
import redislite.commands.server.FlushDbCommand;
import redislite.commands.string.GetCommand;
import redislite.commands.string.SetCommand;
import redislite.db.Store;
import redislite.protocol.Message;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Name to command lookup plus the lookup-validate-execute dispatch. Filled before the
 * server starts accepting and only read afterwards.
 */
public class CommandRegistry {
    private final Map<String, Command> commands = new HashMap<>();

    public static CommandRegistry withDefaults() {
        CommandRegistry registry = new CommandRegistry();

        // Connection
        registry.register(new PingCommand());
        registry.register(new EchoCommand());

        // String
        registry.register(new GetCommand());
        registry.register(new SetCommand());

        // Generic
        registry.register(new DelCommand());
        registry.register(new ExistsCommand());

        // Server
        registry.register(new DbSizeCommand());
        registry.register(new FlushDbCommand());

        return registry;
    }

    // Keyed by the command's own name; a later registration replaces an earlier one.
    public void register(Command command) {
        commands.put(command.name(), command);
    }

    public Command get(String name) {
        return commands.get(name);
    }

    public boolean contains(String name) {
        return commands.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(commands.keySet());
    }

    public int size() {
        return commands.size();
    }

    /**
     * Runs {@code name} (already uppercased) against the store. Unknown commands and
     * invalid arguments come back as error replies; only non-protocol faults throw.
     */
    public Message dispatch(String name, List<Message> args, Store store) {
        Command command = commands.get(name);
        if (command == null) {
            return Message.error("ERR unknown command '" + name + "'");
        }
        try {
            command.validate(args);
        } catch (CommandException e) {
            return Message.error("ERR " + e.getMessage());
        }
        return command.execute(args, store);
    }
}
