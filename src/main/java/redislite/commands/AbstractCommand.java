package redislite.commands;

import redislite.protocol.Message;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Base for commands with a fixed arity range. Also holds the key/value argument
 * conversions shared by the keyspace commands.
 */
public abstract class AbstractCommand implements Command {

    protected static final int VARIADIC = Integer.MAX_VALUE;

    private final String name;
    private final int minArgs;
    private final int maxArgs;

    protected AbstractCommand(String name, int minArgs, int maxArgs) {
        this.name = name;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void validate(List<Message> args) throws CommandException {
        if (args.size() < minArgs || args.size() > maxArgs) {
            throw new CommandException("wrong number of arguments for '" + name.toLowerCase(Locale.ROOT) + "' command");
        }
    }

    protected static String keyOf(Message arg) throws CommandException {
        switch (arg.getType()) {
            case BULK_STRING:
                if (arg.isNull()) throw new CommandException("key cannot be null");
                return toStoreString(arg.asBytes());
            case SIMPLE_STRING:
                return toStoreString(arg.asBytes());
            case ERROR:
            case INTEGER:
            case ARRAY:
                throw new CommandException("invalid key type");
            default:
                throw new IllegalStateException("unhandled type " + arg.getType());
        }
    }

    /**
     * Store strings carry one char per payload byte (ISO-8859-1), so binary keys and
     * values survive the trip through {@link redislite.db.Store} unchanged.
     */
    protected static String toStoreString(byte[] payload) {
        return new String(payload, StandardCharsets.ISO_8859_1);
    }

    protected static byte[] fromStoreString(String value) {
        return value.getBytes(StandardCharsets.ISO_8859_1);
    }

    protected static Message error(CommandException e) {
        return Message.error("ERR " + e.getMessage());
    }
}
