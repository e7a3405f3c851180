package redislite.commands.string;

import redislite.commands.AbstractCommand;
import redislite.commands.CommandException;
import redislite.db.Store;
import redislite.db.StoreException;
import redislite.protocol.Message;

import java.util.List;

/**
 * SET key value. Overwrites unconditionally. A null bulk string value is stored as "".
 */
public class SetCommand extends AbstractCommand {

    public SetCommand() {
        super("SET", 2, 2);
    }

    @Override
    public Message execute(List<Message> args, Store store) {
        String key;
        String value;
        try {
            key = keyOf(args.get(0));
            value = valueOf(args.get(1));
        } catch (CommandException e) {
            return error(e);
        }

        try {
            store.set(key, value);
        } catch (StoreException e) {
            return Message.error("ERR " + e.getMessage());
        }
        return Message.simpleString("OK");
    }

    private static String valueOf(Message arg) throws CommandException {
        switch (arg.getType()) {
            case BULK_STRING:
                return arg.isNull() ? "" : toStoreString(arg.asBytes());
            case SIMPLE_STRING:
                return toStoreString(arg.asBytes());
            case INTEGER:
                return Long.toString(arg.asLong());
            case ERROR:
            case ARRAY:
                throw new CommandException("invalid value type");
            default:
                throw new IllegalStateException("unhandled type " + arg.getType());
        }
    }
}
