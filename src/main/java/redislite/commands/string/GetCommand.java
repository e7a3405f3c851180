package redislite.commands.string;

import redislite.commands.AbstractCommand;
import redislite.commands.CommandException;
import redislite.db.Store;
import redislite.protocol.Message;

import java.util.List;

public class GetCommand extends AbstractCommand {

    public GetCommand() {
        super("GET", 1, 1);
    }

    @Override
    public Message execute(List<Message> args, Store store) {
        String key;
        try {
            key = keyOf(args.get(0));
        } catch (CommandException e) {
            return error(e);
        }

        String value = store.get(key);
        if (value == null) {
            return Message.nullBulkString();
        }
        return Message.bulkString(fromStoreString(value));
    }
}
