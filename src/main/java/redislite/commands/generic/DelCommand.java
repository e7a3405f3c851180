package redislite.commands.generic;

import redislite.commands.AbstractCommand;
import redislite.commands.CommandException;
import redislite.db.Store;
import redislite.protocol.Message;

import java.util.ArrayList;
import java.util.List;

public class DelCommand extends AbstractCommand {

    public DelCommand() {
        super("DEL", 1, VARIADIC);
    }

    @Override
    public Message execute(List<Message> args, Store store) {
        // Resolve every key first so a bad key deletes nothing
        List<String> keys = new ArrayList<>(args.size());
        try {
            for (Message arg : args) {
                keys.add(keyOf(arg));
            }
        } catch (CommandException e) {
            return error(e);
        }

        long removed = 0;
        for (String key : keys) {
            if (store.delete(key)) removed++;
        }
        return Message.integer(removed);
    }
}
