package redislite.commands.generic;

import redislite.commands.AbstractCommand;
import redislite.commands.CommandException;
import redislite.db.Store;
import redislite.protocol.Message;

import java.util.List;

public class ExistsCommand extends AbstractCommand {

    public ExistsCommand() {
        super("EXISTS", 1, VARIADIC);
    }

    @Override
    public Message execute(List<Message> args, Store store) {
        long count = 0;
        try {
            // Repeated keys count once per mention, as in Redis
            for (Message arg : args) {
                if (store.exists(keyOf(arg))) count++;
            }
        } catch (CommandException e) {
            return error(e);
        }
        return Message.integer(count);
    }
}
