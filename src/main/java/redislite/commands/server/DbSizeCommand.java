package redislite.commands.server;

import redislite.commands.AbstractCommand;
import redislite.db.Store;
import redislite.protocol.Message;

import java.util.List;

public class DbSizeCommand extends AbstractCommand {

    public DbSizeCommand() {
        super("DBSIZE", 0, 0);
    }

    @Override
    public Message execute(List<Message> args, Store store) {
        return Message.integer(store.size());
    }
}
