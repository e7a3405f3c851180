package redislite.commands.server;

import redislite.commands.AbstractCommand;
import redislite.db.Store;
import redislite.protocol.Message;

import java.util.List;

public class FlushDbCommand extends AbstractCommand {

    public FlushDbCommand() {
        super("FLUSHDB", 0, 0);
    }

    @Override
    public Message execute(List<Message> args, Store store) {
        store.clear();
        return Message.simpleString("OK");
    }
}
