package redislite.commands.connection;

import redislite.commands.AbstractCommand;
import redislite.db.Store;
import redislite.protocol.Message;

import java.util.List;

public class PingCommand extends AbstractCommand {

    public PingCommand() {
        super("PING", 0, 1);
    }

    @Override
    public Message execute(List<Message> args, Store store) {
        if (args.isEmpty()) {
            return Message.simpleString("PONG");
        }
        // Echo back keeping the variant
        Message arg = args.get(0);
        switch (arg.getType()) {
            case SIMPLE_STRING:
            case BULK_STRING:
                return arg;
            case ERROR:
            case INTEGER:
            case ARRAY:
                return Message.error("ERR invalid argument type for PING");
            default:
                throw new IllegalStateException("unhandled type " + arg.getType());
        }
    }
}
