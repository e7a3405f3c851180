package redislite.commands.connection;

import redislite.commands.AbstractCommand;
import redislite.db.Store;
import redislite.protocol.Message;

import java.util.List;

public class EchoCommand extends AbstractCommand {

    public EchoCommand() {
        super("ECHO", 1, 1);
    }

    @Override
    public Message execute(List<Message> args, Store store) {
        Message msg = args.get(0);
        switch (msg.getType()) {
            case BULK_STRING:
                return msg;
            case SIMPLE_STRING:
                return Message.bulkString(msg.asString());
            case INTEGER:
                return Message.bulkString(Long.toString(msg.asLong()));
            case ERROR:
            case ARRAY:
                return Message.error("ERR invalid argument type for ECHO");
            default:
                throw new IllegalStateException("unhandled type " + msg.getType());
        }
    }
}
