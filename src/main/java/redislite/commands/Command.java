package redislite.commands;

import redislite.db.Store;
import redislite.protocol.Message;

import java.util.List;

public interface Command {
    // Uppercase name the command is registered under
    String name();

    // Checks the argument list (command name excluded). Throws with the problem text on failure.
    void validate(List<Message> args) throws CommandException;

    // Only called after validate passed. User errors come back as Error messages, not exceptions.
    Message execute(List<Message> args, Store store);
}
