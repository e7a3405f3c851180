package redislite.commands;

/**
 * A user-level problem with a command's arguments. Turned into an "ERR ..." reply.
 */
public class CommandException extends Exception {
    public CommandException(String message) {
        super(message);
    }
}
