package com.cmdchat.client.command;

/**
 * Outcome of dispatching one input line.
 *
 * @param consumed   the line was a command and must not be sent as chat text
 * @param roomChange the room or username changed, so both channels must reconnect
 * @param quit       the user asked to leave
 */
public record CommandResult(boolean consumed, boolean roomChange, boolean quit) {

    public static final CommandResult NOT_A_COMMAND = new CommandResult(false, false, false);
    public static final CommandResult HANDLED = new CommandResult(true, false, false);
    public static final CommandResult RECONNECT = new CommandResult(true, true, false);
    public static final CommandResult QUIT = new CommandResult(true, false, true);
}
