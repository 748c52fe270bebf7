package com.cmdchat.client.command;

/**
 * A slash command as typed.
 *
 * @param command  the resolved command, {@code null} when {@code name} matches none
 * @param name     the word after the slash, lower-cased
 * @param argument the rest of the line, trimmed; empty when absent
 */
public record ParsedCommand(ClientCommand command, String name, String argument) {

    public boolean isKnown() {
        return command != null;
    }
}
