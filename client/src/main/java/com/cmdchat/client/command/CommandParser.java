package com.cmdchat.client.command;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Splits an input line into a command and its argument. Lines starting with {@code /}
 * are commands; so are the bare words {@code q}, {@code quit} and {@code exit}.
 */
public final class CommandParser {

    private static final Set<String> BARE_QUIT = Set.of("q", "quit", "exit");

    private CommandParser() {
    }

    /** @return empty when the line is chat text rather than a command */
    public static Optional<ParsedCommand> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.trim();
        if (BARE_QUIT.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return Optional.of(new ParsedCommand(ClientCommand.QUIT, trimmed.toLowerCase(Locale.ROOT), ""));
        }
        if (!trimmed.startsWith("/")) {
            return Optional.empty();
        }
        String body = trimmed.substring(1).trim();
        int space = body.indexOf(' ');
        String name = (space < 0 ? body : body.substring(0, space)).toLowerCase(Locale.ROOT);
        String argument = space < 0 ? "" : body.substring(space + 1).trim();
        return Optional.of(new ParsedCommand(ClientCommand.fromAlias(name).orElse(null), name, argument));
    }
}
