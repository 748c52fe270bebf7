package com.cmdchat.client.command;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Slash commands the client handles locally. Each has a primary name plus aliases. */
public enum ClientCommand {

    QUIT("Leave the chat", "quit", "q", "exit"),
    HELP("Show this help", "help", "h"),
    CLEAR("Clear the screen", "clear", "cls"),
    ROOMS("List known rooms", "rooms", "r"),
    JOIN("Join a room: /join <room>", "join", "j"),
    USERS("Show who is connected to the current room", "users", "u"),
    ME("Show an action: /me <action>", "me"),
    NICK("Change your username: /nick <name>", "nick"),
    STATUS("Show connection status", "status"),
    HISTORY("Show the last messages", "history");

    private static final Map<String, ClientCommand> BY_ALIAS = new HashMap<>();

    static {
        for (ClientCommand command : values()) {
            for (String alias : command.aliases) {
                BY_ALIAS.put(alias, command);
            }
        }
    }

    private final String description;
    private final List<String> aliases;

    ClientCommand(String description, String... aliases) {
        this.description = description;
        this.aliases = List.of(aliases);
    }

    public static Optional<ClientCommand> fromAlias(String alias) {
        if (alias == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_ALIAS.get(alias.toLowerCase(Locale.ROOT)));
    }

    public String primaryName() {
        return aliases.get(0);
    }

    public List<String> aliases() {
        return aliases;
    }

    public String description() {
        return description;
    }
}
