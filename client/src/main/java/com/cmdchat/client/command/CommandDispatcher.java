package com.cmdchat.client.command;

import com.cmdchat.client.ClientState;
import com.cmdchat.client.ReceivedMessage;
import com.cmdchat.client.render.ChatRenderer;
import com.cmdchat.error.ValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs slash commands against the shared client state. Only the result tells the caller
 * what to do next (keep reading, reconnect, or quit); all feedback goes to the renderer.
 */
public class CommandDispatcher {

    static final int HISTORY_LINES = 10;

    private final ClientState state;
    private final ChatRenderer renderer;
    private final String serverLabel;
    private final Clock clock;

    public CommandDispatcher(ClientState state, ChatRenderer renderer, String serverLabel, Clock clock) {
        this.state = state;
        this.renderer = renderer;
        this.serverLabel = serverLabel;
        this.clock = clock;
    }

    public CommandResult dispatch(String line) {
        Optional<ParsedCommand> parsed = CommandParser.parse(line);
        if (parsed.isEmpty()) {
            return CommandResult.NOT_A_COMMAND;
        }
        ParsedCommand command = parsed.get();
        if (!command.isKnown()) {
            renderer.warning("Unknown command: /" + command.name());
            renderer.info("Type /help for available commands");
            return CommandResult.HANDLED;
        }

        return switch (command.command()) {
            case QUIT -> {
                renderer.info("Goodbye!");
                yield CommandResult.QUIT;
            }
            case HELP -> {
                help();
                yield CommandResult.HANDLED;
            }
            case CLEAR -> {
                renderer.clear();
                yield CommandResult.HANDLED;
            }
            case ROOMS -> {
                rooms();
                yield CommandResult.HANDLED;
            }
            case JOIN -> join(command.argument());
            case USERS -> {
                int members = state.memberCount(state.currentRoom());
                renderer.info(members + " member(s) connected to " + state.currentRoom());
                yield CommandResult.HANDLED;
            }
            case ME -> {
                me(command.argument());
                yield CommandResult.HANDLED;
            }
            case NICK -> nick(command.argument());
            case STATUS -> {
                status();
                yield CommandResult.HANDLED;
            }
            case HISTORY -> {
                history();
                yield CommandResult.HANDLED;
            }
        };
    }

    private void help() {
        StringBuilder text = new StringBuilder("Available commands:");
        for (ClientCommand command : ClientCommand.values()) {
            text.append(System.lineSeparator())
                    .append("  /").append(String.join(", /", command.aliases()))
                    .append("  ").append(command.description());
        }
        text.append(System.lineSeparator()).append("Messages are encrypted before they leave this terminal.");
        renderer.info(text.toString());
    }

    private void rooms() {
        String current = state.currentRoom();
        StringBuilder text = new StringBuilder("Rooms:");
        for (Map.Entry<String, Integer> room : state.memberCounts().entrySet()) {
            text.append(System.lineSeparator())
                    .append(room.getKey().equals(current) ? "* " : "  ")
                    .append(room.getKey()).append(" (").append(room.getValue()).append(" online)");
        }
        renderer.info(text.toString());
        renderer.info("Current room: " + current);
    }

    private CommandResult join(String argument) {
        if (argument.isEmpty()) {
            renderer.warning("Usage: /join <room_name>");
            return CommandResult.HANDLED;
        }
        Optional<String> room = state.knownRoom(argument);
        if (room.isEmpty()) {
            renderer.warning("Room '" + argument + "' not found");
            renderer.info("Use /rooms to see available rooms");
            return CommandResult.HANDLED;
        }
        if (room.get().equals(state.currentRoom())) {
            renderer.info("Already in " + room.get());
            return CommandResult.HANDLED;
        }
        String previous = state.switchRoom(room.get());
        renderer.info("Switched from " + previous + " to " + room.get());
        return CommandResult.RECONNECT;
    }

    private void me(String argument) {
        if (argument.isEmpty()) {
            renderer.warning("Usage: /me <action>");
            return;
        }
        renderer.info("* " + state.username() + " " + argument);
    }

    private CommandResult nick(String argument) {
        if (argument.isEmpty()) {
            renderer.warning("Usage: /nick <new_username>");
            return CommandResult.HANDLED;
        }
        try {
            String previous = state.rename(argument);
            renderer.info("Changed username from " + previous + " to " + state.username());
            return CommandResult.RECONNECT;
        } catch (ValidationException e) {
            renderer.warning(e.getMessage());
            return CommandResult.HANDLED;
        }
    }

    private void status() {
        Duration uptime = Duration.between(state.startedAt(), clock.instant());
        Instant heartbeat = state.lastHeartbeat();
        String nl = System.lineSeparator();
        renderer.info("Connection status" + nl
                + "  Server:       " + serverLabel + nl
                + "  Room:         " + state.currentRoom() + nl
                + "  Username:     " + state.username() + nl
                + "  Connection:   " + state.status().name().toLowerCase(Locale.ROOT) + nl
                + "  Messages:     " + state.sentCount() + nl
                + "  Uptime:       " + uptime.toMinutes() + "m " + uptime.toSecondsPart() + "s" + nl
                + "  Reconnects:   " + state.reconnects() + nl
                + "  Last ping:    " + (heartbeat == null ? "never" : heartbeat.toString()));
    }

    private void history() {
        List<ReceivedMessage> recent = state.recentHistory(HISTORY_LINES);
        if (recent.isEmpty()) {
            renderer.info("No messages in history");
            return;
        }
        for (ReceivedMessage message : recent) {
            renderer.renderMessage(message.username(), message.content(), message.timestamp(),
                    message.username().equals(state.username()), message.system());
        }
    }
}
