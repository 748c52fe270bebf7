package com.cmdchat.client.render;

import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/** Plain-text terminal output with {@code HH:mm:ss} timestamps. */
public class ConsoleRenderer implements ChatRenderer {

    private static final String CLEAR_SCREEN = "\033[H\033[2J";

    private final PrintStream out;
    private final DateTimeFormatter timeFormat;

    public ConsoleRenderer(PrintStream out, ZoneId zone) {
        this.out = out;
        this.timeFormat = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(zone);
    }

    @Override
    public synchronized void renderMessage(String username, String content, Instant timestamp,
                                           boolean own, boolean system) {
        String time = timeFormat.format(timestamp == null ? Instant.now() : timestamp);
        if (system) {
            out.println("[" + time + "] SYSTEM: " + content);
        } else if (own) {
            out.println("[" + time + "] " + username + " (you): " + content);
        } else {
            out.println("[" + time + "] " + username + ": " + content);
        }
        out.flush();
    }

    @Override
    public synchronized void info(String text) {
        out.println("[INFO] " + text);
        out.flush();
    }

    @Override
    public synchronized void warning(String text) {
        out.println("[WARNING] " + text);
        out.flush();
    }

    @Override
    public synchronized void error(String text) {
        out.println("[ERROR] " + text);
        out.flush();
    }

    @Override
    public synchronized void status(String text) {
        out.println(timeFormat.format(Instant.now()) + " " + text);
        out.flush();
    }

    @Override
    public synchronized void clear() {
        out.print(CLEAR_SCREEN);
        out.flush();
    }
}
