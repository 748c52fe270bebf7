package com.cmdchat.client.render;

import com.cmdchat.client.ChatClient;
import com.cmdchat.client.ClientState;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/** Reads chat input from the terminal behind a {@code user@room>} prompt. */
public class ConsoleLineSource implements ChatClient.LineSource {

    private final BufferedReader reader;
    private final PrintStream out;
    private final ClientState state;

    public ConsoleLineSource(InputStream in, PrintStream out, ClientState state) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.state = state;
    }

    @Override
    public String readLine() throws IOException {
        out.print(state.username() + "@" + state.currentRoom() + "> ");
        out.flush();
        return reader.readLine();
    }
}
