package io.parley.cli;

import io.parley.core.chat.ChatRequest;
import io.parley.core.chat.ChatResponse;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Send a message, or start an interactive conversation when none is given")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Message to send")
    String message;

    @Option(names = {"-o", "--owner"}, description = "Owner id; the owner's session is reused", defaultValue = "cli")
    String owner;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (message != null && !message.isBlank()) {
                send(message, null, System.out);
                return 0;
            }
            return interactive();
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }

    private int interactive() throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.out.println("Type a message, or 'exit' to quit.");
        String sessionId = null;
        while (true) {
            System.out.print("> ");
            System.out.flush();
            String line = reader.readLine();
            if (line == null || "exit".equalsIgnoreCase(line.trim())) {
                return 0;
            }
            if (line.isBlank()) {
                continue;
            }
            try {
                sessionId = send(line, sessionId, System.out);
            } catch (RuntimeException e) {
                System.err.println("Error: " + e.getMessage());
            }
        }
    }

    private String send(String text, String sessionId, PrintStream out) {
        ChatResponse response = context.chatService().chat(new ChatRequest(owner, sessionId, text, null, null, null));
        out.println(response.responseText());
        if (response.boundReached()) {
            out.println("(stopped after " + response.iterations() + " steps)");
        }
        return response.sessionId();
    }
}
