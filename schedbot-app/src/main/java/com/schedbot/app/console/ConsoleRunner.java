package com.schedbot.app.console;

import com.schedbot.app.commands.CommandContext;
import com.schedbot.app.commands.CommandProcessor;
import com.schedbot.app.commands.CommandResult;
import com.schedbot.scheduler.outbound.Destination;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Local command surface. Non-option program arguments run as one command
 * ({@code java -jar schedbot.jar job list}); with
 * {@code schedbot.console.enabled=true} commands are also read from stdin,
 * one per line, until EOF or {@code exit}. A one-off command without the
 * console closes the application once it has replied.
 */
@Slf4j
@Component
public class ConsoleRunner implements ApplicationRunner {

    private final CommandProcessor commandProcessor;
    private final boolean interactive;
    private final Destination destination;
    private final InputStream in;
    private final PrintStream out;
    private final Runnable shutdown;

    @Autowired
    public ConsoleRunner(CommandProcessor commandProcessor, ConfigurableApplicationContext context,
            @Value("${schedbot.console.enabled:false}") boolean interactive,
            @Value("${schedbot.console.thread-id:console}") String threadId,
            @Value("${schedbot.console.group:false}") boolean group) {
        this(commandProcessor, interactive, new Destination(threadId, group), System.in, System.out, context::close);
    }

    ConsoleRunner(CommandProcessor commandProcessor, boolean interactive, Destination destination,
            InputStream in, PrintStream out, Runnable shutdown) {
        this.commandProcessor = commandProcessor;
        this.interactive = interactive;
        this.destination = destination;
        this.in = in;
        this.out = out;
        this.shutdown = shutdown;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        boolean oneOff = !args.getNonOptionArgs().isEmpty();
        if (oneOff) {
            execute(quoteJoin(args.getNonOptionArgs()));
        }
        if (!interactive) {
            if (oneOff) {
                shutdown.run();
            }
            return;
        }
        log.info("Console ready; type 'job help' for commands, 'exit' to stop reading");
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.equalsIgnoreCase("exit") || trimmed.equalsIgnoreCase("quit")) {
                break;
            }
            if (!trimmed.isEmpty()) {
                execute(trimmed);
            }
        }
    }

    void execute(String line) {
        CommandResult result = commandProcessor.handleCommand(line, new CommandContext(destination, "console"));
        if (result == null) {
            out.println("Unknown command. Available: " + String.join(", ", commandProcessor.commandNames()));
            return;
        }
        out.println(result.text());
    }

    /** Re-quote arguments the shell already split, so "every 1 minute" stays one token. */
    static String quoteJoin(Iterable<String> args) {
        StringBuilder sb = new StringBuilder();
        for (String arg : args) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            boolean needsQuotes = arg.chars().anyMatch(Character::isWhitespace) && !arg.contains("\"");
            sb.append(needsQuotes ? "\"" + arg + "\"" : arg);
        }
        return sb.toString();
    }
}
