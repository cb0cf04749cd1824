package com.schedbot.app.commands;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Routes a command line to its handler. The leading slash is optional:
 * {@code /job list} and {@code job list} are the same command.
 */
@Slf4j
@Component
public class CommandProcessor {

    private final Map<String, CommandHandler> handlers = new LinkedHashMap<>();

    public CommandProcessor(JobCommands jobCommands) {
        handlers.put("job", jobCommands::handleJob);
        handlers.put("jobs", jobCommands::handleJob);
        handlers.put("schedule", jobCommands::handleJob);
        handlers.put("lịch", jobCommands::handleJob);
    }

    public Set<String> commandNames() {
        return handlers.keySet();
    }

    /**
     * @return the reply, or null if the text is not a known command
     */
    public CommandResult handleCommand(String command, CommandContext ctx) {
        if (command == null || command.isBlank()) {
            return null;
        }
        String trimmed = command.trim();
        if (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }

        int spaceIdx = indexOfWhitespace(trimmed);
        String name;
        String args;
        if (spaceIdx < 0) {
            name = trimmed.toLowerCase(Locale.ROOT);
            args = "";
        } else {
            name = trimmed.substring(0, spaceIdx).toLowerCase(Locale.ROOT);
            args = trimmed.substring(spaceIdx + 1).trim();
        }

        CommandHandler handler = handlers.get(name);
        if (handler == null) {
            log.debug("Unknown command: {}", name);
            return null;
        }

        try {
            return handler.handle(args, ctx);
        } catch (Exception e) {
            log.error("Command {} failed: {}", name, e.getMessage(), e);
            return CommandResult.error("❌ An error occurred: " + e.getMessage());
        }
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
