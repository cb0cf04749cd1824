package com.schedbot.app.commands;

/**
 * Reply to a command.
 *
 * @param success false when the command was rejected or failed
 */
public record CommandResult(String text, boolean success) {

    public static CommandResult text(String text) {
        return new CommandResult(text, true);
    }

    public static CommandResult error(String text) {
        return new CommandResult(text, false);
    }
}
