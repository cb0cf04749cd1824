package com.schedbot.app.commands;

/**
 * Handles one top-level command.
 */
@FunctionalInterface
public interface CommandHandler {
    /**
     * @param args text after the command name, may be empty
     * @param ctx  who is asking and where the reply goes
     * @return the reply, never null
     */
    CommandResult handle(String args, CommandContext ctx);
}
