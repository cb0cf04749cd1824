package com.schedbot.app.commands;

import com.schedbot.scheduler.outbound.Destination;

/**
 * Context passed to every command handler.
 *
 * @param destination the conversation the command came from; new jobs send
 *                    there
 * @param senderId    who sent the command, may be null
 */
public record CommandContext(Destination destination, String senderId) {
}
