package com.schedbot.scheduler.outbound;

/**
 * Where a message goes: an opaque thread ID and whether it is a group.
 */
public record Destination(String threadId, boolean group) {
}
