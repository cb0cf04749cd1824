package com.schedbot.scheduler.outbound;

/**
 * Delivers composed messages. The chat transport behind it is external.
 */
@FunctionalInterface
public interface MessageDispatcher {

    /**
     * Deliver {@code content} to {@code destination}. Implementations report
     * transport failures through the result or by throwing; the engine treats
     * both as a failed dispatch.
     */
    DispatchResult dispatch(MessageContent content, Destination destination);
}
