package com.schedbot.scheduler.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.schedbot.scheduler.job.ScheduledJob;
import com.schedbot.scheduler.outbound.Destination;
import com.schedbot.scheduler.outbound.MessageDispatcher;

/**
 * A named routine run after a job's message has been dispatched.
 */
@FunctionalInterface
public interface CustomJobHandler {

    void handle(Invocation invocation) throws Exception;

    /**
     * @param remoteData the firing's remote data, or null
     */
    record Invocation(ScheduledJob job, JsonNode remoteData, MessageDispatcher dispatcher) {

        public Destination destination() {
            return new Destination(job.getThreadId(), job.isGroup());
        }
    }
}
