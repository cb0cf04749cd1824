package com.schedbot.scheduler.engine;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * What happened during one firing of a job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRecord {

    public enum Trigger {
        /** fired by the job's timer */
        SCHEDULED,
        /** run on request; never deactivates one-shot jobs */
        MANUAL
    }

    public enum Outcome {
        DISPATCHED,
        /** nothing to send; stats untouched */
        NO_CONTENT,
        /** a required remote call failed; nothing composed or sent */
        ABORTED_REMOTE,
        FAILED
    }

    public enum Stage {
        FETCH, COMPOSE, MEDIA, DISPATCH, PERSIST, DEACTIVATE, HANDLER
    }

    private String jobName;
    private Trigger trigger;
    private Instant startedAt;
    private Instant finishedAt;
    private long durationMs;

    private Outcome outcome;
    /** stage that failed, if any */
    private Stage stage;
    private String error;

    private String text;
    @Builder.Default
    private List<Path> attachments = new ArrayList<>();
    /** references that could not be resolved and were left out */
    @Builder.Default
    private List<String> skippedAttachments = new ArrayList<>();
    private JsonNode remoteData;

    private boolean statsUpdated;
    private boolean deactivated;
    private String handlerError;

    public boolean isDispatched() {
        return outcome == Outcome.DISPATCHED;
    }
}
