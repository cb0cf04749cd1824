package com.schedbot.scheduler.outbound;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of handing a message to the transport.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DispatchResult {

    private boolean success;

    /** Transport message ID, when the transport returns one. */
    private String messageId;

    private String error;

    public static DispatchResult ok(String messageId) {
        return DispatchResult.builder().success(true).messageId(messageId).build();
    }

    public static DispatchResult failed(String error) {
        return DispatchResult.builder().success(false).error(error).build();
    }
}
