package com.schedbot.app.handlers;

import com.schedbot.scheduler.handler.CustomJobHandler;

/**
 * A custom job handler that registers itself under {@link #name()}. Every
 * Spring bean of this type is added to the handler registry at startup.
 */
public interface NamedJobHandler extends CustomJobHandler {

    /** The value a job's {@code customFunction} field names. */
    String name();
}
