package com.schedbot.scheduler.fetch;

/**
 * A remote data call failed and no fallback was configured.
 */
public class RemoteCallFailedException extends RuntimeException {

    private final String url;
    private final boolean required;

    public RemoteCallFailedException(String url, boolean required, String message) {
        super(message);
        this.url = url;
        this.required = required;
    }

    public RemoteCallFailedException(String url, boolean required, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.required = required;
    }

    public String getUrl() {
        return url;
    }

    /** Whether the owning job must not fire without this data. */
    public boolean isRequired() {
        return required;
    }
}
