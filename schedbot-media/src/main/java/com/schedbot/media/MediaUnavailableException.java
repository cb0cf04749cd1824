package com.schedbot.media;

/**
 * A media reference could not be turned into a usable local file.
 */
public class MediaUnavailableException extends RuntimeException {

    private final String reference;

    public MediaUnavailableException(String reference, String message) {
        super(message);
        this.reference = reference;
    }

    public MediaUnavailableException(String reference, String message, Throwable cause) {
        super(message, cause);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
