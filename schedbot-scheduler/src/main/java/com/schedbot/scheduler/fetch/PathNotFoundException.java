package com.schedbot.scheduler.fetch;

/**
 * A response-extraction path does not exist in the response.
 */
public class PathNotFoundException extends RemoteCallFailedException {

    private final String path;
    private final String missingSegment;

    public PathNotFoundException(String url, String path, String missingSegment, boolean required) {
        super(url, required, "path not found: " + path + " (missing '" + missingSegment + "')");
        this.path = path;
        this.missingSegment = missingSegment;
    }

    public String getPath() {
        return path;
    }

    public String getMissingSegment() {
        return missingSegment;
    }
}
