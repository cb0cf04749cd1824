package com.schedbot.scheduler.engine;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;

/**
 * Dry-run view of a job's remote call.
 *
 * @param responsePreview pretty-printed data, truncated for display
 * @param composedPreview the job's template (or dynamic text) filled with the
 *                        data, or null if the job has neither
 * @param mediaUrl        URL found at the job's media path, or null
 * @param mediaFile       local file for {@code mediaUrl}, or null
 */
public record ApiPreview(String jobName, String url, JsonNode data, String responsePreview,
        String composedPreview, String mediaUrl, Path mediaFile) {
}
