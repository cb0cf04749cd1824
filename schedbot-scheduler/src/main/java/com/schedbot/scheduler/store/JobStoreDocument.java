package com.schedbot.scheduler.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.schedbot.scheduler.job.ScheduledJob;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The persisted job document: every job plus aggregate metadata.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobStoreDocument {

    public static final String SCHEMA_VERSION = "1.0.0";

    private List<ScheduledJob> jobs = new ArrayList<>();
    private Metadata metadata = new Metadata();

    public static JobStoreDocument empty(Instant now) {
        JobStoreDocument doc = new JobStoreDocument();
        doc.getMetadata().setLastUpdated(now);
        return doc;
    }

    public Optional<ScheduledJob> find(String name) {
        return jobs.stream().filter(j -> j.getName() != null && j.getName().equals(name)).findFirst();
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public boolean remove(String name) {
        return jobs.removeIf(j -> name.equals(j.getName()));
    }

    @Data
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata {
        private String version = SCHEMA_VERSION;
        private Instant lastUpdated;
        private AggregateStats stats = new AggregateStats();
        private DisabledJob lastDisabledJob;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AggregateStats {
        private long totalExecutions;
        private Instant lastExecution;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DisabledJob {
        private String name;
        private Instant timestamp;
    }
}
