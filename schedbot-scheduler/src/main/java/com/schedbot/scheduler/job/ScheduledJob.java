package com.schedbot.scheduler.job;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named scheduled job as stored in the job document.
 * <p>
 * Fields the model does not know (e.g. handler settings such as
 * {@code weatherLocation}) are kept in {@link #getExtra()} and written back
 * unchanged.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScheduledJob {

    private String name;
    @Builder.Default
    private boolean enabled = true;
    private boolean oneTime;

    private String cronExpression;
    @Builder.Default
    private TimeFormat timeFormat = TimeFormat.CRON;
    private String humanTime;

    private String threadId;
    @JsonProperty("isGroup")
    private boolean group;

    private String text;
    private boolean useDynamicContent;
    private boolean useRichText;
    private List<JsonNode> styles;
    private Integer urgency;
    private List<JsonNode> mentions;

    private String imagePath;
    private String videoPath;
    private String audioPath;
    private List<String> attachments;

    private ApiCallSpec api;
    /** replaces the text when remote data is available */
    private String template;
    private String customFunction;

    private Instant createdAt;
    private Instant enabledAt;
    private Instant disabledAt;
    private String disabledReason;

    @Builder.Default
    private JobStats stats = new JobStats();

    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    @JsonIgnore
    public boolean hasApi() {
        return api != null && api.getUrl() != null && !api.getUrl().isBlank();
    }

    /** Schedule as shown to users: the phrase for human schedules. */
    @JsonIgnore
    public String scheduleDisplay() {
        return timeFormat == TimeFormat.HUMAN && humanTime != null ? humanTime : cronExpression;
    }

    public List<String> attachmentsOrEmpty() {
        return attachments == null ? List.of() : attachments;
    }

    public void addAttachment(String ref) {
        if (attachments == null) {
            attachments = new ArrayList<>();
        }
        attachments.add(ref);
    }

    /** True when text contains placeholder braces. */
    public static boolean looksDynamic(String text) {
        return text != null && text.contains("{") && text.contains("}");
    }
}
