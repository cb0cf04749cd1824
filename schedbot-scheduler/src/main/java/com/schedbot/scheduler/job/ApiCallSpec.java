package com.schedbot.scheduler.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remote call attached to a job. Persisted under the job's {@code api} key.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiCallSpec {
    private String url;
    @Builder.Default
    private String method = "GET";
    private Map<String, String> headers;
    /** request body, sent for POST, PUT and PATCH */
    private JsonNode data;
    private Map<String, Object> params;
    private boolean required;
    /** dotted path into the response, e.g. {@code data.results[0]} */
    private String responsePath;
    /** dotted path to a media URL in the extracted data */
    private String mediaPath;
    /** milliseconds */
    @JsonProperty("cacheTTL")
    private Long cacheTtl;
    private JsonNode fallback;
    /** milliseconds */
    private Long timeout;
    private boolean saveResponse;

    public Map<String, String> headersOrEmpty() {
        return headers == null ? Map.of() : headers;
    }

    public Map<String, Object> paramsOrEmpty() {
        return params == null ? Map.of() : new LinkedHashMap<>(params);
    }
}
