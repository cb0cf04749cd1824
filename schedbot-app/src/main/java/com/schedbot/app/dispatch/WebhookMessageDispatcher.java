package com.schedbot.app.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.schedbot.scheduler.outbound.Destination;
import com.schedbot.scheduler.outbound.DispatchResult;
import com.schedbot.scheduler.outbound.MessageContent;
import com.schedbot.scheduler.outbound.MessageDispatcher;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts each message as JSON to a chat bridge webhook.
 * <p>
 * Body: {@code threadId}, {@code group}, {@code type} ("plain" or "rich"),
 * {@code text} and, for rich messages, {@code styles}, {@code mentions},
 * {@code attachments} (local file paths) and {@code urgency}. A 2xx reply is a
 * successful delivery; a {@code messageId} field in a JSON reply is passed on.
 */
@Slf4j
public class WebhookMessageDispatcher implements MessageDispatcher {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final String webhookUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebhookMessageDispatcher(String webhookUrl) {
        this(webhookUrl, new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .build());
    }

    /**
     * Constructor for testing, allows injecting the HTTP client.
     */
    WebhookMessageDispatcher(String webhookUrl, OkHttpClient httpClient) {
        this.webhookUrl = webhookUrl;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public DispatchResult dispatch(MessageContent content, Destination destination) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("threadId", destination.threadId());
        body.put("group", destination.group());
        body.put("text", content.text());
        if (content instanceof MessageContent.RichMessage rich) {
            body.put("type", "rich");
            body.put("styles", rich.styles());
            body.put("mentions", rich.mentions());
            body.put("attachments", rich.attachments().stream().map(Path::toString).toList());
            if (rich.urgency() != null) {
                body.put("urgency", rich.urgency());
            }
        } else {
            body.put("type", "plain");
        }

        try {
            String json = objectMapper.writeValueAsString(body);
            Request request = new Request.Builder()
                    .url(webhookUrl)
                    .post(RequestBody.create(json, JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody responseBody = response.body();
                String respStr = responseBody != null ? responseBody.string() : "";
                if (!response.isSuccessful()) {
                    log.error("Webhook HTTP error {} for thread {}: {}", response.code(), destination.threadId(),
                            respStr);
                    return DispatchResult.failed("Webhook HTTP error " + response.code() + ": " + respStr);
                }
                return DispatchResult.ok(messageId(respStr));
            }
        } catch (IOException e) {
            log.error("Webhook call failed for thread {}: {}", destination.threadId(), e.getMessage());
            return DispatchResult.failed("Webhook call failed: " + e.getMessage());
        }
    }

    private String messageId(String respStr) {
        if (respStr.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(respStr);
            JsonNode id = node.path("messageId");
            return id.isMissingNode() || id.isNull() ? null : id.asText();
        } catch (IOException e) {
            log.debug("Webhook reply is not JSON: {}", respStr);
            return null;
        }
    }
}
