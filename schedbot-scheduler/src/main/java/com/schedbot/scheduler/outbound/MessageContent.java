package com.schedbot.scheduler.outbound;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.List;

/**
 * What a firing hands to the dispatcher: either bare text or a rich message.
 */
public sealed interface MessageContent permits MessageContent.PlainText, MessageContent.RichMessage {

    String text();

    record PlainText(String text) implements MessageContent {
    }

    /**
     * Text plus optional styling, mentions, attachments and urgency. Lists are
     * never null.
     */
    record RichMessage(String text, List<JsonNode> styles, List<JsonNode> mentions,
            List<Path> attachments, Integer urgency) implements MessageContent {

        public RichMessage {
            styles = styles == null ? List.of() : List.copyOf(styles);
            mentions = mentions == null ? List.of() : List.copyOf(mentions);
            attachments = attachments == null ? List.of() : List.copyOf(attachments);
        }
    }
}
