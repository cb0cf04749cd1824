package com.schedbot.app.dispatch;

import com.schedbot.scheduler.outbound.Destination;
import com.schedbot.scheduler.outbound.DispatchResult;
import com.schedbot.scheduler.outbound.MessageContent;
import com.schedbot.scheduler.outbound.MessageDispatcher;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * Writes each message to the log instead of a chat transport. Used when no
 * webhook is configured.
 */
@Slf4j
public class LoggingMessageDispatcher implements MessageDispatcher {

    @Override
    public DispatchResult dispatch(MessageContent content, Destination destination) {
        String messageId = UUID.randomUUID().toString();
        if (content instanceof MessageContent.RichMessage rich) {
            log.info("[{}{}] {} (attachments={}, mentions={}, urgency={})",
                    destination.group() ? "group:" : "user:", destination.threadId(), rich.text(),
                    rich.attachments(), rich.mentions().size(), rich.urgency());
        } else {
            log.info("[{}{}] {}", destination.group() ? "group:" : "user:", destination.threadId(), content.text());
        }
        return DispatchResult.ok(messageId);
    }
}
