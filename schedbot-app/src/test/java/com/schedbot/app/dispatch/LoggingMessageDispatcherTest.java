package com.schedbot.app.dispatch;

import com.schedbot.scheduler.outbound.Destination;
import com.schedbot.scheduler.outbound.DispatchResult;
import com.schedbot.scheduler.outbound.MessageContent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoggingMessageDispatcherTest {

    @Test
    void dispatch_alwaysSucceedsWithId() {
        var dispatcher = new LoggingMessageDispatcher();
        DispatchResult plain = dispatcher.dispatch(new MessageContent.PlainText("hi"), new Destination("t", false));
        DispatchResult rich = dispatcher.dispatch(
                new MessageContent.RichMessage("hi", null, null, List.of(), 2), new Destination("t", true));

        assertTrue(plain.isSuccess());
        assertTrue(rich.isSuccess());
        assertNotNull(plain.getMessageId());
        assertNotEquals(plain.getMessageId(), rich.getMessageId());
    }
}
