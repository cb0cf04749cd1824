package com.schedbot.scheduler.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.schedbot.scheduler.engine.ExecutionRecord.Outcome;
import com.schedbot.scheduler.engine.ExecutionRecord.Stage;
import com.schedbot.scheduler.engine.ExecutionRecord.Trigger;
import com.schedbot.scheduler.job.ApiCallSpec;
import com.schedbot.scheduler.job.ScheduledJob;
import com.schedbot.scheduler.outbound.MessageContent;
import com.schedbot.scheduler.outbound.MessageContent.PlainText;
import com.schedbot.scheduler.outbound.MessageContent.RichMessage;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.schedbot.scheduler.engine.EngineFixture.NOW;
import static com.schedbot.scheduler.engine.EngineFixture.job;
import static org.junit.jupiter.api.Assertions.*;

class ExecutionEngineTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private EngineFixture fx;
    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        fx = new EngineFixture(tempDir);
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private ApiCallSpec.ApiCallSpecBuilder api(String path) {
        return ApiCallSpec.builder().url(server.url(path).toString());
    }

    // =========================================================================
    // Content
    // =========================================================================

    @Nested
    class Content {

        @Test
        void execute_plainText_dispatchedAndCounted() {
            fx.save(job("Ping").text("ping").build());

            ExecutionRecord record = fx.engine.execute(fx.stored("Ping"), Trigger.SCHEDULED);

            assertEquals(Outcome.DISPATCHED, record.getOutcome());
            assertTrue(record.isStatsUpdated());
            RecordingDispatcher.Sent sent = fx.dispatcher.last();
            assertEquals(new PlainText("ping"), sent.content());
            assertEquals("thread-1", sent.destination().threadId());
            assertFalse(sent.destination().group());

            ScheduledJob stored = fx.stored("Ping");
            assertEquals(1, stored.getStats().getExecutionCount());
            assertEquals(NOW, stored.getStats().getLastExecuted());
            assertEquals(1, fx.metadata().getStats().getTotalExecutions());
            assertEquals(NOW, fx.metadata().getStats().getLastExecution());
        }

        @Test
        void execute_dynamicText_composedWithJobName() {
            fx.save(job("Ping").text("{date} {jobName}").useDynamicContent(true).build());

            fx.engine.execute(fx.stored("Ping"), Trigger.SCHEDULED);

            assertEquals("05/03/2024 Ping", fx.dispatcher.last().content().text());
        }

        @Test
        void execute_staticTextNotComposed() {
            fx.save(job("Raw").text("{date}").build());

            fx.engine.execute(fx.stored("Raw"), Trigger.SCHEDULED);

            assertEquals("{date}", fx.dispatcher.last().content().text());
        }

        @Test
        void execute_richTextFlag_sendsRichMessage() {
            fx.save(job("Rich").text("bold").useRichText(true).build());

            fx.engine.execute(fx.stored("Rich"), Trigger.SCHEDULED);

            assertInstanceOf(RichMessage.class, fx.dispatcher.last().content());
        }

        @Test
        void execute_mentionsOnlyForGroups() throws Exception {
            List<com.fasterxml.jackson.databind.JsonNode> mentions =
                    List.of(MAPPER.readTree("{\"uid\":\"u1\",\"pos\":0,\"len\":3}"));
            fx.save(job("Direct").text("@al hi").mentions(mentions).build());
            fx.save(job("Group").text("@al hi").group(true).mentions(mentions).build());

            fx.engine.execute(fx.stored("Direct"), Trigger.SCHEDULED);
            MessageContent direct = fx.dispatcher.last().content();
            fx.engine.execute(fx.stored("Group"), Trigger.SCHEDULED);
            MessageContent group = fx.dispatcher.last().content();

            assertInstanceOf(PlainText.class, direct);
            RichMessage rich = assertInstanceOf(RichMessage.class, group);
            assertEquals(1, rich.mentions().size());
            assertTrue(fx.dispatcher.last().destination().group());
        }

        @Test
        void execute_urgency_zeroIgnored() {
            fx.save(job("Calm").text("hi").urgency(0).build());
            fx.save(job("Loud").text("hi").urgency(2).build());

            fx.engine.execute(fx.stored("Calm"), Trigger.SCHEDULED);
            assertInstanceOf(PlainText.class, fx.dispatcher.last().content());
            fx.engine.execute(fx.stored("Loud"), Trigger.SCHEDULED);
            assertEquals(2, ((RichMessage) fx.dispatcher.last().content()).urgency());
        }

        @Test
        void execute_nothingToSend_noDispatchNoStats() {
            fx.save(job("Empty").build());

            ExecutionRecord record = fx.engine.execute(fx.stored("Empty"), Trigger.SCHEDULED);

            assertEquals(Outcome.NO_CONTENT, record.getOutcome());
            assertTrue(fx.dispatcher.sent.isEmpty());
            assertEquals(0, fx.stored("Empty").getStats().getExecutionCount());
            assertEquals(0, fx.metadata().getStats().getTotalExecutions());
        }
    }

    // =========================================================================
    // Attachments
    // =========================================================================

    @Nested
    class Attachments {

        @Test
        void execute_unresolvableAttachmentSkipped() throws Exception {
            Path photo = Files.write(tempDir.resolve("photo.jpg"), new byte[]{1, 2, 3});
            fx.save(job("Photos").text("look")
                    .imagePath("/definitely/not/here.png")
                    .attachments(new ArrayList<>(List.of(photo.toString())))
                    .build());

            ExecutionRecord record = fx.engine.execute(fx.stored("Photos"), Trigger.SCHEDULED);

            assertEquals(Outcome.DISPATCHED, record.getOutcome());
            RichMessage rich = (RichMessage) fx.dispatcher.last().content();
            assertEquals(List.of(photo), rich.attachments());
            assertEquals(List.of("/definitely/not/here.png"), record.getSkippedAttachments());
        }

        @Test
        void execute_defaultAssetAttached() {
            fx.save(job("Reminder").imagePath("default:reminder").build());

            ExecutionRecord record = fx.engine.execute(fx.stored("Reminder"), Trigger.SCHEDULED);

            assertEquals(Outcome.DISPATCHED, record.getOutcome());
            RichMessage rich = (RichMessage) fx.dispatcher.last().content();
            assertEquals(1, rich.attachments().size());
            assertTrue(Files.isRegularFile(rich.attachments().get(0)));
            assertEquals("", rich.text());
        }

        @Test
        void execute_remoteMediaAppendedLast() throws Exception {
            Path local = Files.write(tempDir.resolve("local.png"), new byte[]{9, 9});
            String imageUrl = server.url("/pics/cat.png").toString();
            server.enqueue(new MockResponse().setBody("{\"name\":\"Cat\",\"image\":\"" + imageUrl + "\"}"));
            server.enqueue(new MockResponse().setBody(new Buffer().write(new byte[]{(byte) 0x89, 'P', 'N', 'G'}))
                    .addHeader("Content-Type", "image/png"));
            fx.save(job("Cats").template("Today: {name}")
                    .imagePath(local.toString())
                    .api(api("/cat").mediaPath("image").build())
                    .build());

            ExecutionRecord record = fx.engine.execute(fx.stored("Cats"), Trigger.SCHEDULED);

            assertEquals(Outcome.DISPATCHED, record.getOutcome());
            RichMessage rich = (RichMessage) fx.dispatcher.last().content();
            assertEquals("Today: Cat", rich.text());
            assertEquals(2, rich.attachments().size());
            assertEquals(local, rich.attachments().get(0));
            assertTrue(rich.attachments().get(1).getFileName().toString().endsWith(".png"));
        }
    }

    // =========================================================================
    // Remote data
    // =========================================================================

    @Nested
    class RemoteData {

        @Test
        void execute_requiredCallFails_abortsWithoutSideEffects() {
            server.enqueue(new MockResponse().setResponseCode(500));
            fx.save(job("Weather").template("{main.temp}").api(api("/w").required(true).build()).build());

            ExecutionRecord record = fx.engine.execute(fx.stored("Weather"), Trigger.SCHEDULED);

            assertEquals(Outcome.ABORTED_REMOTE, record.getOutcome());
            assertNotNull(record.getError());
            assertTrue(fx.dispatcher.sent.isEmpty());
            assertEquals(0, fx.stored("Weather").getStats().getExecutionCount());
            assertEquals(0, fx.metadata().getStats().getTotalExecutions());
        }

        @Test
        void execute_optionalCallFails_sendsTextWithTokensKept() {
            server.enqueue(new MockResponse().setResponseCode(500));
            fx.save(job("Weather").text("{api.temp} now").useDynamicContent(true)
                    .api(api("/w").build()).build());

            ExecutionRecord record = fx.engine.execute(fx.stored("Weather"), Trigger.SCHEDULED);

            assertEquals(Outcome.DISPATCHED, record.getOutcome());
            assertEquals("{api.temp} now", fx.dispatcher.last().content().text());
        }

        @Test
        void execute_templateReplacesText() {
            server.enqueue(new MockResponse().setBody("{\"main\":{\"temp\":30.5}}"));
            fx.save(job("Weather").text("fallback text").template("{main.temp} C on {date}")
                    .api(api("/w").build()).build());

            fx.engine.execute(fx.stored("Weather"), Trigger.SCHEDULED);

            assertEquals("30.5 C on 05/03/2024", fx.dispatcher.last().content().text());
        }

        @Test
        void execute_fallbackUsedWhenCallFails() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(502));
            fx.save(job("Quote").template("{quote}")
                    .api(api("/q").required(true).fallback(MAPPER.readTree("{\"quote\":\"keep going\"}")).build())
                    .build());

            ExecutionRecord record = fx.engine.execute(fx.stored("Quote"), Trigger.SCHEDULED);

            assertEquals(Outcome.DISPATCHED, record.getOutcome());
            assertEquals("keep going", fx.dispatcher.last().content().text());
        }
    }

    // =========================================================================
    // Dispatch failures
    // =========================================================================

    @Test
    void execute_dispatcherReportsFailure_statsUntouched() {
        fx.dispatcher.failWith("thread closed");
        fx.save(job("Ping").text("ping").build());

        ExecutionRecord record = fx.engine.execute(fx.stored("Ping"), Trigger.SCHEDULED);

        assertEquals(Outcome.FAILED, record.getOutcome());
        assertEquals(Stage.DISPATCH, record.getStage());
        assertEquals("thread closed", record.getError());
        assertEquals(0, fx.stored("Ping").getStats().getExecutionCount());
    }

    @Test
    void execute_dispatcherThrows_recordedNotPropagated() {
        fx.dispatcher.throwOnDispatch(new IllegalStateException("socket gone"));
        fx.save(job("Ping").text("ping").build());

        ExecutionRecord record = fx.engine.execute(fx.stored("Ping"), Trigger.SCHEDULED);

        assertEquals(Outcome.FAILED, record.getOutcome());
        assertEquals(Stage.DISPATCH, record.getStage());
        assertEquals("socket gone", record.getError());
        assertEquals(0, fx.metadata().getStats().getTotalExecutions());
    }

    @Test
    void execute_jobRemovedBeforeStats_onlyTotalsCounted() {
        ScheduledJob detached = job("Ghost").text("boo").build();

        ExecutionRecord record = fx.engine.execute(detached, Trigger.SCHEDULED);

        assertTrue(record.isStatsUpdated());
        assertEquals(1, fx.metadata().getStats().getTotalExecutions());
        assertTrue(fx.repository.find("Ghost").isEmpty());
    }

    // =========================================================================
    // One-shot jobs
    // =========================================================================

    @Nested
    class OneShot {

        @Test
        void scheduledFiring_disablesJobAndClearsOneTime() {
            List<String> disarmed = new ArrayList<>();
            fx.engine.setOneShotHandler(disarmed::add);
            fx.save(job("Once").text("once").oneTime(true).build());

            ExecutionRecord record = fx.engine.execute(fx.stored("Once"), Trigger.SCHEDULED);

            assertTrue(record.isDeactivated());
            ScheduledJob stored = fx.stored("Once");
            assertFalse(stored.isEnabled());
            assertFalse(stored.isOneTime());
            assertEquals(ExecutionEngine.ONE_SHOT_REASON, stored.getDisabledReason());
            assertEquals(NOW, stored.getDisabledAt());
            assertEquals(1, stored.getStats().getExecutionCount());
            assertEquals("Once", fx.metadata().getLastDisabledJob().getName());
            assertEquals(List.of("Once"), disarmed);
        }

        @Test
        void manualRun_keepsJobEnabled() {
            List<String> disarmed = new ArrayList<>();
            fx.engine.setOneShotHandler(disarmed::add);
            fx.save(job("Once").text("once").oneTime(true).build());

            ExecutionRecord record = fx.engine.execute(fx.stored("Once"), Trigger.MANUAL);

            assertFalse(record.isDeactivated());
            assertTrue(fx.stored("Once").isEnabled());
            assertEquals(1, fx.stored("Once").getStats().getExecutionCount());
            assertTrue(disarmed.isEmpty());
        }

        @Test
        void nothingToSend_stillDisables() {
            fx.save(job("Once").oneTime(true).build());

            ExecutionRecord record = fx.engine.execute(fx.stored("Once"), Trigger.SCHEDULED);

            assertEquals(Outcome.NO_CONTENT, record.getOutcome());
            assertFalse(fx.stored("Once").isEnabled());
        }

        @Test
        void failedDispatch_staysEnabled() {
            fx.dispatcher.failWith("nope");
            fx.save(job("Once").text("once").oneTime(true).build());

            fx.engine.execute(fx.stored("Once"), Trigger.SCHEDULED);

            assertTrue(fx.stored("Once").isEnabled());
        }
    }

    // =========================================================================
    // Custom handlers
    // =========================================================================

    @Nested
    class Handlers {

        @Test
        void handler_runsAfterDispatchWithRemoteData() {
            server.enqueue(new MockResponse().setBody("{\"city\":\"Hue\"}"));
            List<String> seen = new ArrayList<>();
            fx.handlers.register("echoCity", inv -> {
                seen.add(inv.remoteData().get("city").asText());
                inv.dispatcher().dispatch(new PlainText("extra"), inv.destination());
            });
            fx.save(job("City").text("main").customFunction("echoCity").api(api("/c").build()).build());

            ExecutionRecord record = fx.engine.execute(fx.stored("City"), Trigger.SCHEDULED);

            assertNull(record.getHandlerError());
            assertEquals(List.of("Hue"), seen);
            assertEquals(2, fx.dispatcher.sent.size());
            assertEquals("main", fx.dispatcher.sent.get(0).content().text());
            assertEquals("extra", fx.dispatcher.sent.get(1).content().text());
        }

        @Test
        void handlerFailure_doesNotUndoDispatchOrStats() {
            fx.handlers.register("boom", inv -> {
                throw new Exception("kaput");
            });
            fx.save(job("Boom").text("before").customFunction("boom").build());

            ExecutionRecord record = fx.engine.execute(fx.stored("Boom"), Trigger.SCHEDULED);

            assertEquals(Outcome.DISPATCHED, record.getOutcome());
            assertEquals("kaput", record.getHandlerError());
            assertEquals(1, fx.stored("Boom").getStats().getExecutionCount());
        }

        @Test
        void unknownHandler_reported() {
            fx.save(job("Lost").text("x").customFunction("nobodyHome").build());

            ExecutionRecord record = fx.engine.execute(fx.stored("Lost"), Trigger.SCHEDULED);

            assertEquals(Outcome.DISPATCHED, record.getOutcome());
            assertTrue(record.getHandlerError().contains("nobodyHome"));
        }
    }

    // =========================================================================
    // Preview
    // =========================================================================

    @Test
    void preview_neitherDispatchesNorWrites() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"main\":{\"temp\":21}}"));
        fx.save(job("Weather").template("{main.temp} C").api(api("/w").build()).build());
        String before = Files.readString(fx.storePath);

        ApiPreview preview = fx.engine.preview(fx.stored("Weather"), 10);

        assertEquals("21 C", preview.composedPreview());
        assertTrue(preview.responsePreview().length() <= 10);
        assertTrue(preview.responsePreview().endsWith("..."));
        assertTrue(fx.dispatcher.sent.isEmpty());
        assertEquals(before, Files.readString(fx.storePath));
    }
}
