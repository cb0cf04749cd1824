package com.schedbot.app.commands;

import com.schedbot.scheduler.job.ScheduledJob;
import com.schedbot.scheduler.outbound.MessageContent;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link JobCommands} against the real job stack.
 */
class JobCommandsTest {

    @TempDir
    Path tempDir;

    private CommandFixture fixture;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new CommandFixture(tempDir);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private CommandResult job(String args) {
        return fixture.job(args);
    }

    private ScheduledJob stored(String name) {
        return fixture.jobService.get(name);
    }

    // =========================================================================
    // add / list
    // =========================================================================

    @Nested
    class AddAndList {

        @Test
        void add_humanSchedule_createsJobForInvokingThread() {
            CommandResult result = job("add ping \"every day at 08:00\" Hello there");

            assertTrue(result.success(), result.text());
            assertTrue(result.text().startsWith("✅ Created job \"ping\"."));
            assertTrue(result.text().contains("- Schedule: every day at 08:00"));
            assertTrue(result.text().contains("- First run: "));
            assertFalse(result.text().contains("N/A"));

            ScheduledJob job = stored("ping");
            assertEquals("0 0 8 * * *", job.getCronExpression());
            assertEquals("Hello there", job.getText());
            assertEquals("thread-42", job.getThreadId());
            assertFalse(job.isGroup());
            assertTrue(fixture.scheduler.isArmed("ping"));
        }

        @Test
        void add_vietnamesePhrase_translated() {
            CommandResult result = job("add sang \"mỗi ngày lúc 07:30\" Chào buổi sáng");
            assertTrue(result.success(), result.text());
            assertEquals("0 30 7 * * *", stored("sang").getCronExpression());
            assertEquals("Chào buổi sáng", stored("sang").getText());
        }

        @Test
        void add_literalExpression_keptAsCron() {
            CommandResult result = job("add lit \"0 15 9 * * 1\" Weekly standup");
            assertTrue(result.success(), result.text());
            assertTrue(result.text().contains("- Schedule: 0 15 9 * * 1"));
        }

        @Test
        void add_dynamicText_flagged() {
            job("add dyn \"every day at 08:00\" Today is {date}");
            assertTrue(stored("dyn").isUseDynamicContent());
        }

        @ParameterizedTest
        @ValueSource(strings = {"add", "add ping", "add ping \"every day at 08:00\""})
        void add_missingArguments_usage(String args) {
            CommandResult result = job(args);
            assertFalse(result.success());
            assertEquals("❌ Missing arguments. Usage: add [name] [schedule] [message]", result.text());
        }

        @Test
        void add_invalidSchedule_rejected() {
            CommandResult result = job("add bad \"sometimes maybe\" hi");
            assertFalse(result.success());
            assertTrue(result.text().startsWith("❌ Invalid schedule \"sometimes maybe\""));
            assertTrue(fixture.jobService.list().isEmpty());
        }

        @Test
        void add_duplicateName_rejected() {
            job("add ping \"every day at 08:00\" one");
            CommandResult result = job("add ping \"every day at 09:00\" two");
            assertFalse(result.success());
            assertEquals("❌ Job name \"ping\" is already in use.", result.text());
            assertEquals("one", stored("ping").getText());
        }

        @Test
        void list_empty_saysSo() {
            assertEquals("No jobs are configured.", job("list").text());
        }

        @Test
        void list_showsEachJobAndTotals() {
            job("add a \"every day at 08:00\" first");
            job("add b \"0 0 9 * * *\" second");
            job("disable b");

            String text = job("list").text();
            assertTrue(text.startsWith("📋 Scheduled jobs:"));
            assertTrue(text.contains("1. a (✅ Active)"));
            assertTrue(text.contains("   - Schedule: every day at 08:00"));
            assertTrue(text.contains("2. b (❌ Disabled)"));
            assertTrue(text.contains("   - Schedule: 0 0 9 * * *"));
            assertTrue(text.contains("   - Runs: 0"));
            assertTrue(text.contains("📊 Totals:"));
            assertTrue(text.contains("- Total executions: 0"));
            // only the enabled job has a next run line
            assertEquals(1, text.split("Next run:", -1).length - 1);
        }
    }

    // =========================================================================
    // remove / enable / disable
    // =========================================================================

    @Nested
    class Lifecycle {

        @BeforeEach
        void addJob() {
            job("add ping \"every day at 08:00\" Hello");
        }

        @Test
        void remove_deletesAndDisarms() {
            CommandResult result = job("remove ping");
            assertEquals("✅ Removed job \"ping\".", result.text());
            assertTrue(fixture.jobService.list().isEmpty());
            assertFalse(fixture.scheduler.isArmed("ping"));
        }

        @Test
        void delete_isAliasForRemove() {
            assertTrue(job("delete ping").success());
            assertTrue(fixture.jobService.list().isEmpty());
        }

        @Test
        void remove_unknown_notFound() {
            CommandResult result = job("remove nope");
            assertFalse(result.success());
            assertEquals("❌ Job \"nope\" not found.", result.text());
        }

        @Test
        void remove_noName_asksForOne() {
            assertEquals("❌ Please give the name of the job to remove.", job("remove").text());
        }

        @Test
        void disable_thenEnable_roundTrip() {
            assertEquals("✅ Disabled job \"ping\".", job("disable ping").text());
            assertFalse(stored("ping").isEnabled());
            assertFalse(fixture.scheduler.isArmed("ping"));

            CommandResult enabled = job("enable ping");
            assertTrue(enabled.text().startsWith("✅ Enabled job \"ping\"."));
            assertTrue(enabled.text().contains("- Next run: "));
            assertTrue(stored("ping").isEnabled());
            assertTrue(fixture.scheduler.isArmed("ping"));
        }

        @Test
        void disable_alreadyDisabled_warns() {
            job("disable ping");
            CommandResult result = job("disable ping");
            assertFalse(result.success());
            assertEquals("⚠️ Job \"ping\" is already disabled.", result.text());
        }

        @Test
        void enable_withoutDestination_refusedAndStaysDisabled() {
            job("disable ping");
            fixture.repository.mutate(doc -> {
                doc.find("ping").orElseThrow().setThreadId(null);
                return null;
            });

            CommandResult result = job("enable ping");

            assertFalse(result.success());
            assertTrue(result.text().startsWith("❌ Job \"ping\" stays disabled: "));
            assertFalse(stored("ping").isEnabled());
            assertFalse(fixture.scheduler.isArmed("ping"));
        }

        @Test
        void enable_alreadyEnabled_warns() {
            assertEquals("⚠️ Job \"ping\" is already enabled.", job("enable ping").text());
        }
    }

    // =========================================================================
    // update
    // =========================================================================

    @Nested
    class Update {

        @BeforeEach
        void addJob() {
            job("add ping \"every day at 08:00\" Hello");
        }

        @Test
        void update_text_setsTextAndDynamicFlag() {
            CommandResult result = job("update ping text Good morning, it is {time}");
            assertTrue(result.text().startsWith("✅ Updated \"text\" of job \"ping\"."), result.text());
            assertEquals("Good morning, it is {time}", stored("ping").getText());
            assertTrue(stored("ping").isUseDynamicContent());
        }

        @Test
        void update_quotedVietnameseField_resolvesAlias() {
            assertTrue(job("update ping \"tin nhắn\" Xin chào").success());
            assertEquals("Xin chào", stored("ping").getText());
        }

        @Test
        void update_time_reportsNextRun() {
            CommandResult result = job("update ping time \"every monday at 09:15\"");
            assertTrue(result.text().contains("- Next run: "), result.text());
            assertEquals("0 15 9 * * 1", stored("ping").getCronExpression());
        }

        @Test
        void update_jsonValue_keptVerbatim() {
            job("update ping apiUrl https://example.com/data");
            assertTrue(job("update ping apiHeaders {\"Authorization\": \"Bearer x y\"}").success());
            assertEquals("Bearer x y", stored("ping").getApi().getHeaders().get("Authorization"));
        }

        @Test
        void update_quotedTemplate_unquoted() {
            job("update ping template \"Result: {title}\"");
            assertEquals("Result: {title}", stored("ping").getTemplate());
        }

        @Test
        void update_unknownField_rejected() {
            CommandResult result = job("update ping bogus 1");
            assertFalse(result.success());
            assertEquals("❌ Unknown field: bogus", result.text());
        }

        @Test
        void update_missingArguments_usage() {
            assertEquals("❌ Missing arguments. Usage: update [name] [field] [value]", job("update ping").text());
        }

        @Test
        void update_unknownJob_notFound() {
            assertEquals("❌ Job \"nope\" not found.", job("update nope text hi").text());
        }

        @Test
        void update_rename_takenName_rejected() {
            job("add other \"every day at 09:00\" x");
            CommandResult result = job("update ping name other");
            assertEquals("❌ Job name \"other\" is already in use.", result.text());
        }
    }

    // =========================================================================
    // info
    // =========================================================================

    @Nested
    class Info {

        @Test
        void info_showsDetails() {
            job("add ping \"every day at 08:00\" Hello");
            job("update ping apiUrl https://example.com/data");
            job("update ping apiCacheTTL 60");
            job("update ping apiRequired true");
            job("update ping oneTime true");

            String text = job("info ping").text();
            assertTrue(text.startsWith("📋 Job \"ping\":"));
            assertTrue(text.contains("- Status: ✅ Active"));
            assertTrue(text.contains("- Schedule: every day at 08:00"));
            assertTrue(text.contains("- Thread: thread-42"));
            assertTrue(text.contains("- Type: User"));
            assertTrue(text.contains("- Text: Hello"));
            assertTrue(text.contains("🌐 API:"));
            assertTrue(text.contains("- URL: https://example.com/data"));
            assertTrue(text.contains("- Method: GET"));
            assertTrue(text.contains("- Required: yes"));
            assertTrue(text.contains("- Cache TTL: 60 s"));
            assertTrue(text.contains("- One-time: yes"));
            assertTrue(text.contains("- Runs: 0"));
            assertTrue(text.contains("⏰ Next run: "));
        }

        @Test
        void info_longText_truncated() {
            String longText = "x".repeat(150);
            job("add long \"every day at 08:00\" " + longText);
            String text = job("info long").text();
            assertTrue(text.contains("- Text: " + "x".repeat(100) + "...\n"));
        }

        @Test
        void info_disabledJob_noNextRunButReason() {
            job("add ping \"every day at 08:00\" Hello");
            job("disable ping");
            String text = job("info ping").text();
            assertTrue(text.contains("- Status: ❌ Disabled"));
            assertTrue(text.contains("- Disabled because: Manually disabled"));
            assertFalse(text.contains("Next run"));
        }

        @Test
        void info_noName_asksForOne() {
            assertEquals("❌ Please give the name of the job to show.", job("info").text());
        }
    }

    // =========================================================================
    // run / configapi / testapi
    // =========================================================================

    @Nested
    class Execution {

        private MockWebServer server;

        @BeforeEach
        void startServer() throws IOException {
            server = new MockWebServer();
            server.start();
        }

        @AfterEach
        void stopServer() throws IOException {
            server.shutdown();
        }

        @Test
        void run_dispatchesToJobThread() {
            job("add ping \"every day at 08:00\" Hello there");

            CommandResult result = job("run ping");

            assertTrue(result.success(), result.text());
            assertTrue(result.text().startsWith("✅ Ran job \"ping\""));
            assertEquals(1, fixture.sent.size());
            CommandFixture.Sent sent = fixture.sent.get(0);
            assertInstanceOf(MessageContent.PlainText.class, sent.content());
            assertEquals("Hello there", sent.content().text());
            assertEquals("thread-42", sent.destination().threadId());
            assertEquals(1, stored("ping").getStats().getExecutionCount());
            assertTrue(job("list").text().contains("- Total executions: 1"));
        }

        @Test
        void run_requiredApiFails_notSent() {
            server.enqueue(new MockResponse().setResponseCode(500));
            job("add w \"every day at 08:00\" Weather");
            job("configapi w " + server.url("/weather"));
            job("update w apiRequired true");

            CommandResult result = job("run w");

            assertFalse(result.success());
            assertTrue(result.text().startsWith("❌ Job \"w\" was not sent because its required API call failed"),
                    result.text());
            assertTrue(fixture.sent.isEmpty());
            assertEquals(0, stored("w").getStats().getExecutionCount());
        }

        @Test
        void run_unknownJob_notFound() {
            assertEquals("❌ Job \"nope\" not found.", job("run nope").text());
        }

        @Test
        void configapi_setsUrlAndSuggestsNextSteps() {
            job("add w \"every day at 08:00\" Weather");
            String url = server.url("/weather").toString();

            CommandResult result = job("setapi w " + url);

            assertTrue(result.text().startsWith("✅ Configured API for job \"w\":"));
            assertTrue(result.text().contains("- URL: " + url));
            assertTrue(result.text().contains("- Method: GET"));
            assertTrue(result.text().contains("- update w apiMediaPath data.image_url"));
            assertTrue(result.text().contains("job testapi w"));
            assertEquals(url, stored("w").getApi().getUrl());
        }

        @Test
        void configapi_missingUrl_usage() {
            assertEquals("❌ Missing arguments. Usage: configapi [name] [url]", job("configapi w").text());
        }

        @Test
        void testapi_previewsResponseAndTemplate_withoutSending() {
            server.enqueue(new MockResponse()
                    .setHeader("Content-Type", "application/json")
                    .setBody("{\"title\":\"Hello\",\"description\":\"World\"}"));
            job("add w \"every day at 08:00\" Weather");
            job("configapi w " + server.url("/data"));
            job("update w template \"Result: {title} - {description}\"");

            CommandResult result = job("testapi w");

            assertTrue(result.success(), result.text());
            assertTrue(result.text().startsWith("✅ API call succeeded for \"w\":"));
            assertTrue(result.text().contains("📊 Response:"));
            assertTrue(result.text().contains("\"Hello\""));
            assertTrue(result.text().contains("📝 Message preview:\n\nResult: Hello - World"));
            assertTrue(fixture.sent.isEmpty());
            assertEquals(0, stored("w").getStats().getExecutionCount());
        }

        @Test
        void testapi_callFails_reportsError() {
            server.enqueue(new MockResponse().setResponseCode(503));
            job("add w \"every day at 08:00\" Weather");
            job("configapi w " + server.url("/data"));

            CommandResult result = job("testapi w");

            assertFalse(result.success());
            assertTrue(result.text().startsWith("❌ API call failed for \"w\":"), result.text());
        }

        @Test
        void testapi_noApi_rejected() {
            job("add w \"every day at 08:00\" Weather");
            assertEquals("❌ Job \"w\" has no API configured.", job("testapi w").text());
        }
    }

    // =========================================================================
    // help
    // =========================================================================

    @ParameterizedTest
    @ValueSource(strings = {"", "help", "whatever"})
    void handleJob_helpOrUnknownOp_showsHelp(String args) {
        String text = job(args).text();
        assertTrue(text.startsWith("📋 Job management:"));
        assertTrue(text.contains("🌐 API integration:"));
        assertTrue(text.contains("📝 Schedule examples:"));
    }
}
