package com.schedbot.app.commands;

import com.schedbot.common.config.ConfigService;
import com.schedbot.common.infra.RelativeTime;
import com.schedbot.media.MediaUnavailableException;
import com.schedbot.scheduler.cron.InvalidScheduleException;
import com.schedbot.scheduler.engine.ApiPreview;
import com.schedbot.scheduler.engine.DuplicateJobNameException;
import com.schedbot.scheduler.engine.ExecutionRecord;
import com.schedbot.scheduler.engine.JobNotFoundException;
import com.schedbot.scheduler.engine.JobService;
import com.schedbot.scheduler.fetch.RemoteCallFailedException;
import com.schedbot.scheduler.job.ApiCallSpec;
import com.schedbot.scheduler.job.JobStats;
import com.schedbot.scheduler.job.ScheduledJob;
import com.schedbot.scheduler.store.JobStoreDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The {@code job} command: list, add, remove, enable, disable, update, info,
 * run, configapi, testapi and help.
 */
@Slf4j
@Component
public class JobCommands {

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss");
    private static final int INFO_TEXT_MAX = 100;

    private final JobService jobService;
    private final ZoneId zone;
    private final Clock clock;
    private final int previewMaxChars;

    @Autowired
    public JobCommands(JobService jobService, ConfigService configService, Clock clock) {
        this(jobService, configService.resolveZone(), clock,
                configService.loadConfig().getFetch().getPreviewMaxChars());
    }

    JobCommands(JobService jobService, ZoneId zone, Clock clock, int previewMaxChars) {
        this.jobService = jobService;
        this.zone = zone;
        this.clock = clock;
        this.previewMaxChars = previewMaxChars;
    }

    public CommandResult handleJob(String args, CommandContext ctx) {
        CommandTokenizer.Split split = CommandTokenizer.split(args, 1);
        String op = split.head().isEmpty() ? "help" : split.head(0).toLowerCase(Locale.ROOT);
        String rest = split.rest();

        try {
            return switch (op) {
                case "list" -> list();
                case "add" -> add(rest, ctx);
                case "remove", "delete" -> remove(rest);
                case "enable" -> enable(rest);
                case "disable" -> disable(rest);
                case "update" -> update(rest);
                case "info" -> info(rest);
                case "run" -> run(rest);
                case "configapi", "setapi" -> configureApi(rest);
                case "testapi" -> testApi(rest);
                default -> help();
            };
        } catch (JobNotFoundException e) {
            return CommandResult.error("❌ Job \"" + e.getJobName() + "\" not found.");
        } catch (DuplicateJobNameException e) {
            return CommandResult.error("❌ Job name \"" + e.getJobName() + "\" is already in use.");
        } catch (InvalidScheduleException e) {
            return CommandResult.error("❌ Invalid schedule \"" + e.getInput()
                    + "\". Use a phrase such as \"every day at 08:00\" or a cron expression.");
        } catch (IllegalArgumentException | IllegalStateException e) {
            return CommandResult.error("❌ " + e.getMessage());
        }
    }

    // =========================================================================
    // Queries
    // =========================================================================

    private CommandResult list() {
        List<ScheduledJob> jobs = jobService.list();
        if (jobs.isEmpty()) {
            return CommandResult.text("No jobs are configured.");
        }
        StringBuilder sb = new StringBuilder("📋 Scheduled jobs:\n\n");
        int index = 1;
        for (ScheduledJob job : jobs) {
            sb.append(index++).append(". ").append(job.getName())
                    .append(" (").append(status(job)).append(")\n");
            sb.append("   - Schedule: ").append(job.scheduleDisplay()).append('\n');
            if (job.isEnabled()) {
                sb.append("   - Next run: ").append(formatNext(jobService.nextFireTime(job.getName()))).append('\n');
            }
            if (job.getStats() != null) {
                sb.append("   - Runs: ").append(job.getStats().getExecutionCount()).append('\n');
            }
            sb.append('\n');
        }
        JobStoreDocument.Metadata metadata = jobService.metadata();
        if (metadata != null && metadata.getStats() != null) {
            sb.append("📊 Totals:\n");
            sb.append("- Total executions: ").append(metadata.getStats().getTotalExecutions()).append('\n');
            if (metadata.getStats().getLastExecution() != null) {
                sb.append("- Last execution: ").append(format(metadata.getStats().getLastExecution())).append('\n');
            }
        }
        return CommandResult.text(sb.toString().stripTrailing());
    }

    private CommandResult info(String rest) {
        String name = firstToken(rest);
        if (name == null) {
            return CommandResult.error("❌ Please give the name of the job to show.");
        }
        ScheduledJob job = jobService.get(name);

        StringBuilder sb = new StringBuilder();
        sb.append("📋 Job \"").append(job.getName()).append("\":\n\n");
        sb.append("- Status: ").append(status(job)).append('\n');
        sb.append("- Schedule: ").append(job.scheduleDisplay()).append('\n');
        sb.append("- Thread: ").append(job.getThreadId()).append('\n');
        sb.append("- Type: ").append(job.isGroup() ? "Group" : "User").append('\n');
        appendIfPresent(sb, "Text", truncate(job.getText()));
        appendIfPresent(sb, "Template", truncate(job.getTemplate()));
        appendIfPresent(sb, "Image", job.getImagePath());
        appendIfPresent(sb, "Video", job.getVideoPath());
        appendIfPresent(sb, "Audio", job.getAudioPath());
        if (!job.attachmentsOrEmpty().isEmpty()) {
            sb.append("- Attachments: ").append(job.attachmentsOrEmpty().size()).append(" file(s)\n");
        }
        appendIfPresent(sb, "Custom function", job.getCustomFunction());
        if (job.getUrgency() != null && job.getUrgency() > 0) {
            sb.append("- Urgency: ").append(job.getUrgency()).append('\n');
        }
        if (job.isUseRichText()) {
            sb.append("- Rich text: yes\n");
        }

        if (job.hasApi()) {
            ApiCallSpec api = job.getApi();
            sb.append("\n🌐 API:\n");
            sb.append("- URL: ").append(api.getUrl()).append('\n');
            sb.append("- Method: ").append(api.getMethod() != null ? api.getMethod() : "GET").append('\n');
            appendIfPresent(sb, "Response path", api.getResponsePath());
            appendIfPresent(sb, "Media path", api.getMediaPath());
            if (api.isRequired()) {
                sb.append("- Required: yes\n");
            }
            if (api.getCacheTtl() != null) {
                sb.append("- Cache TTL: ").append(api.getCacheTtl() / 1000).append(" s\n");
            }
        }

        if (job.isOneTime()) {
            sb.append("\n- One-time: yes\n");
        }
        if (job.isUseDynamicContent()) {
            sb.append("- Dynamic content: yes\n");
        }
        if (!job.isEnabled() && job.getDisabledReason() != null) {
            sb.append("- Disabled because: ").append(job.getDisabledReason()).append('\n');
        }

        JobStats stats = job.getStats();
        if (stats != null) {
            sb.append("\n📊 Stats:\n");
            sb.append("- Runs: ").append(stats.getExecutionCount()).append('\n');
            if (stats.getLastExecuted() != null) {
                sb.append("- Last run: ").append(format(stats.getLastExecuted())).append(" (")
                        .append(RelativeTime.describe(stats.getLastExecuted(), clock.instant())).append(")\n");
            }
            if (stats.getCreatedAt() != null) {
                sb.append("- Created: ").append(format(stats.getCreatedAt())).append('\n');
            }
        }

        if (job.isEnabled()) {
            Optional<ZonedDateTime> next = jobService.nextFireTime(job.getName());
            sb.append("\n⏰ Next run: ").append(formatNext(next));
            next.ifPresent(n -> sb.append(" (").append(RelativeTime.describe(n.toInstant(), clock.instant()))
                    .append(')'));
            sb.append('\n');
        }
        return CommandResult.text(sb.toString().stripTrailing());
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    private CommandResult add(String rest, CommandContext ctx) {
        CommandTokenizer.Split split = CommandTokenizer.split(rest, 2);
        if (split.head().size() < 2 || split.rest().isEmpty()) {
            return CommandResult.error("❌ Missing arguments. Usage: add [name] [schedule] [message]");
        }
        String name = split.head(0);
        JobService.AddResult result = jobService.add(name, split.head(1), split.rest(), ctx.destination());
        return CommandResult.text("✅ Created job \"" + name + "\".\n"
                + "- Schedule: " + result.job().scheduleDisplay() + "\n"
                + "- First run: " + formatNext(result.nextFire()));
    }

    private CommandResult remove(String rest) {
        String name = firstToken(rest);
        if (name == null) {
            return CommandResult.error("❌ Please give the name of the job to remove.");
        }
        jobService.remove(name);
        return CommandResult.text("✅ Removed job \"" + name + "\".");
    }

    private CommandResult enable(String rest) {
        String name = firstToken(rest);
        if (name == null) {
            return CommandResult.error("❌ Please give the name of the job to enable.");
        }
        JobService.ToggleResult result = jobService.enable(name);
        if (!result.changed()) {
            return CommandResult.error("⚠️ Job \"" + name + "\" is already enabled.");
        }
        return CommandResult.text("✅ Enabled job \"" + name + "\".\n"
                + "- Next run: " + formatNext(result.nextFire()));
    }

    private CommandResult disable(String rest) {
        String name = firstToken(rest);
        if (name == null) {
            return CommandResult.error("❌ Please give the name of the job to disable.");
        }
        JobService.ToggleResult result = jobService.disable(name);
        if (!result.changed()) {
            return CommandResult.error("⚠️ Job \"" + name + "\" is already disabled.");
        }
        return CommandResult.text("✅ Disabled job \"" + name + "\".");
    }

    private CommandResult update(String rest) {
        CommandTokenizer.Split split = CommandTokenizer.split(rest, 2);
        if (split.head().size() < 2) {
            return CommandResult.error("❌ Missing arguments. Usage: update [name] [field] [value]");
        }
        String name = split.head(0);
        String field = split.head(1);
        JobService.UpdateResult result;
        try {
            result = jobService.update(name, field, split.rest());
        } catch (MediaUnavailableException e) {
            return CommandResult.error("❌ Could not download " + e.getReference() + ": " + e.getMessage());
        }
        StringBuilder sb = new StringBuilder();
        sb.append("✅ Updated \"").append(result.field().displayName()).append("\" of job \"")
                .append(name).append("\".");
        if (result.job().isEnabled() && result.nextFire().isPresent()) {
            sb.append("\n- Next run: ").append(formatNext(result.nextFire()));
        }
        for (String note : result.notes()) {
            sb.append("\n- ").append(note);
        }
        return CommandResult.text(sb.toString());
    }

    // =========================================================================
    // Execution
    // =========================================================================

    private CommandResult run(String rest) {
        String name = firstToken(rest);
        if (name == null) {
            return CommandResult.error("❌ Please give the name of the job to run.");
        }
        log.info("Manual run of job \"{}\" requested", name);
        ExecutionRecord record = jobService.run(name);
        return switch (record.getOutcome()) {
            case DISPATCHED -> {
                StringBuilder sb = new StringBuilder("✅ Ran job \"" + name + "\" (" + record.getDurationMs() + " ms).");
                if (!record.getSkippedAttachments().isEmpty()) {
                    sb.append("\n⚠️ Skipped attachments: ").append(String.join(", ", record.getSkippedAttachments()));
                }
                if (record.getHandlerError() != null) {
                    sb.append("\n⚠️ Custom function failed: ").append(record.getHandlerError());
                }
                yield CommandResult.text(sb.toString());
            }
            case NO_CONTENT -> CommandResult.text("⚠️ Job \"" + name + "\" ran but had nothing to send.");
            case ABORTED_REMOTE -> CommandResult.error("❌ Job \"" + name
                    + "\" was not sent because its required API call failed: " + record.getError());
            case FAILED -> CommandResult.error("❌ Job \"" + name + "\" failed"
                    + (record.getStage() != null ? " at " + record.getStage().name().toLowerCase(Locale.ROOT) : "")
                    + ": " + record.getError());
        };
    }

    private CommandResult configureApi(String rest) {
        List<String> tokens = CommandTokenizer.tokenize(rest);
        if (tokens.size() < 2) {
            return CommandResult.error("❌ Missing arguments. Usage: configapi [name] [url]");
        }
        String name = tokens.get(0);
        String url = tokens.get(1);
        jobService.configureApi(name, url);
        return CommandResult.text("✅ Configured API for job \"" + name + "\":\n"
                + "- URL: " + url + "\n"
                + "- Method: GET\n\n"
                + "You can refine it with:\n"
                + "- update " + name + " apiMethod POST\n"
                + "- update " + name + " apiHeaders {\"Authorization\": \"Bearer token\"}\n"
                + "- update " + name + " apiData {\"key\": \"value\"}\n"
                + "- update " + name + " apiResponsePath data.results\n"
                + "- update " + name + " template \"Result: {title} - {description}\"\n"
                + "- update " + name + " apiMediaPath data.image_url\n\n"
                + "💡 Try it now with: job testapi " + name);
    }

    private CommandResult testApi(String rest) {
        String name = firstToken(rest);
        if (name == null) {
            return CommandResult.error("❌ Missing arguments. Usage: testapi [name]");
        }
        ScheduledJob job = jobService.get(name);
        if (!job.hasApi()) {
            return CommandResult.error("❌ Job \"" + name + "\" has no API configured.");
        }
        ApiPreview preview;
        try {
            preview = jobService.testApi(name, previewMaxChars);
        } catch (RemoteCallFailedException e) {
            return CommandResult.error("❌ API call failed for \"" + name + "\":\n" + e.getMessage());
        } catch (MediaUnavailableException e) {
            return CommandResult.error("❌ Could not download media " + e.getReference() + ": " + e.getMessage());
        }

        StringBuilder sb = new StringBuilder();
        sb.append("✅ API call succeeded for \"").append(name).append("\":\n\n");
        sb.append("🌐 URL: ").append(preview.url()).append('\n');
        sb.append("📊 Response:\n").append(preview.responsePreview()).append('\n');
        if (preview.composedPreview() != null) {
            sb.append("\n📝 Message preview:\n\n").append(preview.composedPreview()).append('\n');
        }
        if (job.getApi().getMediaPath() != null) {
            if (preview.mediaUrl() != null) {
                sb.append("\n🖼️ Media: ").append(preview.mediaUrl());
                if (preview.mediaFile() != null) {
                    sb.append(" -> ").append(preview.mediaFile());
                }
                sb.append('\n');
            } else {
                sb.append("\n⚠️ No valid media URL at path: ").append(job.getApi().getMediaPath()).append('\n');
            }
        }
        return CommandResult.text(sb.toString().stripTrailing());
    }

    // =========================================================================
    // Help
    // =========================================================================

    private CommandResult help() {
        return CommandResult.text("""
                📋 Job management:
                - list: list jobs
                - add [name] [schedule] [message]: add a job
                - remove [name]: remove a job
                - enable [name]: enable a job
                - disable [name]: disable a job
                - update [name] [field] [value]: change one field
                - info [name]: show job details
                - run [name]: run a job now

                🌐 API integration:
                - configapi [name] [url]: attach an API to a job
                - testapi [name]: call the job's API without sending anything
                - update [name] apiMethod [GET/POST/...]
                - update [name] apiHeaders {"key":"value"}
                - update [name] apiData {"key":"value"}
                - update [name] apiParams {"key":"value"}
                - update [name] apiResponsePath data.results
                - update [name] apiMediaPath data.image_url
                - update [name] apiCacheTTL [seconds]
                - update [name] template "Result: {title}"

                📝 Schedule examples:
                - "every day at 08:00"
                - "every monday at 09:15"
                - "every 15th of the month at 10:00"
                - "every 30 minutes"
                - "mỗi thứ 2 lúc 09:15"
                - "0 0 8 * * *" (cron: second minute hour day month weekday)

                🔗 Media from URLs:
                - update [name] imagePath https://example.com/image.jpg
                - update [name] videoPath https://example.com/video.mp4
                - update [name] attachments https://example.com/file.pdf

                📊 Weather example:
                - job add Weather "every day at 07:00" Today's weather
                - job configapi Weather https://api.openweathermap.org/data/2.5/weather?q=Hanoi&appid=YOUR_API_KEY&units=metric
                - job update Weather template "🌤️ {name}: {main.temp}°C, {weather[0].description}"
                - job testapi Weather""");
    }

    // =========================================================================
    // Formatting
    // =========================================================================

    private static String status(ScheduledJob job) {
        return job.isEnabled() ? "✅ Active" : "❌ Disabled";
    }

    private String format(Instant instant) {
        return DATE_TIME.format(instant.atZone(zone));
    }

    private String formatNext(Optional<ZonedDateTime> next) {
        return next.map(n -> DATE_TIME.format(n.withZoneSameInstant(zone))).orElse("N/A");
    }

    private static String truncate(String text) {
        if (text == null) {
            return null;
        }
        return text.length() > INFO_TEXT_MAX ? text.substring(0, INFO_TEXT_MAX) + "..." : text;
    }

    private static void appendIfPresent(StringBuilder sb, String label, String value) {
        if (value != null && !value.isEmpty()) {
            sb.append("- ").append(label).append(": ").append(value).append('\n');
        }
    }

    private static String firstToken(String rest) {
        List<String> tokens = CommandTokenizer.tokenize(rest);
        return tokens.isEmpty() ? null : tokens.get(0);
    }
}
