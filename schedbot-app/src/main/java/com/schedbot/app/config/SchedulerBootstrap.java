package com.schedbot.app.config;

import com.schedbot.common.config.ConfigService;
import com.schedbot.scheduler.engine.JobScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Arms the stored jobs once the context is up, before command-line runners
 * execute.
 */
@Slf4j
@Component
public class SchedulerBootstrap {

    private final JobScheduler jobScheduler;
    private final ConfigService configService;

    public SchedulerBootstrap(JobScheduler jobScheduler, ConfigService configService) {
        this.jobScheduler = jobScheduler;
        this.configService = configService;
    }

    @EventListener(ApplicationStartedEvent.class)
    public void onStarted() {
        if (!configService.loadConfig().getScheduler().isEnabled()) {
            log.warn("Scheduler disabled by config (scheduler.enabled=false); jobs will only run on demand");
            return;
        }
        log.info("Starting job scheduler ({})", configService.describe());
        jobScheduler.start();
    }
}
