package com.schedbot.app.config;

import com.schedbot.app.dispatch.LoggingMessageDispatcher;
import com.schedbot.app.dispatch.WebhookMessageDispatcher;
import com.schedbot.app.handlers.NamedJobHandler;
import com.schedbot.common.config.ConfigService;
import com.schedbot.common.config.SchedbotConfig;
import com.schedbot.media.MediaResolver;
import com.schedbot.scheduler.engine.ExecutionEngine;
import com.schedbot.scheduler.engine.JobScheduler;
import com.schedbot.scheduler.engine.JobService;
import com.schedbot.scheduler.fetch.RemoteDataFetcher;
import com.schedbot.scheduler.handler.CustomHandlerRegistry;
import com.schedbot.scheduler.outbound.MessageDispatcher;
import com.schedbot.scheduler.store.JobRepository;
import com.schedbot.scheduler.store.JobStore;
import com.schedbot.scheduler.store.JobStoreDocument;
import com.schedbot.scheduler.store.StoreCorruptException;
import com.schedbot.scheduler.template.ContentComposer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Spring configuration for the scheduling engine.
 */
@Slf4j
@Configuration
public class SchedulerBeanConfig {

    @Value("${schedbot.config.path:~/.schedbot/config.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        return new ConfigService(ConfigService.expandHome(configPath));
    }

    @Bean
    public Clock clock(ConfigService configService) {
        return Clock.system(configService.resolveZone());
    }

    /**
     * Creates the store on first run. A malformed store stops startup: jobs
     * are never dropped silently.
     */
    @Bean
    public JobRepository jobRepository(ConfigService configService) throws IOException {
        Path storePath = configService.resolveStorePath();
        JobRepository repository = new JobRepository(new JobStore(storePath));
        try {
            JobStoreDocument doc = repository.initialize();
            log.info("Job store {} holds {} jobs", storePath, doc.getJobs().size());
        } catch (StoreCorruptException e) {
            log.error("Job store {} is corrupt, refusing to start. Repair or move the file and restart: {}",
                    storePath, e.getMessage());
            throw e;
        }
        return repository;
    }

    @Bean
    public MediaResolver mediaResolver(ConfigService configService) {
        SchedbotConfig.MediaConfig media = configService.loadConfig().getMedia();
        return new MediaResolver(configService.resolveMediaDir(),
                Duration.ofSeconds(media.getDownloadTimeoutSeconds()), media.getMaxBytes());
    }

    @Bean
    public RemoteDataFetcher remoteDataFetcher(ConfigService configService, MediaResolver mediaResolver) {
        SchedbotConfig.FetchConfig fetch = configService.loadConfig().getFetch();
        return new RemoteDataFetcher(fetch.getDefaultCacheTtlMs(), fetch.getTimeoutMs(),
                mediaResolver.getApiResponsesDir());
    }

    @Bean
    public ContentComposer contentComposer(ConfigService configService, Clock clock) {
        Locale locale = configService.resolveLocale();
        return new ContentComposer(clock, configService.resolveZone(), locale);
    }

    @Bean
    public CustomHandlerRegistry customHandlerRegistry(List<NamedJobHandler> namedHandlers) {
        CustomHandlerRegistry registry = new CustomHandlerRegistry();
        for (NamedJobHandler handler : namedHandlers) {
            registry.register(handler.name(), handler);
        }
        log.info("Custom job handlers: {}", registry.names());
        return registry;
    }

    @Bean
    public MessageDispatcher messageDispatcher(ConfigService configService) {
        SchedbotConfig.DispatchConfig dispatch = configService.loadConfig().getDispatch();
        if ("webhook".equalsIgnoreCase(dispatch.getMode())) {
            if (dispatch.getWebhookUrl() == null || dispatch.getWebhookUrl().isBlank()) {
                throw new IllegalStateException("dispatch.mode is webhook but dispatch.webhookUrl is not set");
            }
            log.info("Dispatching messages to webhook {}", dispatch.getWebhookUrl());
            return new WebhookMessageDispatcher(dispatch.getWebhookUrl());
        }
        log.info("Dispatching messages to the log");
        return new LoggingMessageDispatcher();
    }

    @Bean
    public ExecutionEngine executionEngine(JobRepository jobRepository, RemoteDataFetcher remoteDataFetcher,
            ContentComposer contentComposer, MediaResolver mediaResolver, MessageDispatcher messageDispatcher,
            CustomHandlerRegistry customHandlerRegistry, Clock clock) {
        return new ExecutionEngine(jobRepository, remoteDataFetcher, contentComposer, mediaResolver,
                messageDispatcher, customHandlerRegistry, clock);
    }

    @Bean(destroyMethod = "shutdown")
    public JobScheduler jobScheduler(JobRepository jobRepository, ExecutionEngine executionEngine,
            ConfigService configService, Clock clock) {
        return new JobScheduler(jobRepository, executionEngine, clock, configService.resolveZone(),
                configService.loadConfig().getScheduler().getWorkerThreads());
    }

    @Bean
    public JobService jobService(JobRepository jobRepository, JobScheduler jobScheduler,
            ExecutionEngine executionEngine, MediaResolver mediaResolver,
            CustomHandlerRegistry customHandlerRegistry, Clock clock) {
        return new JobService(jobRepository, jobScheduler, executionEngine, mediaResolver,
                customHandlerRegistry, clock);
    }
}
