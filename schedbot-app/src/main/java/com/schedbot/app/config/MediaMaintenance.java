package com.schedbot.app.config;

import com.schedbot.common.config.ConfigService;
import com.schedbot.media.MediaResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodically deletes downloaded media older than
 * {@code media.downloadMaxAgeMinutes}. Does nothing when that is 0.
 */
@Slf4j
@Component
public class MediaMaintenance {

    private final MediaResolver mediaResolver;
    private final ConfigService configService;

    public MediaMaintenance(MediaResolver mediaResolver, ConfigService configService) {
        this.mediaResolver = mediaResolver;
        this.configService = configService;
    }

    @Scheduled(initialDelayString = "${schedbot.media.prune-initial-delay-ms:60000}",
            fixedDelayString = "${schedbot.media.prune-interval-ms:3600000}")
    public void scheduledPrune() {
        prune();
    }

    /**
     * @return number of files deleted
     */
    public int prune() {
        long maxAgeMinutes = configService.loadConfig().getMedia().getDownloadMaxAgeMinutes();
        if (maxAgeMinutes <= 0) {
            return 0;
        }
        int removed = mediaResolver.pruneOlderThan(Duration.ofMinutes(maxAgeMinutes));
        log.debug("Media prune pass removed {} files", removed);
        return removed;
    }
}
