package com.example.purgebot.service;

import com.example.purgebot.model.CategoryConfig;
import com.example.purgebot.model.PurgeConfig;
import com.example.purgebot.model.RunStatus;
import com.example.purgebot.platform.ChannelMessageStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 汇总连接状态、调度与配置概况。
 */
@Service
public class StatusService {

    private final ChannelMessageStore store;
    private final ConfigHolder configHolder;
    private final OperationGuard operationGuard;
    private final CleanupScheduler scheduler;
    private final Clock clock;
    private final Instant startedAt;

    public StatusService(ChannelMessageStore store, ConfigHolder configHolder, OperationGuard operationGuard,
                         CleanupScheduler scheduler, Clock clock) {
        this.store = store;
        this.configHolder = configHolder;
        this.operationGuard = operationGuard;
        this.scheduler = scheduler;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public RunStatus currentStatus() {
        PurgeConfig config = configHolder.get();
        int enabled = 0;
        int channels = 0;
        for (CategoryConfig category : config.getCategories().values()) {
            if (category.isCleanupEnabled()) {
                enabled++;
            }
            channels += category.channelNames().size();
        }
        String activeOperation = operationGuard.activeOperation();
        return new RunStatus(
                store.isConnected(),
                store.guildName(),
                CleanupOrchestrator.OPERATION.equals(activeOperation),
                activeOperation,
                config.dryRunEnabled(),
                config.getSchedule(),
                config.getTimezone(),
                config.scheduleActive(),
                scheduler.nextRun(),
                config.getCategories().size(),
                enabled,
                channels,
                config.globalDefaultDays(),
                Duration.between(startedAt, clock.instant()).toMillis());
    }
}
