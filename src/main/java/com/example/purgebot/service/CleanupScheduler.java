package com.example.purgebot.service;

import com.example.purgebot.exception.OperationInProgressException;
import com.example.purgebot.model.CleanupOptions;
import com.example.purgebot.model.PurgeConfig;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;

/**
 * 按配置中的 cron 表达式与时区触发清理。配置变化后立即重建任务，无需重启。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CleanupScheduler {

    private final TaskScheduler taskScheduler;
    private final CleanupOrchestrator orchestrator;
    private final ConfigHolder configHolder;
    private final Clock clock;

    private ScheduledFuture<?> job;
    private ScheduleKey activeKey;
    private CronExpression activeExpression;
    private ZoneId activeZone;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        applySchedule(configHolder.get());
    }

    @EventListener
    public void onConfigReloaded(ConfigReloadedEvent event) {
        applySchedule(event.getCurrent());
    }

    /**
     * 重建定时任务。表达式或时区非法时旧任务保持停止，不回退到默认表达式。
     *
     * @throws IllegalArgumentException 表达式或时区非法
     */
    public synchronized void reconfigure(PurgeConfig config) {
        ScheduleKey key = new ScheduleKey(config.getSchedule(), config.getTimezone(), config.scheduleActive());
        if (key.equals(activeKey)) {
            return;
        }

        cancelJob();
        activeKey = null;

        if (!key.enabled()) {
            activeKey = key;
            log.info("Schedule disabled, cleanup runs manually only");
            return;
        }

        String expression = toSpringCron(key.expression());
        ZoneId zone = parseZone(key.timezone());
        CronTrigger trigger;
        try {
            trigger = new CronTrigger(expression, zone);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron schedule: \"" + key.expression() + "\"", e);
        }

        job = taskScheduler.schedule(this::tick, trigger);
        activeExpression = CronExpression.parse(expression);
        activeZone = zone;
        activeKey = key;
        log.info("Cron scheduled: \"{}\" ({})", key.expression(), key.timezone());
    }

    /**
     * 下一次计划执行时间，没有活动任务时为 null。
     */
    public synchronized Instant nextRun() {
        if (activeExpression == null) {
            return null;
        }
        ZonedDateTime next = activeExpression.next(ZonedDateTime.now(clock.withZone(activeZone)));
        return next == null ? null : next.toInstant();
    }

    public synchronized boolean isScheduled() {
        return activeExpression != null;
    }

    @PreDestroy
    public synchronized void shutdown() {
        cancelJob();
    }

    void tick() {
        log.info("Cron triggered cleanup");
        try {
            orchestrator.runCleanup(CleanupOptions.scheduled());
        } catch (OperationInProgressException e) {
            log.warn("Scheduled cleanup skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scheduled cleanup failed: {}", e.getMessage(), e);
        }
    }

    /**
     * 配置文件使用 5 段（分钟精度）表达式，Spring 需要带秒的 6 段表达式。
     */
    static String toSpringCron(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron schedule is empty");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length == 5) {
            return "0 " + String.join(" ", fields);
        }
        if (fields.length == 6) {
            return String.join(" ", fields);
        }
        throw new IllegalArgumentException("Invalid cron schedule: \"" + expression + "\" (expected 5 or 6 fields)");
    }

    private void applySchedule(PurgeConfig config) {
        try {
            reconfigure(config);
        } catch (IllegalArgumentException e) {
            log.error("{}, scheduled cleanup stopped", e.getMessage());
        }
    }

    private static ZoneId parseZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new IllegalArgumentException("Timezone is empty");
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid timezone: \"" + timezone + "\"", e);
        }
    }

    private void cancelJob() {
        if (job != null) {
            job.cancel(false);
            job = null;
        }
        activeExpression = null;
        activeZone = null;
    }

    private record ScheduleKey(String expression, String timezone, boolean enabled) {
    }
}
