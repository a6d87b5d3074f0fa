package com.example.purgebot.service;

import com.example.purgebot.exception.ChannelCleanupException;
import com.example.purgebot.model.CategoryConfig;
import com.example.purgebot.model.CategoryResult;
import com.example.purgebot.model.ChannelResult;
import com.example.purgebot.model.CleanupOptions;
import com.example.purgebot.model.CleanupRun;
import com.example.purgebot.model.PurgeConfig;
import com.example.purgebot.model.ResolvedRetention;
import com.example.purgebot.platform.ChannelMessageStore;
import com.example.purgebot.platform.MessageStoreException;
import com.example.purgebot.platform.PlatformChannel;
import com.example.purgebot.platform.PlatformSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 驱动一次完整的清理运行：重新加载配置、增量发现、逐分类逐频道清理、记录统计并通知监听器。
 * 与 full sync 共用 OperationGuard，同一时刻只允许一个操作。
 */
@Service
@Slf4j
public class CleanupOrchestrator {

    public static final String OPERATION = "cleanup";

    private final ConfigHolder configHolder;
    private final ChannelMessageStore store;
    private final DiscoveryReconciler discoveryReconciler;
    private final RetentionResolver retentionResolver;
    private final ChannelCleaner channelCleaner;
    private final StatsAggregator statsAggregator;
    private final OperationGuard operationGuard;
    private final CleanupListeners listeners;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Executor taskExecutor;

    private final AtomicReference<CancellationToken> activeToken = new AtomicReference<>();

    public CleanupOrchestrator(ConfigHolder configHolder,
                               ChannelMessageStore store,
                               DiscoveryReconciler discoveryReconciler,
                               RetentionResolver retentionResolver,
                               ChannelCleaner channelCleaner,
                               StatsAggregator statsAggregator,
                               OperationGuard operationGuard,
                               CleanupListeners listeners,
                               Sleeper sleeper,
                               Clock clock,
                               @Qualifier("taskExecutor") Executor taskExecutor) {
        this.configHolder = configHolder;
        this.store = store;
        this.discoveryReconciler = discoveryReconciler;
        this.retentionResolver = retentionResolver;
        this.channelCleaner = channelCleaner;
        this.statsAggregator = statsAggregator;
        this.operationGuard = operationGuard;
        this.listeners = listeners;
        this.sleeper = sleeper;
        this.clock = clock;
        this.taskExecutor = taskExecutor;
    }

    public CleanupRun runCleanup(CleanupOptions options) {
        return runCleanup(options, CancellationToken.create());
    }

    /**
     * 在调用线程上同步执行一次清理。
     *
     * @throws com.example.purgebot.exception.OperationInProgressException 已有清理或同步在执行
     */
    public CleanupRun runCleanup(CleanupOptions options, CancellationToken token) {
        operationGuard.acquire(OPERATION);
        try {
            return execute(options, token);
        } finally {
            operationGuard.release(OPERATION);
        }
    }

    /**
     * 在调用线程上获取单飞标记后交给 taskExecutor 异步执行，冲突时立即抛出。
     */
    public void startCleanup(CleanupOptions options) {
        operationGuard.acquire(OPERATION);
        CancellationToken token = CancellationToken.create();
        activeToken.set(token);
        try {
            taskExecutor.execute(() -> {
                try {
                    execute(options, token);
                } catch (RuntimeException e) {
                    log.error("Cleanup failed: {}", e.getMessage(), e);
                } finally {
                    operationGuard.release(OPERATION);
                }
            });
        } catch (RejectedExecutionException e) {
            activeToken.compareAndSet(token, null);
            operationGuard.release(OPERATION);
            throw e;
        }
    }

    /**
     * 请求取消正在执行的清理，在下一个分类或频道边界生效。
     *
     * @return 没有正在执行的清理时返回 false
     */
    public boolean cancel() {
        CancellationToken token = activeToken.get();
        if (token == null) {
            return false;
        }
        if (token.cancel()) {
            log.info("Cleanup cancellation requested");
        }
        return true;
    }

    public boolean isRunning() {
        return OPERATION.equals(operationGuard.activeOperation());
    }

    private CleanupRun execute(CleanupOptions options, CancellationToken token) {
        activeToken.set(token);
        Instant started = clock.instant();
        try {
            configHolder.reload();
            PurgeConfig config = configHolder.get();
            boolean dryRun = options.effectiveDryRun(config.dryRunEnabled());
            log.info("Starting cleanup run (dryRun={}, trigger={}, scope={})", dryRun,
                    options.getTrigger().label(), options.scopeLabel());

            PlatformSnapshot snapshot;
            try {
                snapshot = PlatformSnapshot.capture(store);
            } catch (MessageStoreException e) {
                log.error("Cleanup aborted: {}", e.getMessage());
                CleanupRun failed = CleanupRun.failed(started, options.getTrigger(), dryRun, e.getMessage(),
                        elapsedMillis(started));
                complete(failed, config);
                return failed;
            }

            discoveryReconciler.discoverIncremental(config, snapshot);

            CleanupRun run = processCategories(config, snapshot, options, dryRun, token, started);
            String action = dryRun ? "would delete" : "deleted";
            log.info("Cleanup {}: {} channels processed, {} messages {}, {} skipped, {} errors",
                    run.cancelled() ? "cancelled" : "complete", run.totalProcessed(), run.totalPurged(), action,
                    run.totalSkipped(), run.totalErrors());
            complete(run, config);
            return run;
        } finally {
            activeToken.compareAndSet(token, null);
        }
    }

    private CleanupRun processCategories(PurgeConfig config, PlatformSnapshot snapshot, CleanupOptions options,
                                         boolean dryRun, CancellationToken token, Instant started) {
        PurgeConfig.DiscordSettings discord = config.discordSettings();
        Duration channelDelay = Duration.ofMillis(discord.getDelayBetweenChannels());
        Map<String, CategoryResult> categories = new LinkedHashMap<>();
        int totalProcessed = 0;
        int totalPurged = 0;
        int totalSkipped = 0;
        int totalErrors = 0;
        boolean interrupted = false;

        categoryLoop:
        for (Map.Entry<String, List<PlatformChannel>> entry : snapshot.channelsByCategory().entrySet()) {
            if (token.isCancelled()) {
                log.info("Cleanup cancelled by user");
                break;
            }
            String categoryName = entry.getKey();
            List<PlatformChannel> channels = entry.getValue();
            CategoryConfig category = config.category(categoryName);
            if (category == null || !category.isCleanupEnabled()) {
                totalSkipped += channels.size();
                continue;
            }
            if (!options.matchesCategory(categoryName)) {
                continue;
            }

            Set<String> allowed = category.channelNames();
            long allowedCount = channels.stream().filter(c -> allowed.contains(c.name())).count();
            List<ChannelResult> results = new ArrayList<>();
            int channelIndex = 0;
            log.info("Processing category \"{}\" ({} channels)", categoryName, allowedCount);

            for (PlatformChannel channel : channels) {
                if (token.isCancelled()) {
                    break;
                }
                if (!allowed.contains(channel.name())) {
                    totalSkipped++;
                    continue;
                }
                if (!options.matchesChannel(channel.name())) {
                    continue;
                }

                channelIndex++;
                totalProcessed++;
                log.info("  Scanning {}/#{} ({}/{})", categoryName, channel.name(), channelIndex, allowedCount);

                ResolvedRetention retention = retentionResolver.resolve(config, categoryName, channel.name());
                if (retention.neverDelete()) {
                    results.add(ChannelResult.skipped(channel.name(), retention));
                    continue;
                }

                try {
                    ChannelResult result = channelCleaner.clean(categoryName, channel, retention, discord,
                            category.isDeleteOldEnabled(), dryRun);
                    results.add(result);
                    totalPurged += result.purged();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                } catch (ChannelCleanupException e) {
                    log.error("{}/#{}: {} ({} deleted before failure)", categoryName, channel.name(),
                            e.getMessage(), e.getPurged());
                    results.add(ChannelResult.failed(channel.name(), retention, e.getMessage(), e.getPurged()));
                    totalPurged += e.getPurged();
                    totalErrors++;
                } catch (RuntimeException e) {
                    log.error("{}/#{}: {}", categoryName, channel.name(), e.getMessage());
                    results.add(ChannelResult.failed(channel.name(), retention, e.getMessage()));
                    totalErrors++;
                }

                if (!interrupted) {
                    try {
                        sleeper.sleep(channelDelay);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        interrupted = true;
                    }
                }
                if (interrupted) {
                    log.warn("Cleanup interrupted in {}/#{}", categoryName, channel.name());
                    categories.put(categoryName, CategoryResult.of(results));
                    break categoryLoop;
                }
            }

            categories.put(categoryName, CategoryResult.of(results));
        }

        boolean cancelled = token.isCancelled() || interrupted;
        return new CleanupRun(started, options.getTrigger(), dryRun, cancelled, null, totalProcessed, totalPurged,
                totalSkipped, totalErrors, elapsedMillis(started), categories);
    }

    private void complete(CleanupRun run, PurgeConfig config) {
        statsAggregator.record(run);
        listeners.runCompleted(run, config);
    }

    private long elapsedMillis(Instant started) {
        return Math.max(0, Duration.between(started, clock.instant()).toMillis());
    }
}
