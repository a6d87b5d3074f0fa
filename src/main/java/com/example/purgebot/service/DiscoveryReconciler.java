package com.example.purgebot.service;

import com.example.purgebot.model.CategoryConfig;
import com.example.purgebot.model.ChannelEntry;
import com.example.purgebot.model.DiscoveredItem;
import com.example.purgebot.model.PurgeConfig;
import com.example.purgebot.model.ResolvedRetention;
import com.example.purgebot.model.RetentionValue;
import com.example.purgebot.model.SyncChange;
import com.example.purgebot.model.SyncReport;
import com.example.purgebot.platform.ChannelMessageStore;
import com.example.purgebot.platform.PlatformSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 平台上的分类/频道与配置之间的对账。
 * 增量模式只新增（每次清理前自动执行）；full sync 会新增、删除并迁移旧版 overrides。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiscoveryReconciler {

    public static final String OPERATION = "sync";

    private final ConfigHolder configHolder;
    private final ChannelMessageStore store;
    private final RetentionResolver retentionResolver;
    private final OperationGuard operationGuard;
    private final CleanupListeners listeners;

    /**
     * 进程启动后的第一次发现不发通知，避免启动时刷屏。
     */
    private final AtomicBoolean firstPassComplete = new AtomicBoolean(false);

    /**
     * 增量发现：新分类以禁用状态加入，已知分类的新频道追加到 _channels 并排序。从不删除。
     *
     * @return 本次新增的分类与频道
     */
    public List<DiscoveredItem> discoverIncremental(PurgeConfig config, PlatformSnapshot snapshot) {
        boolean firstPass = !firstPassComplete.get();
        List<DiscoveredItem> discoveries = new ArrayList<>();

        for (String categoryName : snapshot.channelsByCategory().keySet()) {
            List<String> channelNames = distinct(snapshot.sortedChannelNames(categoryName));
            CategoryConfig category = config.category(categoryName);

            if (category == null) {
                config.getCategories().put(categoryName,
                        CategoryConfig.discovered(config.globalDefaultDays(), channelNames));
                log.info("Auto-discovered category \"{}\" (DISABLED) with {} channels", categoryName,
                        channelNames.size());
                discoveries.add(DiscoveredItem.category(categoryName, channelNames));
                continue;
            }

            Set<String> existing = category.channelNames();
            for (String channelName : channelNames) {
                if (existing.contains(channelName)) {
                    continue;
                }
                category.getChannels().add(ChannelEntry.plain(channelName));
                category.getChannels().sort(Comparator.comparing(ChannelEntry::name));
                existing.add(channelName);

                ResolvedRetention retention = retentionResolver.resolve(config, categoryName, channelName);
                log.info("Auto-discovered #{} in \"{}\" ({}, {} default)", channelName, categoryName,
                        RetentionValue.describe(retention.days()), retention.source().label());
                discoveries.add(DiscoveredItem.channel(channelName, categoryName, retention.days(),
                        retention.source(), category.isCleanupEnabled()));
            }
        }

        if (!discoveries.isEmpty()) {
            try {
                configHolder.save(config);
                log.info("Auto-discovery: {} new channels/categories added to config", discoveries.size());
            } catch (UncheckedIOException e) {
                log.error("Auto-discovery could not write config: {}", e.getMessage());
            }
        }

        firstPassComplete.set(true);
        if (!firstPass && !discoveries.isEmpty()) {
            listeners.discovered(discoveries, config);
        }
        return discoveries;
    }

    /**
     * 完整同步。与清理共用单飞标记，配置仅在有变更时写盘。
     *
     * @throws com.example.purgebot.exception.OperationInProgressException 已有清理或同步在执行
     * @throws com.example.purgebot.platform.GuildUnavailableException 服务器不可达
     */
    public SyncReport syncConfig() {
        operationGuard.acquire(OPERATION);
        try {
            return executeSync();
        } finally {
            operationGuard.release(OPERATION);
        }
    }

    @SuppressWarnings("deprecation")
    private SyncReport executeSync() {
        log.info("Syncing config with Discord channels...");
        configHolder.reload();
        PurgeConfig config = configHolder.get();
        PlatformSnapshot snapshot = PlatformSnapshot.capture(store);

        int changes = 0;
        List<SyncChange> details = new ArrayList<>();

        for (String categoryName : snapshot.channelsByCategory().keySet()) {
            List<String> channelNames = distinct(snapshot.sortedChannelNames(categoryName));
            CategoryConfig category = config.category(categoryName);

            if (category == null) {
                config.getCategories().put(categoryName,
                        CategoryConfig.discovered(config.globalDefaultDays(), channelNames));
                changes++;
                details.add(new SyncChange(SyncChange.Type.ADDED, SyncChange.Scope.CATEGORY, categoryName,
                        channelNames));
                log.info("+ Category \"{}\" (DISABLED, default: {}d) with {} channels: {}", categoryName,
                        config.globalDefaultDays(), channelNames.size(), String.join(", ", channelNames));
                continue;
            }

            Map<String, RetentionValue> overrides = new LinkedHashMap<>();
            for (ChannelEntry entry : category.getChannels()) {
                if (entry instanceof ChannelEntry.WithRetention withRetention && withRetention.days() != null) {
                    overrides.put(withRetention.name(), withRetention.days());
                }
            }

            if (category.getOverrides() != null) {
                category.getOverrides().forEach((channelName, value) -> {
                    if (!channelName.startsWith("_") && value != null) {
                        overrides.put(channelName, value);
                    }
                });
                category.setOverrides(null);
                changes++;
                details.add(new SyncChange(SyncChange.Type.MIGRATED, SyncChange.Scope.OVERRIDES, categoryName,
                        List.of()));
                log.info("  {}: migrated overrides to inline format", categoryName);
            }

            Set<String> onPlatform = new LinkedHashSet<>(channelNames);
            Set<String> existing = category.channelNames();
            List<ChannelEntry> rebuilt = new ArrayList<>();
            for (String channelName : channelNames) {
                RetentionValue override = overrides.get(channelName);
                rebuilt.add(override != null
                        ? ChannelEntry.withRetention(channelName, override)
                        : ChannelEntry.plain(channelName));
            }

            List<String> added = new ArrayList<>();
            for (String channelName : channelNames) {
                if (!existing.contains(channelName)) {
                    added.add(channelName);
                }
            }
            if (!added.isEmpty()) {
                details.add(new SyncChange(SyncChange.Type.ADDED, SyncChange.Scope.CHANNEL, categoryName, added));
            }

            List<String> removed = new ArrayList<>();
            for (String channelName : existing) {
                if (!onPlatform.contains(channelName)) {
                    removed.add(channelName);
                }
            }
            for (String channelName : overrides.keySet()) {
                if (!onPlatform.contains(channelName)) {
                    log.warn("  {}/#{}: override removed (channel no longer on Discord)", categoryName, channelName);
                    changes++;
                }
            }
            if (!removed.isEmpty()) {
                details.add(new SyncChange(SyncChange.Type.REMOVED, SyncChange.Scope.CHANNEL, categoryName,
                        removed));
            }

            if (!rebuilt.equals(category.getChannels())) {
                category.setChannels(rebuilt);
                changes++;
            }

            log.info("  Category \"{}\" ({}, default: {}) with {} channels", categoryName,
                    category.isCleanupEnabled() ? "enabled" : "DISABLED",
                    category.getDefaultRetention() != null ? category.getDefaultRetention() + "d"
                            : config.globalDefaultDays() + "d",
                    channelNames.size());
        }

        for (String categoryName : new ArrayList<>(config.getCategories().keySet())) {
            if (snapshot.hasCategory(categoryName)) {
                continue;
            }
            CategoryConfig removed = config.getCategories().remove(categoryName);
            List<String> removedChannels = removed == null ? List.of() : new ArrayList<>(removed.channelNames());
            details.add(new SyncChange(SyncChange.Type.REMOVED, SyncChange.Scope.CATEGORY, categoryName,
                    removedChannels));
            changes++;
            log.warn("Category \"{}\": not found on Discord, removed from config", categoryName);
        }

        if (changes > 0) {
            configHolder.save(config);
            log.info("Config updated: {} changes written", changes);
        } else {
            log.info("No changes, config is up to date");
        }
        log.info("Sync complete: {} categories, {} channels on Discord", snapshot.categoryCount(),
                snapshot.channelCount());

        return new SyncReport(snapshot.categoryCount(), snapshot.channelCount(), changes, details);
    }

    private static List<String> distinct(List<String> names) {
        return new ArrayList<>(new LinkedHashSet<>(names));
    }
}
