package com.example.purgebot.service;

import com.example.purgebot.exception.ChannelCleanupException;
import com.example.purgebot.model.ChannelResult;
import com.example.purgebot.model.PurgeConfig;
import com.example.purgebot.model.ResolvedRetention;
import com.example.purgebot.platform.ChannelMessage;
import com.example.purgebot.platform.ChannelMessageStore;
import com.example.purgebot.platform.MessageStoreException;
import com.example.purgebot.platform.PlatformChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 单个频道的清理：分页抓取、按保留期和 14 天界限拆分、批量删除 + 逐条删除。
 * 抓取失败抛出 MessageStoreException；批量阶段失败抛出 ChannelCleanupException 并带上已删除数，由调用方隔离。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChannelCleaner {

    /**
     * 逐条删除之间的固定间隔，约每秒一次。
     */
    static final Duration INDIVIDUAL_DELETE_PAUSE = Duration.ofMillis(1200);

    private static final Duration BULK_WINDOW = Duration.ofDays(ChannelMessageStore.BULK_DELETE_MAX_AGE_DAYS);

    private final ChannelMessageStore store;
    private final Sleeper sleeper;
    private final Clock clock;

    public ChannelResult clean(String categoryName, PlatformChannel channel, ResolvedRetention retention,
                               PurgeConfig.DiscordSettings discord, boolean deleteOld, boolean dryRun)
            throws InterruptedException {
        String label = categoryName + "/#" + channel.name();
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofDays(retention.days()));
        Instant bulkLimit = now.minus(BULK_WINDOW);
        boolean skipPinned = !Boolean.FALSE.equals(discord.getSkipPinned());
        int maxMessages = discord.getMaxMessagesPerChannel();
        int maxOld = discord.getMaxOldDeletesPerChannel();

        List<ChannelMessage> bulkDeletable = new ArrayList<>();
        List<ChannelMessage> oldDeletable = new ArrayList<>();
        String before = null;
        int fetched = 0;
        while (fetched < maxMessages) {
            int pageSize = Math.min(ChannelMessageStore.MAX_BATCH_SIZE, maxMessages - fetched);
            List<ChannelMessage> page = store.fetchMessagesBefore(channel, before, pageSize);
            if (page.isEmpty()) {
                break;
            }
            for (ChannelMessage message : page) {
                if (message.pinned() && skipPinned) {
                    continue;
                }
                if (!message.createdAt().isBefore(cutoff)) {
                    continue;
                }
                if (message.createdAt().isAfter(bulkLimit)) {
                    bulkDeletable.add(message);
                } else if (deleteOld) {
                    oldDeletable.add(message);
                }
            }
            before = page.get(page.size() - 1).id();
            fetched += page.size();
        }

        int cappedOld = Math.min(oldDeletable.size(), maxOld);
        int remaining = oldDeletable.size() - cappedOld;

        if (bulkDeletable.isEmpty() && oldDeletable.isEmpty()) {
            log.info("  {}: 0 messages to delete ({} scanned, retention={}d)", label, fetched, retention.days());
            return result(channel, retention, 0, 0, 0);
        }

        if (dryRun) {
            int wouldDelete = bulkDeletable.size() + cappedOld;
            log.info("[DRY RUN] {}: would delete {} messages ({} bulk + {} old, {} old remaining, retention={}d){}",
                    label, wouldDelete, bulkDeletable.size(), cappedOld, remaining, retention.days(),
                    deleteOld ? "" : " (bulk only)");
            return result(channel, retention, wouldDelete, remaining, 0);
        }

        int deleted = 0;
        int agedOut = 0;
        try {
            for (int i = 0; i < bulkDeletable.size(); i += ChannelMessageStore.MAX_BATCH_SIZE) {
                List<ChannelMessage> chunk = bulkDeletable.subList(i,
                        Math.min(i + ChannelMessageStore.MAX_BATCH_SIZE, bulkDeletable.size()));
                if (chunk.size() == 1) {
                    store.deleteMessage(channel, chunk.get(0).id());
                    deleted++;
                    continue;
                }
                // 抓取之后才越过 14 天界限的消息不能再批量删除，留给下一次运行
                Instant chunkLimit = clock.instant().minus(BULK_WINDOW);
                List<String> ids = new ArrayList<>();
                for (ChannelMessage message : chunk) {
                    if (message.createdAt().isAfter(chunkLimit)) {
                        ids.add(message.id());
                    }
                }
                agedOut += chunk.size() - ids.size();
                if (ids.size() == 1) {
                    store.deleteMessage(channel, ids.get(0));
                    deleted++;
                } else if (!ids.isEmpty()) {
                    deleted += store.deleteBatch(channel, ids);
                }
            }
        } catch (MessageStoreException e) {
            if (deleted > 0) {
                log.warn("{}: bulk delete failed after {} messages", label, deleted);
            }
            throw new ChannelCleanupException(e.getMessage(), deleted, e);
        }
        if (agedOut > 0) {
            log.info("  {}: {} messages crossed the 14-day bulk limit during the run, left for next run",
                    label, agedOut);
        }

        int failedDeletes = 0;
        for (ChannelMessage message : oldDeletable.subList(0, cappedOld)) {
            try {
                store.deleteMessage(channel, message.id());
                deleted++;
            } catch (MessageStoreException e) {
                failedDeletes++;
                log.warn("{}: failed to delete message {}: {}", label, message.id(), e.getMessage());
            }
            sleeper.sleep(INDIVIDUAL_DELETE_PAUSE);
        }
        if (remaining > 0) {
            log.warn("{}: {} old messages remain (capped at {}/run)", label, remaining, maxOld);
        }

        log.info("{}: deleted {} messages (retention={}d)", label, deleted, retention.days());
        return result(channel, retention, deleted, remaining + agedOut, failedDeletes);
    }

    private static ChannelResult result(PlatformChannel channel, ResolvedRetention retention, int purged,
                                        int remaining, int failedDeletes) {
        return ChannelResult.builder()
                .name(channel.name())
                .retention(retention.days())
                .retentionSource(retention.source())
                .purged(purged)
                .remaining(remaining)
                .failedDeletes(failedDeletes)
                .build();
    }
}
