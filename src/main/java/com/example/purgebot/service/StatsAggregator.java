package com.example.purgebot.service;

import com.example.purgebot.model.CategoryResult;
import com.example.purgebot.model.ChannelResult;
import com.example.purgebot.model.CleanupRun;
import com.example.purgebot.model.StatsSnapshot;
import com.example.purgebot.repository.StatsFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 运行统计：滚动历史（最近 90 次）、累计计数和频道/分类排行榜。
 * dry-run 只进入历史，不计入累计与排行榜。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatsAggregator {

    static final int MAX_HISTORY = 90;
    static final int MAX_CHANNEL_TOTALS = 200;
    static final int MAX_CATEGORY_TOTALS = 100;

    private final StatsFileRepository repository;

    /**
     * 写入一次运行结果。失败只记录日志，不影响运行本身。
     */
    public synchronized void record(CleanupRun run) {
        try {
            StatsSnapshot stats = repository.load();
            apply(stats, run);
            repository.save(stats);
        } catch (RuntimeException e) {
            log.warn("Failed to persist stats: {}", e.getMessage());
        }
    }

    public synchronized StatsSnapshot snapshot() {
        return repository.load();
    }

    public List<StatsSnapshot.HistoryEntry> history(int limit) {
        List<StatsSnapshot.HistoryEntry> history = snapshot().getHistory();
        int size = Math.max(0, Math.min(limit, history.size()));
        return new ArrayList<>(history.subList(0, size));
    }

    static void apply(StatsSnapshot stats, CleanupRun run) {
        stats.setLastRun(run);
        if (!run.dryRun()) {
            stats.setLastLiveRun(run);
        }

        List<StatsSnapshot.HistoryEntry> history = new ArrayList<>();
        history.add(StatsSnapshot.HistoryEntry.of(run));
        history.addAll(stats.getHistory());
        if (history.size() > MAX_HISTORY) {
            history = history.subList(0, MAX_HISTORY);
        }
        stats.setHistory(history);

        if (run.dryRun()) {
            return;
        }

        StatsSnapshot.LifetimeTotals lifetime = stats.getLifetime();
        if (lifetime == null) {
            lifetime = new StatsSnapshot.LifetimeTotals(run.timestamp());
            stats.setLifetime(lifetime);
        }
        lifetime.setTotalRuns(lifetime.getTotalRuns() + 1);
        lifetime.setTotalPurged(lifetime.getTotalPurged() + run.totalPurged());
        lifetime.setTotalErrors(lifetime.getTotalErrors() + run.totalErrors());

        Map<String, Long> channelTotals = stats.getChannelTotals();
        Map<String, Long> categoryTotals = stats.getCategoryTotals();
        run.categories().forEach((categoryName, category) -> {
            categoryTotals.merge(categoryName, (long) category.purged(), Long::sum);
            for (ChannelResult channel : channelsOf(category)) {
                if (channel.purged() > 0) {
                    // category/channel 组合键，避免不同分类下同名频道冲突
                    channelTotals.merge(categoryName + "/" + channel.name(), (long) channel.purged(), Long::sum);
                }
            }
        });

        stats.setChannelTotals(prune(channelTotals, MAX_CHANNEL_TOTALS));
        stats.setCategoryTotals(prune(categoryTotals, MAX_CATEGORY_TOTALS));
    }

    /**
     * 超过上限时按累计值降序保留前 cap 个。
     */
    static Map<String, Long> prune(Map<String, Long> totals, int cap) {
        if (totals.size() <= cap) {
            return totals;
        }
        List<Map.Entry<String, Long>> entries = new ArrayList<>(totals.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue().reversed());
        Map<String, Long> pruned = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : entries.subList(0, cap)) {
            pruned.put(entry.getKey(), entry.getValue());
        }
        return pruned;
    }

    private static List<ChannelResult> channelsOf(CategoryResult category) {
        return category.channels() == null ? List.of() : category.channels();
    }
}
