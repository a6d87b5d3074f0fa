package com.example.purgebot.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * stats.json 文档：最近一次运行、滚动历史、累计计数与两个排行榜。
 */
@Data
@NoArgsConstructor
public class StatsSnapshot {

    private CleanupRun lastRun;
    private CleanupRun lastLiveRun;
    private List<HistoryEntry> history = new ArrayList<>();
    private LifetimeTotals lifetime;
    private Map<String, Long> channelTotals = new LinkedHashMap<>();
    private Map<String, Long> categoryTotals = new LinkedHashMap<>();

    public void setHistory(List<HistoryEntry> history) {
        this.history = history == null ? new ArrayList<>() : new ArrayList<>(history);
    }

    public void setChannelTotals(Map<String, Long> channelTotals) {
        this.channelTotals = channelTotals == null ? new LinkedHashMap<>() : new LinkedHashMap<>(channelTotals);
    }

    public void setCategoryTotals(Map<String, Long> categoryTotals) {
        this.categoryTotals = categoryTotals == null ? new LinkedHashMap<>() : new LinkedHashMap<>(categoryTotals);
    }

    public record HistoryEntry(
            Instant timestamp,
            int purged,
            int errors,
            boolean dryRun,
            long duration,
            RunTrigger trigger,
            boolean cancelled,
            Map<String, CategorySummary> categories) {

        public HistoryEntry {
            categories = categories == null ? Map.of() : new LinkedHashMap<>(categories);
        }

        public static HistoryEntry of(CleanupRun run) {
            Map<String, CategorySummary> summary = new LinkedHashMap<>();
            run.categories().forEach((name, category) ->
                    summary.put(name, new CategorySummary(category.purged(), category.errors())));
            RunTrigger trigger = run.trigger() == null ? RunTrigger.SCHEDULE : run.trigger();
            return new HistoryEntry(run.timestamp(), run.totalPurged(), run.totalErrors(), run.dryRun(),
                    run.duration(), trigger, run.cancelled(), summary);
        }
    }

    public record CategorySummary(int purged, int errors) {
    }

    @Data
    @NoArgsConstructor
    public static class LifetimeTotals {
        private long totalRuns;
        private long totalPurged;
        private long totalErrors;
        private Instant firstRun;

        public LifetimeTotals(Instant firstRun) {
            this.firstRun = firstRun;
        }
    }
}
