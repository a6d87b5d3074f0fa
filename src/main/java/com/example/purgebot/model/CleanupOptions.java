package com.example.purgebot.model;

import lombok.Builder;
import lombok.Value;

/**
 * 单次清理的触发参数。forceLive 优先于配置中的 dryRun 与 forceDryRun。
 */
@Value
@Builder(toBuilder = true)
public class CleanupOptions {

    boolean forceDryRun;
    boolean forceLive;
    String categoryFilter;
    String channelFilter;
    @Builder.Default
    RunTrigger trigger = RunTrigger.SCHEDULE;

    public static CleanupOptions scheduled() {
        return CleanupOptions.builder().trigger(RunTrigger.SCHEDULE).build();
    }

    public boolean effectiveDryRun(boolean configuredDryRun) {
        if (forceLive) {
            return false;
        }
        return configuredDryRun || forceDryRun;
    }

    public boolean matchesCategory(String categoryName) {
        return categoryFilter == null || categoryFilter.equals(categoryName);
    }

    public boolean matchesChannel(String channelName) {
        return channelFilter == null || channelFilter.equals(channelName);
    }

    /**
     * 日志里使用的范围描述，例如 "#general" 或 "all"。
     */
    public String scopeLabel() {
        if (channelFilter != null) {
            return "#" + channelFilter;
        }
        return categoryFilter != null ? categoryFilter : "all";
    }
}
