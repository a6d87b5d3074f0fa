package com.example.purgebot.model;

import java.time.Instant;

/**
 * 实时状态，供 /api/stats/status 使用。
 */
public record RunStatus(
        boolean connected,
        String guildName,
        boolean cleanupRunning,
        String activeOperation,
        boolean dryRun,
        String schedule,
        String timezone,
        boolean scheduleEnabled,
        Instant nextRun,
        int totalCategories,
        int enabledCategories,
        int totalChannels,
        int globalDefault,
        long uptimeMs) {
}
