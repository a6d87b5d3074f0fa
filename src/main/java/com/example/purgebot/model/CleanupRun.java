package com.example.purgebot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次清理执行的不可变结果，在运行结束时创建，写入历史后不再修改。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CleanupRun(
        Instant timestamp,
        RunTrigger trigger,
        boolean dryRun,
        boolean cancelled,
        String error,
        int totalProcessed,
        int totalPurged,
        int totalSkipped,
        int totalErrors,
        long duration,
        Map<String, CategoryResult> categories) {

    public CleanupRun {
        categories = categories == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(categories));
    }

    /**
     * 运行级致命错误（例如服务器不可达）：零进度，计一个错误。
     */
    public static CleanupRun failed(Instant timestamp, RunTrigger trigger, boolean dryRun, String error,
                                    long duration) {
        return new CleanupRun(timestamp, trigger, dryRun, false, error, 0, 0, 0, 1, duration, Map.of());
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }

    public RunOutcome outcome() {
        if (isFailed()) {
            return RunOutcome.FAILED;
        }
        return cancelled ? RunOutcome.CANCELLED : RunOutcome.COMPLETED;
    }
}
