package com.example.purgebot.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * 单个频道在一次清理中的结果。dry-run 时 purged 为 "将删除" 数量（已应用逐条删除上限）。
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChannelResult(
        String name,
        Integer retention,
        RetentionSource retentionSource,
        int purged,
        int remaining,
        int failedDeletes,
        boolean skipped,
        String error) {

    public static ChannelResult skipped(String name, ResolvedRetention retention) {
        return ChannelResult.builder()
                .name(name)
                .retention(retention.days())
                .retentionSource(retention.source())
                .skipped(true)
                .build();
    }

    public static ChannelResult failed(String name, ResolvedRetention retention, String error) {
        return failed(name, retention, error, 0);
    }

    /**
     * 失败前已删除的消息仍计入 purged。
     */
    public static ChannelResult failed(String name, ResolvedRetention retention, String error, int purged) {
        return ChannelResult.builder()
                .name(name)
                .retention(retention.days())
                .retentionSource(retention.source())
                .purged(purged)
                .error(error)
                .build();
    }

    public boolean hasError() {
        return error != null;
    }
}
