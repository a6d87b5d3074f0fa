package com.example.purgebot.model;

import java.util.List;

/**
 * 单个分类的清理汇总。
 */
public record CategoryResult(int processed, int purged, int errors, List<ChannelResult> channels) {

    public CategoryResult {
        channels = channels == null ? List.of() : List.copyOf(channels);
    }

    public static CategoryResult of(List<ChannelResult> channels) {
        int purged = 0;
        int errors = 0;
        for (ChannelResult channel : channels) {
            purged += channel.purged();
            if (channel.hasError()) {
                errors++;
            }
        }
        return new CategoryResult(channels.size(), purged, errors, channels);
    }

    /**
     * 有删除或有错误时才值得通知。
     */
    public boolean hasActivity() {
        return purged > 0 || errors > 0;
    }
}
