package com.example.purgebot.model;

import java.util.List;

/**
 * 增量发现新增的分类或频道。
 */
public record DiscoveredItem(
        Kind kind,
        String name,
        String category,
        List<String> channels,
        int retention,
        RetentionSource source,
        boolean categoryEnabled) {

    public enum Kind {
        CATEGORY,
        CHANNEL
    }

    public static DiscoveredItem category(String name, List<String> channels) {
        return new DiscoveredItem(Kind.CATEGORY, name, name, List.copyOf(channels), 0, RetentionSource.GLOBAL, false);
    }

    public static DiscoveredItem channel(String name, String category, int retention, RetentionSource source,
                                         boolean categoryEnabled) {
        return new DiscoveredItem(Kind.CHANNEL, name, category, List.of(), retention, source, categoryEnabled);
    }
}
