package com.example.purgebot.platform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 某一时刻平台上 "分类名 -> 文本频道" 的快照，按平台返回顺序排列。
 * 同名分类会合并其频道。
 */
public final class PlatformSnapshot {

    private final Map<String, List<PlatformChannel>> channelsByCategory;

    private PlatformSnapshot(Map<String, List<PlatformChannel>> channelsByCategory) {
        this.channelsByCategory = channelsByCategory;
    }

    public static PlatformSnapshot capture(ChannelMessageStore store) {
        Map<String, List<PlatformChannel>> map = new LinkedHashMap<>();
        for (PlatformCategory category : store.listCategories()) {
            List<PlatformChannel> channels = store.listChannelsIn(category);
            if (channels.isEmpty()) {
                continue;
            }
            map.computeIfAbsent(category.name(), k -> new ArrayList<>()).addAll(channels);
        }
        return of(map);
    }

    public static PlatformSnapshot of(Map<String, List<PlatformChannel>> channelsByCategory) {
        Map<String, List<PlatformChannel>> copy = new LinkedHashMap<>();
        channelsByCategory.forEach((name, channels) -> copy.put(name, List.copyOf(channels)));
        return new PlatformSnapshot(Collections.unmodifiableMap(copy));
    }

    public Map<String, List<PlatformChannel>> channelsByCategory() {
        return channelsByCategory;
    }

    public boolean hasCategory(String name) {
        return channelsByCategory.containsKey(name);
    }

    /**
     * 排序后的频道名列表。
     */
    public List<String> sortedChannelNames(String category) {
        List<String> names = new ArrayList<>();
        for (PlatformChannel channel : channelsByCategory.getOrDefault(category, List.of())) {
            names.add(channel.name());
        }
        Collections.sort(names);
        return names;
    }

    public int categoryCount() {
        return channelsByCategory.size();
    }

    public int channelCount() {
        int count = 0;
        for (List<PlatformChannel> channels : channelsByCategory.values()) {
            count += channels.size();
        }
        return count;
    }
}
