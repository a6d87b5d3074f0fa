package com.example.purgebot.service;

import com.example.purgebot.model.CleanupRun;
import com.example.purgebot.model.DiscoveredItem;
import com.example.purgebot.model.PurgeConfig;

import java.util.List;

/**
 * 清理运行与自动发现的观察者。实现不应抛异常；抛出的异常只会被记录。
 */
public interface CleanupListener {

    default void onRunCompleted(CleanupRun run, PurgeConfig config) {
    }

    default void onDiscovery(List<DiscoveredItem> discoveries, PurgeConfig config) {
    }
}
