package com.example.purgebot.service;

import com.example.purgebot.model.CleanupRun;
import com.example.purgebot.model.DiscoveredItem;
import com.example.purgebot.model.PurgeConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 按顺序通知所有 CleanupListener，单个监听器失败不影响其他监听器和运行结果。
 */
@Component
@Slf4j
public class CleanupListeners {

    private final List<CleanupListener> listeners;

    public CleanupListeners(List<CleanupListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    public void runCompleted(CleanupRun run, PurgeConfig config) {
        for (CleanupListener listener : listeners) {
            try {
                listener.onRunCompleted(run, config);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on run completion: {}", listener.getClass().getSimpleName(),
                        e.getMessage(), e);
            }
        }
    }

    public void discovered(List<DiscoveredItem> discoveries, PurgeConfig config) {
        for (CleanupListener listener : listeners) {
            try {
                listener.onDiscovery(discoveries, config);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on discovery: {}", listener.getClass().getSimpleName(),
                        e.getMessage(), e);
            }
        }
    }
}
