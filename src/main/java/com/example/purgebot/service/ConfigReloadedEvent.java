package com.example.purgebot.service;

import com.example.purgebot.model.PurgeConfig;
import org.springframework.context.ApplicationEvent;

/**
 * 配置文档被整体替换后发布。
 */
public class ConfigReloadedEvent extends ApplicationEvent {

    private final transient PurgeConfig previous;
    private final transient PurgeConfig current;

    public ConfigReloadedEvent(Object source, PurgeConfig previous, PurgeConfig current) {
        super(source);
        this.previous = previous;
        this.current = current;
    }

    public PurgeConfig getPrevious() {
        return previous;
    }

    public PurgeConfig getCurrent() {
        return current;
    }
}
