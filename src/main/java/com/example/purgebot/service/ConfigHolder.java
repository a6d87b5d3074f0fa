package com.example.purgebot.service;

import com.example.purgebot.exception.ConfigLoadException;
import com.example.purgebot.model.CategoryConfig;
import com.example.purgebot.model.PurgeConfig;
import com.example.purgebot.repository.ConfigFileRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.nio.file.attribute.FileTime;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 进程内唯一的配置句柄。重新加载时整体替换引用，持有旧引用的调用方不会看到半更新的文档。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfigHolder {

    private final ConfigFileRepository repository;
    private final ApplicationEventPublisher eventPublisher;

    private final AtomicReference<PurgeConfig> current = new AtomicReference<>();
    private volatile FileTime loadedModified;

    /**
     * 启动时必须能读到配置文件，否则启动失败。
     */
    @PostConstruct
    public void init() {
        if (!repository.exists()) {
            throw new ConfigLoadException("Config file not found: " + repository.getPath()
                    + ". Mount a config volume with config.yaml, see config.yaml.sample for reference", null);
        }
        current.set(loadFromDisk());
    }

    public PurgeConfig get() {
        PurgeConfig config = current.get();
        if (config == null) {
            throw new IllegalStateException("Configuration has not been loaded");
        }
        return config;
    }

    /**
     * 从磁盘重新读取配置。解析失败时保留当前配置。
     *
     * @return 是否成功替换
     */
    public boolean reload() {
        PurgeConfig fresh;
        try {
            fresh = loadFromDisk();
        } catch (ConfigLoadException e) {
            log.error("Config reload failed, keeping previous config: {}", e.getMessage());
            return false;
        }
        PurgeConfig previous = current.getAndSet(fresh);
        eventPublisher.publishEvent(new ConfigReloadedEvent(this, previous, fresh));
        return true;
    }

    /**
     * 写回磁盘并把 config 设为当前配置。
     */
    public void save(PurgeConfig config) {
        repository.save(config);
        current.set(config);
        loadedModified = repository.lastModified();
    }

    /**
     * 文件修改时间与上次加载/保存时不同。
     */
    public boolean isModifiedOnDisk() {
        FileTime modified = repository.lastModified();
        return modified != null && !modified.equals(loadedModified);
    }

    private PurgeConfig loadFromDisk() {
        FileTime modified = repository.lastModified();
        PurgeConfig config = ConfigNormalizer.normalize(repository.load());
        loadedModified = modified;

        long enabled = config.getCategories().values().stream().filter(CategoryConfig::isCleanupEnabled).count();
        log.info("Config loaded: {}/{} categories enabled, globalDefault={}, dryRun={}",
                enabled, config.getCategories().size(), config.globalDefaultDays(), config.dryRunEnabled());
        return config;
    }
}
