package com.example.purgebot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 轮询 config.yaml 的修改时间，手工编辑后无需重启即可生效（例如 schedule/timezone）。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfigFileWatcher {

    static final String OPERATION = "reload";

    private final ConfigHolder configHolder;
    private final OperationGuard operationGuard;

    @Scheduled(fixedDelayString = "${app.config-watch-interval:5000}",
            initialDelayString = "${app.config-watch-interval:5000}")
    public void checkForChanges() {
        if (!operationGuard.tryAcquire(OPERATION)) {
            return;
        }
        try {
            if (configHolder.isModifiedOnDisk()) {
                log.info("Config file changed on disk, reloading");
                configHolder.reload();
            }
        } finally {
            operationGuard.release(OPERATION);
        }
    }
}
