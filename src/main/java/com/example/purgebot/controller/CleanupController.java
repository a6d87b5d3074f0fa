package com.example.purgebot.controller;

import com.example.purgebot.model.CleanupOptions;
import com.example.purgebot.model.RunTrigger;
import com.example.purgebot.model.SyncReport;
import com.example.purgebot.platform.ChannelMessageStore;
import com.example.purgebot.platform.GuildUnavailableException;
import com.example.purgebot.service.CleanupOrchestrator;
import com.example.purgebot.service.DiscoveryReconciler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 清理控制接口：触发清理 / dry-run、完整同步与取消。
 */
@RestController
@RequestMapping("/api/cleanup")
@RequiredArgsConstructor
public class CleanupController {

    private final CleanupOrchestrator orchestrator;
    private final DiscoveryReconciler discoveryReconciler;
    private final ChannelMessageStore store;

    /**
     * 异步触发清理，可选限定分类/频道。遵循配置中的 dryRun，live=true 时强制实际删除
     */
    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run(@RequestBody(required = false) CleanupScope scope,
                                                   @RequestParam(defaultValue = "false") boolean live) {
        return start(scope, false, live);
    }

    /**
     * 异步触发 dry-run，只统计不删除
     */
    @PostMapping("/dryrun")
    public ResponseEntity<Map<String, Object>> dryRun(@RequestBody(required = false) CleanupScope scope) {
        return start(scope, true, false);
    }

    /**
     * 同步执行完整同步并返回变更报告
     */
    @PostMapping("/sync")
    public ResponseEntity<SyncReport> sync() {
        requireConnected();
        return ResponseEntity.ok(discoveryReconciler.syncConfig());
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        if (!orchestrator.cancel()) {
            return ResponseEntity.badRequest().body(response(false, "No cleanup running"));
        }
        return ResponseEntity.ok(response(true, "Cancellation requested"));
    }

    private ResponseEntity<Map<String, Object>> start(CleanupScope scope, boolean dryRun, boolean live) {
        requireConnected();
        CleanupScope effective = scope == null ? new CleanupScope(null, null) : scope;
        CleanupOptions options = CleanupOptions.builder()
                .forceDryRun(dryRun)
                .forceLive(live)
                .categoryFilter(blankToNull(effective.category()))
                .channelFilter(blankToNull(effective.channel()))
                .trigger(RunTrigger.API)
                .build();
        orchestrator.startCleanup(options);
        String message = (dryRun ? "Dry run" : "Cleanup") + " started (" + options.scopeLabel() + ")";
        return ResponseEntity.accepted().body(response(true, message));
    }

    private void requireConnected() {
        if (!store.isConnected()) {
            throw new GuildUnavailableException("Discord is not connected");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static Map<String, Object> response(boolean ok, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", ok);
        body.put("message", message);
        return body;
    }

    public record CleanupScope(String category, String channel) {
    }
}
