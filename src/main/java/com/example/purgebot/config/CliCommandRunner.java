package com.example.purgebot.config;

import com.example.purgebot.model.CleanupOptions;
import com.example.purgebot.model.CleanupRun;
import com.example.purgebot.model.RunTrigger;
import com.example.purgebot.model.SyncReport;
import com.example.purgebot.service.CleanupOrchestrator;
import com.example.purgebot.service.DiscoveryReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * 命令行模式：--sync 执行完整同步，--now 立即执行一次清理，完成后退出进程。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CliCommandRunner implements ApplicationRunner {

    static final String SYNC_FLAG = "sync";
    static final String NOW_FLAG = "now";

    private final DiscoveryReconciler discoveryReconciler;
    private final CleanupOrchestrator orchestrator;
    private final ApplicationContext context;

    public static boolean isCliInvocation(String... args) {
        return Arrays.stream(args).anyMatch(arg -> arg.equals("--" + SYNC_FLAG) || arg.equals("--" + NOW_FLAG));
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(SYNC_FLAG) && !args.containsOption(NOW_FLAG)) {
            return;
        }
        int exitCode = execute(args);
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }

    /**
     * @return 进程退出码，0 表示成功
     */
    int execute(ApplicationArguments args) {
        if (args.containsOption(SYNC_FLAG)) {
            try {
                SyncReport report = discoveryReconciler.syncConfig();
                log.info("Sync done ({} changes), exiting", report.changes());
                return 0;
            } catch (RuntimeException e) {
                log.error("Sync failed: {}", e.getMessage());
                return 1;
            }
        }

        log.info("Running cleanup immediately (--now flag)");
        try {
            CleanupRun run = orchestrator.runCleanup(CleanupOptions.builder().trigger(RunTrigger.CLI).build());
            if (run.isFailed()) {
                log.error("Cleanup failed: {}", run.error());
                return 1;
            }
            log.info("Done, exiting");
            return 0;
        } catch (RuntimeException e) {
            log.error("Cleanup failed: {}", e.getMessage());
            return 1;
        }
    }
}
