package com.example.purgebot.service;

import com.example.purgebot.exception.OperationInProgressException;
import com.example.purgebot.model.CategoryConfig;
import com.example.purgebot.model.ChannelEntry;
import com.example.purgebot.model.DiscoveredItem;
import com.example.purgebot.model.PurgeConfig;
import com.example.purgebot.model.RetentionSource;
import com.example.purgebot.model.RetentionValue;
import com.example.purgebot.model.SyncChange;
import com.example.purgebot.model.SyncReport;
import com.example.purgebot.platform.GuildUnavailableException;
import com.example.purgebot.platform.PlatformSnapshot;
import com.example.purgebot.support.CountingConfigFileRepository;
import com.example.purgebot.support.InMemoryMessageStore;
import com.example.purgebot.support.RecordingListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.purgebot.support.TestConfigs.category;
import static com.example.purgebot.support.TestConfigs.config;
import static com.example.purgebot.support.TestConfigs.override;
import static com.example.purgebot.support.TestConfigs.plain;
import static org.junit.jupiter.api.Assertions.*;

class DiscoveryReconcilerTest {

    @TempDir
    Path tempDir;

    private InMemoryMessageStore store;
    private CountingConfigFileRepository repository;
    private ConfigHolder configHolder;
    private RecordingListener listener;
    private OperationGuard guard;
    private DiscoveryReconciler reconciler;

    @BeforeEach
    void setUp() {
        store = new InMemoryMessageStore();
        repository = new CountingConfigFileRepository(tempDir.resolve("config.yaml"));
        listener = new RecordingListener();
        guard = new OperationGuard();
    }

    private void start(PurgeConfig config) {
        repository.save(config);
        repository.saves = 0;
        configHolder = new ConfigHolder(repository, event -> { });
        configHolder.init();
        reconciler = new DiscoveryReconciler(configHolder, store, new RetentionResolver(), guard,
                new CleanupListeners(List.of(listener)));
    }

    @Test
    void testNewCategoryIsAddedDisabled() {
        store.addChannel("Projects", "beta");
        store.addChannel("Projects", "alpha");
        start(config(7));

        PurgeConfig config = configHolder.get();
        List<DiscoveredItem> found = reconciler.discoverIncremental(config, PlatformSnapshot.capture(store));

        assertEquals(1, found.size());
        assertEquals(DiscoveredItem.Kind.CATEGORY, found.get(0).kind());
        CategoryConfig projects = configHolder.get().category("Projects");
        assertNotNull(projects);
        assertFalse(projects.isCleanupEnabled());
        assertEquals(RetentionValue.of(7), projects.getDefaultRetention());
        assertEquals(List.of(plain("alpha"), plain("beta")), projects.getChannels());
        assertEquals(1, repository.saves);
    }

    @Test
    void testNewChannelIsInsertedSorted() {
        store.addChannel("logs", "alerts");
        store.addChannel("logs", "general");
        store.addChannel("logs", "builds");
        PurgeConfig initial = config(7);
        initial.getCategories().put("logs", category(true, 3, plain("alerts"), plain("general")));
        start(initial);

        PurgeConfig config = configHolder.get();
        List<DiscoveredItem> found = reconciler.discoverIncremental(config, PlatformSnapshot.capture(store));

        assertEquals(1, found.size());
        DiscoveredItem item = found.get(0);
        assertEquals("builds", item.name());
        assertEquals(3, item.retention());
        assertEquals(RetentionSource.CATEGORY, item.source());
        assertTrue(item.categoryEnabled());
        assertEquals(List.of(plain("alerts"), plain("builds"), plain("general")),
                configHolder.get().category("logs").getChannels());
    }

    @Test
    void testIncrementalNeverRemovesAndSkipsSaveWhenNothingNew() {
        store.addChannel("logs", "general");
        PurgeConfig initial = config(7);
        initial.getCategories().put("logs", category(true, null, plain("general"), plain("gone")));
        initial.getCategories().put("old", category(false, null, plain("x")));
        start(initial);

        List<DiscoveredItem> found = reconciler.discoverIncremental(configHolder.get(),
                PlatformSnapshot.capture(store));

        assertTrue(found.isEmpty());
        assertEquals(0, repository.saves);
        assertTrue(configHolder.get().getCategories().containsKey("old"));
        assertTrue(configHolder.get().category("logs").channelNames().contains("gone"));
    }

    @Test
    void testFirstPassIsSilentLaterPassesNotify() {
        store.addChannel("logs", "general");
        start(config(7));

        reconciler.discoverIncremental(configHolder.get(), PlatformSnapshot.capture(store));
        assertTrue(listener.discoveries.isEmpty());

        store.addChannel("logs", "alerts");
        reconciler.discoverIncremental(configHolder.get(), PlatformSnapshot.capture(store));

        assertEquals(1, listener.discoveries.size());
        assertEquals("alerts", listener.discoveries.get(0).get(0).name());
    }

    @Test
    void testSyncAddsAndRemoves() {
        store.addChannel("logs", "general");
        store.addChannel("logs", "alerts");
        store.addChannel("Fresh", "one");
        PurgeConfig initial = config(7);
        initial.getCategories().put("logs", category(true, null, plain("general"), plain("deleted")));
        initial.getCategories().put("Gone", category(false, null, plain("x")));
        start(initial);

        SyncReport report = reconciler.syncConfig();

        assertEquals(2, report.categories());
        assertEquals(3, report.channels());
        assertTrue(report.changes() > 0);
        assertEquals(1, repository.saves);
        PurgeConfig saved = configHolder.get();
        assertFalse(saved.getCategories().containsKey("Gone"));
        assertFalse(saved.category("Fresh").isCleanupEnabled());
        assertEquals(List.of(plain("alerts"), plain("general")), saved.category("logs").getChannels());
        assertTrue(report.details().contains(new SyncChange(SyncChange.Type.REMOVED, SyncChange.Scope.CATEGORY,
                "Gone", List.of("x"))));
        assertTrue(report.details().contains(new SyncChange(SyncChange.Type.ADDED, SyncChange.Scope.CHANNEL,
                "logs", List.of("alerts"))));
        assertTrue(report.details().contains(new SyncChange(SyncChange.Type.REMOVED, SyncChange.Scope.CHANNEL,
                "logs", List.of("deleted"))));
    }

    @Test
    void testSyncIsIdempotent() {
        store.addChannel("logs", "general");
        store.addChannel("logs", "alerts");
        PurgeConfig initial = config(7);
        initial.getCategories().put("logs", category(true, null, plain("general")));
        start(initial);

        reconciler.syncConfig();
        int savesAfterFirst = repository.saves;
        SyncReport second = reconciler.syncConfig();

        assertEquals(0, second.changes());
        assertTrue(second.details().isEmpty());
        assertEquals(savesAfterFirst, repository.saves);
    }

    @Test
    void testSyncRemovingOnlyACategoryCountsOneChange() {
        store.addChannel("logs", "general");
        PurgeConfig initial = config(7);
        initial.getCategories().put("logs", category(true, null, plain("general")));
        initial.getCategories().put("Gone", category(false, null, plain("x")));
        start(initial);

        SyncReport report = reconciler.syncConfig();

        assertEquals(1, report.changes());
        assertEquals(1, repository.saves);
    }

    @Test
    void testSyncKeepsOverridesOfExistingChannelsAndDropsOthers() {
        store.addChannel("logs", "archive");
        store.addChannel("logs", "general");
        PurgeConfig initial = config(7);
        initial.getCategories().put("logs", category(true, null, override("archive", -1), plain("general"),
                override("removed", 30)));
        start(initial);

        SyncReport report = reconciler.syncConfig();

        assertEquals(List.of(override("archive", -1), plain("general")),
                configHolder.get().category("logs").getChannels());
        // 丢弃的覆盖值算一次，列表本身变化再算一次
        assertEquals(2, report.changes());
    }

    @Test
    @SuppressWarnings("deprecation")
    void testSyncMigratesLegacyOverrides() {
        store.addChannel("logs", "archive");
        store.addChannel("logs", "general");
        PurgeConfig initial = config(7);
        CategoryConfig logs = category(true, null, plain("archive"), plain("general"));
        Map<String, RetentionValue> legacy = new LinkedHashMap<>();
        legacy.put("archive", RetentionValue.of(-1));
        legacy.put("_comment", RetentionValue.of(1));
        logs.setOverrides(legacy);
        initial.getCategories().put("logs", logs);
        start(initial);

        SyncReport report = reconciler.syncConfig();

        CategoryConfig migrated = configHolder.get().category("logs");
        assertNull(migrated.getOverrides());
        assertEquals(List.<ChannelEntry>of(override("archive", -1), plain("general")), migrated.getChannels());
        assertTrue(report.details().stream().anyMatch(d -> d.type() == SyncChange.Type.MIGRATED));
        assertEquals(1, repository.saves);
    }

    @Test
    void testSyncRejectedWhileCleanupRuns() {
        start(config(7));
        guard.acquire(CleanupOrchestrator.OPERATION);

        OperationInProgressException e = assertThrows(OperationInProgressException.class,
                () -> reconciler.syncConfig());

        assertEquals("cleanup", e.getActiveOperation());
        assertEquals(0, repository.saves);
    }

    @Test
    void testSyncFailsWhenGuildUnavailable() {
        start(config(7));
        store.setGuildAvailable(false);

        assertThrows(GuildUnavailableException.class, () -> reconciler.syncConfig());
        assertFalse(guard.isBusy());
        assertEquals(0, repository.saves);
    }
}
