package com.example.purgebot.repository;

import com.example.purgebot.config.JacksonConfig;
import com.example.purgebot.exception.ConfigLoadException;
import com.example.purgebot.model.CategoryConfig;
import com.example.purgebot.model.ChannelEntry;
import com.example.purgebot.model.PurgeConfig;
import com.example.purgebot.model.RetentionValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigFileRepositoryTest {

    private static final String SAMPLE = """
            globalDefault: 7
            dryRun: false
            schedule: "0 3 * * *"
            timezone: "UTC"
            _discoveryComplete: true
            logging:
              maxDays: 14
            webhooks:
              cleanup: "https://discord.com/api/webhooks/1/abc"
              cleanupColor: "#238636"
            categories:
              logs:
                enabled: true
                default: 14
                deleteOld: false
                _channels:
                  - general
                  - archive: -1
                  - noisy: 1
              Projects:
                _channels:
                  - alpha
            """;

    @TempDir
    Path tempDir;

    private Path file;
    private ConfigFileRepository repository;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("config.yaml");
        repository = new ConfigFileRepository(file, JacksonConfig.configYamlMapper());
    }

    @Test
    void testLoadParsesChannelEntries() throws Exception {
        Files.writeString(file, SAMPLE, StandardCharsets.UTF_8);

        PurgeConfig config = repository.load();

        assertEquals(RetentionValue.of(7), config.getGlobalDefault());
        assertEquals("0 3 * * *", config.getSchedule());
        CategoryConfig logs = config.category("logs");
        assertTrue(logs.isCleanupEnabled());
        assertFalse(logs.isDeleteOldEnabled());
        assertEquals(RetentionValue.of(14), logs.getDefaultRetention());
        assertEquals(List.of(ChannelEntry.plain("general"),
                ChannelEntry.withRetention("archive", RetentionValue.of(-1)),
                ChannelEntry.withRetention("noisy", RetentionValue.of(1))), logs.getChannels());
        assertFalse(config.category("Projects").isCleanupEnabled());
    }

    @Test
    void testDiscoveryMarkerIsDroppedAndUnknownKeysSurvive() throws Exception {
        Files.writeString(file, SAMPLE, StandardCharsets.UTF_8);

        repository.save(repository.load());
        String written = Files.readString(file, StandardCharsets.UTF_8);
        PurgeConfig reloaded = repository.load();

        assertFalse(written.contains("_discoveryComplete"));
        assertTrue(written.startsWith("# PurgeBot configuration"));
        assertEquals(Map.of("maxDays", 14), reloaded.getExtras().get("logging"));
        assertEquals("#238636", reloaded.getWebhooks().getCleanupColor());
        assertEquals(List.of(ChannelEntry.plain("general"),
                ChannelEntry.withRetention("archive", RetentionValue.of(-1)),
                ChannelEntry.withRetention("noisy", RetentionValue.of(1))),
                reloaded.category("logs").getChannels());
        assertEquals(List.of("logs", "Projects"), List.copyOf(reloaded.getCategories().keySet()));
    }

    @Test
    void testInvalidRetentionIsKeptAsRawText() throws Exception {
        Files.writeString(file, """
                globalDefault: 7
                categories:
                  logs:
                    default: "forever"
                    _channels:
                      - general: 2.5
                """, StandardCharsets.UTF_8);

        PurgeConfig config = repository.load();

        RetentionValue categoryDefault = config.category("logs").getDefaultRetention();
        assertFalse(categoryDefault.isValid());
        assertEquals("forever", categoryDefault.getRaw());
        assertFalse(config.category("logs").findOverride("general").orElseThrow().isValid());
    }

    @Test
    void testBlankFileLoadsEmptyConfig() throws Exception {
        Files.writeString(file, "   \n", StandardCharsets.UTF_8);

        PurgeConfig config = repository.load();

        assertTrue(config.getCategories().isEmpty());
        assertNull(config.getGlobalDefault());
    }

    @Test
    void testMalformedYamlFailsToLoad() throws Exception {
        Files.writeString(file, "categories: [unclosed", StandardCharsets.UTF_8);

        assertThrows(ConfigLoadException.class, () -> repository.load());
    }

    @Test
    void testSaveLeavesNoTempFile() throws Exception {
        PurgeConfig config = new PurgeConfig();
        config.setGlobalDefault(RetentionValue.of(3));

        repository.save(config);

        assertTrue(repository.exists());
        assertNotNull(repository.lastModified());
        try (var files = Files.list(tempDir)) {
            assertEquals(List.of(file), files.toList());
        }
    }
}
