package com.example.purgebot.repository;

import com.example.purgebot.exception.ConfigLoadException;
import com.example.purgebot.model.PurgeConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/**
 * config.yaml 的读写。写入时带固定的说明头部，并通过临时文件 + rename 原子替换。
 */
@Component
@Slf4j
public class ConfigFileRepository {

    static final String HEADER = """
            # PurgeBot configuration
            #
            # Retention hierarchy (first match wins):
            #   1. Inline override on channel  - per-channel retention
            #   2. default                     - category-wide default
            #   3. globalDefault               - fallback for categories without a default
            #
            # Retention values:
            #   -1   = Never delete (keep all messages forever)
            #    0   = Delete all messages (bulk <14d + individual >14d, capped per run)
            #    N   = Keep messages newer than N days, delete older ones
            #
            # Discord limits bulk delete to messages <14 days old. Older messages are
            # deleted individually, capped at maxOldDeletesPerChannel per channel per run.
            # Pinned messages are skipped when skipPinned is true (default).
            #
            # Categories must have "enabled: true" to be cleaned.
            # _channels is auto-populated by --sync. Add ": <days>" to override a channel.
            # Config is re-read before each cleanup run, no restart needed after editing.
            #
            # deleteOld: true  - delete all messages older than retention (default)
            # deleteOld: false - only bulk-delete messages up to 14 days old (faster)
            #
            # Example:
            #   my-category:
            #     enabled: true
            #     default: 7
            #     deleteOld: false
            #     _channels:
            #       - general
            #       - error-channel: 14
            #       - important-log: -1
            #
            # Commands:
            #   java -jar purgebot.jar --sync   # discover channels
            #   java -jar purgebot.jar --now    # run cleanup now

            """;

    private final Path configPath;
    private final ObjectMapper yamlMapper;

    public ConfigFileRepository(
            @Value("${app.config-path:/config/config.yaml}") Path configPath,
            @Qualifier("yamlMapper") ObjectMapper yamlMapper) {
        this.configPath = configPath;
        this.yamlMapper = yamlMapper;
    }

    public Path getPath() {
        return configPath;
    }

    public boolean exists() {
        return Files.isRegularFile(configPath);
    }

    /**
     * @throws ConfigLoadException 文件不存在或 YAML 无法解析
     */
    public PurgeConfig load() {
        try {
            String raw = Files.readString(configPath, StandardCharsets.UTF_8);
            if (raw.isBlank()) {
                return new PurgeConfig();
            }
            PurgeConfig config = yamlMapper.readValue(raw, PurgeConfig.class);
            return config == null ? new PurgeConfig() : config;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to load config " + configPath + ": " + e.getMessage(), e);
        }
    }

    public void save(PurgeConfig config) {
        try {
            String yaml = yamlMapper.writeValueAsString(config);
            AtomicFileWriter.write(configPath, HEADER + yaml);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write config " + configPath, e);
        }
    }

    public FileTime lastModified() {
        try {
            return Files.exists(configPath) ? Files.getLastModifiedTime(configPath) : null;
        } catch (IOException e) {
            log.debug("Could not stat {}: {}", configPath, e.getMessage());
            return null;
        }
    }
}
