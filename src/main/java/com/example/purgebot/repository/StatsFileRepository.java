package com.example.purgebot.repository;

import com.example.purgebot.model.StatsSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * stats.json 的读写，默认与 config.yaml 位于同一目录。
 */
@Component
@Slf4j
public class StatsFileRepository {

    private final Path statsPath;
    private final ObjectMapper objectMapper;

    @Autowired
    public StatsFileRepository(
            @Value("${app.stats-path:#{null}}") Path statsPath,
            @Value("${app.config-path:/config/config.yaml}") Path configPath,
            ObjectMapper objectMapper) {
        this(statsPath != null ? statsPath : defaultStatsPath(configPath), objectMapper);
    }

    public StatsFileRepository(Path statsPath, ObjectMapper objectMapper) {
        this.statsPath = statsPath;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    static Path defaultStatsPath(Path configPath) {
        Path parent = configPath.toAbsolutePath().getParent();
        return parent == null ? Path.of("stats.json") : parent.resolve("stats.json");
    }

    public Path getPath() {
        return statsPath;
    }

    /**
     * 读取统计文件；不存在时返回空文档。损坏的文件被移到 stats.json.corrupt 后重新开始。
     */
    public StatsSnapshot load() {
        if (!Files.exists(statsPath)) {
            return new StatsSnapshot();
        }
        try {
            String raw = Files.readString(statsPath, StandardCharsets.UTF_8);
            if (raw.isBlank()) {
                return new StatsSnapshot();
            }
            StatsSnapshot snapshot = objectMapper.readValue(raw, StatsSnapshot.class);
            return snapshot == null ? new StatsSnapshot() : snapshot;
        } catch (IOException e) {
            log.warn("Stats file {} is unreadable ({}), starting fresh", statsPath, e.getMessage());
            quarantine();
            return new StatsSnapshot();
        }
    }

    public void save(StatsSnapshot snapshot) {
        try {
            AtomicFileWriter.write(statsPath, objectMapper.writeValueAsString(snapshot));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write stats " + statsPath, e);
        }
    }

    private void quarantine() {
        Path corrupt = statsPath.resolveSibling(statsPath.getFileName() + ".corrupt");
        try {
            Files.move(statsPath, corrupt, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Moved unreadable stats file to {}", corrupt);
        } catch (IOException e) {
            log.warn("Could not move unreadable stats file aside: {}", e.getMessage());
        }
    }
}
