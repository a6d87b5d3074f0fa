package com.example.purgebot.support;

import com.example.purgebot.config.JacksonConfig;
import com.example.purgebot.model.PurgeConfig;
import com.example.purgebot.repository.ConfigFileRepository;

import java.nio.file.Path;

/**
 * 统计写盘次数的 ConfigFileRepository。
 */
public class CountingConfigFileRepository extends ConfigFileRepository {

    public int saves;

    public CountingConfigFileRepository(Path configPath) {
        super(configPath, JacksonConfig.configYamlMapper());
    }

    @Override
    public void save(PurgeConfig config) {
        saves++;
        super.save(config);
    }
}
