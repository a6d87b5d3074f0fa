package com.example.purgebot.service;

import com.example.purgebot.model.CategoryConfig;
import com.example.purgebot.model.PurgeConfig;
import com.example.purgebot.model.RetentionValue;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 加载后补齐默认值并修正越界字段。字段级问题只告警，不会让加载失败。
 */
@Slf4j
public final class ConfigNormalizer {

    private ConfigNormalizer() {
    }

    @SuppressWarnings("deprecation")
    public static PurgeConfig normalize(PurgeConfig config) {
        RetentionValue globalDefault = config.getGlobalDefault();
        if (globalDefault == null) {
            config.setGlobalDefault(RetentionValue.of(PurgeConfig.DEFAULT_GLOBAL_RETENTION));
        } else if (!globalDefault.isValid()) {
            log.warn("Invalid globalDefault \"{}\", using {}", globalDefault.getRaw(),
                    PurgeConfig.DEFAULT_GLOBAL_RETENTION);
            config.setGlobalDefault(RetentionValue.of(PurgeConfig.DEFAULT_GLOBAL_RETENTION));
        }

        if (config.getDryRun() == null) {
            config.setDryRun(false);
        }
        if (isBlank(config.getSchedule())) {
            config.setSchedule(PurgeConfig.DEFAULT_SCHEDULE);
        }
        if (isBlank(config.getTimezone())) {
            config.setTimezone(PurgeConfig.DEFAULT_TIMEZONE);
        }
        if (config.getScheduleEnabled() == null) {
            config.setScheduleEnabled(true);
        }

        config.setDiscord(normalizeDiscord(config.getDiscord()));
        config.setWebhooks(normalizeWebhooks(config.getWebhooks()));

        for (Map.Entry<String, CategoryConfig> entry : config.getCategories().entrySet()) {
            if (entry.getValue() == null) {
                entry.setValue(new CategoryConfig());
                continue;
            }
            if (entry.getValue().getOverrides() != null) {
                log.warn("Category \"{}\" uses deprecated 'overrides:' section, run --sync to migrate to inline format",
                        entry.getKey());
            }
        }
        return config;
    }

    private static PurgeConfig.DiscordSettings normalizeDiscord(PurgeConfig.DiscordSettings discord) {
        PurgeConfig.DiscordSettings settings = discord != null ? discord : new PurgeConfig.DiscordSettings();
        settings.setMaxMessagesPerChannel(atLeast(settings.getMaxMessagesPerChannel(),
                PurgeConfig.DiscordSettings.DEFAULT_MAX_MESSAGES_PER_CHANNEL, 1, "discord.maxMessagesPerChannel"));
        settings.setMaxOldDeletesPerChannel(atLeast(settings.getMaxOldDeletesPerChannel(),
                PurgeConfig.DiscordSettings.DEFAULT_MAX_OLD_DELETES_PER_CHANNEL, 0,
                "discord.maxOldDeletesPerChannel"));
        Long delay = settings.getDelayBetweenChannels();
        if (delay == null) {
            settings.setDelayBetweenChannels(PurgeConfig.DiscordSettings.DEFAULT_DELAY_BETWEEN_CHANNELS_MS);
        } else if (delay < 0) {
            log.warn("discord.delayBetweenChannels {} is negative, using 0", delay);
            settings.setDelayBetweenChannels(0L);
        }
        if (settings.getSkipPinned() == null) {
            settings.setSkipPinned(true);
        }
        return settings;
    }

    private static PurgeConfig.WebhookSettings normalizeWebhooks(PurgeConfig.WebhookSettings webhooks) {
        PurgeConfig.WebhookSettings settings = webhooks != null ? webhooks : new PurgeConfig.WebhookSettings();
        if (isBlank(settings.getCleanupColor())) {
            settings.setCleanupColor(PurgeConfig.WebhookSettings.DEFAULT_CLEANUP_COLOR);
        }
        if (isBlank(settings.getInfoColor())) {
            settings.setInfoColor(PurgeConfig.WebhookSettings.DEFAULT_INFO_COLOR);
        }
        return settings;
    }

    private static int atLeast(Integer value, int defaultValue, int minimum, String key) {
        if (value == null) {
            return defaultValue;
        }
        if (value < minimum) {
            log.warn("{} {} is below {}, using {}", key, value, minimum, minimum);
            return minimum;
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
