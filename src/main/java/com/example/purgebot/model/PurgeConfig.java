package com.example.purgebot.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 保留策略配置文档（config.yaml）。
 * 未识别的顶层键原样保留，保存时写回；内部标记 _discoveryComplete 永不落盘。
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"globalDefault", "dryRun", "schedule", "scheduleEnabled", "timezone", "discord", "webhooks",
        "categories"})
public class PurgeConfig {

    public static final int DEFAULT_GLOBAL_RETENTION = 7;
    public static final String DEFAULT_SCHEDULE = "0 2 * * *";
    public static final String DEFAULT_TIMEZONE = "Europe/Oslo";
    public static final String DISCOVERY_MARKER_KEY = "_discoveryComplete";

    private RetentionValue globalDefault;
    private Boolean dryRun;
    private String schedule;
    private Boolean scheduleEnabled;
    private String timezone;
    private DiscordSettings discord;
    private WebhookSettings webhooks;
    private Map<String, CategoryConfig> categories = new LinkedHashMap<>();

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> extras = new LinkedHashMap<>();

    /**
     * 规范化之后的全局默认保留天数。
     */
    public int globalDefaultDays() {
        if (globalDefault == null || !globalDefault.isValid()) {
            return DEFAULT_GLOBAL_RETENTION;
        }
        return globalDefault.getDays();
    }

    public boolean dryRunEnabled() {
        return Boolean.TRUE.equals(dryRun);
    }

    public boolean scheduleActive() {
        return !Boolean.FALSE.equals(scheduleEnabled);
    }

    /**
     * discord: 段缺失时返回默认值，不修改当前文档。
     */
    public DiscordSettings discordSettings() {
        return discord != null ? discord : DiscordSettings.defaults();
    }

    public CategoryConfig category(String name) {
        return categories == null ? null : categories.get(name);
    }

    public void setCategories(Map<String, CategoryConfig> categories) {
        this.categories = categories == null ? new LinkedHashMap<>() : new LinkedHashMap<>(categories);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtras() {
        return extras;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        if (DISCOVERY_MARKER_KEY.equals(key)) {
            return;
        }
        extras.put(key, value);
    }

    /**
     * discord: 段，控制抓取上限、逐条删除上限与频道间延迟。
     */
    @Data
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class DiscordSettings {
        public static final int DEFAULT_MAX_MESSAGES_PER_CHANNEL = 500;
        public static final int DEFAULT_MAX_OLD_DELETES_PER_CHANNEL = 50;
        public static final long DEFAULT_DELAY_BETWEEN_CHANNELS_MS = 2000L;

        private Integer maxMessagesPerChannel;
        private Integer maxOldDeletesPerChannel;
        private Long delayBetweenChannels;
        private Boolean skipPinned;

        public static DiscordSettings defaults() {
            DiscordSettings settings = new DiscordSettings();
            settings.setMaxMessagesPerChannel(DEFAULT_MAX_MESSAGES_PER_CHANNEL);
            settings.setMaxOldDeletesPerChannel(DEFAULT_MAX_OLD_DELETES_PER_CHANNEL);
            settings.setDelayBetweenChannels(DEFAULT_DELAY_BETWEEN_CHANNELS_MS);
            settings.setSkipPinned(true);
            return settings;
        }
    }

    /**
     * webhooks: 段，cleanup 与 info 两个独立的通知目标。
     */
    @Data
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class WebhookSettings {
        public static final String DEFAULT_CLEANUP_COLOR = "#238636";
        public static final String DEFAULT_INFO_COLOR = "#f39c12";

        private String cleanup;
        private String info;
        private String cleanupColor;
        private String infoColor;
    }
}
