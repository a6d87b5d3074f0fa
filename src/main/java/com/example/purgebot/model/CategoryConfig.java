package com.example.purgebot.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 分类配置：启用开关、分类默认保留天数与频道白名单（_channels）。
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"enabled", "default", "deleteOld", "_channels", "overrides"})
public class CategoryConfig {

    private Boolean enabled;

    @JsonProperty("default")
    private RetentionValue defaultRetention;

    /**
     * false 时只做 14 天内的批量删除，跳过逐条删除。
     */
    private Boolean deleteOld;

    @JsonProperty("_channels")
    private List<ChannelEntry> channels = new ArrayList<>();

    /**
     * 旧版 overrides: 段，full sync 时迁移为内联格式。
     */
    @Deprecated
    private Map<String, RetentionValue> overrides;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> extras = new LinkedHashMap<>();

    public static CategoryConfig discovered(int globalDefault, List<String> channelNames) {
        CategoryConfig category = new CategoryConfig();
        category.setEnabled(false);
        category.setDefaultRetention(RetentionValue.of(globalDefault));
        for (String name : channelNames) {
            category.getChannels().add(ChannelEntry.plain(name));
        }
        return category;
    }

    /**
     * 只有显式 enabled: true 的分类才会被清理。
     */
    @JsonIgnore
    public boolean isCleanupEnabled() {
        return Boolean.TRUE.equals(enabled);
    }

    @JsonIgnore
    public boolean isDeleteOldEnabled() {
        return !Boolean.FALSE.equals(deleteOld);
    }

    public Set<String> channelNames() {
        Set<String> names = new LinkedHashSet<>();
        if (channels != null) {
            for (ChannelEntry entry : channels) {
                names.add(entry.name());
            }
        }
        return names;
    }

    public Optional<RetentionValue> findOverride(String channelName) {
        if (channels == null) {
            return Optional.empty();
        }
        for (ChannelEntry entry : channels) {
            if (entry instanceof ChannelEntry.WithRetention withRetention
                    && withRetention.name().equals(channelName)) {
                return Optional.ofNullable(withRetention.days());
            }
        }
        return Optional.empty();
    }

    public void setChannels(List<ChannelEntry> channels) {
        this.channels = channels == null ? new ArrayList<>() : new ArrayList<>(channels);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtras() {
        return extras;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extras.put(key, value);
    }
}
