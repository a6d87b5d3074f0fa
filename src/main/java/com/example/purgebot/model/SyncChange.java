package com.example.purgebot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * full sync 报告中的一条变更明细。
 */
public record SyncChange(Type type, Scope scope, String category, List<String> channels) {

    public SyncChange {
        channels = channels == null ? List.of() : List.copyOf(channels);
    }

    public enum Type {
        ADDED,
        REMOVED,
        MIGRATED;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Scope {
        CATEGORY,
        CHANNEL,
        OVERRIDES;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
