package com.example.purgebot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 生效保留天数的来源层级。
 */
public enum RetentionSource {
    OVERRIDE,
    CATEGORY,
    GLOBAL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
