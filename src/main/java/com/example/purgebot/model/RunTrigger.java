package com.example.purgebot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunTrigger {
    SCHEDULE,
    MANUAL,
    API,
    CLI;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunTrigger fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return SCHEDULE;
        }
        return RunTrigger.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
