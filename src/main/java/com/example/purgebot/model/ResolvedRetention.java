package com.example.purgebot.model;

/**
 * 解析后的保留策略，days 始终满足 >= -1。
 */
public record ResolvedRetention(int days, RetentionSource source) {

    public boolean neverDelete() {
        return days == RetentionValue.NEVER_DELETE;
    }
}
