package com.example.purgebot.platform;

import java.time.Instant;

/**
 * 清理所需的最小消息视图。
 */
public record ChannelMessage(String id, Instant createdAt, boolean pinned) {
}
