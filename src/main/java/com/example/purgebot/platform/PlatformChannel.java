package com.example.purgebot.platform;

public record PlatformChannel(String id, String name, String categoryId) {
}
