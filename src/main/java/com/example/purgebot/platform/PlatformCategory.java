package com.example.purgebot.platform;

public record PlatformCategory(String id, String name) {
}
