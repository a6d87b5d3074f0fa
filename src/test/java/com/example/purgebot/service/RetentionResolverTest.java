package com.example.purgebot.service;

import com.example.purgebot.model.CategoryConfig;
import com.example.purgebot.model.ChannelEntry;
import com.example.purgebot.model.PurgeConfig;
import com.example.purgebot.model.ResolvedRetention;
import com.example.purgebot.model.RetentionSource;
import com.example.purgebot.model.RetentionValue;
import org.junit.jupiter.api.Test;

import static com.example.purgebot.support.TestConfigs.category;
import static com.example.purgebot.support.TestConfigs.config;
import static com.example.purgebot.support.TestConfigs.override;
import static com.example.purgebot.support.TestConfigs.plain;
import static org.junit.jupiter.api.Assertions.*;

class RetentionResolverTest {

    private final RetentionResolver resolver = new RetentionResolver();

    @Test
    void testOverrideWinsOverCategoryAndGlobal() {
        PurgeConfig config = config(7);
        config.getCategories().put("logs", category(true, 14, plain("general"), override("archive", -1)));

        ResolvedRetention resolved = resolver.resolve(config, "logs", "archive");

        assertEquals(-1, resolved.days());
        assertEquals(RetentionSource.OVERRIDE, resolved.source());
        assertTrue(resolved.neverDelete());
    }

    @Test
    void testOverrideWithoutCategoryDefault() {
        PurgeConfig config = config(7);
        config.getCategories().put("logs", category(true, null, plain("general"), override("archive", -1)));

        ResolvedRetention resolved = resolver.resolve(config, "logs", "archive");

        assertEquals(new ResolvedRetention(-1, RetentionSource.OVERRIDE), resolved);
    }

    @Test
    void testCategoryDefaultForPlainChannel() {
        PurgeConfig config = config(7);
        config.getCategories().put("logs", category(true, 14, plain("general")));

        assertEquals(new ResolvedRetention(14, RetentionSource.CATEGORY),
                resolver.resolve(config, "logs", "general"));
    }

    @Test
    void testGlobalDefaultWhenNothingElseSet() {
        PurgeConfig config = config(3);
        config.getCategories().put("logs", category(true, null, plain("general")));

        assertEquals(new ResolvedRetention(3, RetentionSource.GLOBAL),
                resolver.resolve(config, "logs", "general"));
    }

    @Test
    void testUnknownCategoryFallsBackToGlobal() {
        assertEquals(new ResolvedRetention(7, RetentionSource.GLOBAL),
                resolver.resolve(config(7), "missing", "general"));
    }

    @Test
    void testInvalidOverrideFallsBackToGlobal() {
        PurgeConfig config = config(5);
        CategoryConfig category = category(true, 14,
                ChannelEntry.withRetention("bad", RetentionValue.invalid("forever")),
                ChannelEntry.withRetention("negative", RetentionValue.of(-3)));
        config.getCategories().put("logs", category);

        ResolvedRetention bad = resolver.resolve(config, "logs", "bad");
        ResolvedRetention negative = resolver.resolve(config, "logs", "negative");

        assertEquals(5, bad.days());
        assertEquals(RetentionSource.OVERRIDE, bad.source());
        assertEquals(5, negative.days());
    }

    @Test
    void testInvalidCategoryDefaultFallsBackToGlobal() {
        PurgeConfig config = config(7);
        CategoryConfig category = category(true, null, plain("general"));
        category.setDefaultRetention(RetentionValue.invalid("1.5"));
        config.getCategories().put("logs", category);

        ResolvedRetention resolved = resolver.resolve(config, "logs", "general");

        assertEquals(7, resolved.days());
        assertEquals(RetentionSource.CATEGORY, resolved.source());
    }

    @Test
    void testResolvedDaysAlwaysAtLeastNeverDelete() {
        PurgeConfig config = config(7);
        int[] values = {-100, -2, -1, 0, 1, 30, Integer.MAX_VALUE};
        for (int value : values) {
            config.getCategories().put("logs", category(true, null, override("c", value)));
            assertTrue(resolver.resolve(config, "logs", "c").days() >= -1, "value " + value);
        }
    }
}
