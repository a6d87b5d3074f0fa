package com.example.purgebot.service;

import com.example.purgebot.model.CategoryResult;
import com.example.purgebot.model.ChannelResult;
import com.example.purgebot.model.CleanupRun;
import com.example.purgebot.model.DiscoveredItem;
import com.example.purgebot.model.PurgeConfig;
import com.example.purgebot.model.RetentionSource;
import com.example.purgebot.model.RetentionValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把清理结果和自动发现结果发送到 Discord webhook。发送失败只记录日志。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookNotifier implements CleanupListener {

    static final int MAX_DESCRIPTION_LENGTH = 4000;
    static final int TRUNCATED_LENGTH = 3990;
    static final String TRUNCATION_MARKER = "\n... (truncated)";
    static final int MAX_EMBEDS_PER_MESSAGE = 10;

    static final int DRY_RUN_COLOR = 0x3498db;
    static final int ERROR_COLOR = 0xe74c3c;
    static final int IDLE_COLOR = 0x95a5a6;

    private static final Duration BATCH_PAUSE = Duration.ofSeconds(1);

    private final WebhookTransport transport;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;
    private final Clock clock;

    @Override
    public void onRunCompleted(CleanupRun run, PurgeConfig config) {
        PurgeConfig.WebhookSettings webhooks = config.getWebhooks();
        String url = webhooks == null ? null : webhooks.getCleanup();
        if (url == null || url.isBlank()) {
            return;
        }

        List<Embed> embeds = new ArrayList<>();
        if (run.isFailed()) {
            embeds.add(new Embed("Message Cleanup Failed", truncate(run.error()), ERROR_COLOR,
                    new Footer("trigger: " + run.trigger().label()), timestamp()));
        } else {
            int successColor = parseColor(webhooks.getCleanupColor(),
                    PurgeConfig.WebhookSettings.DEFAULT_CLEANUP_COLOR);
            run.categories().forEach((name, category) -> {
                if (category.hasActivity()) {
                    embeds.add(categoryEmbed(name, category, run.dryRun(), successColor));
                }
            });
        }
        if (!embeds.isEmpty()) {
            send(url, embeds, "Webhook");
        }
    }

    @Override
    public void onDiscovery(List<DiscoveredItem> discoveries, PurgeConfig config) {
        PurgeConfig.WebhookSettings webhooks = config.getWebhooks();
        String url = webhooks == null ? null : webhooks.getInfo();
        if (url == null || url.isBlank() || discoveries.isEmpty()) {
            return;
        }

        List<String> lines = new ArrayList<>();
        Map<String, List<DiscoveredItem>> channelsByCategory = new LinkedHashMap<>();
        for (DiscoveredItem item : discoveries) {
            if (item.kind() == DiscoveredItem.Kind.CATEGORY) {
                lines.add("**New category: " + item.name() + "** — `DISABLED`");
                lines.add("Channels: " + String.join(", ", item.channels()) + " (" + item.channels().size() + ")");
                lines.add("Set `enabled: true` in config to activate cleanup\n");
            } else {
                channelsByCategory.computeIfAbsent(item.category(), k -> new ArrayList<>()).add(item);
            }
        }
        channelsByCategory.forEach((category, items) -> {
            for (DiscoveredItem item : items) {
                lines.add("**" + category + "** — #" + item.name() + " added");
                lines.add("Cleanup: " + RetentionValue.describe(item.retention()) + " (" + item.source().label()
                        + " default)" + (item.categoryEnabled() ? "" : " · category disabled"));
            }
        });

        int count = discoveries.size();
        Embed embed = new Embed("Channel Auto-Discovery", truncate(String.join("\n", lines)),
                parseColor(webhooks.getInfoColor(), PurgeConfig.WebhookSettings.DEFAULT_INFO_COLOR),
                new Footer(count + " change" + (count != 1 ? "s" : "") + " detected"), timestamp());
        send(url, List.of(embed), "Info webhook");
    }

    Embed categoryEmbed(String categoryName, CategoryResult category, boolean dryRun, int successColor) {
        List<String> lines = new ArrayList<>();
        for (ChannelResult channel : category.channels()) {
            if (channel.hasError()) {
                lines.add("#" + channel.name() + " — ❌ " + channel.error());
            } else if (channel.purged() > 0) {
                String source = channel.retentionSource() == RetentionSource.OVERRIDE ? " (override)" : "";
                lines.add("#" + channel.name() + " — " + channel.retention() + "d" + source + " — **"
                        + channel.purged() + " purged**");
            }
        }

        int color = dryRun ? DRY_RUN_COLOR : successColor;
        if (category.errors() > 0) {
            color = ERROR_COLOR;
        } else if (category.purged() == 0) {
            color = IDLE_COLOR;
        }

        String title = (dryRun ? "Dry Run — " : "") + "Message Cleanup — " + categoryName;
        String footer = category.channels().size() + " channels • " + category.purged() + " messages "
                + (dryRun ? "would be purged" : "purged");
        return new Embed(title, truncate(String.join("\n", lines)), color, new Footer(footer), timestamp());
    }

    static String truncate(String description) {
        if (description == null || description.length() <= MAX_DESCRIPTION_LENGTH) {
            return description;
        }
        return description.substring(0, TRUNCATED_LENGTH) + TRUNCATION_MARKER;
    }

    static int parseColor(String hex, String fallback) {
        int defaultColor = Integer.parseInt(fallback.substring(1), 16);
        if (hex == null) {
            return defaultColor;
        }
        try {
            int color = Integer.parseInt(hex.trim().replace("#", ""), 16);
            return color == 0 ? defaultColor : color;
        } catch (NumberFormatException e) {
            log.warn("Invalid webhook color \"{}\", using {}", hex, fallback);
            return defaultColor;
        }
    }

    private void send(String url, List<Embed> embeds, String label) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            log.warn("{} URL is invalid: {}", label, e.getMessage());
            return;
        }

        for (int i = 0; i < embeds.size(); i += MAX_EMBEDS_PER_MESSAGE) {
            List<Embed> batch = embeds.subList(i, Math.min(i + MAX_EMBEDS_PER_MESSAGE, embeds.size()));
            try {
                String payload = objectMapper.writeValueAsString(Map.of("embeds", batch));
                WebhookTransport.Response response = transport.post(uri, payload);
                if (!response.isSuccess()) {
                    log.warn("{} response: {} {}", label, response.status(), response.body());
                }
                if (i + MAX_EMBEDS_PER_MESSAGE < embeds.size()) {
                    sleeper.sleep(BATCH_PAUSE);
                }
            } catch (JsonProcessingException e) {
                log.error("{} payload could not be encoded: {}", label, e.getMessage());
                return;
            } catch (IOException e) {
                log.error("{} failed: {}", label, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} delivery interrupted", label);
                return;
            }
        }
    }

    private String timestamp() {
        return clock.instant().toString();
    }

    public record Embed(String title, String description, int color, Footer footer, String timestamp) {
    }

    public record Footer(String text) {
    }
}
