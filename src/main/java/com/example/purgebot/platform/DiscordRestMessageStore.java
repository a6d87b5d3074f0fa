package com.example.purgebot.platform;

import com.example.purgebot.service.Sleeper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 基于 Discord REST API (v10) 的 ChannelMessageStore 实现。
 * 只关心分类（type 4）和挂在分类下的文本频道（type 0）。
 */
@Component
@Slf4j
public class DiscordRestMessageStore implements ChannelMessageStore {

    private static final int TYPE_TEXT = 0;
    private static final int TYPE_CATEGORY = 4;
    private static final int MAX_ATTEMPTS = 3;
    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiBase;
    private final String token;
    private final String guildId;
    private final Duration requestTimeout;
    private final RetryTemplate retryTemplate;

    private volatile List<RawChannel> channelCache = List.of();
    private volatile String guildName;
    private volatile boolean guildReachable = true;

    @Autowired
    public DiscordRestMessageStore(
            ObjectMapper objectMapper,
            Sleeper sleeper,
            @Value("${app.discord.api-base:https://discord.com/api/v10}") String apiBase,
            @Value("${app.discord.token:}") String token,
            @Value("${app.discord.guild-id:}") String guildId,
            @Value("${app.discord.request-timeout:PT15S}") Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(),
                objectMapper, sleeper, apiBase, token, guildId, requestTimeout);
    }

    DiscordRestMessageStore(HttpClient httpClient, ObjectMapper objectMapper, Sleeper sleeper, String apiBase,
                            String token, String guildId, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        this.token = token;
        this.guildId = guildId;
        this.requestTimeout = requestTimeout;
        this.retryTemplate = rateLimitRetryTemplate(sleeper);
    }

    @Override
    public boolean isConnected() {
        return isConfigured() && guildReachable;
    }

    @Override
    public String guildName() {
        return guildName;
    }

    @Override
    public List<PlatformCategory> listCategories() {
        if (!isConfigured()) {
            throw new GuildUnavailableException("DISCORD_TOKEN and GUILD_ID must be configured");
        }
        JsonNode guild = fetchGuildResource("/guilds/" + guildId);
        guildName = guild.path("name").asText(null);

        JsonNode channels = fetchGuildResource("/guilds/" + guildId + "/channels");
        List<RawChannel> parsed = new ArrayList<>();
        for (JsonNode node : channels) {
            parsed.add(new RawChannel(
                    node.path("id").asText(),
                    node.path("name").asText(),
                    node.path("type").asInt(-1),
                    node.hasNonNull("parent_id") ? node.get("parent_id").asText() : null,
                    node.path("position").asInt(0)));
        }
        parsed.sort(Comparator.comparingInt(RawChannel::position).thenComparing(RawChannel::id));
        channelCache = List.copyOf(parsed);
        guildReachable = true;

        List<PlatformCategory> categories = new ArrayList<>();
        for (RawChannel channel : parsed) {
            if (channel.type() == TYPE_CATEGORY) {
                categories.add(new PlatformCategory(channel.id(), channel.name()));
            }
        }
        return categories;
    }

    @Override
    public List<PlatformChannel> listChannelsIn(PlatformCategory category) {
        List<PlatformChannel> channels = new ArrayList<>();
        for (RawChannel channel : channelCache) {
            if (channel.type() == TYPE_TEXT && category.id().equals(channel.parentId())) {
                channels.add(new PlatformChannel(channel.id(), channel.name(), channel.parentId()));
            }
        }
        return channels;
    }

    @Override
    public List<ChannelMessage> fetchMessagesBefore(PlatformChannel channel, String beforeId, int limit) {
        int pageSize = Math.max(1, Math.min(limit, MAX_BATCH_SIZE));
        StringBuilder path = new StringBuilder("/channels/").append(channel.id())
                .append("/messages?limit=").append(pageSize);
        if (beforeId != null) {
            path.append("&before=").append(URLEncoder.encode(beforeId, StandardCharsets.UTF_8));
        }
        HttpResponse<String> response = send(request(path.toString()).GET());
        ensureSuccess(response, "fetch messages in #" + channel.name());

        List<ChannelMessage> messages = new ArrayList<>();
        for (JsonNode node : readTree(response.body())) {
            messages.add(new ChannelMessage(
                    node.path("id").asText(),
                    parseTimestamp(node.path("timestamp").asText()),
                    node.path("pinned").asBoolean(false)));
        }
        return messages;
    }

    @Override
    public void deleteMessage(PlatformChannel channel, String messageId) {
        HttpResponse<String> response = send(
                request("/channels/" + channel.id() + "/messages/" + messageId).DELETE());
        if (response.statusCode() == 404) {
            log.debug("Message {} in #{} already gone", messageId, channel.name());
            return;
        }
        ensureSuccess(response, "delete message " + messageId + " in #" + channel.name());
    }

    @Override
    public int deleteBatch(PlatformChannel channel, List<String> messageIds) {
        if (messageIds.isEmpty()) {
            return 0;
        }
        if (messageIds.size() > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("Bulk delete accepts at most " + MAX_BATCH_SIZE + " messages");
        }
        if (messageIds.size() == 1) {
            deleteMessage(channel, messageIds.get(0));
            return 1;
        }
        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("messages", messageIds));
        } catch (IOException e) {
            throw new MessageStoreException("Failed to encode bulk delete payload", e);
        }
        HttpResponse<String> response = send(request("/channels/" + channel.id() + "/messages/bulk-delete")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8)));
        ensureSuccess(response, "bulk delete in #" + channel.name());
        return messageIds.size();
    }

    private boolean isConfigured() {
        return token != null && !token.isBlank() && guildId != null && !guildId.isBlank();
    }

    private JsonNode fetchGuildResource(String path) {
        HttpResponse<String> response;
        try {
            response = send(request(path).GET());
        } catch (MessageStoreException e) {
            guildReachable = false;
            throw new GuildUnavailableException("Guild " + guildId + " unreachable: " + e.getMessage(), e);
        }
        int status = response.statusCode();
        if (status == 401 || status == 403 || status == 404) {
            guildReachable = false;
            throw new GuildUnavailableException("Guild " + guildId + " not found (HTTP " + status + ")");
        }
        if (status < 200 || status >= 300) {
            guildReachable = false;
            throw new GuildUnavailableException("Guild " + guildId + " unavailable: GET " + path
                    + " returned HTTP " + status);
        }
        try {
            return objectMapper.readTree(response.body() == null ? "" : response.body());
        } catch (IOException e) {
            throw new GuildUnavailableException("Unreadable guild response for " + path + ": " + e.getMessage(), e);
        }
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create(apiBase + path))
                .timeout(requestTimeout)
                .header("Authorization", "Bot " + token)
                .header("User-Agent", "DiscordBot (purgebot, 1.0)");
    }

    private HttpResponse<String> send(HttpRequest.Builder builder) {
        HttpRequest request = builder.build();
        try {
            return retryTemplate.execute(context -> {
                HttpResponse<String> response = exchange(request);
                if (response.statusCode() == 429) {
                    Duration retryAfter = retryAfter(response);
                    log.warn("Rate limited on {} {}, retry after {} ms (attempt {}/{})",
                            request.method(), request.uri().getPath(), retryAfter.toMillis(),
                            context.getRetryCount() + 1, MAX_ATTEMPTS);
                    throw new RateLimitedException(response, retryAfter);
                }
                return response;
            }, context -> {
                if (context.getLastThrowable() instanceof RateLimitedException limited) {
                    log.warn("Giving up on {} {} after {} rate limited attempts",
                            request.method(), request.uri().getPath(), context.getRetryCount());
                    return limited.getResponse();
                }
                if (context.getLastThrowable() instanceof RuntimeException failure) {
                    throw failure;
                }
                throw new MessageStoreException(request.method() + " " + request.uri().getPath() + " failed",
                        context.getLastThrowable());
            });
        } catch (BackOffInterruptedException e) {
            throw new MessageStoreException("Interrupted while waiting for rate limit", e);
        }
    }

    private HttpResponse<String> exchange(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new MessageStoreException(request.method() + " " + request.uri().getPath() + " failed: "
                    + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessageStoreException("Interrupted during " + request.method() + " "
                    + request.uri().getPath(), e);
        }
    }

    private static RetryTemplate rateLimitRetryTemplate(Sleeper sleeper) {
        Map<Class<? extends Throwable>, Boolean> retryable = Map.of(RateLimitedException.class, true);
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(MAX_ATTEMPTS, retryable));
        template.setBackOffPolicy(new RetryAfterBackOffPolicy(sleeper, DEFAULT_RETRY_AFTER));
        return template;
    }

    private Duration retryAfter(HttpResponse<String> response) {
        try {
            JsonNode body = objectMapper.readTree(response.body());
            if (body.hasNonNull("retry_after")) {
                return Duration.ofMillis((long) Math.ceil(body.get("retry_after").asDouble() * 1000));
            }
        } catch (IOException e) {
            log.debug("Unparseable rate limit body: {}", response.body());
        }
        String header = response.headers().firstValue("Retry-After").orElse(null);
        if (header != null) {
            try {
                return Duration.ofMillis((long) Math.ceil(Double.parseDouble(header) * 1000));
            } catch (NumberFormatException e) {
                log.debug("Unparseable Retry-After header: {}", header);
            }
        }
        return DEFAULT_RETRY_AFTER;
    }

    private void ensureSuccess(HttpResponse<String> response, String action) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new MessageStoreException("Failed to " + action + ": HTTP " + status + " " + response.body());
        }
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body == null || body.isEmpty() ? "[]" : body);
        } catch (IOException e) {
            throw new MessageStoreException("Unreadable response from Discord: " + e.getMessage(), e);
        }
    }

    private static Instant parseTimestamp(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new MessageStoreException("Unexpected message timestamp: " + value, e);
        }
    }

    private record RawChannel(String id, String name, int type, String parentId, int position) {
    }
}
