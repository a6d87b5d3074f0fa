package com.example.purgebot.platform;

import com.example.purgebot.config.JacksonConfig;
import com.example.purgebot.support.RecordingSleeper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DiscordRestMessageStoreTest {

    private static final String GUILD_ID = "42";

    private final ObjectMapper mapper = JacksonConfig.jsonMapper();
    private final Map<String, Deque<Reply>> replies = new HashMap<>();
    private final List<String> requests = Collections.synchronizedList(new ArrayList<>());
    private final List<String> bodies = Collections.synchronizedList(new ArrayList<>());
    private final List<String> authHeaders = Collections.synchronizedList(new ArrayList<>());
    private HttpServer server;
    private RecordingSleeper sleeper;
    private DiscordRestMessageStore store;

    private record Reply(int status, String body) {
    }

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        sleeper = new RecordingSleeper();
        store = storeWith("test-token", GUILD_ID);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private DiscordRestMessageStore storeWith(String token, String guildId) {
        String base = "http://127.0.0.1:" + server.getAddress().getPort() + "/api/v10/";
        return new DiscordRestMessageStore(HttpClient.newHttpClient(), mapper, sleeper, base, token, guildId,
                Duration.ofSeconds(5));
    }

    private void reply(String method, String path, int status, String body) {
        replies.computeIfAbsent(method + " " + path, k -> new ArrayDeque<>()).add(new Reply(status, body));
    }

    private void handle(HttpExchange exchange) throws IOException {
        String key = exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath()
                + (exchange.getRequestURI().getRawQuery() != null ? "?" + exchange.getRequestURI().getRawQuery() : "");
        requests.add(key);
        authHeaders.add(exchange.getRequestHeaders().getFirst("Authorization"));
        bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        Deque<Reply> queue = replies.get(key);
        Reply reply = queue == null || queue.isEmpty() ? new Reply(404, "{\"message\":\"Unknown\"}")
                : queue.size() > 1 ? queue.poll() : queue.peek();
        byte[] body = reply.body().getBytes(StandardCharsets.UTF_8);
        if (reply.status() == 204) {
            exchange.sendResponseHeaders(204, -1);
        } else {
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(reply.status(), body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        }
        exchange.close();
    }

    private void guildWithChannels() {
        reply("GET", "/api/v10/guilds/42", 200, "{\"id\":\"42\",\"name\":\"Homelab\"}");
        reply("GET", "/api/v10/guilds/42/channels", 200, "["
                + "{\"id\":\"10\",\"name\":\"logs\",\"type\":4,\"position\":1},"
                + "{\"id\":\"11\",\"name\":\"general\",\"type\":0,\"parent_id\":\"10\",\"position\":2},"
                + "{\"id\":\"12\",\"name\":\"alerts\",\"type\":0,\"parent_id\":\"10\",\"position\":1},"
                + "{\"id\":\"13\",\"name\":\"voice\",\"type\":2,\"parent_id\":\"10\",\"position\":3},"
                + "{\"id\":\"14\",\"name\":\"lobby\",\"type\":0,\"position\":0},"
                + "{\"id\":\"20\",\"name\":\"archive\",\"type\":4,\"position\":0}"
                + "]");
    }

    @Test
    void testListsCategoriesAndTextChannels() {
        guildWithChannels();

        List<PlatformCategory> categories = store.listCategories();

        assertEquals(List.of(new PlatformCategory("20", "archive"), new PlatformCategory("10", "logs")), categories);
        assertEquals("Homelab", store.guildName());
        assertTrue(store.isConnected());
        List<PlatformChannel> logs = store.listChannelsIn(categories.get(1));
        assertEquals(List.of(new PlatformChannel("12", "alerts", "10"), new PlatformChannel("11", "general", "10")),
                logs);
        assertTrue(store.listChannelsIn(categories.get(0)).isEmpty());
        assertEquals("Bot test-token", authHeaders.get(0));
    }

    @Test
    void testUnknownGuildIsUnavailable() {
        reply("GET", "/api/v10/guilds/42", 404, "{\"message\":\"Unknown Guild\"}");

        GuildUnavailableException e = assertThrows(GuildUnavailableException.class, () -> store.listCategories());

        assertTrue(e.getMessage().contains("42"));
        assertFalse(store.isConnected());
    }

    @Test
    void testMissingCredentialsAreUnavailable() {
        DiscordRestMessageStore unconfigured = storeWith("", "");

        assertFalse(unconfigured.isConnected());
        assertThrows(GuildUnavailableException.class, unconfigured::listCategories);
        assertTrue(requests.isEmpty());
    }

    @Test
    void testFetchParsesMessagesAndPaginates() {
        reply("GET", "/api/v10/channels/11/messages?limit=100&before=900", 200, "["
                + "{\"id\":\"899\",\"timestamp\":\"2026-01-10T08:00:00.000000+00:00\",\"pinned\":true},"
                + "{\"id\":\"898\",\"timestamp\":\"2026-01-01T10:30:00+01:00\"}"
                + "]");
        PlatformChannel general = new PlatformChannel("11", "general", "10");

        List<ChannelMessage> messages = store.fetchMessagesBefore(general, "900", 250);

        assertEquals(2, messages.size());
        assertEquals(new ChannelMessage("899", Instant.parse("2026-01-10T08:00:00Z"), true), messages.get(0));
        assertEquals(Instant.parse("2026-01-01T09:30:00Z"), messages.get(1).createdAt());
        assertFalse(messages.get(1).pinned());
    }

    @Test
    void testBulkDeletePostsIds() throws Exception {
        reply("POST", "/api/v10/channels/11/messages/bulk-delete", 204, "");
        PlatformChannel general = new PlatformChannel("11", "general", "10");

        int deleted = store.deleteBatch(general, List.of("1", "2", "3"));

        assertEquals(3, deleted);
        JsonNode body = mapper.readTree(bodies.get(0));
        assertEquals(3, body.get("messages").size());
        assertEquals("1", body.get("messages").get(0).asText());
    }

    @Test
    void testSingleIdBatchUsesSingleDelete() {
        reply("DELETE", "/api/v10/channels/11/messages/7", 204, "");
        PlatformChannel general = new PlatformChannel("11", "general", "10");

        assertEquals(1, store.deleteBatch(general, List.of("7")));
        assertEquals(List.of("DELETE /api/v10/channels/11/messages/7"), requests);
    }

    @Test
    void testDeletingMissingMessageIsIgnored() {
        PlatformChannel general = new PlatformChannel("11", "general", "10");

        assertDoesNotThrow(() -> store.deleteMessage(general, "404"));
    }

    @Test
    void testForbiddenDeleteThrows() {
        reply("DELETE", "/api/v10/channels/11/messages/8", 403, "{\"message\":\"Missing Permissions\"}");
        PlatformChannel general = new PlatformChannel("11", "general", "10");

        MessageStoreException e = assertThrows(MessageStoreException.class,
                () -> store.deleteMessage(general, "8"));
        assertTrue(e.getMessage().contains("403"));
    }

    @Test
    void testRateLimitIsRetried() {
        reply("DELETE", "/api/v10/channels/11/messages/9", 429, "{\"retry_after\":0.25,\"global\":false}");
        reply("DELETE", "/api/v10/channels/11/messages/9", 204, "");
        PlatformChannel general = new PlatformChannel("11", "general", "10");

        store.deleteMessage(general, "9");

        assertEquals(2, requests.size());
        assertEquals(List.of(Duration.ofMillis(250)), sleeper.sleeps);
    }

    @Test
    void testRateLimitGivesUpAfterThreeAttempts() {
        reply("DELETE", "/api/v10/channels/11/messages/9", 429, "{\"retry_after\":0.5,\"global\":false}");
        PlatformChannel general = new PlatformChannel("11", "general", "10");

        MessageStoreException e = assertThrows(MessageStoreException.class,
                () -> store.deleteMessage(general, "9"));

        assertTrue(e.getMessage().contains("429"));
        assertEquals(3, requests.size());
        assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(500)), sleeper.sleeps);
    }

    @Test
    void testGuildServerErrorIsUnavailable() {
        reply("GET", "/api/v10/guilds/42", 503, "{\"message\":\"Service Unavailable\"}");

        GuildUnavailableException e = assertThrows(GuildUnavailableException.class, () -> store.listCategories());

        assertTrue(e.getMessage().contains("503"));
        assertFalse(store.isConnected());
    }

    @Test
    void testUnreadableChannelListIsUnavailable() {
        reply("GET", "/api/v10/guilds/42", 200, "{\"id\":\"42\",\"name\":\"Homelab\"}");
        reply("GET", "/api/v10/guilds/42/channels", 200, "<html>bad gateway</html>");

        assertThrows(GuildUnavailableException.class, () -> store.listCategories());
    }

    @Test
    void testBatchOverLimitIsRejected() {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 101; i++) {
            ids.add(Integer.toString(i));
        }
        PlatformChannel general = new PlatformChannel("11", "general", "10");

        assertThrows(IllegalArgumentException.class, () -> store.deleteBatch(general, ids));
        assertTrue(requests.isEmpty());
    }
}
