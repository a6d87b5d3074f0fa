package com.example.purgebot.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * 基于 java.net.http 的同步 webhook 投递，在清理线程上执行。
 */
@Component
public class HttpClientWebhookTransport implements WebhookTransport {

    private final HttpClient client;
    private final Duration requestTimeout;

    public HttpClientWebhookTransport(@Value("${app.webhook.timeout:PT10S}") Duration requestTimeout) {
        this.client = HttpClient.newBuilder().connectTimeout(requestTimeout).build();
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Response post(URI uri, String jsonPayload) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(jsonPayload, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        return new Response(response.statusCode(), response.body());
    }
}
