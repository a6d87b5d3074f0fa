package com.example.purgebot.service;

import java.io.IOException;
import java.net.URI;

/**
 * Webhook 投递通道，便于测试替换。
 */
@FunctionalInterface
public interface WebhookTransport {

    Response post(URI uri, String jsonPayload) throws IOException, InterruptedException;

    record Response(int status, String body) {

        public boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }
}
