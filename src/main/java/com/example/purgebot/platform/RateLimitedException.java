package com.example.purgebot.platform;

import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Discord 返回 429，携带服务端要求的等待时间。
 */
class RateLimitedException extends MessageStoreException {

    private final transient HttpResponse<String> response;
    private final Duration retryAfter;

    RateLimitedException(HttpResponse<String> response, Duration retryAfter) {
        super("Rate limited: HTTP 429, retry after " + retryAfter.toMillis() + " ms");
        this.response = response;
        this.retryAfter = retryAfter;
    }

    HttpResponse<String> getResponse() {
        return response;
    }

    Duration getRetryAfter() {
        return retryAfter;
    }
}
