package com.example.purgebot.platform;

import com.example.purgebot.service.Sleeper;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;

import java.time.Duration;

/**
 * 按 429 响应给出的 retry_after 退避，其余情况使用固定等待。
 */
class RetryAfterBackOffPolicy implements BackOffPolicy {

    private final Sleeper sleeper;
    private final Duration fallback;

    RetryAfterBackOffPolicy(Sleeper sleeper, Duration fallback) {
        this.sleeper = sleeper;
        this.fallback = fallback;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new RetryAfterContext(context);
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        Throwable last = ((RetryAfterContext) backOffContext).retryContext.getLastThrowable();
        Duration wait = last instanceof RateLimitedException limited ? limited.getRetryAfter() : fallback;
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted while waiting for rate limit", e);
        }
    }

    private static final class RetryAfterContext implements BackOffContext {

        private final transient RetryContext retryContext;

        private RetryAfterContext(RetryContext retryContext) {
            this.retryContext = retryContext;
        }
    }
}
