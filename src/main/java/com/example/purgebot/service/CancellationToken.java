package com.example.purgebot.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 协作式取消标记。只在分类/频道边界被轮询，不会打断正在进行的删除调用。
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * @return true 表示本次调用把状态从未取消切换为已取消
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
