package com.example.purgebot.service;

import com.example.purgebot.exception.OperationInProgressException;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 进程级单飞标记：同一时刻最多一个清理或同步在执行，后来的请求立即被拒绝。
 */
@Component
public class OperationGuard {

    private final AtomicReference<String> active = new AtomicReference<>();

    /**
     * @throws OperationInProgressException 已有操作在执行
     */
    public void acquire(String operation) {
        if (!tryAcquire(operation)) {
            String holder = active.get();
            throw new OperationInProgressException(holder != null ? holder : "unknown");
        }
    }

    /**
     * 不抛异常的版本，已有操作在执行时返回 false。
     */
    public boolean tryAcquire(String operation) {
        return active.compareAndSet(null, operation);
    }

    public void release(String operation) {
        active.compareAndSet(operation, null);
    }

    public boolean isBusy() {
        return active.get() != null;
    }

    public String activeOperation() {
        return active.get();
    }
}
