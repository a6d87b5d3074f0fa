package com.example.purgebot.model;

/**
 * 清理状态机的终态：RUNNING 之后只能进入其中之一。
 */
public enum RunOutcome {
    COMPLETED,
    CANCELLED,
    FAILED
}
