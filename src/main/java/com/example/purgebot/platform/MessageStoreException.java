package com.example.purgebot.platform;

/**
 * 平台调用失败（抓取或删除）。在频道级别被隔离，不会中断整次清理。
 */
public class MessageStoreException extends RuntimeException {

    public MessageStoreException(String message) {
        super(message);
    }

    public MessageStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
