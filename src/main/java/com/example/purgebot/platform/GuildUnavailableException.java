package com.example.purgebot.platform;

/**
 * 目标服务器不可达或未连接：运行级致命错误。
 */
public class GuildUnavailableException extends MessageStoreException {

    public GuildUnavailableException(String message) {
        super(message);
    }

    public GuildUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
