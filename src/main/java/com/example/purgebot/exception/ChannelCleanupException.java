package com.example.purgebot.exception;

import com.example.purgebot.platform.MessageStoreException;

/**
 * 频道清理中途失败，携带失败前已删除的消息数。
 */
public class ChannelCleanupException extends MessageStoreException {

    private final int purged;

    public ChannelCleanupException(String message, int purged, Throwable cause) {
        super(message, cause);
        this.purged = purged;
    }

    public int getPurged() {
        return purged;
    }
}
