package com.example.purgebot.platform;

import java.util.List;

/**
 * 聊天平台能力抽象：列出分类与频道、倒序分页抓取消息、单条/批量删除。
 */
public interface ChannelMessageStore {

    /**
     * Discord 批量删除只接受 14 天以内的消息。
     */
    int BULK_DELETE_MAX_AGE_DAYS = 14;

    /**
     * 单次批量删除与单页抓取的上限。
     */
    int MAX_BATCH_SIZE = 100;

    boolean isConnected();

    String guildName();

    /**
     * @throws GuildUnavailableException 服务器不可达
     */
    List<PlatformCategory> listCategories();

    List<PlatformChannel> listChannelsIn(PlatformCategory category);

    /**
     * 按时间倒序返回 beforeId 之前的最多 limit 条消息；beforeId 为 null 时从最新一条开始。
     */
    List<ChannelMessage> fetchMessagesBefore(PlatformChannel channel, String beforeId, int limit);

    void deleteMessage(PlatformChannel channel, String messageId);

    /**
     * @return 实际删除的条数
     */
    int deleteBatch(PlatformChannel channel, List<String> messageIds);
}
