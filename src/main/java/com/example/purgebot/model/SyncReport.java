package com.example.purgebot.model;

import java.util.List;

/**
 * full sync 的结构化结果：平台上的分类/频道数量、变更数与明细。
 */
public record SyncReport(int categories, int channels, int changes, List<SyncChange> details) {

    public SyncReport {
        details = details == null ? List.of() : List.copyOf(details);
    }
}
