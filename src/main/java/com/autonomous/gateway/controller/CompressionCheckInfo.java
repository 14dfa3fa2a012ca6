package com.autonomous.gateway.controller;

import com.autonomous.gateway.model.ChatSession;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CompressionCheckInfo {
    String sessionId;
    boolean shouldCompress;
    boolean enabled;
    String strategy;
    int currentMessageCount;
    int archivedMessageCount;
    int compressionCount;

    public static CompressionCheckInfo of(ChatSession session, boolean shouldCompress) {
        return CompressionCheckInfo.builder()
            .sessionId(session.getId())
            .shouldCompress(shouldCompress)
            .enabled(session.getCompressionConfig().isEnabled())
            .strategy(session.getCompressionConfig().getStrategy().name())
            .currentMessageCount(session.getMessages().size())
            .archivedMessageCount(session.getArchivedMessages().size())
            .compressionCount(session.getCompressionCount())
            .build();
    }
}
