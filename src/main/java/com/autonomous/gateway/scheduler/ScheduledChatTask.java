package com.autonomous.gateway.scheduler;

import com.autonomous.gateway.model.ProviderType;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A chat message resent to the same session on every tick. The session the task posts
 * into is tracked separately in a {@link TaskBinding}, since it only exists after
 * initialization.
 */
@Value
@Builder(toBuilder = true)
public class ScheduledChatTask implements ScheduledTask {
    @Builder.Default
    String id = UUID.randomUUID().toString();
    String title;
    String taskRequest;
    long intervalSeconds;
    boolean executeImmediately;
    /** Null means the gateway default provider. */
    ProviderType providerId;
    /** Null means the provider's default model. */
    String model;
    @Builder.Default
    long createdAt = System.currentTimeMillis();
}
