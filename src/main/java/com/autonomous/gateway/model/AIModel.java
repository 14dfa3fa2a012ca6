package com.autonomous.gateway.model;

import lombok.Value;

@Value
public class AIModel {
    String id;
    String name;
    ProviderType providerId;
    ModelCapabilities capabilities;
}
