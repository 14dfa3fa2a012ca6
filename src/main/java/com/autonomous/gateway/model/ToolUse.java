package com.autonomous.gateway.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class ToolUse {
    String id;
    String name;
    JsonNode input;
}
