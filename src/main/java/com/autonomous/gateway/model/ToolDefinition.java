package com.autonomous.gateway.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/** A capability the model may ask to invoke; inputSchema is a JSON schema. */
@Value
public class ToolDefinition {
    String name;
    String description;
    JsonNode inputSchema;
}
