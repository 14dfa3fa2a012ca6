package com.autonomous.gateway.model;

import lombok.Value;

@Value
public class ImageContent {
    String data; // base64 or URL, depending on source
    String mimeType;
    Source source;

    public enum Source {
        BASE64, URL, LOCAL_FILE
    }
}
