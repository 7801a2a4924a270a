package com.autonomous.orchestrator.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SourceRecord {
    String title;
    String content;
    String source;
    String url;
    Double confidence;

    public boolean hasContent() {
        return content != null && !content.isBlank();
    }
}
