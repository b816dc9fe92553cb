package com.chartsignal.backend.model;

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Channel-neutral alert payload. Dispatchers decide how to render it.
 */
@Data
@Builder
public class AlertNotification {
    private String title;
    private String body;
    private AlertSeverity severity;
    private String symbol;
    private long timestamp;
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
