package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class QualityRecord implements ParsedRecord {
    String sourceName;
    long lineNumber;

    CallId callId;
    Instant timestamp;
    String deviceName;
    // Null when the composite metrics value held no usable MoS or CCR
    QualityMetrics metrics;
    int durationSeconds;
}
