package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class CallRecord implements ParsedRecord {
    String sourceName;
    long lineNumber;

    CallId callId;
    Instant originationTime;
    String origIp;
    String destIp;
    String callingNumber;
    String originalCalledNumber;
    String finalCalledNumber;
    // Absent when the export left the column empty
    Integer origCauseCode;
    Integer destCauseCode;
    String origDeviceName;
    String destDeviceName;
    int durationSeconds;

    // Embedded per-leg metrics (origVarVQMetrics/destVarVQMetrics), when the export carries them
    QualityMetrics origQuality;
    QualityMetrics destQuality;

    public String getDeviceName(CallLeg leg) {
        return leg == CallLeg.SOURCE ? origDeviceName : destDeviceName;
    }

    public QualityMetrics getEmbeddedQuality(CallLeg leg) {
        return leg == CallLeg.SOURCE ? origQuality : destQuality;
    }
}
