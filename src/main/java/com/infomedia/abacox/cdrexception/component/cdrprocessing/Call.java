package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.Value;

import java.time.Instant;

/**
 * A call-detail record with the quality measured on each of its legs, as produced by {@link CallIndex}.
 */
@Value
public class Call {
    CallRecord record;
    LegQuality sourceQuality;
    LegQuality destinationQuality;

    public CallId getCallId() {
        return record.getCallId();
    }

    public Instant getOriginationTime() {
        return record.getOriginationTime();
    }

    public String getDeviceName(CallLeg leg) {
        return record.getDeviceName(leg);
    }

    public LegQuality getQuality(CallLeg leg) {
        return leg == CallLeg.SOURCE ? sourceQuality : destinationQuality;
    }
}
