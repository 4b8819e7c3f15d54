package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CorrelationResult {
    List<Call> calls;
    int orphanQualityRecords;
    int replacedCallRecords;
    int attachedQualityRecords;
}
