package com.infomedia.abacox.cdrexception.component.exceptionanalysis;

import com.infomedia.abacox.cdrexception.component.cdrprocessing.IngestionStats;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class ExceptionAnalysisResult {
    private Instant start;
    private Instant end;
    private List<ExceptionGroup> exceptions;
    private ExceptionSummary summary;
    private int amberCount;
    private int redCount;
    private IngestionStats ingestionStats;
    private int correlatedCalls;
    private int callsInRange;
    private int orphanQualityRecords;
    private int replacedCallRecords;

    /**
     * No call survived correlation and filtering. Still a valid result that produces an empty report.
     */
    public boolean isEmpty() {
        return callsInRange == 0;
    }
}
