package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

/**
 * Diagnostic counters for the read/parse stage of one run.
 */
@Data
public class IngestionStats {
    private int filesRead;
    private int filesSkipped;
    private int callDetailFiles;
    private int callQualityFiles;
    private long rowsRead;
    private long rowsSkipped;
    private long callRecords;
    private long qualityRecords;
    private long rowParseErrors;
    private final Map<RowParseErrorType, Long> parseErrorsByType = new EnumMap<>(RowParseErrorType.class);

    public void recordParseError(RowParseError error) {
        rowParseErrors++;
        parseErrorsByType.merge(error.getType(), 1L, Long::sum);
    }
}
