package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * A row that could not be turned into a typed record. Never thrown; it is counted and the run continues.
 */
@Value
@Builder
public class RowParseError implements ParsedRecord {
    String sourceName;
    long lineNumber;
    RowParseErrorType type;
    String reason;
    @ToString.Exclude
    String rawRow;
}
