package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.Getter;

@Getter
public enum RowParseErrorType {
    MISSING_CALL_ID("Call manager id or global call id is missing"),
    INVALID_DATE("Timestamp is missing or is not a valid epoch value"),
    INVALID_DURATION("Duration is not a non-negative integer"),
    INVALID_CAUSE_CODE("Cause code is present but is not an integer"),
    INSUFFICIENT_FIELDS("Row has fewer fields than the columns required by the header"),
    MALFORMED_ROW("Row could not be split into CSV fields"),
    UNHANDLED_EXCEPTION("An unexpected error occurred while parsing the row");

    private final String description;

    RowParseErrorType(String description) {
        this.description = description;
    }
}
