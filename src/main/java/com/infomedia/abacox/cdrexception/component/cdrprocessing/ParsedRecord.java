package com.infomedia.abacox.cdrexception.component.cdrprocessing;

/**
 * Result of parsing one export row: a {@link CallRecord}, a {@link QualityRecord} or a {@link RowParseError}.
 * The concrete type is decided by the schema of the file header, never by the row itself.
 */
public interface ParsedRecord {

    /**
     * @return The name of the file the row was read from.
     */
    String getSourceName();

    /**
     * @return The physical line number of the row inside its file.
     */
    long getLineNumber();
}
