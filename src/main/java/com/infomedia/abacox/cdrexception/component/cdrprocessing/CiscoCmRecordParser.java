package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.extern.log4j.Log4j2;

import java.time.Instant;
import java.util.Objects;

/**
 * Turns one row of a Cisco CM CDR or CMR flat file into a typed record.
 * <p>
 * Parsing is a pure function of the row and the header in effect for its file. Malformed data never
 * throws: every row yields exactly one {@link CallRecord}, {@link QualityRecord} or {@link RowParseError}.
 */
@Log4j2
public class CiscoCmRecordParser {

    private static final String CMR_RECORD_TYPE = "2";

    private final VqMetricsParser vqMetricsParser;

    public CiscoCmRecordParser(VqMetricsParser vqMetricsParser) {
        this.vqMetricsParser = Objects.requireNonNull(vqMetricsParser, "vqMetricsParser cannot be null");
    }

    /**
     * Rows that carry no record at all: the column-type line after the header, a repeated header,
     * and CMR rows that some exporters interleave into CDR files.
     */
    public boolean isSkippableRow(String[] row, CdrHeader header) {
        if (CdrUtil.isBlankRow(row) || CdrUtil.isTypeDefinitionRow(row)) {
            return true;
        }
        String first = CdrUtil.cleanCsvField(row[0]);
        if (CdrColumns.CDR_RECORD_TYPE.equalsIgnoreCase(first) || CdrColumns.CALL_MANAGER_ID.equalsIgnoreCase(first)
                || CdrColumns.CALL_MANAGER_ID_ALIAS.equalsIgnoreCase(first)) {
            log.debug("Skipping header line found mid-stream.");
            return true;
        }
        if (header.getSchema() == CdrSchema.CALL_DETAIL && header.hasColumn(CdrColumns.CDR_RECORD_TYPE)
                && CMR_RECORD_TYPE.equals(header.get(row, CdrColumns.CDR_RECORD_TYPE))) {
            log.debug("Skipping CMR record (cdrRecordType=2) inside a CDR file.");
            return true;
        }
        return false;
    }

    public ParsedRecord parse(String[] row, CdrHeader header, String sourceName, long lineNumber) {
        if (!header.isRecognised()) {
            throw new IllegalArgumentException("Cannot parse rows of a file whose header matches no known schema: " + sourceName);
        }
        try {
            if (row.length < header.getMinExpectedFields()) {
                throw new RowFormatException(RowParseErrorType.INSUFFICIENT_FIELDS,
                        "Found " + row.length + " fields, expected at least " + header.getMinExpectedFields());
            }
            return switch (header.getSchema()) {
                case CALL_DETAIL -> parseCallRecord(row, header, sourceName, lineNumber);
                case CALL_QUALITY -> parseQualityRecord(row, header, sourceName, lineNumber);
            };
        } catch (RowFormatException e) {
            return error(row, sourceName, lineNumber, e.getType(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected error parsing {} line {}", sourceName, lineNumber, e);
            return error(row, sourceName, lineNumber, RowParseErrorType.UNHANDLED_EXCEPTION, e.toString());
        }
    }

    private CallRecord parseCallRecord(String[] row, CdrHeader header, String sourceName, long lineNumber) {
        CallId callId = parseCallId(row, header);
        Instant origination = parseTimestamp(header.get(row, CdrColumns.DATE_TIME_ORIGINATION), CdrColumns.DATE_TIME_ORIGINATION);

        CallRecord callRecord = CallRecord.builder()
                .sourceName(sourceName)
                .lineNumber(lineNumber)
                .callId(callId)
                .originationTime(origination)
                .origIp(CdrUtil.formatIpAddress(header.get(row, CdrColumns.ORIG_IP_ADDR)))
                .destIp(CdrUtil.formatIpAddress(header.get(row, CdrColumns.DEST_IP_ADDR)))
                .callingNumber(header.get(row, CdrColumns.CALLING_PARTY_NUMBER))
                .originalCalledNumber(header.get(row, CdrColumns.ORIGINAL_CALLED_PARTY_NUMBER))
                .finalCalledNumber(header.get(row, CdrColumns.FINAL_CALLED_PARTY_NUMBER))
                .origCauseCode(parseCauseCode(header.get(row, CdrColumns.ORIG_CAUSE_VALUE), CdrColumns.ORIG_CAUSE_VALUE))
                .destCauseCode(parseCauseCode(header.get(row, CdrColumns.DEST_CAUSE_VALUE), CdrColumns.DEST_CAUSE_VALUE))
                .origDeviceName(CdrUtil.emptyToNull(header.get(row, CdrColumns.ORIG_DEVICE_NAME)))
                .destDeviceName(CdrUtil.emptyToNull(header.get(row, CdrColumns.DEST_DEVICE_NAME)))
                .durationSeconds(parseDuration(header.get(row, CdrColumns.DURATION)))
                .origQuality(vqMetricsParser.parse(header.get(row, CdrColumns.ORIG_VQ_METRICS)).orElse(null))
                .destQuality(vqMetricsParser.parse(header.get(row, CdrColumns.DEST_VQ_METRICS)).orElse(null))
                .build();
        log.trace("Parsed CDR {} from {} line {}", callId, sourceName, lineNumber);
        return callRecord;
    }

    private QualityRecord parseQualityRecord(String[] row, CdrHeader header, String sourceName, long lineNumber) {
        CallId callId = parseCallId(row, header);
        Instant timestamp = parseTimestamp(header.get(row, CdrColumns.DATE_TIME_STAMP), CdrColumns.DATE_TIME_STAMP);

        QualityRecord qualityRecord = QualityRecord.builder()
                .sourceName(sourceName)
                .lineNumber(lineNumber)
                .callId(callId)
                .timestamp(timestamp)
                .deviceName(CdrUtil.emptyToNull(header.get(row, CdrColumns.DEVICE_NAME)))
                .metrics(vqMetricsParser.parse(header.get(row, CdrColumns.VQ_METRICS)).orElse(null))
                .durationSeconds(parseDuration(header.get(row, CdrColumns.DURATION)))
                .build();
        log.trace("Parsed CMR {} from {} line {}", callId, sourceName, lineNumber);
        return qualityRecord;
    }

    private CallId parseCallId(String[] row, CdrHeader header) {
        String callManagerId = header.get(row, CdrColumns.CALL_MANAGER_ID);
        String globalCallId = header.get(row, CdrColumns.GLOBAL_CALL_ID);
        if (callManagerId.isEmpty() || globalCallId.isEmpty()) {
            throw new RowFormatException(RowParseErrorType.MISSING_CALL_ID,
                    "callManagerId='" + callManagerId + "', globalCallId='" + globalCallId + "'");
        }
        return new CallId(callManagerId, globalCallId);
    }

    private Instant parseTimestamp(String value, String column) {
        Instant instant = DateTimeUtil.parseEpochSeconds(value);
        if (instant == null) {
            throw new RowFormatException(RowParseErrorType.INVALID_DATE, column + " '" + value + "' is not an epoch timestamp");
        }
        return instant;
    }

    private Integer parseCauseCode(String value, String column) {
        if (value.isEmpty()) return null;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new RowFormatException(RowParseErrorType.INVALID_CAUSE_CODE, column + " '" + value + "' is not an integer");
        }
    }

    private int parseDuration(String value) {
        if (value.isEmpty()) return 0;
        try {
            int duration = Integer.parseInt(value);
            if (duration < 0) {
                throw new RowFormatException(RowParseErrorType.INVALID_DURATION, "duration " + duration + " is negative");
            }
            return duration;
        } catch (NumberFormatException e) {
            throw new RowFormatException(RowParseErrorType.INVALID_DURATION, "duration '" + value + "' is not an integer");
        }
    }

    private RowParseError error(String[] row, String sourceName, long lineNumber, RowParseErrorType type, String reason) {
        log.debug("Unable to parse {} line {} ({}): {}", sourceName, lineNumber, type, reason);
        return RowParseError.builder()
                .sourceName(sourceName)
                .lineNumber(lineNumber)
                .type(type)
                .reason(reason)
                .rawRow(CdrUtil.joinRow(row))
                .build();
    }

    private static class RowFormatException extends RuntimeException {
        private final RowParseErrorType type;

        RowFormatException(RowParseErrorType type, String message) {
            super(message);
            this.type = type;
        }

        RowParseErrorType getType() {
            return type;
        }
    }
}
