package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Column positions read from the header of one export file, plus the schema they identify.
 */
@Getter
@Log4j2
public class CdrHeader {

    private final CdrSchema schema;
    private final Map<String, Integer> positions;
    private final int minExpectedFields;

    private CdrHeader(CdrSchema schema, Map<String, Integer> positions, int minExpectedFields) {
        this.schema = schema;
        this.positions = Collections.unmodifiableMap(positions);
        this.minExpectedFields = minExpectedFields;
    }

    public static CdrHeader parse(String[] headerFields) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < headerFields.length; i++) {
            String column = CdrUtil.cleanCsvField(headerFields[i]).toLowerCase();
            if (!column.isEmpty()) {
                positions.putIfAbsent(column, i);
            }
        }
        String callManagerKey = CdrColumns.CALL_MANAGER_ID.toLowerCase();
        Integer aliasPosition = positions.get(CdrColumns.CALL_MANAGER_ID_ALIAS.toLowerCase());
        if (!positions.containsKey(callManagerKey) && aliasPosition != null) {
            positions.put(callManagerKey, aliasPosition);
        }

        CdrSchema schema = CdrSchema.detect(positions.keySet());
        int minExpected = 0;
        if (schema != null) {
            for (String required : schema.getRequiredColumns()) {
                minExpected = Math.max(minExpected, positions.get(required.toLowerCase()) + 1);
            }
        }
        log.debug("Parsed header. Schema: {}, mapped columns: {}, min expected fields: {}", schema, positions.size(), minExpected);
        return new CdrHeader(schema, positions, minExpected);
    }

    public boolean isRecognised() {
        return schema != null;
    }

    public boolean hasColumn(String column) {
        return positions.containsKey(column.toLowerCase());
    }

    /**
     * @return The cleaned field value, or an empty string when the column is unknown or beyond the row.
     */
    public String get(String[] row, String column) {
        Integer position = positions.get(column.toLowerCase());
        if (position == null || position < 0 || position >= row.length) {
            return "";
        }
        return CdrUtil.cleanCsvField(row[position]);
    }

    public List<String> getRequiredColumns() {
        return schema == null ? List.of() : schema.getRequiredColumns();
    }
}
