package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.Getter;

import java.util.List;
import java.util.Set;

/**
 * The two export layouts the analyser understands. A file's layout is decided once, from its header.
 */
@Getter
public enum CdrSchema {
    CALL_DETAIL("CDR", List.of(
            CdrColumns.CALL_MANAGER_ID,
            CdrColumns.GLOBAL_CALL_ID,
            CdrColumns.DATE_TIME_ORIGINATION)),
    CALL_QUALITY("CMR", List.of(
            CdrColumns.CALL_MANAGER_ID,
            CdrColumns.GLOBAL_CALL_ID,
            CdrColumns.DATE_TIME_STAMP,
            CdrColumns.DEVICE_NAME,
            CdrColumns.VQ_METRICS));

    private final String shortName;
    private final List<String> requiredColumns;

    CdrSchema(String shortName, List<String> requiredColumns) {
        this.shortName = shortName;
        this.requiredColumns = requiredColumns;
    }

    public boolean matches(Set<String> lowerCaseHeaders) {
        return requiredColumns.stream()
                .map(String::toLowerCase)
                .allMatch(lowerCaseHeaders::contains);
    }

    /**
     * @param lowerCaseHeaders Header names of a file, lower-cased.
     * @return The matching schema, or null if the header belongs to neither export.
     */
    public static CdrSchema detect(Set<String> lowerCaseHeaders) {
        // CMR exports never carry dateTimeOrigination, so the CDR check cannot shadow a CMR header
        for (CdrSchema schema : values()) {
            if (schema.matches(lowerCaseHeaders)) {
                return schema;
            }
        }
        return null;
    }
}
