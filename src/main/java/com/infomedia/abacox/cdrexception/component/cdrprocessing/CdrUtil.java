package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.extern.log4j.Log4j2;

import java.util.List;

@Log4j2
public class CdrUtil {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    // Second line of CUCM flat files declares column types instead of values
    private static final List<String> TYPE_DEFINITION_PREFIXES = List.of("INTEGER", "VARCHAR", "UNIQUEIDENTIFIER", "CHAR");

    private CdrUtil() {
    }

    public static String cleanCsvField(String field) {
        if (field == null) return "";
        String cleaned = field.trim();
        cleaned = cleaned.replace("\u0000", "");
        if (!cleaned.isEmpty() && cleaned.charAt(0) == BYTE_ORDER_MARK) {
            cleaned = cleaned.substring(1).trim();
        }

        if (cleaned.startsWith("\"") && cleaned.endsWith("\"") && cleaned.length() >= 2) {
            cleaned = cleaned.substring(1, cleaned.length() - 1);
        }
        return cleaned;
    }

    /**
     * CUCM exports IPv4 addresses as signed 32-bit integers in little-endian byte order.
     */
    public static String decimalToIp(long dec) {
        long unsigned = dec & 0xFFFFFFFFL;
        return String.format("%d.%d.%d.%d",
                (unsigned & 0xFF),
                (unsigned >> 8) & 0xFF,
                (unsigned >> 16) & 0xFF,
                (unsigned >> 24) & 0xFF);
    }

    /**
     * Renders an exported address column. Decimal values become dotted quads, anything else
     * (IPv6, already formatted values) is returned as exported.
     */
    public static String formatIpAddress(String rawValue) {
        if (rawValue == null || rawValue.isEmpty() || rawValue.equals("0") || rawValue.equals("-1")) {
            return rawValue == null ? "" : rawValue;
        }
        try {
            return decimalToIp(Long.parseLong(rawValue));
        } catch (NumberFormatException e) {
            log.trace("Address '{}' is not decimal, keeping as exported", rawValue);
            return rawValue;
        }
    }

    public static boolean isBlankRow(String[] fields) {
        if (fields == null || fields.length == 0) return true;
        for (String field : fields) {
            if (!cleanCsvField(field).isEmpty()) return false;
        }
        return true;
    }

    public static boolean isTypeDefinitionRow(String[] fields) {
        if (fields == null || fields.length == 0) return false;
        String first = cleanCsvField(fields[0]).toUpperCase();
        return TYPE_DEFINITION_PREFIXES.stream().anyMatch(first::startsWith);
    }

    public static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    public static String joinRow(String[] fields) {
        return fields == null ? "" : String.join(",", fields);
    }
}
