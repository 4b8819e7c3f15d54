package com.infomedia.abacox.cdrexception.component.configmanager;

import lombok.Getter;

/**
 * Every tunable setting of the analyser. Each key holds its default value so the analyser can always run
 * without a settings file.
 */
@Getter
public enum ConfigKey {

    // --- Cause code exceptions ---
    CAUSE_CODES_EXCLUDED("0,16,17,31,393216"),
    CAUSE_CODE_AMBER_THRESHOLD("3"),
    CAUSE_CODE_RED_THRESHOLD("5"),

    // --- Call quality exceptions ---
    MOS_THRESHOLD("3.7"),
    CCR_THRESHOLD("0.01"),
    MOS_AMBER_THRESHOLD("3"),
    MOS_RED_THRESHOLD("5"),

    // --- varVQMetrics sub-field names ---
    MOS_METRIC_KEY("MLQKav"),
    CCR_METRIC_KEY("CCR");

    private final String defaultValue;

    ConfigKey(String defaultValue) {
        this.defaultValue = defaultValue;
    }

    /**
     * Converts the enum's name from UPPER_SNAKE_CASE to lowerCamelCase.
     * For example, MOS_AMBER_THRESHOLD becomes mosAmberThreshold.
     *
     * @return The lowerCamelCase representation of the enum name.
     */
    public String getKey() {
        String[] parts = this.name().toLowerCase().split("_");
        if (parts.length == 1) {
            return parts[0];
        }
        StringBuilder camelCaseString = new StringBuilder(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            String part = parts[i];
            camelCaseString.append(Character.toUpperCase(part.charAt(0)))
                    .append(part.substring(1));
        }
        return camelCaseString.toString();
    }

    /**
     * @return The lower snake_case name used by exception_settings.json files of earlier releases.
     */
    public String getLegacyKey() {
        return this.name().toLowerCase();
    }
}
