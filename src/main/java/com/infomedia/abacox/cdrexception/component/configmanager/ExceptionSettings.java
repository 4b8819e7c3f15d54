package com.infomedia.abacox.cdrexception.component.configmanager;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Validated, read-only thresholds for one analysis run.
 * <p>
 * {@code mosThreshold}/{@code ccrThreshold} decide whether a single leg has poor quality;
 * the amber/red pairs are instance counts that make a group of exceptions notable.
 */
@Value
@Builder(toBuilder = true)
public class ExceptionSettings {
    @Singular
    Set<Integer> excludedCauseCodes;
    int causeAmberThreshold;
    int causeRedThreshold;
    BigDecimal mosThreshold;
    BigDecimal ccrThreshold;
    int mosAmberThreshold;
    int mosRedThreshold;
    @Builder.Default
    String mosMetricKey = ConfigKey.MOS_METRIC_KEY.getDefaultValue();
    @Builder.Default
    String ccrMetricKey = ConfigKey.CCR_METRIC_KEY.getDefaultValue();

    public boolean isExcluded(Integer causeCode) {
        return excludedCauseCodes.contains(causeCode);
    }
}
