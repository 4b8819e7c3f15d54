package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import java.math.BigDecimal;

/**
 * Voice quality values extracted from a composite varVQMetrics value.
 * Either value may be null when the exporter left it out for the call type.
 *
 * @param avgMos Average MoS over the call (lower is worse).
 * @param ccr    Cumulative conceal ratio (higher is worse).
 */
public record QualityMetrics(BigDecimal avgMos, BigDecimal ccr) {

    public boolean isEmpty() {
        return avgMos == null && ccr == null;
    }
}
