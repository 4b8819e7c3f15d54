package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Extracts average MoS and conceal ratio from a varVQMetrics value such as
 * {@code MLQK=4.5000;MLQKav=4.1328;MLQKmn=3.8000;MLQKmx=4.5000;ICR=0.0000;CCR=0.0021;ICRmx=0.0000;CS=0;SCS=0}.
 * <p>
 * The sub-field keys are configurable because their names have changed between CUCM releases.
 */
@Log4j2
@Getter
public class VqMetricsParser {

    private static final String PAIR_SEPARATOR = ";";
    private static final String KEY_VALUE_SEPARATOR = "=";

    private final String mosKey;
    private final String ccrKey;

    public VqMetricsParser(String mosKey, String ccrKey) {
        this.mosKey = Objects.requireNonNull(mosKey, "mosKey cannot be null");
        this.ccrKey = Objects.requireNonNull(ccrKey, "ccrKey cannot be null");
    }

    /**
     * @return The extracted metrics, or empty when neither value is present and numeric.
     */
    public Optional<QualityMetrics> parse(String composite) {
        if (composite == null || composite.isBlank()) {
            return Optional.empty();
        }
        BigDecimal avgMos = null;
        BigDecimal ccr = null;
        for (String pair : composite.split(PAIR_SEPARATOR)) {
            int separatorIndex = pair.indexOf(KEY_VALUE_SEPARATOR);
            if (separatorIndex <= 0) continue;
            String key = pair.substring(0, separatorIndex).trim();
            String rawValue = pair.substring(separatorIndex + 1).trim();
            if (key.equals(mosKey)) {
                avgMos = parseDecimal(key, rawValue);
            } else if (key.equals(ccrKey)) {
                ccr = parseDecimal(key, rawValue);
            }
        }
        QualityMetrics metrics = new QualityMetrics(avgMos, ccr);
        return metrics.isEmpty() ? Optional.empty() : Optional.of(metrics);
    }

    private BigDecimal parseDecimal(String key, String rawValue) {
        try {
            return new BigDecimal(rawValue);
        } catch (NumberFormatException e) {
            log.trace("Ignoring non-numeric {} value '{}'", key, rawValue);
            return null;
        }
    }
}
