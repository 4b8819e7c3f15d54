package com.infomedia.abacox.cdrexception.component.configmanager;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

@Service
@Log4j2
@RequiredArgsConstructor
public class ConfigService {

    private final ConfigValueService configValueService;

    public Value getValue(ConfigKey configKey) {
        return configValueService.getValue(configKey);
    }

    /**
     * Builds the validated settings for a run.
     *
     * @throws ConfigurationException if any value is not a valid number or the thresholds are inconsistent.
     */
    public ExceptionSettings getExceptionSettings() {
        ExceptionSettings settings;
        try {
            settings = ExceptionSettings.builder()
                    .excludedCauseCodes(getValue(ConfigKey.CAUSE_CODES_EXCLUDED).asIntegerSet())
                    .causeAmberThreshold(getValue(ConfigKey.CAUSE_CODE_AMBER_THRESHOLD).asInteger())
                    .causeRedThreshold(getValue(ConfigKey.CAUSE_CODE_RED_THRESHOLD).asInteger())
                    .mosThreshold(getValue(ConfigKey.MOS_THRESHOLD).asBigDecimal())
                    .ccrThreshold(getValue(ConfigKey.CCR_THRESHOLD).asBigDecimal())
                    .mosAmberThreshold(getValue(ConfigKey.MOS_AMBER_THRESHOLD).asInteger())
                    .mosRedThreshold(getValue(ConfigKey.MOS_RED_THRESHOLD).asInteger())
                    .mosMetricKey(getValue(ConfigKey.MOS_METRIC_KEY).asString())
                    .ccrMetricKey(getValue(ConfigKey.CCR_METRIC_KEY).asString())
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("One or more numeric thresholds is not a valid number: " + e.getMessage(), e);
        }
        validate(settings);
        log.debug("Exception settings: {}", settings);
        return settings;
    }

    private void validate(ExceptionSettings settings) {
        requireCountPair("Cause code", settings.getCauseAmberThreshold(), settings.getCauseRedThreshold());
        requireCountPair("MoS", settings.getMosAmberThreshold(), settings.getMosRedThreshold());
        if (settings.getMosThreshold().compareTo(BigDecimal.ZERO) < 0) {
            throw new ConfigurationException("MoS threshold cannot be negative: " + settings.getMosThreshold());
        }
        if (settings.getCcrThreshold().compareTo(BigDecimal.ZERO) < 0) {
            throw new ConfigurationException("CCR threshold cannot be negative: " + settings.getCcrThreshold());
        }
        if (isBlank(settings.getMosMetricKey()) || isBlank(settings.getCcrMetricKey())) {
            throw new ConfigurationException("varVQMetrics key names for MoS and CCR must not be empty");
        }
    }

    private void requireCountPair(String name, int amber, int red) {
        if (amber < 1) {
            throw new ConfigurationException(name + " amber threshold must be at least 1, was " + amber);
        }
        if (red < amber) {
            throw new ConfigurationException(name + " red threshold (" + red + ") is below the amber threshold (" + amber + ")");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
