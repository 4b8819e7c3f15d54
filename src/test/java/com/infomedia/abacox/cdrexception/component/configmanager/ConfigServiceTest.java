package com.infomedia.abacox.cdrexception.component.configmanager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class ConfigServiceTest {

    @Mock
    private ConfigValueService configValueService;

    private ConfigService configService;
    private final Map<ConfigKey, String> values = new EnumMap<>(ConfigKey.class);

    @BeforeEach
    void setUp() {
        for (ConfigKey key : ConfigKey.values()) {
            values.put(key, key.getDefaultValue());
        }
        lenient().when(configValueService.getValue(any(ConfigKey.class)))
                .thenAnswer(invocation -> {
                    ConfigKey key = invocation.getArgument(0);
                    return new Value(key.getKey(), values.get(key));
                });
        configService = new ConfigService(configValueService);
    }

    @Test
    void shouldBuildSettingsFromDefaults() {
        ExceptionSettings settings = configService.getExceptionSettings();

        assertThat(settings.getExcludedCauseCodes()).containsExactlyInAnyOrder(0, 16, 17, 31, 393216);
        assertThat(settings.getCauseAmberThreshold()).isEqualTo(3);
        assertThat(settings.getCauseRedThreshold()).isEqualTo(5);
        assertThat(settings.getMosThreshold()).isEqualByComparingTo("3.7");
        assertThat(settings.getCcrThreshold()).isEqualByComparingTo("0.01");
        assertThat(settings.getMosAmberThreshold()).isEqualTo(3);
        assertThat(settings.getMosRedThreshold()).isEqualTo(5);
        assertThat(settings.getMosMetricKey()).isEqualTo("MLQKav");
        assertThat(settings.getCcrMetricKey()).isEqualTo("CCR");
        assertThat(settings.isExcluded(16)).isTrue();
        assertThat(settings.isExcluded(41)).isFalse();
    }

    @Test
    void shouldRejectNonNumericThreshold() {
        values.put(ConfigKey.MOS_THRESHOLD, "high");

        assertThatThrownBy(configService::getExceptionSettings)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("mosThreshold");
    }

    @Test
    void shouldRejectRedBelowAmber() {
        values.put(ConfigKey.CAUSE_CODE_AMBER_THRESHOLD, "6");

        assertThatThrownBy(configService::getExceptionSettings)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Cause code red threshold");
    }

    @Test
    void shouldRejectZeroAmberThreshold() {
        values.put(ConfigKey.MOS_AMBER_THRESHOLD, "0");

        assertThatThrownBy(configService::getExceptionSettings)
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldRejectNegativeQualityThreshold() {
        values.put(ConfigKey.CCR_THRESHOLD, "-0.1");

        assertThatThrownBy(configService::getExceptionSettings)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("CCR");
    }

    @Test
    void shouldRejectBlankMetricKey() {
        values.put(ConfigKey.CCR_METRIC_KEY, " ");

        assertThatThrownBy(configService::getExceptionSettings)
                .isInstanceOf(ConfigurationException.class);
    }
}
