package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class VqMetricsParserTest {

    private static final String CISCO_METRICS =
            "MLQK=4.5000;MLQKav=4.1328;MLQKmn=3.8000;MLQKmx=4.5000;ICR=0.0000;CCR=0.0021;ICRmx=0.0000;CS=0;SCS=0";

    private final VqMetricsParser parser = new VqMetricsParser("MLQKav", "CCR");

    @Test
    void shouldExtractAverageMosAndConcealRatio() {
        Optional<QualityMetrics> metrics = parser.parse(CISCO_METRICS);

        assertThat(metrics).isPresent();
        assertThat(metrics.get().avgMos()).isEqualByComparingTo("4.1328");
        assertThat(metrics.get().ccr()).isEqualByComparingTo("0.0021");
    }

    @Test
    void shouldMatchKeysExactlyRatherThanByPrefix() {
        // MLQK and MLQKmn must not be mistaken for MLQKav
        Optional<QualityMetrics> metrics = parser.parse("MLQK=1.0;MLQKmn=2.0;MLQKav=3.5");

        assertThat(metrics).isPresent();
        assertThat(metrics.get().avgMos()).isEqualTo(new BigDecimal("3.5"));
    }

    @Test
    void shouldHonourConfiguredKeys() {
        VqMetricsParser custom = new VqMetricsParser("MOS", "CR");

        Optional<QualityMetrics> metrics = custom.parse("CR=0.2;MOS=2.9");

        assertThat(metrics).isPresent();
        assertThat(metrics.get().avgMos()).isEqualByComparingTo("2.9");
        assertThat(metrics.get().ccr()).isEqualByComparingTo("0.2");
    }

    @Test
    void shouldLeaveMissingOrNonNumericSubValueAbsent() {
        Optional<QualityMetrics> metrics = parser.parse("MLQKav=n/a;CCR=0.0300");

        assertThat(metrics).isPresent();
        assertThat(metrics.get().avgMos()).isNull();
        assertThat(metrics.get().ccr()).isEqualByComparingTo("0.03");
    }

    @Test
    void shouldReturnEmptyWhenNeitherValueIsUsable() {
        assertThat(parser.parse("ICR=0.0000;CS=0")).isEmpty();
        assertThat(parser.parse("garbage")).isEmpty();
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }
}
