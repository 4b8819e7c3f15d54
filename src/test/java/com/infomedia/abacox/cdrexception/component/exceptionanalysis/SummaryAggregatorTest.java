package com.infomedia.abacox.cdrexception.component.exceptionanalysis;

import com.infomedia.abacox.cdrexception.component.cdrprocessing.Call;
import com.infomedia.abacox.cdrexception.component.configmanager.ExceptionSettings;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.infomedia.abacox.cdrexception.testsupport.CallFixtures.call;
import static com.infomedia.abacox.cdrexception.testsupport.CallFixtures.callRecord;
import static com.infomedia.abacox.cdrexception.testsupport.CallFixtures.defaultSettings;
import static com.infomedia.abacox.cdrexception.testsupport.CallFixtures.quality;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class SummaryAggregatorTest {

    private final SummaryAggregator aggregator = new SummaryAggregator();
    private final ExceptionSettings settings = defaultSettings();

    @Test
    void shouldCountBelowThresholdActivity() {
        // GIVEN two poor-quality calls, below the quality amber threshold
        List<Call> calls = List.of(
                call(callRecord().origDeviceName("Phone-B").build(), quality("Phone-B", "3.5", null), null),
                call(callRecord().origDeviceName("Phone-B").build(), quality("Phone-B", "3.5", null), null));

        // WHEN
        ExceptionSummary summary = aggregator.aggregate(calls, settings);

        // THEN
        assertThat(summary.getNotableCalls()).isEqualTo(2);
        assertThat(summary.getCallsByDevice()).containsExactly(entry("Phone-B", 2L));
        assertThat(summary.getCallsByCauseCode()).isEmpty();
    }

    @Test
    void shouldIgnoreCallsWithOnlyExcludedCausesAndGoodQuality() {
        List<Call> calls = List.of(
                call(callRecord().origDeviceName("SEP-A").origCauseCode(16).destCauseCode(0).build(),
                        quality("SEP-A", "4.4", "0.0"), null));

        ExceptionSummary summary = aggregator.aggregate(calls, settings);

        assertThat(summary.getNotableCalls()).isZero();
        assertThat(summary.getCallsByDate()).isEmpty();
        assertThat(summary.getCallsByDevice()).isEmpty();
    }

    @Test
    void shouldCountCallOncePerDeviceAndCauseCode() {
        // Same device on both sides and the same code on both legs
        Call loopback = call(callRecord().origDeviceName("SEP-A").destDeviceName("SEP-A")
                .origCauseCode(41).destCauseCode(41).build(), quality("SEP-A", "1.0", null), null);

        ExceptionSummary summary = aggregator.aggregate(List.of(loopback), settings);

        assertThat(summary.getCallsByDevice()).containsExactly(entry("SEP-A", 1L));
        assertThat(summary.getCallsByCauseCode()).containsExactly(entry(41, 1L));
    }

    @Test
    void shouldCountNotableCallsWithoutDevicesInDateAndCauseTotals() {
        Call anonymous = call(callRecord().origCauseCode(58).build());

        ExceptionSummary summary = aggregator.aggregate(List.of(anonymous), settings);

        assertThat(summary.getCallsByDate()).containsOnlyKeys(LocalDate.of(2023, 11, 14));
        assertThat(summary.getCallsByCauseCode()).containsExactly(entry(58, 1L));
        assertThat(summary.getCallsByDevice()).isEmpty();
    }

    @Test
    void shouldOrderTablesByCountThenKey() {
        List<Call> calls = new ArrayList<>();
        calls.add(call(callRecord().origDeviceName("SEP-C").origCauseCode(41).build()));
        calls.add(call(callRecord().origDeviceName("SEP-B").origCauseCode(58).build()));
        calls.add(call(callRecord().origDeviceName("SEP-A").origCauseCode(3).build()));
        calls.add(call(callRecord().origDeviceName("SEP-C").origCauseCode(3).build()));

        ExceptionSummary summary = aggregator.aggregate(calls, settings);

        assertThat(summary.getCallsByDevice()).containsExactly(
                entry("SEP-C", 2L), entry("SEP-A", 1L), entry("SEP-B", 1L));
        assertThat(summary.getCallsByCauseCode()).containsExactly(
                entry(3, 2L), entry(41, 1L), entry(58, 1L));
    }

    @Test
    void shouldBucketByUtcDateChronologically() {
        List<Call> calls = List.of(
                call(callRecord().origCauseCode(41).originationTime(Instant.parse("2023-11-15T00:00:00Z")).build()),
                call(callRecord().origCauseCode(41).originationTime(Instant.parse("2023-11-13T23:59:59Z")).build()),
                call(callRecord().origCauseCode(41).originationTime(Instant.parse("2023-11-15T12:00:00Z")).build()));

        ExceptionSummary summary = aggregator.aggregate(calls, settings);

        assertThat(summary.getCallsByDate()).containsExactly(
                entry(LocalDate.of(2023, 11, 13), 1L),
                entry(LocalDate.of(2023, 11, 15), 2L));
    }
}
