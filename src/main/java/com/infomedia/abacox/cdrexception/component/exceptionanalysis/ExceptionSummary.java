package com.infomedia.abacox.cdrexception.component.exceptionanalysis;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Overview counters over every notable call in range, whether or not its groups were reported.
 * Maps iterate in presentation order.
 */
@Value
@Builder
public class ExceptionSummary {
    Map<LocalDate, Long> callsByDate;
    Map<String, Long> callsByDevice;
    Map<Integer, Long> callsByCauseCode;
    long notableCalls;
}
