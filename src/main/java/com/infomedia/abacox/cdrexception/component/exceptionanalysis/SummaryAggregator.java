package com.infomedia.abacox.cdrexception.component.exceptionanalysis;

import com.infomedia.abacox.cdrexception.component.cdrprocessing.Call;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.DateTimeUtil;
import com.infomedia.abacox.cdrexception.component.configmanager.ExceptionSettings;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Component
@Log4j2
public class SummaryAggregator {

    public ExceptionSummary aggregate(Collection<Call> calls, ExceptionSettings settings) {
        ExceptionCriteria criteria = new ExceptionCriteria(settings);
        Map<LocalDate, Long> byDate = new TreeMap<>();
        Map<String, Long> byDevice = new HashMap<>();
        Map<Integer, Long> byCause = new HashMap<>();
        long notable = 0;

        for (Call call : calls) {
            if (!criteria.isNotable(call)) {
                continue;
            }
            notable++;
            byDate.merge(DateTimeUtil.toUtcDate(call.getOriginationTime()), 1L, Long::sum);

            // A call counts once per device even if the device shows up in several of its groups
            Set<String> devices = new LinkedHashSet<>();
            criteria.keysFor(call).forEach(key -> devices.add(key.deviceName()));
            devices.forEach(device -> byDevice.merge(device, 1L, Long::sum));

            criteria.reportableCauseCodes(call).forEach(code -> byCause.merge(code, 1L, Long::sum));
        }
        log.debug("{} of {} calls in range are notable", notable, calls.size());

        return ExceptionSummary.builder()
                .callsByDate(Collections.unmodifiableMap(new LinkedHashMap<>(byDate)))
                .callsByDevice(sortByCountDescending(byDevice))
                .callsByCauseCode(sortByCountDescending(byCause))
                .notableCalls(notable)
                .build();
    }

    private static <K extends Comparable<K>> Map<K, Long> sortByCountDescending(Map<K, Long> counts) {
        Map<K, Long> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<K, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<K, Long>comparingByKey()))
                .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
        return Collections.unmodifiableMap(sorted);
    }
}
