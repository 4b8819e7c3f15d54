package com.infomedia.abacox.cdrexception.component.exceptionanalysis;

import com.infomedia.abacox.cdrexception.component.cdrprocessing.Call;
import com.infomedia.abacox.cdrexception.component.configmanager.ExceptionSettings;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups calls by device, role, dimension and value, and classifies every group against the amber/red
 * instance-count thresholds of its dimension.
 */
@Component
@Log4j2
public class ExceptionClassifier {

    static final Comparator<ExceptionGroup> REPORT_ORDER = Comparator
            .comparingInt(ExceptionGroup::getInstanceCount).reversed()
            .thenComparing(ExceptionGroup::getKey, ExceptionGroupKey.NATURAL_ORDER);

    /**
     * @return Amber and red groups only, largest first.
     */
    public List<ExceptionGroup> classify(Collection<Call> calls, ExceptionSettings settings) {
        List<ExceptionGroup> reported = groupAll(calls, settings).stream()
                .filter(ExceptionGroup::isReported)
                .toList();
        log.debug("{} of the exception groups reached the amber threshold", reported.size());
        return reported;
    }

    /**
     * Every group any call contributed to, including those classified {@link Classification#NONE}, in report order.
     */
    public List<ExceptionGroup> groupAll(Collection<Call> calls, ExceptionSettings settings) {
        ExceptionCriteria criteria = new ExceptionCriteria(settings);
        Map<ExceptionGroupKey, List<Call>> members = new LinkedHashMap<>();
        for (Call call : calls) {
            for (ExceptionGroupKey key : criteria.keysFor(call)) {
                members.computeIfAbsent(key, k -> new ArrayList<>()).add(call);
            }
        }

        List<ExceptionGroup> groups = new ArrayList<>(members.size());
        members.forEach((key, groupCalls) -> groups.add(new ExceptionGroup(
                key,
                Collections.unmodifiableList(groupCalls),
                criteria.classify(key, groupCalls.size()))));
        groups.sort(REPORT_ORDER);
        log.debug("Grouped {} calls into {} exception groups", calls.size(), groups.size());
        return groups;
    }
}
