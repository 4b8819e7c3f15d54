package com.infomedia.abacox.cdrexception.component.exceptionanalysis;

import com.infomedia.abacox.cdrexception.component.cdrprocessing.Call;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.CallLeg;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.LegQuality;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.QualityMetrics;
import com.infomedia.abacox.cdrexception.component.configmanager.ExceptionSettings;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The membership rules shared by {@link ExceptionClassifier} and {@link SummaryAggregator}.
 */
public class ExceptionCriteria {

    private final ExceptionSettings settings;

    public ExceptionCriteria(ExceptionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
    }

    public boolean isReportableCause(Integer causeCode) {
        return causeCode != null && !settings.isExcluded(causeCode);
    }

    /**
     * A leg is poor when its average MoS is strictly below the MoS threshold or its conceal ratio is strictly
     * above the CCR threshold. A missing value never counts against the leg.
     */
    public boolean isPoorQuality(QualityMetrics metrics) {
        if (metrics == null) {
            return false;
        }
        boolean lowMos = metrics.avgMos() != null && metrics.avgMos().compareTo(settings.getMosThreshold()) < 0;
        boolean highCcr = metrics.ccr() != null && metrics.ccr().compareTo(settings.getCcrThreshold()) > 0;
        return lowMos || highCcr;
    }

    public boolean isPoorQuality(LegQuality legQuality) {
        return legQuality != null && isPoorQuality(legQuality.metrics());
    }

    /**
     * Reportable cause codes of a call, originating cause first, each code once.
     */
    public Set<Integer> reportableCauseCodes(Call call) {
        Set<Integer> codes = new LinkedHashSet<>(2);
        if (isReportableCause(call.getRecord().getOrigCauseCode())) {
            codes.add(call.getRecord().getOrigCauseCode());
        }
        if (isReportableCause(call.getRecord().getDestCauseCode())) {
            codes.add(call.getRecord().getDestCauseCode());
        }
        return codes;
    }

    /**
     * Every group a call belongs to: each known device with each reportable cause, plus each poor-quality leg.
     * A key is only produced when the device it belongs to is known.
     */
    public List<ExceptionGroupKey> keysFor(Call call) {
        List<ExceptionGroupKey> keys = new ArrayList<>(6);
        Integer origCause = call.getRecord().getOrigCauseCode();
        Integer destCause = call.getRecord().getDestCauseCode();
        for (CallLeg role : CallLeg.values()) {
            String device = call.getDeviceName(role);
            if (isBlank(device)) {
                continue;
            }
            if (isReportableCause(origCause)) {
                keys.add(ExceptionGroupKey.cause(device, role, ExceptionDimension.ORIG_CAUSE, origCause));
            }
            if (isReportableCause(destCause)) {
                keys.add(ExceptionGroupKey.cause(device, role, ExceptionDimension.DEST_CAUSE, destCause));
            }
        }
        for (CallLeg leg : CallLeg.values()) {
            LegQuality quality = call.getQuality(leg);
            if (isPoorQuality(quality) && !isBlank(quality.deviceName())) {
                keys.add(ExceptionGroupKey.poorQuality(quality.deviceName(), leg));
            }
        }
        return keys;
    }

    public boolean hasPoorQuality(Call call) {
        return isPoorQuality(call.getQuality(CallLeg.SOURCE)) || isPoorQuality(call.getQuality(CallLeg.DESTINATION));
    }

    /**
     * A call is notable when it carries a reportable cause code or a poor-quality leg, whether or not the
     * device involved is known.
     */
    public boolean isNotable(Call call) {
        return !reportableCauseCodes(call).isEmpty() || hasPoorQuality(call);
    }

    public Classification classify(ExceptionGroupKey key, int instanceCount) {
        if (key.dimension().isCauseDimension()) {
            return Classification.of(instanceCount, settings.getCauseAmberThreshold(), settings.getCauseRedThreshold());
        }
        return Classification.of(instanceCount, settings.getMosAmberThreshold(), settings.getMosRedThreshold());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
