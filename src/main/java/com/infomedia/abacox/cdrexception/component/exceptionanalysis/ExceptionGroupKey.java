package com.infomedia.abacox.cdrexception.component.exceptionanalysis;

import com.infomedia.abacox.cdrexception.component.cdrprocessing.CallLeg;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of an exception group. Two calls land in the same group only if all four parts are equal.
 *
 * @param deviceName The device on the {@code role} side of the call, or the device that measured the quality.
 * @param role       Which side of the call the device was on.
 * @param dimension  What is being counted.
 * @param causeCode  The cause code for cause dimensions, null for {@link ExceptionDimension#QUALITY}.
 */
public record ExceptionGroupKey(String deviceName, CallLeg role, ExceptionDimension dimension, Integer causeCode) {

    public static final String POOR_QUALITY_LABEL = "POOR";

    /**
     * Device ascending, then cause code ascending with quality last, then role, then dimension.
     */
    public static final Comparator<ExceptionGroupKey> NATURAL_ORDER = Comparator
            .comparing(ExceptionGroupKey::deviceName)
            .thenComparing(ExceptionGroupKey::isQuality)
            .thenComparing(ExceptionGroupKey::causeCode, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ExceptionGroupKey::role)
            .thenComparing(ExceptionGroupKey::dimension);

    public ExceptionGroupKey {
        Objects.requireNonNull(deviceName, "deviceName cannot be null");
        Objects.requireNonNull(role, "role cannot be null");
        Objects.requireNonNull(dimension, "dimension cannot be null");
        if (dimension.isCauseDimension() && causeCode == null) {
            throw new IllegalArgumentException("A cause code is required for dimension " + dimension);
        }
        if (!dimension.isCauseDimension() && causeCode != null) {
            throw new IllegalArgumentException("Dimension " + dimension + " does not take a cause code");
        }
    }

    public static ExceptionGroupKey cause(String deviceName, CallLeg role, ExceptionDimension dimension, int causeCode) {
        return new ExceptionGroupKey(deviceName, role, dimension, causeCode);
    }

    public static ExceptionGroupKey poorQuality(String deviceName, CallLeg role) {
        return new ExceptionGroupKey(deviceName, role, ExceptionDimension.QUALITY, null);
    }

    public boolean isQuality() {
        return dimension == ExceptionDimension.QUALITY;
    }

    public String getValueLabel() {
        return isQuality() ? POOR_QUALITY_LABEL : String.valueOf(causeCode);
    }
}
