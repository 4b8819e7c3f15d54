package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.Getter;

/**
 * The side of a call a device or a measurement belongs to.
 */
@Getter
public enum CallLeg {
    SOURCE("Source"),
    DESTINATION("Destination");

    private final String label;

    CallLeg(String label) {
        this.label = label;
    }
}
