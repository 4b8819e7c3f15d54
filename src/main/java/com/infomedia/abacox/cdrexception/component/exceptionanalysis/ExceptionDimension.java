package com.infomedia.abacox.cdrexception.component.exceptionanalysis;

import lombok.Getter;

@Getter
public enum ExceptionDimension {
    ORIG_CAUSE("Originating cause", true),
    DEST_CAUSE("Destination cause", true),
    QUALITY("Call quality", false);

    private final String label;
    private final boolean causeDimension;

    ExceptionDimension(String label, boolean causeDimension) {
        this.label = label;
        this.causeDimension = causeDimension;
    }
}
