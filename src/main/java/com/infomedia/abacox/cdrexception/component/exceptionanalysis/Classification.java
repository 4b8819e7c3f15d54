package com.infomedia.abacox.cdrexception.component.exceptionanalysis;

public enum Classification {
    NONE,
    AMBER,
    RED;

    /**
     * Red wins over amber; a count below the amber threshold is not an exception.
     */
    public static Classification of(int instanceCount, int amberThreshold, int redThreshold) {
        if (instanceCount >= redThreshold) {
            return RED;
        }
        if (instanceCount >= amberThreshold) {
            return AMBER;
        }
        return NONE;
    }
}
