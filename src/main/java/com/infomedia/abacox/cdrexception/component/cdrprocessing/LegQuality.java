package com.infomedia.abacox.cdrexception.component.cdrprocessing;

/**
 * Quality measured on one leg of a call, together with the device that reported it.
 * The device is usually the leg's own endpoint but differs for transferred calls.
 */
public record LegQuality(String deviceName, QualityMetrics metrics) {
}
