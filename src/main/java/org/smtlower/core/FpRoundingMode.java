package org.smtlower.core;

/**
 * IEEE-754 舍入模式及其 SMT-LIB 名称。
 */
public enum FpRoundingMode {

    RNE("roundNearestTiesToEven"),
    RNA("roundNearestTiesToAway"),
    RTP("roundTowardPositive"),
    RTN("roundTowardNegative"),
    RTZ("roundTowardZero");

    private final String smtName;

    FpRoundingMode(String smtName) {
        this.smtName = smtName;
    }

    public String getSmtName() {
        return smtName;
    }
}
