package org.smtlower.expressions;

/**
 * 求解器原生的乘法溢出判定原语。
 * 原语本身判定的是"不溢出"，渲染时取反，使节点的值为"溢出"条件。
 */
public enum OverflowOp {

    UMUL_OVFL("bvumul_noovfl"),
    SMUL_OVFL("bvsmul_noovfl"),
    SMUL_UDFL("bvsmul_noudfl");

    private final String primitive;

    OverflowOp(String primitive) {
        this.primitive = primitive;
    }

    public String getPrimitive() {
        return primitive;
    }
}
