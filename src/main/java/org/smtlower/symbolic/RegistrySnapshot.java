package org.smtlower.symbolic;

import lombok.Getter;

/**
 * 共享登记表在某一时刻的大小。登记表只追加，因此回放结束后按这些大小截取，就得到回放期间新增的条目；
 * lowering 失败时按这些大小截断，就恢复到回放之前的状态。
 */
@Getter
public final class RegistrySnapshot {

    private final int usedKinds;
    private final int usedLabels;
    private final int observables;
    private final int codeSegments;
    private final int tables;
    private final int arrays;
    private final int assertions;
    private final int uninterpreted;
    private final int userFunctions;
    private final int definitions;
    private final int axioms;

    public RegistrySnapshot(int usedKinds, int usedLabels, int observables, int codeSegments, int tables, int arrays,
                            int assertions, int uninterpreted, int userFunctions, int definitions, int axioms) {
        this.usedKinds = usedKinds;
        this.usedLabels = usedLabels;
        this.observables = observables;
        this.codeSegments = codeSegments;
        this.tables = tables;
        this.arrays = arrays;
        this.assertions = assertions;
        this.uninterpreted = uninterpreted;
        this.userFunctions = userFunctions;
        this.definitions = definitions;
        this.axioms = axioms;
    }

    @Override
    public String toString() {
        return "RegistrySnapshot{kinds=" + usedKinds + ", labels=" + usedLabels + ", observables=" + observables
                + ", codeSegments=" + codeSegments + ", tables=" + tables + ", arrays=" + arrays
                + ", assertions=" + assertions + ", uninterpreted=" + uninterpreted
                + ", userFunctions=" + userFunctions + ", definitions=" + definitions + ", axioms=" + axioms + "}";
    }
}
