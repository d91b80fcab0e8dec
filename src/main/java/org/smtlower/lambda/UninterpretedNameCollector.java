package org.smtlower.lambda;

import org.smtlower.expressions.Assignment;
import org.smtlower.expressions.OpType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 收集赋值序列中引用的未解释函数名，按首次出现的顺序，不重复。
 */
public final class UninterpretedNameCollector {

    private UninterpretedNameCollector() {
    }

    public static List<String> collect(List<Assignment> assignments) {
        Set<String> names = new LinkedHashSet<>();
        for (Assignment a : assignments) {
            if (a.getExpr().getOp().getType() == OpType.UNINTERPRETED) {
                names.add(a.getExpr().getOp().getName());
            }
        }
        return new ArrayList<>(names);
    }
}
