package org.smtlower.lambda;

import lombok.Getter;
import org.smtlower.core.ConcreteValue;
import org.smtlower.core.FpRoundingMode;
import org.smtlower.core.NodeRef;
import org.smtlower.expressions.Assignment;

import java.util.List;
import java.util.Map;

/**
 * 通过全部检查后从回放记录中提取的内容：参数、常量 (不含布尔字面量)、赋值、唯一的输出和自由名字。
 */
@Getter
public final class ValidatedTrace {

    private final List<NodeRef> params;
    private final List<Map.Entry<ConcreteValue, NodeRef>> constants;
    private final List<Assignment> assignments;
    private final NodeRef output;
    private final List<String> frees;
    private final FpRoundingMode roundingMode;

    ValidatedTrace(List<NodeRef> params, List<Map.Entry<ConcreteValue, NodeRef>> constants,
                   List<Assignment> assignments, NodeRef output, List<String> frees, FpRoundingMode roundingMode) {
        this.params = List.copyOf(params);
        this.constants = List.copyOf(constants);
        this.assignments = List.copyOf(assignments);
        this.output = output;
        this.frees = List.copyOf(frees);
        this.roundingMode = roundingMode;
    }
}
