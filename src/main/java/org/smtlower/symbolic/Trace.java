package org.smtlower.symbolic;

import lombok.Getter;
import org.smtlower.core.ConcreteValue;
import org.smtlower.core.FpRoundingMode;
import org.smtlower.core.Kind;
import org.smtlower.core.NodeRef;
import org.smtlower.expressions.Assignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次回放的不可变记录。
 * <p>
 * 输入、常量、赋值、约束和输出来自子上下文自己的容器，按原样取全部；
 * 观测值、查找表、数组、外部代码段、断言和类型登记与父上下文共享，只保留回放期间新增的部分。
 */
@Getter
public final class Trace {

    private final int lambdaLevel;
    private final FpRoundingMode roundingMode;
    private final List<Kind> usedKinds;
    private final List<NamedInput> inputs;
    private final List<NamedInput> trackers;
    private final Map<ConcreteValue, NodeRef> constants;
    private final List<Assignment> assignments;
    private final List<TableInfo> tables;
    private final List<ArrayInfo> arrays;
    private final Map<String, List<String>> codeSegments;
    private final List<NamedNode> observables;
    private final List<NodeRef> constraints;
    private final List<NamedNode> assertions;
    private final List<NodeRef> outputs;

    private Trace(ExecutionContext ctx, RegistrySnapshot before) {
        this.lambdaLevel = ctx.getLambdaLevel();
        this.roundingMode = ctx.getConfig().getRoundingMode();
        this.usedKinds = tail(new ArrayList<>(ctx.getUsedKinds()), before.getUsedKinds());
        this.inputs = List.copyOf(ctx.getInputs());
        this.trackers = List.copyOf(ctx.getTrackers());
        this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(ctx.getConstants()));
        this.assignments = List.copyOf(ctx.getAssignments());
        this.tables = tail(ctx.getTables(), before.getTables());
        this.arrays = tail(ctx.getArrays(), before.getArrays());
        this.codeSegments = tail(ctx.getCodeSegments(), before.getCodeSegments());
        this.observables = tail(ctx.getObservables(), before.getObservables());
        this.constraints = List.copyOf(ctx.getConstraints());
        this.assertions = tail(ctx.getAssertions(), before.getAssertions());
        this.outputs = List.copyOf(ctx.getOutputs());
    }

    /**
     * 从刚完成回放的上下文中提取记录。
     * @param before 回放开始前对共享登记表做的快照。
     */
    public static Trace extract(ExecutionContext ctx, RegistrySnapshot before) {
        return new Trace(ctx, before);
    }

    private static <T> List<T> tail(List<T> list, int from) {
        return List.copyOf(list.subList(Math.min(from, list.size()), list.size()));
    }

    private static Map<String, List<String>> tail(Map<String, List<String>> map, int from) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        int i = 0;
        for (Map.Entry<String, List<String>> e : map.entrySet()) {
            if (i++ >= from) {
                result.put(e.getKey(), e.getValue());
            }
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String toString() {
        return "Trace{level=" + lambdaLevel + ", inputs=" + inputs.size() + ", constants=" + constants.size()
                + ", assignments=" + assignments.size() + ", outputs=" + outputs + "}";
    }
}
