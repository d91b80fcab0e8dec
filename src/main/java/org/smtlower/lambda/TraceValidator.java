package org.smtlower.lambda;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtlower.core.ConcreteValue;
import org.smtlower.core.Kind;
import org.smtlower.core.NodeRef;
import org.smtlower.symbolic.NamedInput;
import org.smtlower.symbolic.Quantifier;
import org.smtlower.symbolic.Trace;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 校验一次回放记录只使用了可以独立成为定义的构造，并从中提取序列化所需的内容。
 * <p>
 * 检查按固定顺序执行，遇到第一个失败立即停止，因此诊断信息只描述最先发现的问题。
 */
public final class TraceValidator {

    private static final Logger logger = LoggerFactory.getLogger(TraceValidator.class);

    static final List<TraceCheck> CHECKS = List.of(
            TraceValidator::noObservables,
            TraceValidator::noCodeSegments,
            TraceValidator::noTables,
            TraceValidator::noArrays,
            TraceValidator::noConstraints,
            TraceValidator::noAssertions,
            TraceValidator::noExistentials,
            TraceValidator::noTrackers,
            TraceValidator::singleOutputOfExpectedKind);

    private TraceValidator() {
    }

    /**
     * @throws UnsupportedConstructException  如果记录中含有不支持的构造。
     * @throws InternalInconsistencyException 如果输出个数或类型不符合预期。
     */
    public static ValidatedTrace validate(Trace trace, Kind expectedKind) {
        for (TraceCheck check : CHECKS) {
            CheckOutcome outcome = check.check(trace, expectedKind);
            if (!outcome.isOk()) {
                logger.error("lowering 校验失败: {}", outcome);
                throw outcome.toException();
            }
        }
        return extract(trace);
    }

    private static ValidatedTrace extract(Trace trace) {
        List<NodeRef> params = new ArrayList<>();
        for (NamedInput in : trace.getInputs()) {
            if (in.getQuantifier() != Quantifier.ALL) {
                logger.error("提取参数时发现存在量化输入: {}", in);
                throw new InternalInconsistencyException("Unexpected existential input while extracting parameters.",
                        List.of(in.toString()));
            }
            params.add(in.getNode());
        }
        List<Map.Entry<ConcreteValue, NodeRef>> constants = new ArrayList<>();
        for (Map.Entry<ConcreteValue, NodeRef> e : trace.getConstants().entrySet()) {
            if (!e.getValue().isBooleanLiteral()) {
                constants.add(Map.entry(e.getKey(), e.getValue()));
            }
        }
        return new ValidatedTrace(params, constants, trace.getAssignments(), trace.getOutputs().get(0),
                UninterpretedNameCollector.collect(trace.getAssignments()), trace.getRoundingMode());
    }

    // --- 各项检查 ---

    static CheckOutcome noObservables(Trace trace, Kind expectedKind) {
        if (trace.getObservables().isEmpty()) {
            return CheckOutcome.ok();
        }
        return CheckOutcome.unsupported("Observables are not supported in lowered definitions.",
                trace.getObservables().stream().map(o -> "observable " + o.getName()).toList());
    }

    static CheckOutcome noCodeSegments(Trace trace, Kind expectedKind) {
        if (trace.getCodeSegments().isEmpty()) {
            return CheckOutcome.ok();
        }
        return CheckOutcome.unsupported("Foreign code segments are not supported in lowered definitions.",
                trace.getCodeSegments().keySet().stream().map(f -> "code segment for " + f).toList());
    }

    static CheckOutcome noTables(Trace trace, Kind expectedKind) {
        if (trace.getTables().isEmpty()) {
            return CheckOutcome.ok();
        }
        return CheckOutcome.unsupported("Lookup tables are not supported in lowered definitions.",
                trace.getTables().stream().map(Object::toString).toList());
    }

    static CheckOutcome noArrays(Trace trace, Kind expectedKind) {
        if (trace.getArrays().isEmpty()) {
            return CheckOutcome.ok();
        }
        return CheckOutcome.unsupported("Arrays are not supported in lowered definitions.",
                trace.getArrays().stream().map(Object::toString).toList());
    }

    static CheckOutcome noConstraints(Trace trace, Kind expectedKind) {
        if (trace.getConstraints().isEmpty()) {
            return CheckOutcome.ok();
        }
        return CheckOutcome.unsupported("Extra constraints are not supported in lowered definitions.",
                List.of(trace.getConstraints().size() + " constraint(s)"));
    }

    static CheckOutcome noAssertions(Trace trace, Kind expectedKind) {
        if (trace.getAssertions().isEmpty()) {
            return CheckOutcome.ok();
        }
        return CheckOutcome.unsupported("Assertions are not supported in lowered definitions.",
                trace.getAssertions().stream().map(a -> "assertion " + a.getName()).toList());
    }

    static CheckOutcome noExistentials(Trace trace, Kind expectedKind) {
        List<String> ex = trace.getInputs().stream()
                .filter(in -> in.getQuantifier() == Quantifier.EX)
                .map(NamedInput::getUserName)
                .toList();
        if (ex.isEmpty()) {
            return CheckOutcome.ok();
        }
        return CheckOutcome.unsupported("Existentially quantified inputs are not supported in lowered definitions.",
                ex.stream().map(n -> "existential " + n).toList());
    }

    static CheckOutcome noTrackers(Trace trace, Kind expectedKind) {
        if (trace.getTrackers().isEmpty()) {
            return CheckOutcome.ok();
        }
        return CheckOutcome.unsupported("Tracker variables are not supported in lowered definitions.",
                trace.getTrackers().stream().map(t -> "tracker " + t.getUserName()).toList());
    }

    static CheckOutcome singleOutputOfExpectedKind(Trace trace, Kind expectedKind) {
        List<NodeRef> outputs = trace.getOutputs();
        if (outputs.size() != 1) {
            return CheckOutcome.inconsistent("Expected exactly one output.",
                    List.of(outputs.size() + " output(s): " + outputs));
        }
        Kind actual = outputs.get(0).getKind();
        if (!actual.equals(expectedKind)) {
            return CheckOutcome.inconsistent("Output kind does not match the expected kind.",
                    List.of("expected " + expectedKind, "actual   " + actual));
        }
        return CheckOutcome.ok();
    }
}
