package org.smtlower.lambda;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtlower.symbolic.ExecutionContext;
import org.smtlower.symbolic.SessionMode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * 从一个活动的执行上下文分叉出隔离的子上下文。
 * 子上下文的 lambda 层级比父上下文高一级，会话模式为 {@link SessionMode#LOWERING}；
 * 其余字段按 {@link ForkManifest} 共享、重新分配或复制。父上下文本身不被修改。
 */
public final class ContextForker {

    private static final Logger logger = LoggerFactory.getLogger(ContextForker.class);

    private ContextForker() {
    }

    public static ExecutionContext fork(ExecutionContext parent, ForkPurpose purpose) {
        ExecutionContext.Builder b = ExecutionContext.builder();
        for (ContextField field : ContextField.values()) {
            FieldPolicy p = ForkManifest.policy(field, purpose);
            switch (field) {
                case CONFIG -> b.config(inherit(p, parent.getConfig(), unsupported(field, p), v -> v));
                case START_TIME -> b.startTime(inherit(p, parent.getStartTime(), unsupported(field, p), v -> v));
                case PATH_CONDITION -> b.pathCondition(inherit(p, parent.getPathCondition(),
                        unsupported(field, p), v -> v));
                case QUERY_MODE -> b.queryMode(inherit(p, parent.getQueryMode(),
                        () -> new AtomicBoolean(false), v -> new AtomicBoolean(v.get())));
                case OBSERVABLES -> b.observables(inherit(p, parent.getObservables(),
                        ArrayList::new, ArrayList::new));
                case NODE_COUNTER -> b.nodeCounter(inherit(p, parent.getNodeCounter(),
                        () -> new AtomicInteger(0), v -> new AtomicInteger(v.get())));
                case LAMBDA_LEVEL -> b.lambdaLevel(inherit(p, parent.getLambdaLevel(),
                        () -> parent.getLambdaLevel() + 1, v -> v));
                case SESSION_MODE -> b.sessionMode(inherit(p, parent.getSessionMode(),
                        () -> SessionMode.LOWERING, v -> v));
                case USED_KINDS -> b.usedKinds(inherit(p, parent.getUsedKinds(),
                        LinkedHashSet::new, LinkedHashSet::new));
                case USED_LABELS -> b.usedLabels(inherit(p, parent.getUsedLabels(),
                        LinkedHashSet::new, LinkedHashSet::new));
                case INPUTS -> b.inputs(inherit(p, parent.getInputs(), ArrayList::new, ArrayList::new));
                case TRACKERS -> b.trackers(inherit(p, parent.getTrackers(), ArrayList::new, ArrayList::new));
                case CONSTRAINTS -> b.constraints(inherit(p, parent.getConstraints(),
                        ArrayList::new, ArrayList::new));
                case OUTPUTS -> b.outputs(inherit(p, parent.getOutputs(), ArrayList::new, ArrayList::new));
                case TABLES -> b.tables(inherit(p, parent.getTables(), ArrayList::new, ArrayList::new));
                case ASSIGNMENTS -> b.assignments(inherit(p, parent.getAssignments(),
                        ArrayList::new, ArrayList::new));
                case CONSTANTS -> b.constants(inherit(p, parent.getConstants(),
                        ExecutionContext::initialConstants, LinkedHashMap::new));
                case EXPR_CACHE -> b.exprCache(inherit(p, parent.getExprCache(),
                        LinkedHashMap::new, LinkedHashMap::new));
                case ARRAYS -> b.arrays(inherit(p, parent.getArrays(), ArrayList::new, ArrayList::new));
                case UNINTERPRETED -> b.uninterpreted(inherit(p, parent.getUninterpreted(),
                        LinkedHashMap::new, LinkedHashMap::new));
                case USER_FUNCTIONS -> b.userFunctions(inherit(p, parent.getUserFunctions(),
                        LinkedHashSet::new, LinkedHashSet::new));
                case CODE_SEGMENTS -> b.codeSegments(inherit(p, parent.getCodeSegments(),
                        LinkedHashMap::new, LinkedHashMap::new));
                case DEFINITIONS -> b.definitions(inherit(p, parent.getDefinitions(),
                        ArrayList::new, ArrayList::new));
                case SMT_OPTIONS -> b.smtOptions(inherit(p, parent.getSmtOptions(),
                        LinkedHashMap::new, LinkedHashMap::new));
                case ASSERTIONS -> b.assertions(inherit(p, parent.getAssertions(),
                        ArrayList::new, ArrayList::new));
                case AXIOMS -> b.axioms(inherit(p, parent.getAxioms(), LinkedHashMap::new, LinkedHashMap::new));
            }
        }
        ExecutionContext child = b.build();
        logger.debug("分叉子上下文: purpose={}, level {} -> {}", purpose, parent.getLambdaLevel(), child.getLambdaLevel());
        return child;
    }

    private static <T> T inherit(FieldPolicy policy, T parentValue,
                                 Supplier<T> fresh, UnaryOperator<T> copy) {
        return switch (policy) {
            case SHARE -> parentValue;
            case FRESH -> fresh.get();
            case COPY -> copy.apply(parentValue);
        };
    }

    private static <T> Supplier<T> unsupported(ContextField field, FieldPolicy policy) {
        return () -> {
            logger.error("ContextForker: 字段 {} 不能使用策略 {}", field, policy);
            throw new IllegalStateException("字段 " + field + " 不能使用策略 " + policy);
        };
    }
}
