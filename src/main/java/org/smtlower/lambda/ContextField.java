package org.smtlower.lambda;

/**
 * 执行上下文的全部字段。每个字段在 {@link ForkManifest} 中对每种分叉目的都必须有继承策略。
 */
public enum ContextField {
    CONFIG,
    START_TIME,
    PATH_CONDITION,
    QUERY_MODE,
    OBSERVABLES,
    NODE_COUNTER,
    LAMBDA_LEVEL,
    SESSION_MODE,
    USED_KINDS,
    USED_LABELS,
    INPUTS,
    TRACKERS,
    CONSTRAINTS,
    OUTPUTS,
    TABLES,
    ASSIGNMENTS,
    CONSTANTS,
    EXPR_CACHE,
    ARRAYS,
    UNINTERPRETED,
    USER_FUNCTIONS,
    CODE_SEGMENTS,
    DEFINITIONS,
    SMT_OPTIONS,
    ASSERTIONS,
    AXIOMS
}
