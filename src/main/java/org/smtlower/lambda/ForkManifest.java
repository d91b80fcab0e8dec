package org.smtlower.lambda;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 子上下文的字段继承表：对每种分叉目的、每个字段给出共享、重新分配或复制。
 * 所有分叉决策只在这里做出。
 */
public final class ForkManifest {

    private static final Logger logger = LoggerFactory.getLogger(ForkManifest.class);

    private static final Set<ContextField> SHARED = Collections.unmodifiableSet(EnumSet.of(
            ContextField.CONFIG,
            ContextField.START_TIME,
            ContextField.PATH_CONDITION,
            ContextField.QUERY_MODE,
            ContextField.OBSERVABLES,
            ContextField.USED_KINDS,
            ContextField.USED_LABELS,
            ContextField.TABLES,
            ContextField.ARRAYS,
            ContextField.UNINTERPRETED,
            ContextField.CODE_SEGMENTS,
            ContextField.SMT_OPTIONS,
            ContextField.ASSERTIONS,
            ContextField.AXIOMS));

    private static final Set<ContextField> FRESH = Collections.unmodifiableSet(EnumSet.of(
            ContextField.NODE_COUNTER,
            ContextField.LAMBDA_LEVEL,
            ContextField.SESSION_MODE,
            ContextField.INPUTS,
            ContextField.TRACKERS,
            ContextField.OUTPUTS,
            ContextField.CONSTRAINTS,
            ContextField.ASSIGNMENTS,
            ContextField.CONSTANTS,
            ContextField.EXPR_CACHE));

    // 具名函数按值继承此前的定义，其余目的按引用共享
    private static final Set<ContextField> BY_PURPOSE = Collections.unmodifiableSet(EnumSet.of(
            ContextField.USER_FUNCTIONS,
            ContextField.DEFINITIONS));

    private static final Map<ForkPurpose, Map<ContextField, FieldPolicy>> TABLE = new EnumMap<>(ForkPurpose.class);

    static {
        for (ForkPurpose purpose : ForkPurpose.values()) {
            Map<ContextField, FieldPolicy> row = new EnumMap<>(ContextField.class);
            SHARED.forEach(f -> row.put(f, FieldPolicy.SHARE));
            FRESH.forEach(f -> row.put(f, FieldPolicy.FRESH));
            FieldPolicy inherited = purpose == ForkPurpose.NAMED_FUNCTION ? FieldPolicy.COPY : FieldPolicy.SHARE;
            BY_PURPOSE.forEach(f -> row.put(f, inherited));
            TABLE.put(purpose, Collections.unmodifiableMap(row));
        }
    }

    private ForkManifest() {
    }

    /**
     * @throws IllegalStateException 如果该字段在该目的下没有策略 (新增字段后忘记登记)。
     */
    public static FieldPolicy policy(ContextField field, ForkPurpose purpose) {
        FieldPolicy p = TABLE.get(purpose).get(field);
        if (p == null) {
            logger.error("ForkManifest: 字段 {} 在 {} 下没有继承策略", field, purpose);
            throw new IllegalStateException("字段 " + field + " 在 " + purpose + " 下没有继承策略");
        }
        return p;
    }

    public static Map<ContextField, FieldPolicy> row(ForkPurpose purpose) {
        return TABLE.get(purpose);
    }
}
