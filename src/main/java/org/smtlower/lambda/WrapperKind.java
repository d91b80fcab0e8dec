package org.smtlower.lambda;

/**
 * 序列化结果的外层结构。
 */
public enum WrapperKind {
    ANONYMOUS_LAMBDA,
    NAMED_FUNCTION,
    QUANTIFIED_CONSTRAINT
}
