package org.smtlower.lambda;

/**
 * 分叉子上下文的目的，决定部分字段是共享还是复制。
 */
public enum ForkPurpose {
    LAMBDA,
    NAMED_FUNCTION,
    CONSTRAINT
}
