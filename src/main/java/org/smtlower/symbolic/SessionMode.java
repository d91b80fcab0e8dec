package org.smtlower.symbolic;

/**
 * 执行上下文的运行模式。顶层会话是 PROOF / SAT / OPTIMIZE 之一，
 * lowering 时分叉出的子上下文总是 LOWERING。
 */
public enum SessionMode {
    PROOF,
    SAT,
    OPTIMIZE,
    LOWERING
}
