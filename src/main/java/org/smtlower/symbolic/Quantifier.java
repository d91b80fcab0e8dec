package org.smtlower.symbolic;

/**
 * 输入变量的量词：全称 (ALL) 或存在 (EX)。
 */
public enum Quantifier {
    ALL,
    EX
}
