package org.smtlower.expressions;

/**
 * 运算符种类。带参数的运算符 (EXTRACT, UNINTERPRETED, OVERFLOW, QUANTIFIED) 的参数由 {@link Op} 携带。
 */
public enum OpType {
    PLUS,
    TIMES,
    MINUS,
    UNEG,
    QUOT,
    REM,
    EQUAL,
    NOT_EQUAL,
    LESS_THAN,
    GREATER_THAN,
    LESS_EQ,
    GREATER_EQ,
    ITE,
    AND,
    OR,
    XOR,
    NOT,
    JOIN,
    EXTRACT,
    UNINTERPRETED,
    OVERFLOW,
    QUANTIFIED
}
