package org.smtlower.core;

/**
 * 符号值类型标签的种类。具体宽度、符号等参数由 {@link Kind} 携带。
 */
public enum KindType {
    BOOL,
    BOUNDED,        // 定宽位向量，有符号或无符号
    UNBOUNDED,      // 数学整数
    REAL,
    FLOAT,          // IEEE-754 单精度
    DOUBLE,         // IEEE-754 双精度
    FP,             // 任意指数/尾数宽度的浮点
    ROUNDING_MODE,
    STRING,
    CHAR,
    USER_SORT       // 用户声明的未解释排序
}
