package org.smtlower.lambda;

/**
 * 子上下文字段的继承方式。
 */
public enum FieldPolicy {
    /** 与父上下文共享同一个容器，子上下文的修改对父上下文可见。 */
    SHARE,
    /** 重新分配一个空容器或初始值。 */
    FRESH,
    /** 复制父上下文的当前内容，之后两者互不影响。 */
    COPY
}
