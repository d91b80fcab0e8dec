package org.smtlower.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 节点引用：对一个已计算子表达式的不透明句柄，是共享的基本单位。
 * 名称由 lambda 层级和节点编号组成，顶层为 {@code s7}，第 1 层 lowering 内为 {@code l1_s7}，
 * 因此子上下文的编号永远不会与父上下文冲突。
 * 两个保留句柄直接渲染为 {@code false} 和 {@code true}。
 */
@Getter
public final class NodeRef {

    private static final int FALSE_INDEX = -2;
    private static final int TRUE_INDEX = -1;

    public static final NodeRef FALSE = new NodeRef(Kind.BOOL, 0, FALSE_INDEX);
    public static final NodeRef TRUE = new NodeRef(Kind.BOOL, 0, TRUE_INDEX);

    private final Kind kind;
    private final int level;
    private final int index;

    public NodeRef(Kind kind, int level, int index) {
        this.kind = Objects.requireNonNull(kind, "NodeRef-构造函数: kind 不能为 null");
        this.level = level;
        this.index = index;
    }

    public boolean isBooleanLiteral() {
        return index == FALSE_INDEX || index == TRUE_INDEX;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NodeRef that = (NodeRef) o;
        // 保留句柄与层级无关
        if (this.isBooleanLiteral() || that.isBooleanLiteral()) {
            return this.index == that.index;
        }
        return level == that.level && index == that.index;
    }

    @Override
    public int hashCode() {
        return isBooleanLiteral() ? index : Objects.hash(level, index);
    }

    @Override
    public String toString() {
        if (index == FALSE_INDEX) {
            return "false";
        }
        if (index == TRUE_INDEX) {
            return "true";
        }
        return level == 0 ? "s" + index : "l" + level + "_s" + index;
    }
}
