package org.smtlower.expressions;

import lombok.Getter;
import org.smtlower.core.NodeRef;

import java.util.Objects;

/**
 * 一条赋值：节点 {@code node} 的值由 {@code expr} 定义。
 * 上下文中的赋值序列按创建顺序排列，每个表达式只引用常量、输入或更早赋值的节点。
 */
@Getter
public final class Assignment {

    private final NodeRef node;
    private final NodeExpr expr;

    public Assignment(NodeRef node, NodeExpr expr) {
        this.node = Objects.requireNonNull(node, "Assignment-构造函数: node 不能为 null");
        this.expr = Objects.requireNonNull(expr, "Assignment-构造函数: expr 不能为 null");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Assignment that = (Assignment) o;
        return node.equals(that.node) && expr.equals(that.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(node, expr);
    }

    @Override
    public String toString() {
        return node + " = " + expr;
    }
}
