package org.smtlower.expressions;

import lombok.Getter;
import org.smtlower.core.NodeRef;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 一个运算符作用在若干已有节点上的表达式。
 * (运算符, 操作数句柄) 的相等性就是上下文中构造期去重的键。
 */
@Getter
public final class NodeExpr {

    private final Op op;
    private final List<NodeRef> args;

    private final int hashCode;

    public NodeExpr(Op op, List<NodeRef> args) {
        this.op = Objects.requireNonNull(op, "NodeExpr-构造函数: op 不能为 null");
        this.args = List.copyOf(Objects.requireNonNull(args, "NodeExpr-构造函数: args 不能为 null"));
        this.hashCode = Objects.hash(op, this.args);
    }

    public static NodeExpr of(Op op, NodeRef... args) {
        return new NodeExpr(op, List.of(args));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NodeExpr that = (NodeExpr) o;
        return op.equals(that.op) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return op + " " + args.stream().map(NodeRef::toString).collect(Collectors.joining(" "));
    }
}
