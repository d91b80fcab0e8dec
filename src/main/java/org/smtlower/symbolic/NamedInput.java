package org.smtlower.symbolic;

import lombok.Getter;
import org.smtlower.core.NodeRef;

import java.util.Objects;

/**
 * 一个已声明的输入：量词、节点句柄和用户名。
 * 用户名缺省时使用节点名。
 */
@Getter
public final class NamedInput {

    private final Quantifier quantifier;
    private final NodeRef node;
    private final String userName;

    public NamedInput(Quantifier quantifier, NodeRef node, String userName) {
        this.quantifier = Objects.requireNonNull(quantifier, "NamedInput-构造函数: quantifier 不能为 null");
        this.node = Objects.requireNonNull(node, "NamedInput-构造函数: node 不能为 null");
        this.userName = userName == null ? node.toString() : userName;
    }

    @Override
    public String toString() {
        return quantifier + " " + userName + " (" + node + " :: " + node.getKind() + ")";
    }
}
