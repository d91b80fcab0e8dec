package org.smtlower.symbolic;

import lombok.Getter;
import org.smtlower.core.NodeRef;

import java.util.Objects;

/**
 * 带名字的节点，用于观测值 (observable) 和断言 (assertion) 登记。
 */
@Getter
public final class NamedNode {

    private final String name;
    private final NodeRef node;

    public NamedNode(String name, NodeRef node) {
        this.name = Objects.requireNonNull(name, "NamedNode-构造函数: name 不能为 null");
        this.node = Objects.requireNonNull(node, "NamedNode-构造函数: node 不能为 null");
    }

    @Override
    public String toString() {
        return name + " = " + node;
    }
}
