package org.smtlower.lambda;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtlower.core.ConcreteValue;
import org.smtlower.core.Kind;
import org.smtlower.core.NodeRef;
import org.smtlower.expressions.Assignment;
import org.smtlower.expressions.SmtLibRenderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;
import java.util.stream.Collectors;

/**
 * 把通过校验的回放记录渲染成带正确作用域的 SMT-LIB 文本。
 * <p>
 * 每个绑定 (先常量，后赋值，均按创建顺序) 生成一层 {@code let}，最新的绑定在最内层，
 * 输出节点出现在最后一行，随后为每层 {@code let} 补一个右括号。
 * 只有一个绑定且它就是输出时，直接渲染该绑定的表达式。
 */
public final class TermSerializer {

    private static final Logger logger = LoggerFactory.getLogger(TermSerializer.class);

    private TermSerializer() {
    }

    public static Definition serialize(ValidatedTrace vt, Kind kind) {
        List<Pair<NodeRef, String>> bindings = new ArrayList<>();
        for (Map.Entry<ConcreteValue, NodeRef> c : vt.getConstants()) {
            bindings.add(Pair.of(c.getValue(), c.getKey().toSmtLib(vt.getRoundingMode())));
        }
        for (Assignment a : vt.getAssignments()) {
            bindings.add(Pair.of(a.getNode(), SmtLibRenderer.render(a.getExpr())));
        }
        NodeRef out = vt.getOutput();

        String params = vt.getParams().isEmpty() ? null
                : vt.getParams().stream()
                    .map(p -> "(" + p + " " + p.getKind().smtType() + ")")
                    .collect(Collectors.joining(" ", "(", ")"));
        List<Kind> argKinds = vt.getParams().stream().map(NodeRef::getKind).toList();

        logger.debug("序列化: {} 个参数, {} 个绑定, 输出 {}", argKinds.size(), bindings.size(), out);
        return new Definition(kind, argKinds, vt.getFrees(), params, body(bindings, out));
    }

    static IntFunction<String> body(List<Pair<NodeRef, String>> bindings, NodeRef out) {
        List<Pair<NodeRef, String>> bs = List.copyOf(bindings);
        return depth -> {
            String tab = StringUtils.repeat(' ', depth);
            if (bs.size() == 1 && bs.get(0).getLeft().equals(out)) {
                return tab + bs.get(0).getRight();
            }
            StringBuilder sb = new StringBuilder();
            for (Pair<NodeRef, String> b : bs) {
                sb.append(tab).append("(let ((").append(b.getLeft()).append(' ').append(b.getRight()).append("))\n");
            }
            sb.append(tab).append(out).append(StringUtils.repeat(')', bs.size()));
            return sb.toString();
        };
    }

    /**
     * 序列化并按外层结构渲染。
     */
    public static String serialize(ValidatedTrace vt, Kind kind, WrapperKind wrapper) {
        return wrap(serialize(vt, kind), wrapper);
    }

    /**
     * 按外层结构渲染定义。具名函数只渲染正文 (缩进 2)，声明头由 {@link DeclarationEmitter} 负责。
     */
    public static String wrap(Definition def, WrapperKind wrapper) {
        return switch (wrapper) {
            case ANONYMOUS_LAMBDA -> "(lambda " + def.getParams().orElse("()") + "\n" + def.getBody().apply(2) + ")";
            case NAMED_FUNCTION -> def.getBody().apply(2);
            case QUANTIFIED_CONSTRAINT -> def.getParams()
                    .map(p -> "(forall " + p + "\n" + def.getBody().apply(4) + ")")
                    .orElseGet(() -> def.getBody().apply(0));
        };
    }
}
