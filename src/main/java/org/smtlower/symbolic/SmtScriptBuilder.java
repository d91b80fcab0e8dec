package org.smtlower.symbolic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtlower.core.ConcreteValue;
import org.smtlower.core.NodeRef;
import org.smtlower.expressions.Assignment;
import org.smtlower.expressions.SmtLibRenderer;
import org.smtlower.lambda.DeclarationEmitter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 把一个顶层会话渲染成完整的 SMT-LIB 脚本 (不含 check-sat)。
 * <p>
 * 顺序：选项、逻辑、输入声明、未解释函数声明 (已定义的具名函数除外)、具名函数定义、
 * 常量与赋值 (零元 define-fun)、公理、约束。
 */
public final class SmtScriptBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SmtScriptBuilder.class);

    private SmtScriptBuilder() {
    }

    public static String build(ExecutionContext ctx) {
        if (ctx.getLambdaLevel() != 0) {
            logger.error("SmtScriptBuilder: 只能为顶层会话生成脚本, 当前层级 {}", ctx.getLambdaLevel());
            throw new IllegalStateException("只能为顶层会话生成脚本, 当前 lambda 层级为 " + ctx.getLambdaLevel());
        }
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, String> opt : ctx.getSmtOptions().entrySet()) {
            lines.add("(set-option :" + opt.getKey() + " " + opt.getValue() + ")");
        }
        ctx.getConfig().getLogic().ifPresent(l -> lines.add("(set-logic " + l + ")"));

        for (NamedInput in : ctx.getInputs()) {
            lines.add(declareConst(in.getNode()) + " ; " + in.getQuantifier() + " " + in.getUserName());
        }
        for (NamedInput t : ctx.getTrackers()) {
            lines.add(declareConst(t.getNode()) + " ; tracker " + t.getUserName());
        }
        for (Map.Entry<String, FunctionSignature> u : ctx.getUninterpreted().entrySet()) {
            if (!ctx.getUserFunctions().contains(u.getKey())) {
                lines.add(u.getValue().smtDeclaration(u.getKey()));
            }
        }
        if (!ctx.getDefinitions().isEmpty()) {
            lines.add(DeclarationEmitter.emitAll(ctx.getDefinitions()));
        }

        for (Map.Entry<ConcreteValue, NodeRef> c : ctx.getConstants().entrySet()) {
            if (c.getValue().isBooleanLiteral()) {
                continue;
            }
            lines.add(defineConst(c.getValue(), c.getKey().toSmtLib(ctx.getConfig().getRoundingMode())));
        }
        for (Assignment a : ctx.getAssignments()) {
            lines.add(defineConst(a.getNode(), SmtLibRenderer.render(a.getExpr())));
        }

        lines.addAll(ctx.getAxioms().values());
        for (NodeRef c : ctx.getConstraints()) {
            lines.add("(assert " + c + ")");
        }
        logger.debug("生成脚本: {} 行", lines.size());
        return String.join("\n", lines) + "\n";
    }

    private static String declareConst(NodeRef node) {
        return "(declare-fun " + node + " () " + node.getKind().smtType() + ")";
    }

    private static String defineConst(NodeRef node, String rhs) {
        return "(define-fun " + node + " () " + node.getKind().smtType() + " " + rhs + ")";
    }
}
