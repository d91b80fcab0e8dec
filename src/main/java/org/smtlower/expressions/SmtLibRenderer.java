package org.smtlower.expressions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtlower.core.Kind;
import org.smtlower.core.NodeRef;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 将单个 {@link NodeExpr} 渲染为 SMT-LIB 项。操作数以节点名出现，运算符按第一个操作数的类型选择
 * (位向量用 bv* 族，整数/实数用算术运算符，有符号比较用 bvs*)。
 */
public final class SmtLibRenderer {

    private static final Logger logger = LoggerFactory.getLogger(SmtLibRenderer.class);

    private SmtLibRenderer() {
    }

    public static String render(NodeExpr expr) {
        List<NodeRef> args = expr.getArgs();
        Op op = expr.getOp();
        Kind k = args.isEmpty() ? null : args.get(0).getKind();

        return switch (op.getType()) {
            case PLUS -> app(isBv(k) ? "bvadd" : "+", args);
            case TIMES -> app(isBv(k) ? "bvmul" : "*", args);
            case MINUS -> app(isBv(k) ? "bvsub" : "-", args);
            case UNEG -> app(isBv(k) ? "bvneg" : "-", args);
            case QUOT -> app(requireBv(op, k).hasSign() ? "bvsdiv" : "bvudiv", args);
            case REM -> app(requireBv(op, k).hasSign() ? "bvsrem" : "bvurem", args);
            case EQUAL -> app("=", args);
            case NOT_EQUAL -> app("distinct", args);
            case LESS_THAN -> app(compare(k, "bvslt", "bvult", "<"), args);
            case GREATER_THAN -> app(compare(k, "bvsgt", "bvugt", ">"), args);
            case LESS_EQ -> app(compare(k, "bvsle", "bvule", "<="), args);
            case GREATER_EQ -> app(compare(k, "bvsge", "bvuge", ">="), args);
            case ITE -> app("ite", args);
            case AND -> app(isBv(k) ? "bvand" : "and", args);
            case OR -> app(isBv(k) ? "bvor" : "or", args);
            case XOR -> app(isBv(k) ? "bvxor" : "xor", args);
            case NOT -> app(isBv(k) ? "bvnot" : "not", args);
            case JOIN -> app("concat", args);
            case EXTRACT -> app("(_ extract " + op.getHigh() + " " + op.getLow() + ")", args);
            case UNINTERPRETED -> args.isEmpty() ? op.getName() : app(op.getName(), args);
            case OVERFLOW -> "(not " + app(op.getOverflow().getPrimitive(), args) + ")";
            case QUANTIFIED -> op.getName();
        };
    }

    private static boolean isBv(Kind k) {
        return k != null && k.isBounded();
    }

    private static Kind requireBv(Op op, Kind k) {
        if (!isBv(k)) {
            logger.error("SmtLibRenderer: 运算符 {} 只支持位向量操作数, 实际为 {}", op, k);
            throw new IllegalArgumentException("运算符 " + op + " 只支持位向量操作数, 实际为: " + k);
        }
        return k;
    }

    private static String compare(Kind k, String signedBv, String unsignedBv, String arith) {
        if (isBv(k)) {
            return k.hasSign() ? signedBv : unsignedBv;
        }
        return arith;
    }

    private static String app(String fn, List<NodeRef> args) {
        return "(" + fn + " " + args.stream().map(NodeRef::toString).collect(Collectors.joining(" ")) + ")";
    }
}
