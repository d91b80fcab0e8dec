package org.smtlower.lambda;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtlower.core.Kind;
import org.smtlower.symbolic.ExecutionContext;
import org.smtlower.symbolic.SVal;
import org.smtlower.symbolic.SmtFunctionDef;
import org.smtlower.symbolic.SmtLambda;
import org.smtlower.symbolic.SymbolicComputation;

import java.util.List;
import java.util.Objects;

/**
 * lowering 的入口：把一个符号计算转成独立的 SMT-LIB 定义。
 * <p>
 * 每次调用都先从给定上下文分叉出子上下文，在子上下文中回放计算，校验回放记录，最后序列化。
 * 任何一步失败都以异常结束，父上下文中不会留下该次调用的定义。
 */
public final class Lowering {

    private static final Logger logger = LoggerFactory.getLogger(Lowering.class);

    private Lowering() {
    }

    // ========== 匿名 lambda ==========

    public static SmtLambda lambda(ExecutionContext ctx, Kind resultKind, SymbolicComputation computation) {
        Definition def = lower(ctx, ForkPurpose.LAMBDA, resultKind, computation);
        return new SmtLambda(resultKind, def.getFrees(), def.getParams().orElse(null), def.getBody());
    }

    public static String lambdaStr(ExecutionContext ctx, Kind resultKind, SymbolicComputation computation) {
        Definition def = lower(ctx, ForkPurpose.LAMBDA, resultKind, computation);
        return TermSerializer.wrap(def, WrapperKind.ANONYMOUS_LAMBDA);
    }

    // ========== 具名函数 ==========

    /**
     * 生成具名函数定义并登记到 {@code ctx}，由脚本输出时统一声明。
     */
    public static SmtFunctionDef namedLambda(ExecutionContext ctx, String name, Kind resultKind,
                                             SymbolicComputation computation) {
        SmtFunctionDef def = namedDefinition(ctx, name, resultKind, computation);
        ctx.addDefinition(def);
        return def;
    }

    /**
     * 直接渲染具名函数的声明文本，不登记。
     */
    public static String namedLambdaStr(ExecutionContext ctx, String name, Kind resultKind,
                                        SymbolicComputation computation) {
        return DeclarationEmitter.emit(namedDefinition(ctx, name, resultKind, computation));
    }

    private static SmtFunctionDef namedDefinition(ExecutionContext ctx, String name, Kind resultKind,
                                                  SymbolicComputation computation) {
        Objects.requireNonNull(name, "Lowering-namedLambda: name 不能为 null");
        Definition def = lower(ctx, ForkPurpose.NAMED_FUNCTION, resultKind, computation);
        return new SmtFunctionDef(name, def.getArgKinds(), resultKind, def.getFrees(),
                def.getParams().orElse(null), def.getBody());
    }

    // ========== 量化约束 ==========

    /**
     * 把布尔计算转成全称量化公式，作为一个布尔符号值返回。
     * @throws UnsupportedConstructException 如果 {@code ctx} 不是顶层上下文。
     */
    public static SVal constraint(ExecutionContext ctx, SymbolicComputation computation) {
        Definition def = lowerConstraint(ctx, computation);
        return SVal.quantified(TermSerializer.wrap(def, WrapperKind.QUANTIFIED_CONSTRAINT));
    }

    /**
     * 渲染为一条带注释的顶层断言。
     * @throws UnsupportedConstructException 如果 {@code ctx} 不是顶层上下文。
     */
    public static String constraintStr(ExecutionContext ctx, String label, SymbolicComputation computation) {
        Objects.requireNonNull(label, "Lowering-constraintStr: label 不能为 null");
        Definition def = lowerConstraint(ctx, computation);
        String refers = def.getFrees().isEmpty() ? "" : " refers to: " + String.join(", ", def.getFrees());
        return "; Constraint: " + label + refers + "\n"
                + "(assert " + TermSerializer.wrap(def, WrapperKind.QUANTIFIED_CONSTRAINT) + ")";
    }

    /**
     * 把布尔计算作为公理登记到 {@code ctx}。
     */
    public static void axiom(ExecutionContext ctx, String label, SymbolicComputation computation) {
        String text = constraintStr(ctx, label, computation);
        ctx.addAxiom(label, text);
        logger.info("登记公理: {}", label);
    }

    private static Definition lowerConstraint(ExecutionContext ctx, SymbolicComputation computation) {
        if (ctx.getLambdaLevel() != 0) {
            logger.error("量化约束只能在顶层生成, 当前 lambda 层级为 {}", ctx.getLambdaLevel());
            throw new UnsupportedConstructException("Quantified constraints are only supported at the top level.",
                    List.of("constraint requested at lambda level " + ctx.getLambdaLevel()));
        }
        return lower(ctx, ForkPurpose.CONSTRAINT, Kind.BOOL, computation);
    }

    // ========== 公共流程 ==========

    private static Definition lower(ExecutionContext ctx, ForkPurpose purpose, Kind resultKind,
                                    SymbolicComputation computation) {
        Objects.requireNonNull(resultKind, "Lowering: resultKind 不能为 null");
        Objects.requireNonNull(computation, "Lowering: computation 不能为 null");
        ExecutionContext child = ContextForker.fork(ctx, purpose);
        ValidatedTrace trace = ScopedReplayer.replay(child, resultKind, computation);
        Definition def = TermSerializer.serialize(trace, resultKind);
        logger.info("lowering 完成: purpose={}, level={}, kind={}", purpose, child.getLambdaLevel(), resultKind);
        return def;
    }
}
