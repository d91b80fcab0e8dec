package org.smtlower.symbolic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.smtlower.core.Kind;
import org.smtlower.lambda.ContextForker;
import org.smtlower.lambda.ForkPurpose;
import org.smtlower.lambda.Lowering;

import static org.junit.jupiter.api.Assertions.*;

class SmtScriptBuilderTest {

    private static final Kind W8 = Kind.word(8);

    @Test
    @DisplayName("输入、常量、赋值和约束按顺序输出")
    void testBuild_Basic() {
        ExecutionContext ctx = ExecutionContext.newSession();
        SVal x = ctx.forall(W8, "x");
        ctx.constrain(x.greaterThan(SVal.of(W8, 3)));

        assertEquals("(declare-fun s0 () (_ BitVec 8)) ; ALL x\n"
                + "(define-fun s1 () (_ BitVec 8) #x03)\n"
                + "(define-fun s2 () Bool (bvugt s0 s1))\n"
                + "(assert s2)\n", SmtScriptBuilder.build(ctx));
    }

    @Test
    @DisplayName("选项和逻辑出现在脚本开头")
    void testBuild_OptionsAndLogic() {
        ExecutionContext ctx = ExecutionContext.newSession(SolverConfig.defaults().withLogic("QF_BV"), SessionMode.SAT);
        ctx.setOption("produce-models", "true");

        assertEquals("(set-option :produce-models true)\n(set-logic QF_BV)\n", SmtScriptBuilder.build(ctx));
    }

    @Test
    @DisplayName("已定义的具名函数不再声明为未解释函数")
    void testBuild_DefinedFunction_ShouldNotBeDeclared() {
        ExecutionContext ctx = ExecutionContext.newSession();
        Lowering.namedLambda(ctx, "inc", W8, SymbolicComputation.of(W8, v -> v.plus(SVal.of(W8, 1))));
        SVal x = ctx.forall(W8, "x");
        SVal.uninterpreted("inc", W8, x).toNode(ctx);
        SVal.uninterpreted("u", W8, x).toNode(ctx);

        String script = SmtScriptBuilder.build(ctx);
        assertAll(
                () -> assertTrue(script.contains("(define-fun inc ((l1_s0 (_ BitVec 8))) (_ BitVec 8)\n")),
                () -> assertFalse(script.contains("(declare-fun inc")),
                () -> assertTrue(script.contains("(declare-fun u ((_ BitVec 8)) (_ BitVec 8))")),
                () -> assertTrue(script.indexOf("(define-fun inc") < script.indexOf("(inc s0)"))
        );
    }

    @Test
    @DisplayName("子上下文不能生成脚本")
    void testBuild_WhenNested_ShouldThrow() {
        ExecutionContext child = ContextForker.fork(ExecutionContext.newSession(), ForkPurpose.LAMBDA);
        assertThrows(IllegalStateException.class, () -> SmtScriptBuilder.build(child));
    }
}
