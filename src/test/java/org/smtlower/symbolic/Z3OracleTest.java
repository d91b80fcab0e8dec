package org.smtlower.symbolic;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.smtlower.core.FpRoundingMode;
import org.smtlower.core.Kind;
import org.smtlower.lambda.Lowering;

import static org.junit.jupiter.api.Assertions.*;

class Z3OracleTest {

    private static final Kind W8 = Kind.word(8);

    private Z3Oracle oracle;
    private ExecutionContext ctx;

    @BeforeEach
    void setUp() {
        oracle = new Z3Oracle();
        ctx = ExecutionContext.newSession();
    }

    @AfterEach
    void tearDown() {
        oracle.close();
    }

    @Test
    @DisplayName("简单的有效与无效目标")
    void testIsValid_Basic() {
        SVal x = ctx.forall(W8, "x");

        assertAll(
                () -> assertTrue(oracle.isValid(ctx, x.plus(x).equal(x.times(SVal.of(W8, 2))))),
                () -> assertFalse(oracle.isValid(ctx, x.lessThan(SVal.of(W8, 200)))),
                () -> assertTrue(oracle.isSatisfiable(ctx, x.equal(SVal.of(W8, 7))))
        );
    }

    @Test
    @DisplayName("具名函数定义在证明中可用")
    void testNamedFunction_InProof() {
        Lowering.namedLambda(ctx, "inc", W8, SymbolicComputation.of(W8, v -> v.plus(SVal.of(W8, 1))));
        SVal x = ctx.forall(W8, "x");

        SVal goal = SVal.uninterpreted("inc", W8, x).minus(x).equal(SVal.of(W8, 1));
        assertTrue(oracle.isValid(ctx, goal));
    }

    @Test
    @DisplayName("公理约束未解释函数")
    void testAxiom_InProof() {
        SVal y = ctx.forall(W8, "y");
        SVal goal = SVal.uninterpreted("f", W8, y).equal(y);
        assertFalse(oracle.isValid(ctx, goal));

        ExecutionContext withAxiom = ExecutionContext.newSession();
        Lowering.axiom(withAxiom, "fId", SymbolicComputation.of(W8, v -> SVal.uninterpreted("f", W8, v).equal(v)));
        SVal z = withAxiom.forall(W8, "z");
        assertTrue(oracle.isValid(withAxiom, SVal.uninterpreted("f", W8, z).equal(z)));
    }

    @Test
    @DisplayName("量化约束作为布尔值参与约束")
    void testConstraintValue_InProof() {
        SVal ax = Lowering.constraint(ctx, SymbolicComputation.of(W8, v -> SVal.uninterpreted("g", W8, v).equal(v.plus(v))));
        ctx.constrain(ax);
        SVal z = ctx.forall(W8, "z");

        assertTrue(oracle.isValid(ctx, SVal.uninterpreted("g", W8, z).equal(z.times(SVal.of(W8, 2)))));
    }

    @Test
    @DisplayName("递归具名函数")
    void testRecursiveFunction_InProof() {
        Kind integer = Kind.UNBOUNDED;
        SVal zero = SVal.of(integer, 0);
        SVal one = SVal.of(integer, 1);
        Lowering.namedLambda(ctx, "sum", integer, SymbolicComputation.of(integer,
                n -> SVal.ite(n.lessEq(zero), zero, n.plus(SVal.uninterpreted("sum", integer, n.minus(one))))));

        SVal goal = SVal.uninterpreted("sum", integer, SVal.of(integer, 3)).equal(SVal.of(integer, 6));
        assertTrue(oracle.isValid(ctx, goal));
    }

    @Test
    @DisplayName("会话配置的求解器不是 Z3 时拒绝检查")
    void testCheck_WhenOtherSolverConfigured_ShouldThrow() {
        ExecutionContext cvc = ExecutionContext.newSession(
                new SolverConfig(FpRoundingMode.RNE, "cvc5", null, false), SessionMode.PROOF);
        SVal x = cvc.forall(W8, "x");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> oracle.isValid(cvc, x.equal(x)));
        assertTrue(e.getMessage().contains("cvc5"));
    }

    @Test
    @DisplayName("verbose 开启时以 info 级别记录完整脚本")
    void testCheck_WhenVerbose_ShouldLogScript() {
        Logger log = (Logger) LoggerFactory.getLogger(Z3Oracle.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        log.addAppender(appender);
        Level previous = log.getLevel();
        log.setLevel(Level.INFO);
        try {
            ExecutionContext quiet = ExecutionContext.newSession();
            SVal a = quiet.forall(W8, "a");
            oracle.isSatisfiable(quiet, a.equal(SVal.of(W8, 1)));
            assertTrue(appender.list.stream().noneMatch(ev -> ev.getLevel() == Level.INFO));

            ExecutionContext loud = ExecutionContext.newSession(
                    SolverConfig.defaults().withVerbose(true), SessionMode.PROOF);
            SVal b = loud.forall(W8, "b");
            oracle.isSatisfiable(loud, b.equal(SVal.of(W8, 1)));
            assertTrue(appender.list.stream().anyMatch(ev -> ev.getLevel() == Level.INFO
                    && ev.getFormattedMessage().contains("(declare-fun s0 () (_ BitVec 8)) ; ALL b")));
        } finally {
            log.detachAppender(appender);
            log.setLevel(previous);
        }
    }
}
