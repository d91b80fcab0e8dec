package org.smtlower.lambda;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.smtlower.core.Kind;
import org.smtlower.symbolic.ExecutionContext;
import org.smtlower.symbolic.SVal;
import org.smtlower.symbolic.SymbolicComputation;
import org.smtlower.symbolic.Trace;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TraceValidatorTest {

    private static final Kind W8 = Kind.word(8);

    private ExecutionContext parent;

    @BeforeEach
    void setUp() {
        parent = ExecutionContext.newSession();
    }

    private Trace record(SymbolicComputation computation) {
        return ScopedReplayer.record(ContextForker.fork(parent, ForkPurpose.LAMBDA), computation);
    }

    private UnsupportedConstructException unsupported(SymbolicComputation computation, Kind kind) {
        Trace trace = record(computation);
        return assertThrows(UnsupportedConstructException.class, () -> TraceValidator.validate(trace, kind));
    }

    @Nested
    @DisplayName("不支持的构造")
    class UnsupportedTests {

        @Test
        @DisplayName("同时出现可观测值和查找表时只报告可观测值")
        void testObservableAndTable_ShouldReportObservableOnly() {
            UnsupportedConstructException e = unsupported(c -> {
                SVal x = c.freshInput(W8);
                c.observe("seen", x);
                c.newTable(W8, W8, List.of(x, x));
                return x;
            }, W8);

            assertAll(
                    () -> assertTrue(e.getTitle().startsWith("Observables")),
                    () -> assertEquals(List.of("observable seen"), e.getDetails()),
                    () -> assertFalse(e.getMessage().contains("table")),
                    () -> assertTrue(e.getMessage().contains("*** Lowering: Unsupported construct."))
            );
        }

        @Test
        @DisplayName("查找表")
        void testTable() {
            UnsupportedConstructException e = unsupported(c -> {
                SVal x = c.freshInput(W8);
                c.newTable(W8, W8, List.of(x));
                return x;
            }, W8);
            assertTrue(e.getTitle().startsWith("Lookup tables"));
        }

        @Test
        @DisplayName("外部代码片段")
        void testCodeSegment() {
            UnsupportedConstructException e = unsupported(c -> {
                c.addCodeSegment("helper", List.of("int helper(void);"));
                return SVal.TRUE;
            }, Kind.BOOL);
            assertEquals(List.of("code segment for helper"), e.getDetails());
        }

        @Test
        @DisplayName("数组")
        void testArray() {
            UnsupportedConstructException e = unsupported(c -> {
                c.newArray("mem", W8, W8);
                return SVal.TRUE;
            }, Kind.BOOL);
            assertTrue(e.getTitle().startsWith("Arrays"));
        }

        @Test
        @DisplayName("额外约束")
        void testConstraint() {
            UnsupportedConstructException e = unsupported(c -> {
                SVal x = c.freshInput(W8);
                c.constrain(x.greaterThan(SVal.of(W8, 3)));
                return x;
            }, W8);
            assertTrue(e.getTitle().startsWith("Extra constraints"));
        }

        @Test
        @DisplayName("具名断言")
        void testAssertion() {
            UnsupportedConstructException e = unsupported(c -> {
                SVal x = c.freshInput(W8);
                c.addAssertion("positive", x.greaterThan(SVal.of(W8, 0)));
                return x;
            }, W8);
            assertEquals(List.of("assertion positive"), e.getDetails());
        }

        @Test
        @DisplayName("存在量化输入")
        void testExistential() {
            UnsupportedConstructException e = unsupported(c -> c.exists(W8, "e"), W8);
            assertEquals(List.of("existential e"), e.getDetails());
        }

        @Test
        @DisplayName("跟踪变量")
        void testTracker() {
            UnsupportedConstructException e = unsupported(c -> {
                SVal x = c.freshInput(W8);
                c.tracker(W8, "t");
                return x;
            }, W8);
            assertEquals(List.of("tracker t"), e.getDetails());
        }
    }

    @Nested
    @DisplayName("输出检查")
    class OutputTests {

        @Test
        @DisplayName("输出类型与期望不符时报告内部不一致")
        void testKindMismatch_ShouldBeInconsistent() {
            Trace trace = record(c -> c.freshInput(W8));

            InternalInconsistencyException e = assertThrows(InternalInconsistencyException.class,
                    () -> TraceValidator.validate(trace, Kind.BOOL));
            assertAll(
                    () -> assertEquals(List.of("expected SBool", "actual   SWord8"), e.getDetails()),
                    () -> assertTrue(e.getMessage().contains("*** Lowering: Impossible happened."))
            );
        }

        @Test
        @DisplayName("多个输出时报告内部不一致")
        void testTwoOutputs_ShouldBeInconsistent() {
            Trace trace = record(c -> {
                SVal x = c.freshInput(W8);
                c.output(x);
                return x;
            });
            assertThrows(InternalInconsistencyException.class, () -> TraceValidator.validate(trace, W8));
        }
    }

    @Nested
    @DisplayName("提取")
    class ExtractionTests {

        @Test
        @DisplayName("父上下文中已有的共享登记项不影响子记录")
        void testParentRegistries_ShouldNotLeakIntoTrace() {
            SVal y = parent.forall(W8, "y");
            parent.observe("parentObs", y);
            parent.newTable(W8, W8, List.of(y));

            ValidatedTrace vt = TraceValidator.validate(record(c -> c.freshInput(W8)), W8);

            assertEquals(1, vt.getParams().size());
        }

        @Test
        @DisplayName("参数按声明顺序提取，布尔字面量不进入常量")
        void testExtract_ParamsAndConstants() {
            ValidatedTrace vt = TraceValidator.validate(record(c -> {
                SVal a = c.freshInput(W8);
                SVal b = c.freshInput(W8);
                return SVal.ite(a.lessThan(b), a.plus(SVal.of(W8, 1)), b);
            }), W8);

            assertAll(
                    () -> assertEquals("l1_s0", vt.getParams().get(0).toString()),
                    () -> assertEquals("l1_s1", vt.getParams().get(1).toString()),
                    () -> assertEquals(1, vt.getConstants().size()),
                    () -> assertEquals(3, vt.getAssignments().size()),
                    () -> assertTrue(vt.getFrees().isEmpty())
            );
        }

        @Test
        @DisplayName("未解释函数名按首次出现顺序去重")
        void testExtract_Frees() {
            ValidatedTrace vt = TraceValidator.validate(record(c -> {
                SVal x = c.freshInput(W8);
                SVal h = SVal.uninterpreted("h", W8, x);
                SVal g = SVal.uninterpreted("g", W8, x);
                return h.plus(g).plus(SVal.uninterpreted("h", W8, g));
            }), W8);

            assertEquals(List.of("h", "g"), vt.getFrees());
        }
    }
}
