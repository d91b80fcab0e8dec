package org.smtlower.symbolic;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.smtlower.core.Kind;
import org.smtlower.core.NodeRef;
import org.smtlower.expressions.OpType;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class SValTest {

    private static final Kind W8 = Kind.word(8);
    private static final Kind I8 = Kind.intN(8);

    private static BigInteger value(SVal v) {
        return v.asConcrete().orElseThrow().asInteger();
    }

    @Nested
    @DisplayName("具体值折叠")
    class FoldingTests {

        @Test
        @DisplayName("位向量算术按宽度回绕")
        void testArithmetic_ShouldWrap() {
            assertAll(
                    () -> assertEquals(BigInteger.valueOf(44), value(SVal.of(W8, 200).plus(SVal.of(W8, 100)))),
                    () -> assertEquals(BigInteger.valueOf(-56), value(SVal.of(I8, 100).plus(SVal.of(I8, 100)))),
                    () -> assertEquals(BigInteger.valueOf(255), value(SVal.of(W8, 0).minus(SVal.of(W8, 1)))),
                    () -> assertEquals(BigInteger.valueOf(-128), value(SVal.of(I8, -128).negate()))
            );
        }

        @Test
        @DisplayName("除以0遵循 SMT-LIB 语义")
        void testDivisionByZero() {
            assertAll(
                    () -> assertEquals(BigInteger.valueOf(255), value(SVal.of(W8, 7).quot(SVal.of(W8, 0)))),
                    () -> assertEquals(BigInteger.valueOf(7), value(SVal.of(W8, 7).rem(SVal.of(W8, 0)))),
                    () -> assertEquals(BigInteger.valueOf(-1), value(SVal.of(I8, 7).quot(SVal.of(I8, 0)))),
                    () -> assertEquals(BigInteger.ONE, value(SVal.of(I8, -7).quot(SVal.of(I8, 0)))),
                    () -> assertEquals(BigInteger.valueOf(-7), value(SVal.of(I8, -7).rem(SVal.of(I8, 0))))
            );
        }

        @Test
        @DisplayName("有符号除法向零截断，余数符号跟随被除数")
        void testSignedDivision() {
            assertAll(
                    () -> assertEquals(BigInteger.valueOf(-3), value(SVal.of(I8, -7).quot(SVal.of(I8, 2)))),
                    () -> assertEquals(BigInteger.valueOf(-1), value(SVal.of(I8, -7).rem(SVal.of(I8, 2)))),
                    () -> assertEquals(BigInteger.valueOf(-128), value(SVal.of(I8, -128).quot(SVal.of(I8, -1))))
            );
        }

        @Test
        @DisplayName("比较按类型的有无符号解释")
        void testComparisons() {
            assertSame(SVal.TRUE, SVal.of(I8, -1).lessThan(SVal.of(I8, 0)));
            assertSame(SVal.FALSE, SVal.of(W8, 255).lessThan(SVal.of(W8, 0)));
            assertSame(SVal.TRUE, SVal.of(W8, 3).equal(SVal.of(W8, 3)));
        }

        @Test
        @DisplayName("位操作：拼接、截取、测试位")
        void testBitOperations() {
            SVal hi = SVal.of(Kind.word(4), 0xA);
            SVal lo = SVal.of(Kind.word(4), 0x5);
            SVal joined = hi.join(lo);
            assertAll(
                    () -> assertEquals(Kind.word(8), joined.getKind()),
                    () -> assertEquals(BigInteger.valueOf(0xA5), value(joined)),
                    () -> assertEquals(BigInteger.valueOf(0xA), value(joined.extract(7, 4))),
                    () -> assertSame(SVal.TRUE, joined.testBit(0)),
                    () -> assertSame(SVal.FALSE, joined.testBit(1)),
                    () -> assertSame(SVal.TRUE, SVal.of(I8, -1).msb())
            );
        }

        @Test
        @DisplayName("类型不一致应抛出异常")
        void testKindMismatch_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> SVal.of(W8, 1).plus(SVal.of(I8, 1)));
            assertThrows(IllegalArgumentException.class,
                    () -> SVal.of(Kind.UNBOUNDED, 1).quot(SVal.of(Kind.UNBOUNDED, 1)));
        }
    }

    @Nested
    @DisplayName("布尔短路")
    class ShortCircuitTests {

        private ExecutionContext ctx;
        private SVal b;

        @BeforeEach
        void setUp() {
            ctx = ExecutionContext.newSession();
            b = ctx.freshInput(Kind.BOOL);
        }

        @Test
        @DisplayName("与/或遇到具体值时不产生节点")
        void testAndOr_WithConcrete_ShouldNotCreateNodes() {
            assertAll(
                    () -> assertSame(SVal.FALSE, b.and(SVal.FALSE)),
                    () -> assertSame(b, b.and(SVal.TRUE)),
                    () -> assertSame(SVal.TRUE, SVal.TRUE.or(b)),
                    () -> assertSame(b, SVal.FALSE.or(b))
            );
        }

        @Test
        @DisplayName("ite 的条件为具体值时直接选择分支")
        void testIte_ConcreteCondition() {
            SVal x = ctx.freshInput(W8);
            SVal y = SVal.of(W8, 1);
            assertSame(x, SVal.ite(SVal.TRUE, x, y));
            assertSame(y, SVal.ite(SVal.FALSE, x, y));
            assertSame(x, SVal.ite(b, x, x));
        }
    }

    @Nested
    @DisplayName("节点构造")
    class NodeTests {

        @Test
        @DisplayName("同一个符号值在同一上下文中只构造一次")
        void testToNode_ShouldMemoizePerContext() {
            ExecutionContext ctx = ExecutionContext.newSession();
            SVal x = ctx.freshInput(W8);
            SVal sum = x.plus(x);

            NodeRef first = sum.toNode(ctx);
            NodeRef second = sum.toNode(ctx);

            assertEquals(first, second);
            assertEquals(1, ctx.getAssignments().size());
            assertEquals(OpType.PLUS, ctx.getAssignments().get(0).getExpr().getOp().getType());
        }

        @Test
        @DisplayName("结构相同的表达式被去重")
        void testNewExpr_ShouldDeduplicate() {
            ExecutionContext ctx = ExecutionContext.newSession();
            SVal x = ctx.freshInput(W8);

            NodeRef a = x.plus(x).toNode(ctx);
            NodeRef b = x.plus(x).toNode(ctx);

            assertEquals(a, b);
            assertEquals(1, ctx.getAssignments().size());
        }

        @Test
        @DisplayName("布尔常量映射到保留节点")
        void testBooleanConstants_ShouldUseReservedNodes() {
            ExecutionContext ctx = ExecutionContext.newSession();
            assertEquals(NodeRef.TRUE, SVal.TRUE.toNode(ctx));
            assertEquals("false", SVal.FALSE.toNode(ctx).toString());
            assertEquals(0, ctx.getNodeCounter().get());
        }

        @Test
        @DisplayName("未解释函数调用登记签名")
        void testUninterpreted_ShouldRegisterSignature() {
            ExecutionContext ctx = ExecutionContext.newSession();
            SVal x = ctx.freshInput(W8);
            SVal.uninterpreted("f", Kind.BOOL, x).toNode(ctx);

            FunctionSignature sig = ctx.getUninterpreted().get("f");
            assertNotNull(sig);
            assertEquals("(declare-fun f ((_ BitVec 8)) Bool)", sig.smtDeclaration("f"));
        }

        @Test
        @DisplayName("同名未解释函数的签名冲突应抛出异常")
        void testUninterpreted_ConflictingSignature_ShouldThrow() {
            ExecutionContext ctx = ExecutionContext.newSession();
            SVal x = ctx.freshInput(W8);
            SVal.uninterpreted("f", Kind.BOOL, x).toNode(ctx);

            assertThrows(IllegalArgumentException.class, () -> SVal.uninterpreted("f", W8, x).toNode(ctx));
        }
    }
}
