package org.smtlower.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class RationalTest {

    @Nested
    @DisplayName("构造与规范化")
    class ConstructionTests {

        @Test
        @DisplayName("分数应约分，分母应为正 (4/-6 => -2/3)")
        void testValueOf_ShouldReduceAndNormalizeSign() {
            Rational r = Rational.valueOf(4, -6);

            assertAll("4/-6 should normalize to -2/3",
                    () -> assertEquals(-2, r.getNumerator().intValue()),
                    () -> assertEquals(3, r.getDenominator().intValue()),
                    () -> assertEquals("-2/3", r.toString())
            );
        }

        @Test
        @DisplayName("小整数应命中缓存")
        void testValueOf_SmallIntegers_ShouldBeCached() {
            assertSame(Rational.valueOf(7), Rational.valueOf(14, 2));
            assertSame(Rational.ZERO, Rational.valueOf(0, 5));
        }

        @Test
        @DisplayName("分母为0应抛出异常")
        void testValueOf_ZeroDenominator_ShouldThrow() {
            assertThrows(ArithmeticException.class, () -> Rational.valueOf(1, 0));
        }

        @Test
        @DisplayName("double 应被精确转换 (0.1 不是 1/10)")
        void testValueOf_Double_ShouldBeExact() {
            assertEquals(Rational.valueOf(1, 2), Rational.valueOf(0.5));
            assertNotEquals(Rational.valueOf(1, 10), Rational.valueOf(0.1));
            assertEquals(Rational.valueOf(new BigDecimal(0.1)), Rational.valueOf(0.1));
        }

        @Test
        @DisplayName("NaN 和无穷不能转换")
        void testValueOf_NonFiniteDouble_ShouldThrow() {
            assertAll(
                    () -> assertThrows(IllegalArgumentException.class, () -> Rational.valueOf(Double.NaN)),
                    () -> assertThrows(IllegalArgumentException.class, () -> Rational.valueOf(Double.POSITIVE_INFINITY))
            );
        }
    }

    @Nested
    @DisplayName("运算与比较")
    class ArithmeticTests {

        @Test
        @DisplayName("四则运算")
        void testArithmetic() {
            Rational a = Rational.valueOf(1, 3);
            Rational b = Rational.valueOf(1, 6);

            assertAll(
                    () -> assertEquals(Rational.valueOf(1, 2), a.add(b)),
                    () -> assertEquals(Rational.valueOf(1, 6), a.subtract(b)),
                    () -> assertEquals(Rational.valueOf(1, 18), a.multiply(b)),
                    () -> assertEquals(Rational.valueOf(-1, 3), a.negate())
            );
        }

        @Test
        @DisplayName("0 取反仍为 0")
        void testNegate_Zero_ShouldStayZero() {
            assertAll(
                    () -> assertEquals(Rational.ZERO, Rational.ZERO.negate()),
                    () -> assertEquals(0, Rational.ZERO.negate().signum()),
                    () -> assertEquals("0.0", Rational.ZERO.negate().toSmtLib())
            );
        }

        @Test
        @DisplayName("比较按数值进行")
        void testCompareTo() {
            assertTrue(Rational.valueOf(1, 3).compareTo(Rational.valueOf(1, 2)) < 0);
            assertEquals(0, Rational.valueOf(2, 4).compareTo(Rational.valueOf(1, 2)));
        }
    }

    @Nested
    @DisplayName("SMT-LIB 字面量")
    class SmtLibTests {

        @Test
        @DisplayName("整数、分数和负数的渲染")
        void testToSmtLib() {
            assertAll(
                    () -> assertEquals("3.0", Rational.valueOf(3).toSmtLib()),
                    () -> assertEquals("(/ 1.0 3.0)", Rational.valueOf(1, 3).toSmtLib()),
                    () -> assertEquals("(- (/ 5.0 2.0))", Rational.valueOf(-5, 2).toSmtLib()),
                    () -> assertEquals("(- 4.0)", Rational.valueOf(-4).toSmtLib())
            );
        }
    }
}
