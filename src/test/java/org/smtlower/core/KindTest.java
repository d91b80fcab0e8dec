package org.smtlower.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class KindTest {

    @Nested
    @DisplayName("SMT-LIB 类型名")
    class SmtTypeTests {

        @Test
        @DisplayName("所有种类都有类型名")
        void testSmtType_ShouldBeTotal() {
            assertAll(
                    () -> assertEquals("Bool", Kind.BOOL.smtType()),
                    () -> assertEquals("(_ BitVec 8)", Kind.word(8).smtType()),
                    () -> assertEquals("(_ BitVec 16)", Kind.intN(16).smtType()),
                    () -> assertEquals("Int", Kind.UNBOUNDED.smtType()),
                    () -> assertEquals("Real", Kind.REAL.smtType()),
                    () -> assertEquals("(_ FloatingPoint 8 24)", Kind.FLOAT.smtType()),
                    () -> assertEquals("(_ FloatingPoint 11 53)", Kind.DOUBLE.smtType()),
                    () -> assertEquals("(_ FloatingPoint 5 11)", Kind.fp(5, 11).smtType()),
                    () -> assertEquals("RoundingMode", Kind.ROUNDING_MODE.smtType()),
                    () -> assertEquals("String", Kind.STRING.smtType()),
                    () -> assertEquals("String", Kind.CHAR.smtType()),
                    () -> assertEquals("Color", Kind.userSort("Color").smtType())
            );
        }

        @Test
        @DisplayName("每个 KindType 都能渲染")
        void testSmtType_EveryKindTypeCovered() {
            Kind[] samples = {Kind.BOOL, Kind.word(1), Kind.UNBOUNDED, Kind.REAL, Kind.FLOAT, Kind.DOUBLE,
                    Kind.fp(3, 5), Kind.ROUNDING_MODE, Kind.STRING, Kind.CHAR, Kind.userSort("S")};
            assertEquals(KindType.values().length, samples.length);
            for (Kind k : samples) {
                assertNotNull(k.smtType(), "smtType should not be null for " + k);
            }
        }
    }

    @Nested
    @DisplayName("位向量")
    class BoundedTests {

        @Test
        @DisplayName("有符号 8 位的取值范围")
        void testRange_Signed8() {
            Kind k = Kind.intN(8);
            assertAll(
                    () -> assertEquals(BigInteger.valueOf(-128), k.minValue()),
                    () -> assertEquals(BigInteger.valueOf(127), k.maxValue()),
                    () -> assertTrue(k.hasSign()),
                    () -> assertEquals(8, k.intSizeOf())
            );
        }

        @Test
        @DisplayName("无符号 8 位的取值范围")
        void testRange_Unsigned8() {
            Kind k = Kind.word(8);
            assertEquals(BigInteger.ZERO, k.minValue());
            assertEquals(BigInteger.valueOf(255), k.maxValue());
        }

        @Test
        @DisplayName("宽度 0 合法，负宽度非法")
        void testWidth() {
            assertEquals(0, Kind.word(0).intSizeOf());
            assertThrows(IllegalArgumentException.class, () -> Kind.word(-1));
        }

        @Test
        @DisplayName("非位向量没有宽度")
        void testIntSizeOf_NonBounded_ShouldThrow() {
            assertThrows(IllegalStateException.class, Kind.BOOL::intSizeOf);
        }

        @Test
        @DisplayName("相等性由符号性和宽度决定")
        void testEquality() {
            assertEquals(Kind.word(8), Kind.bounded(false, 8));
            assertNotEquals(Kind.word(8), Kind.intN(8));
            assertEquals("SWord8", Kind.word(8).toString());
            assertEquals("SInt32", Kind.intN(32).toString());
        }
    }
}
