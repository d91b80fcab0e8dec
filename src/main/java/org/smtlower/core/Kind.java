package org.smtlower.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 符号值的类型标签 (Kind)，例如布尔、定宽有符号/无符号位向量、浮点等。
 * 此类是不可变的；相等性由全部字段决定。
 */
@Getter
public final class Kind {

    private static final Logger logger = LoggerFactory.getLogger(Kind.class);

    public static final Kind BOOL = new Kind(KindType.BOOL, false, 0, 0, 0, null);
    public static final Kind UNBOUNDED = new Kind(KindType.UNBOUNDED, true, 0, 0, 0, null);
    public static final Kind REAL = new Kind(KindType.REAL, true, 0, 0, 0, null);
    public static final Kind FLOAT = new Kind(KindType.FLOAT, true, 0, 8, 24, null);
    public static final Kind DOUBLE = new Kind(KindType.DOUBLE, true, 0, 11, 53, null);
    public static final Kind ROUNDING_MODE = new Kind(KindType.ROUNDING_MODE, false, 0, 0, 0, null);
    public static final Kind STRING = new Kind(KindType.STRING, false, 0, 0, 0, null);
    public static final Kind CHAR = new Kind(KindType.CHAR, false, 0, 0, 0, null);

    private final KindType type;
    private final boolean signed;
    private final int width;            // 仅 BOUNDED
    private final int exponentWidth;    // 仅浮点
    private final int significandWidth; // 仅浮点
    private final String sortName;      // 仅 USER_SORT

    private final int hashCode;

    private Kind(KindType type, boolean signed, int width, int exponentWidth, int significandWidth, String sortName) {
        this.type = type;
        this.signed = signed;
        this.width = width;
        this.exponentWidth = exponentWidth;
        this.significandWidth = significandWidth;
        this.sortName = sortName;
        this.hashCode = Objects.hash(type, signed, width, exponentWidth, significandWidth, sortName);
    }

    // --- 工厂方法 ---

    /**
     * @param signed 是否有符号。
     * @param width  位宽，允许为 0。
     */
    public static Kind bounded(boolean signed, int width) {
        if (width < 0) {
            logger.error("Kind-bounded: 位宽不能为负: {}", width);
            throw new IllegalArgumentException("位向量宽度不能为负: " + width);
        }
        return new Kind(KindType.BOUNDED, signed, width, 0, 0, null);
    }

    public static Kind word(int width) {
        return bounded(false, width);
    }

    public static Kind intN(int width) {
        return bounded(true, width);
    }

    public static Kind fp(int exponentWidth, int significandWidth) {
        if (exponentWidth < 2 || significandWidth < 2) {
            logger.error("Kind-fp: 非法的浮点宽度: eb={}, sb={}", exponentWidth, significandWidth);
            throw new IllegalArgumentException("非法的浮点宽度: eb=" + exponentWidth + ", sb=" + significandWidth);
        }
        return new Kind(KindType.FP, true, 0, exponentWidth, significandWidth, null);
    }

    public static Kind userSort(String name) {
        Objects.requireNonNull(name, "Kind-userSort: name 不能为 null");
        return new Kind(KindType.USER_SORT, false, 0, 0, 0, name);
    }

    // --- 查询 ---

    public boolean isBoolean() {
        return type == KindType.BOOL;
    }

    public boolean isBounded() {
        return type == KindType.BOUNDED;
    }

    public boolean isFloatingPoint() {
        return type == KindType.FLOAT || type == KindType.DOUBLE || type == KindType.FP;
    }

    /**
     * 是否有符号。对位向量而言就是 signed 标志；布尔等非数值类型总是 false。
     */
    public boolean hasSign() {
        return signed;
    }

    /**
     * 位向量宽度。
     * @throws IllegalStateException 如果不是定宽位向量。
     */
    public int intSizeOf() {
        if (type != KindType.BOUNDED) {
            logger.error("Kind-intSizeOf: {} 不是位向量", this);
            throw new IllegalStateException("intSizeOf 只适用于位向量, 实际为: " + this);
        }
        return width;
    }

    /**
     * 该位向量类型所能表示的最小值 (无符号为 0)。
     */
    public BigInteger minValue() {
        int n = intSizeOf();
        if (!signed || n == 0) {
            return BigInteger.ZERO;
        }
        return BigInteger.ONE.shiftLeft(n - 1).negate();
    }

    /**
     * 该位向量类型所能表示的最大值。
     */
    public BigInteger maxValue() {
        int n = intSizeOf();
        if (n == 0) {
            return BigInteger.ZERO;
        }
        return signed ? BigInteger.ONE.shiftLeft(n - 1).subtract(BigInteger.ONE)
                      : BigInteger.ONE.shiftLeft(n).subtract(BigInteger.ONE);
    }

    /**
     * 该类型在 SMT-LIB 中的排序名。对所有种类都是全函数。
     */
    public String smtType() {
        return switch (type) {
            case BOOL -> "Bool";
            case BOUNDED -> "(_ BitVec " + width + ")";
            case UNBOUNDED -> "Int";
            case REAL -> "Real";
            case FLOAT, DOUBLE, FP -> "(_ FloatingPoint " + exponentWidth + " " + significandWidth + ")";
            case ROUNDING_MODE -> "RoundingMode";
            case STRING, CHAR -> "String";
            case USER_SORT -> sortName;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Kind that = (Kind) o;
        return type == that.type && signed == that.signed && width == that.width
                && exponentWidth == that.exponentWidth && significandWidth == that.significandWidth
                && Objects.equals(sortName, that.sortName);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return switch (type) {
            case BOOL -> "SBool";
            case BOUNDED -> (signed ? "SInt" : "SWord") + width;
            case UNBOUNDED -> "SInteger";
            case REAL -> "SReal";
            case FLOAT -> "SFloat";
            case DOUBLE -> "SDouble";
            case FP -> "SFloatingPoint " + exponentWidth + " " + significandWidth;
            case ROUNDING_MODE -> "SRoundingMode";
            case STRING -> "SString";
            case CHAR -> "SChar";
            case USER_SORT -> sortName;
        };
    }
}
