package org.smtlower.core;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtlower.utils.Rational;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 一个具体值 (concrete value)：类型标签加上其 Java 表示。
 * <ul>
 *     <li>BOOL: {@link Boolean}</li>
 *     <li>BOUNDED / UNBOUNDED: {@link BigInteger}，位向量按宽度规范化 (有符号用补码的有符号解释)</li>
 *     <li>REAL / FP: {@link Rational}</li>
 *     <li>FLOAT / DOUBLE: {@link Float} / {@link Double}</li>
 *     <li>ROUNDING_MODE: {@link FpRoundingMode}; STRING: {@link String}; CHAR: {@link Character}</li>
 *     <li>USER_SORT: 枚举常量名 {@link String}</li>
 * </ul>
 * 此类是不可变的。
 */
@Getter
public final class ConcreteValue {

    private static final Logger logger = LoggerFactory.getLogger(ConcreteValue.class);

    public static final ConcreteValue FALSE = new ConcreteValue(Kind.BOOL, Boolean.FALSE);
    public static final ConcreteValue TRUE = new ConcreteValue(Kind.BOOL, Boolean.TRUE);

    private final Kind kind;
    private final Object value;

    private final int hashCode;

    private ConcreteValue(Kind kind, Object value) {
        this.kind = Objects.requireNonNull(kind, "ConcreteValue-构造函数: kind 不能为 null");
        this.value = Objects.requireNonNull(value, "ConcreteValue-构造函数: value 不能为 null");
        this.hashCode = Objects.hash(kind, value);
    }

    // --- 工厂方法 ---

    public static ConcreteValue ofBool(boolean b) {
        return b ? TRUE : FALSE;
    }

    /**
     * 创建整数类常量。位向量会被回绕到其宽度内。
     * @throws IllegalArgumentException 如果 kind 不是整数类。
     */
    public static ConcreteValue ofInteger(Kind kind, BigInteger v) {
        Objects.requireNonNull(v, "ConcreteValue-ofInteger: value 不能为 null");
        return switch (kind.getType()) {
            case BOUNDED -> new ConcreteValue(kind, normalize(kind, v));
            case UNBOUNDED -> new ConcreteValue(kind, v);
            default -> {
                logger.error("ConcreteValue-ofInteger: {} 不是整数类型", kind);
                throw new IllegalArgumentException("整数常量需要位向量或 Integer 类型, 实际为: " + kind);
            }
        };
    }

    public static ConcreteValue ofInteger(Kind kind, long v) {
        return ofInteger(kind, BigInteger.valueOf(v));
    }

    public static ConcreteValue ofReal(Rational r) {
        return new ConcreteValue(Kind.REAL, r);
    }

    public static ConcreteValue ofFloat(float f) {
        return new ConcreteValue(Kind.FLOAT, f);
    }

    public static ConcreteValue ofDouble(double d) {
        return new ConcreteValue(Kind.DOUBLE, d);
    }

    /**
     * 任意精度浮点常量，以精确有理数给出其值。
     */
    public static ConcreteValue ofFp(Kind kind, Rational r) {
        if (kind.getType() != KindType.FP) {
            logger.error("ConcreteValue-ofFp: {} 不是 FP 类型", kind);
            throw new IllegalArgumentException("ofFp 需要 FP 类型, 实际为: " + kind);
        }
        return new ConcreteValue(kind, r);
    }

    public static ConcreteValue ofRoundingMode(FpRoundingMode rm) {
        return new ConcreteValue(Kind.ROUNDING_MODE, rm);
    }

    public static ConcreteValue ofString(String s) {
        return new ConcreteValue(Kind.STRING, s);
    }

    public static ConcreteValue ofChar(char c) {
        return new ConcreteValue(Kind.CHAR, c);
    }

    public static ConcreteValue ofUserSort(Kind kind, String constructor) {
        if (kind.getType() != KindType.USER_SORT) {
            logger.error("ConcreteValue-ofUserSort: {} 不是用户排序", kind);
            throw new IllegalArgumentException("ofUserSort 需要用户排序, 实际为: " + kind);
        }
        return new ConcreteValue(kind, constructor);
    }

    /**
     * 将任意整数回绕到位向量的取值范围内。
     */
    static BigInteger normalize(Kind kind, BigInteger v) {
        int n = kind.intSizeOf();
        if (n == 0) {
            return BigInteger.ZERO;
        }
        BigInteger modulus = BigInteger.ONE.shiftLeft(n);
        BigInteger unsigned = v.mod(modulus);
        if (kind.hasSign() && unsigned.testBit(n - 1)) {
            return unsigned.subtract(modulus);
        }
        return unsigned;
    }

    // --- 访问 ---

    public boolean asBoolean() {
        if (!(value instanceof Boolean b)) {
            throw new IllegalStateException("不是布尔常量: " + this);
        }
        return b;
    }

    public BigInteger asInteger() {
        if (!(value instanceof BigInteger i)) {
            throw new IllegalStateException("不是整数常量: " + this);
        }
        return i;
    }

    public Rational asRational() {
        if (!(value instanceof Rational r)) {
            throw new IllegalStateException("不是有理数常量: " + this);
        }
        return r;
    }

    /**
     * 位向量的无符号位模式 (补码)，范围 [0, 2^n)。
     */
    public BigInteger unsignedBits() {
        BigInteger i = asInteger();
        int n = kind.intSizeOf();
        return n == 0 ? BigInteger.ZERO : i.mod(BigInteger.ONE.shiftLeft(n));
    }

    public boolean isBooleanLiteral() {
        return kind.isBoolean();
    }

    // --- SMT-LIB 转换 ---

    /**
     * 转换为目标语言的字面量语法。
     * @param roundingMode 会话配置的舍入模式，用于浮点常量。
     */
    public String toSmtLib(FpRoundingMode roundingMode) {
        return switch (kind.getType()) {
            case BOOL -> asBoolean() ? "true" : "false";
            case BOUNDED -> bitVectorLiteral();
            case UNBOUNDED -> {
                BigInteger i = asInteger();
                yield i.signum() < 0 ? "(- " + i.negate() + ")" : i.toString();
            }
            case REAL -> asRational().toSmtLib();
            case FLOAT -> floatLiteral(((Float) value).doubleValue(), roundingMode);
            case DOUBLE -> floatLiteral((Double) value, roundingMode);
            case FP -> "((_ to_fp " + kind.getExponentWidth() + " " + kind.getSignificandWidth() + ") "
                    + roundingMode.getSmtName() + " " + asRational().toSmtLib() + ")";
            case ROUNDING_MODE -> ((FpRoundingMode) value).getSmtName();
            case STRING -> stringLiteral((String) value);
            case CHAR -> "(_ char #x" + Integer.toHexString((Character) value).toUpperCase() + ")";
            case USER_SORT -> (String) value;
        };
    }

    private String bitVectorLiteral() {
        int n = kind.intSizeOf();
        BigInteger bits = unsignedBits();
        if (n > 0 && n % 4 == 0) {
            return "#x" + StringUtils.leftPad(bits.toString(16), n / 4, '0');
        }
        return "#b" + StringUtils.leftPad(bits.toString(2), n, '0');
    }

    private String floatLiteral(double d, FpRoundingMode roundingMode) {
        String sizes = kind.getExponentWidth() + " " + kind.getSignificandWidth();
        if (Double.isNaN(d)) {
            return "(_ NaN " + sizes + ")";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "(_ +oo " + sizes + ")" : "(_ -oo " + sizes + ")";
        }
        if (d == 0.0) {
            return Math.copySign(1.0, d) < 0 ? "(_ -zero " + sizes + ")" : "(_ +zero " + sizes + ")";
        }
        return "((_ to_fp " + sizes + ") " + roundingMode.getSmtName() + " " + Rational.valueOf(d).toSmtLib() + ")";
    }

    private static String stringLiteral(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"') {
                sb.append("\"\"");
            } else if (c >= 32 && c < 127) {
                sb.append(c);
            } else {
                sb.append("\\u{").append(Integer.toHexString(c)).append('}');
            }
        }
        return sb.append('"').toString();
    }

    // --- Object 方法 ---

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConcreteValue that = (ConcreteValue) o;
        return kind.equals(that.kind) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return value + " :: " + kind;
    }
}
