package org.smtlower.utils;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 精确有理数，用于 Real 类型常量以及浮点常量的精确展开。
 * 与求解器的 Real 排序一致，这里只有有限值：没有无穷，也没有 NaN。
 * 此类是不可变的。
 */
public final class Rational implements Comparable<Rational> {
    private static final Logger logger = LoggerFactory.getLogger(Rational.class);
    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(256);

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);

    static {
        for (int i = -16; i <= 16; i++) {
            Rational r = i == 0 ? ZERO : new Rational(BigInteger.valueOf(i), BigInteger.ONE);
            CACHE.put(r.getCacheKey(), r);
        }
    }

    /**
     * 私有构造函数，调用者保证已约分且分母为正。
     */
    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(long numerator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(BigInteger numerator) {
        return valueOf(numerator, BigInteger.ONE);
    }

    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "Rational-valueOf: numerator 不能为 null");
        Objects.requireNonNull(denominator, "Rational-valueOf: denominator 不能为 null");
        if (denominator.signum() == 0) {
            logger.error("Rational-valueOf: 分母为0: {} / {}", numerator, denominator);
            throw new ArithmeticException("Rational 分母不能为 0: " + numerator + "/" + denominator);
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }
        // 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BigInteger.ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }

        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }
        logger.debug("创建 Rational: {}/{}", numerator, denominator);
        return new Rational(numerator, denominator);
    }

    /**
     * 精确转换一个 BigDecimal，不做任何舍入。
     */
    public static Rational valueOf(BigDecimal value) {
        Objects.requireNonNull(value, "Rational-valueOf: value 不能为 null");
        if (value.scale() <= 0) {
            return valueOf(value.toBigIntegerExact());
        }
        return valueOf(value.unscaledValue(), BigInteger.TEN.pow(value.scale()));
    }

    /**
     * 精确转换一个有限的 double。double 的二进制值本身就是一个有理数，因此这里没有精度损失。
     * @throws IllegalArgumentException 如果 value 是 NaN 或无穷。
     */
    public static Rational valueOf(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            logger.error("Rational-valueOf: 尝试从非有限 double 创建 Rational: {}", value);
            throw new IllegalArgumentException("无法精确表示非有限值: " + value);
        }
        return valueOf(new BigDecimal(value));
    }

    // ========== 基础运算 ==========

    public Rational add(Rational other) {
        return valueOf(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return this.add(other.negate());
    }

    public Rational multiply(Rational other) {
        return valueOf(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    public Rational negate() {
        return valueOf(numerator.negate(), denominator);
    }

    public int signum() {
        return numerator.signum();
    }

    private boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    /**
     * 转换为 SMT-LIB 的 Real 字面量：整数写作 {@code 3.0}，分数写作 {@code (/ 1.0 3.0)}，
     * 负数再套一层 {@code (- ...)}。
     */
    public String toSmtLib() {
        String magnitude;
        BigInteger absNum = numerator.abs();
        if (isInteger()) {
            magnitude = absNum + ".0";
        } else {
            magnitude = "(/ " + absNum + ".0 " + denominator + ".0)";
        }
        return signum() < 0 ? "(- " + magnitude + ")" : magnitude;
    }

    // ========== 对象基础方法 ==========

    @Override
    public int compareTo(Rational other) {
        BigInteger ad = this.numerator.multiply(other.denominator);
        BigInteger cb = other.numerator.multiply(this.denominator);
        return ad.compareTo(cb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rational that)) {
            return false;
        }
        return this.numerator.equals(that.numerator) && this.denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    private List<BigInteger> getCacheKey() {
        return List.of(this.numerator, this.denominator);
    }

    @Override
    public String toString() {
        if (isInteger()) {
            return numerator.toString();
        }
        return numerator + "/" + denominator;
    }
}
