package org.smtlower.overflow;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtlower.core.Kind;
import org.smtlower.expressions.OverflowOp;
import org.smtlower.symbolic.SVal;

/**
 * 位向量算术的下溢/上溢判定。
 * <p>
 * 每个运算返回一对布尔符号值：左边为下溢条件，右边为上溢条件。
 * 宽度 n 和有无符号由操作数的类型决定，两个操作数的类型必须相同。
 * 操作数都是具体值时结果也是具体值。
 */
public final class BvOverflow {

    private static final Logger logger = LoggerFactory.getLogger(BvOverflow.class);

    private static final Pair<SVal, SVal> NEITHER = Pair.of(SVal.FALSE, SVal.FALSE);

    private BvOverflow() {
    }

    // ========== 加法 ==========

    public static Pair<SVal, SVal> bvAddO(SVal x, SVal y) {
        int n = width("bvAddO", x, y);
        if (n == 0) {
            return NEITHER;
        }
        if (!x.getKind().hasSign()) {
            SVal sum = zeroExtend(x, n + 1).plus(zeroExtend(y, n + 1));
            return Pair.of(SVal.FALSE, sum.testBit(n));
        }
        SVal r = x.plus(y);
        SVal underflow = x.msb().and(y.msb()).and(r.msb().not());
        SVal overflow = x.msb().not().and(y.msb().not()).and(r.msb());
        return Pair.of(underflow, overflow);
    }

    // ========== 减法 ==========

    public static Pair<SVal, SVal> bvSubO(SVal x, SVal y) {
        int n = width("bvSubO", x, y);
        if (n == 0) {
            return NEITHER;
        }
        if (!x.getKind().hasSign()) {
            return Pair.of(y.greaterThan(x), SVal.FALSE);
        }
        SVal r = x.minus(y);
        SVal underflow = x.msb().and(y.msb().not()).and(r.msb().not());
        SVal overflow = x.msb().not().and(y.msb()).and(r.msb());
        return Pair.of(underflow, overflow);
    }

    // ========== 乘法 ==========

    /**
     * 乘法溢出，使用逐位进位累积算法。
     * 结果由两部分取或：(n+1) 位扩展乘积的高位检查，以及逐位累积的检查，两者缺一不可。
     */
    public static Pair<SVal, SVal> bvMulO(SVal x, SVal y) {
        int n = width("bvMulO", x, y);
        if (n == 0) {
            return NEITHER;
        }
        return x.getKind().hasSign() ? signedMulOverflow(x, y, n) : unsignedMulOverflow(x, y, n);
    }

    /**
     * 与 {@link #bvMulO} 语义相同。操作数不全是具体值时直接使用求解器原生的溢出原语。
     */
    public static Pair<SVal, SVal> bvMulOFast(SVal x, SVal y) {
        int n = width("bvMulOFast", x, y);
        if (n == 0) {
            return NEITHER;
        }
        if (x.isConcrete() && y.isConcrete()) {
            return bvMulO(x, y);
        }
        if (!x.getKind().hasSign()) {
            return Pair.of(SVal.FALSE, SVal.overflow(OverflowOp.UMUL_OVFL, x, y));
        }
        return Pair.of(SVal.overflow(OverflowOp.SMUL_UDFL, x, y), SVal.overflow(OverflowOp.SMUL_OVFL, x, y));
    }

    private static Pair<SVal, SVal> unsignedMulOverflow(SVal x, SVal y, int n) {
        SVal product = zeroExtend(x, n + 1).times(zeroExtend(y, n + 1));
        SVal overflow1 = product.testBit(n);

        SVal seen = SVal.FALSE;
        SVal overflow2 = SVal.FALSE;
        for (int i = 1; i < n; i++) {
            seen = seen.or(x.testBit(n - i));
            overflow2 = overflow2.or(seen.and(y.testBit(i)));
        }
        return Pair.of(SVal.FALSE, overflow1.or(overflow2));
    }

    private static Pair<SVal, SVal> signedMulOverflow(SVal x, SVal y, int n) {
        SVal sx = x.msb();
        SVal sy = y.msb();

        SVal product = signExtend(x, n + 1).times(signExtend(y, n + 1));
        SVal overflow1 = product.testBit(n).xor(product.testBit(n - 1));

        SVal acc = SVal.FALSE;
        SVal overflow2 = SVal.FALSE;
        for (int i = 1; i + 1 < n; i++) {
            SVal b = sy.xor(y.testBit(i));
            SVal a = sx.xor(x.testBit(n - 1 - i));
            acc = acc.or(a);
            overflow2 = overflow2.or(acc.and(b));
        }

        SVal possible = overflow1.or(overflow2);
        SVal sameSign = sx.equal(sy);
        return Pair.of(sameSign.not().and(possible), sameSign.and(possible));
    }

    // ========== 除法 ==========

    public static Pair<SVal, SVal> bvDivO(SVal x, SVal y) {
        int n = width("bvDivO", x, y);
        if (n == 0 || !x.getKind().hasSign()) {
            return NEITHER;
        }
        Kind k = x.getKind();
        return Pair.of(SVal.FALSE, x.equal(SVal.of(k, k.minValue())).and(y.equal(SVal.of(k, -1))));
    }

    // ========== 取负 ==========

    public static Pair<SVal, SVal> bvNegO(SVal x) {
        int n = width("bvNegO", x, x);
        if (n == 0 || !x.getKind().hasSign()) {
            return NEITHER;
        }
        Kind k = x.getKind();
        return Pair.of(SVal.FALSE, x.equal(SVal.of(k, k.minValue())));
    }

    // ========== 扩展 ==========

    /**
     * 零扩展到 {@code m} 位，结果的符号性与 {@code x} 相同。
     * @throws IllegalArgumentException 如果 {@code m} 小于 {@code x} 的宽度。
     */
    static SVal zeroExtend(SVal x, int m) {
        int n = extensionWidth("zeroExtend", x, m);
        if (m == n) {
            return x;
        }
        return SVal.of(Kind.bounded(x.getKind().hasSign(), m - n), 0).join(x);
    }

    /**
     * 符号扩展到 {@code m} 位，结果的符号性与 {@code x} 相同。
     * @throws IllegalArgumentException 如果 {@code m} 小于 {@code x} 的宽度。
     */
    static SVal signExtend(SVal x, int m) {
        int n = extensionWidth("signExtend", x, m);
        if (m == n) {
            return x;
        }
        if (n == 0) {
            return zeroExtend(x, m);
        }
        Kind pad = Kind.bounded(x.getKind().hasSign(), m - n);
        return SVal.ite(x.msb(), SVal.of(pad, -1), SVal.of(pad, 0)).join(x);
    }

    private static int extensionWidth(String where, SVal x, int m) {
        int n = x.getKind().intSizeOf();
        if (m < n) {
            logger.error("BvOverflow-{}: 目标宽度 {} 小于源宽度 {}", where, m, n);
            throw new IllegalArgumentException(where + ": 目标宽度 " + m + " 小于源宽度 " + n);
        }
        return n;
    }

    private static int width(String where, SVal x, SVal y) {
        Kind kx = x.getKind();
        Kind ky = y.getKind();
        if (!kx.isBounded() || !kx.equals(ky)) {
            logger.error("BvOverflow-{}: 需要相同类型的位向量操作数, 实际为 {} 和 {}", where, kx, ky);
            throw new IllegalArgumentException(where + " 需要相同类型的位向量操作数, 实际为: " + kx + ", " + ky);
        }
        return kx.intSizeOf();
    }
}
