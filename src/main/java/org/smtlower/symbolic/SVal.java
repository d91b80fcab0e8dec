package org.smtlower.symbolic;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtlower.core.ConcreteValue;
import org.smtlower.core.Kind;
import org.smtlower.core.KindType;
import org.smtlower.core.NodeRef;
import org.smtlower.expressions.NodeExpr;
import org.smtlower.expressions.Op;
import org.smtlower.expressions.OpType;
import org.smtlower.expressions.OverflowOp;
import org.smtlower.utils.Rational;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.WeakHashMap;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * 符号值：要么是一个具体值，要么是一个"在给定上下文中构造节点"的延迟构造器。
 * <p>
 * 延迟构造器对每个上下文只执行一次，结果按上下文缓存，因此同一个符号值在一次回放中被多次使用时
 * 只对应一个节点，共享结构由此保留到序列化阶段。
 * 所有运算在操作数都是具体值时直接折叠，否则产生新的符号值。
 * 此类是不可变的 (缓存除外)。
 */
public final class SVal {

    private static final Logger logger = LoggerFactory.getLogger(SVal.class);

    public static final SVal FALSE = new SVal(ConcreteValue.FALSE);
    public static final SVal TRUE = new SVal(ConcreteValue.TRUE);

    @Getter
    private final Kind kind;
    private final ConcreteValue concrete;
    private final Function<ExecutionContext, NodeRef> builder;
    private final Map<ExecutionContext, NodeRef> nodes;

    private SVal(ConcreteValue concrete) {
        this.kind = concrete.getKind();
        this.concrete = concrete;
        this.builder = null;
        this.nodes = null;
    }

    private SVal(Kind kind, Function<ExecutionContext, NodeRef> builder) {
        this.kind = Objects.requireNonNull(kind, "SVal-构造函数: kind 不能为 null");
        this.concrete = null;
        this.builder = Objects.requireNonNull(builder, "SVal-构造函数: builder 不能为 null");
        this.nodes = new WeakHashMap<>();
    }

    // ========== 工厂方法 ==========

    public static SVal of(ConcreteValue cv) {
        if (cv.isBooleanLiteral()) {
            return cv.asBoolean() ? TRUE : FALSE;
        }
        return new SVal(cv);
    }

    public static SVal of(Kind kind, long value) {
        return of(ConcreteValue.ofInteger(kind, value));
    }

    public static SVal of(Kind kind, BigInteger value) {
        return of(ConcreteValue.ofInteger(kind, value));
    }

    public static SVal bool(boolean b) {
        return b ? TRUE : FALSE;
    }

    /**
     * 已声明输入的符号值，在任何上下文中都解析为同一个节点。
     */
    static SVal input(Kind kind, NodeRef node) {
        return new SVal(kind, ctx -> node);
    }

    private static SVal symbolic(Kind kind, Op op, SVal... args) {
        return new SVal(kind, ctx -> {
            List<NodeRef> refs = new ArrayList<>(args.length);
            for (SVal a : args) {
                refs.add(a.toNode(ctx));
            }
            return ctx.newExpr(kind, new NodeExpr(op, refs));
        });
    }

    // ========== 查询 ==========

    public boolean isConcrete() {
        return concrete != null;
    }

    public Optional<ConcreteValue> asConcrete() {
        return Optional.ofNullable(concrete);
    }

    /**
     * 在给定上下文中取得该值对应的节点。具体值进入常量池，符号值执行其构造器 (每个上下文一次)。
     */
    public NodeRef toNode(ExecutionContext ctx) {
        if (concrete != null) {
            return ctx.constant(concrete);
        }
        NodeRef node = nodes.get(ctx);
        if (node == null) {
            node = builder.apply(ctx);
            nodes.put(ctx, node);
        }
        return node;
    }

    // ========== 算术 ==========

    public SVal plus(SVal other) {
        return arith(OpType.PLUS, other, BigInteger::add, Rational::add);
    }

    public SVal minus(SVal other) {
        return arith(OpType.MINUS, other, BigInteger::subtract, Rational::subtract);
    }

    public SVal times(SVal other) {
        return arith(OpType.TIMES, other, BigInteger::multiply, Rational::multiply);
    }

    public SVal negate() {
        if (concrete != null) {
            if (isIntegral(kind)) {
                return of(kind, concrete.asInteger().negate());
            }
            if (kind.getType() == KindType.REAL) {
                return of(ConcreteValue.ofReal(concrete.asRational().negate()));
            }
        }
        return symbolic(kind, Op.of(OpType.UNEG), this);
    }

    /**
     * 位向量除法 (向零截断)。除数为 0 时遵循 SMT-LIB 的定义：
     * 无符号结果为全 1，有符号结果在被除数非负时为 -1，否则为 1。
     */
    public SVal quot(SVal other) {
        requireBounded("quot", other);
        if (concrete != null && other.concrete != null) {
            BigInteger x = concrete.asInteger();
            BigInteger y = other.concrete.asInteger();
            if (y.signum() == 0) {
                if (!kind.hasSign()) {
                    return of(kind, kind.maxValue());
                }
                return of(kind, x.signum() >= 0 ? -1 : 1);
            }
            return of(kind, x.divide(y));
        }
        return symbolic(kind, Op.of(OpType.QUOT), this, other);
    }

    /**
     * 位向量取余，符号跟随被除数。除数为 0 时结果为被除数。
     */
    public SVal rem(SVal other) {
        requireBounded("rem", other);
        if (concrete != null && other.concrete != null) {
            BigInteger x = concrete.asInteger();
            BigInteger y = other.concrete.asInteger();
            if (y.signum() == 0) {
                return this;
            }
            return of(kind, x.remainder(y));
        }
        return symbolic(kind, Op.of(OpType.REM), this, other);
    }

    private SVal arith(OpType type, SVal other, BinaryOperator<BigInteger> intOp, BinaryOperator<Rational> realOp) {
        requireSameKind(type.name(), other);
        if (concrete != null && other.concrete != null) {
            if (isIntegral(kind)) {
                return of(kind, intOp.apply(concrete.asInteger(), other.concrete.asInteger()));
            }
            if (kind.getType() == KindType.REAL) {
                return of(ConcreteValue.ofReal(realOp.apply(concrete.asRational(), other.concrete.asRational())));
            }
        }
        return symbolic(kind, Op.of(type), this, other);
    }

    // ========== 比较 ==========

    public SVal equal(SVal other) {
        requireSameKind("equal", other);
        if (concrete != null && other.concrete != null) {
            return bool(concrete.equals(other.concrete));
        }
        return symbolic(Kind.BOOL, Op.of(OpType.EQUAL), this, other);
    }

    public SVal notEqual(SVal other) {
        requireSameKind("notEqual", other);
        if (concrete != null && other.concrete != null) {
            return bool(!concrete.equals(other.concrete));
        }
        return symbolic(Kind.BOOL, Op.of(OpType.NOT_EQUAL), this, other);
    }

    public SVal lessThan(SVal other) {
        return compare(OpType.LESS_THAN, other);
    }

    public SVal lessEq(SVal other) {
        return compare(OpType.LESS_EQ, other);
    }

    public SVal greaterThan(SVal other) {
        return compare(OpType.GREATER_THAN, other);
    }

    public SVal greaterEq(SVal other) {
        return compare(OpType.GREATER_EQ, other);
    }

    private SVal compare(OpType type, SVal other) {
        requireSameKind(type.name(), other);
        if (concrete != null && other.concrete != null) {
            Integer c = null;
            if (isIntegral(kind)) {
                c = concrete.asInteger().compareTo(other.concrete.asInteger());
            } else if (kind.getType() == KindType.REAL) {
                c = concrete.asRational().compareTo(other.concrete.asRational());
            }
            if (c != null) {
                return bool(switch (type) {
                    case LESS_THAN -> c < 0;
                    case LESS_EQ -> c <= 0;
                    case GREATER_THAN -> c > 0;
                    case GREATER_EQ -> c >= 0;
                    default -> throw new IllegalStateException("不是比较运算符: " + type);
                });
            }
        }
        return symbolic(Kind.BOOL, Op.of(type), this, other);
    }

    // ========== 逻辑 / 按位 ==========

    public SVal and(SVal other) {
        requireSameKind("and", other);
        if (kind.isBoolean()) {
            if (this == FALSE || other == FALSE) {
                return FALSE;
            }
            if (this == TRUE) {
                return other;
            }
            if (other == TRUE) {
                return this;
            }
        } else if (concrete != null && other.concrete != null) {
            return bits(concrete.unsignedBits().and(other.concrete.unsignedBits()));
        }
        return symbolic(kind, Op.of(OpType.AND), this, other);
    }

    public SVal or(SVal other) {
        requireSameKind("or", other);
        if (kind.isBoolean()) {
            if (this == TRUE || other == TRUE) {
                return TRUE;
            }
            if (this == FALSE) {
                return other;
            }
            if (other == FALSE) {
                return this;
            }
        } else if (concrete != null && other.concrete != null) {
            return bits(concrete.unsignedBits().or(other.concrete.unsignedBits()));
        }
        return symbolic(kind, Op.of(OpType.OR), this, other);
    }

    public SVal xor(SVal other) {
        requireSameKind("xor", other);
        if (concrete != null && other.concrete != null) {
            if (kind.isBoolean()) {
                return bool(concrete.asBoolean() ^ other.concrete.asBoolean());
            }
            return bits(concrete.unsignedBits().xor(other.concrete.unsignedBits()));
        }
        if (kind.isBoolean()) {
            if (this == FALSE) {
                return other;
            }
            if (other == FALSE) {
                return this;
            }
        }
        return symbolic(kind, Op.of(OpType.XOR), this, other);
    }

    public SVal not() {
        if (!kind.isBoolean() && !kind.isBounded()) {
            logger.error("SVal-not: 不支持的类型 {}", kind);
            throw new IllegalArgumentException("not 需要布尔或位向量操作数, 实际为: " + kind);
        }
        if (concrete != null) {
            if (kind.isBoolean()) {
                return bool(!concrete.asBoolean());
            }
            return bits(concrete.unsignedBits().not());
        }
        return symbolic(kind, Op.of(OpType.NOT), this);
    }

    /**
     * 条件选择。条件为具体值时直接取对应分支，两个分支是同一个值时不产生节点。
     */
    public static SVal ite(SVal cond, SVal thenVal, SVal elseVal) {
        if (!cond.kind.isBoolean()) {
            logger.error("SVal-ite: 条件必须是布尔值, 实际为 {}", cond.kind);
            throw new IllegalArgumentException("ite 的条件必须是布尔值, 实际为: " + cond.kind);
        }
        thenVal.requireSameKind("ite", elseVal);
        if (cond == TRUE) {
            return thenVal;
        }
        if (cond == FALSE) {
            return elseVal;
        }
        if (thenVal == elseVal) {
            return thenVal;
        }
        return symbolic(thenVal.kind, Op.of(OpType.ITE), cond, thenVal, elseVal);
    }

    // ========== 位操作 ==========

    /**
     * 拼接：{@code this} 为高位部分。结果的符号性跟随高位部分。
     */
    public SVal join(SVal low) {
        requireBounded("join", low);
        int lw = low.kind.intSizeOf();
        Kind result = Kind.bounded(kind.hasSign(), kind.intSizeOf() + lw);
        if (concrete != null && low.concrete != null) {
            return of(result, concrete.unsignedBits().shiftLeft(lw).or(low.concrete.unsignedBits()));
        }
        return symbolic(result, Op.of(OpType.JOIN), this, low);
    }

    /**
     * 取出 [high:low] 位，结果是宽度为 {@code high - low + 1} 的无符号位向量。
     */
    public SVal extract(int high, int low) {
        int n = requireBounded("extract", this);
        if (low < 0 || high < low || high >= n) {
            logger.error("SVal-extract: 区间 [{}:{}] 超出宽度 {}", high, low, n);
            throw new IllegalArgumentException("extract 区间 [" + high + ":" + low + "] 超出宽度 " + n);
        }
        Kind result = Kind.word(high - low + 1);
        if (concrete != null) {
            return of(result, concrete.unsignedBits().shiftRight(low));
        }
        return symbolic(result, Op.extract(high, low), this);
    }

    /**
     * 第 {@code i} 位 (0 为最低位) 是否为 1。
     */
    public SVal testBit(int i) {
        if (concrete != null) {
            int n = requireBounded("testBit", this);
            if (i < 0 || i >= n) {
                throw new IllegalArgumentException("testBit 下标 " + i + " 超出宽度 " + n);
            }
            return bool(concrete.unsignedBits().testBit(i));
        }
        return extract(i, i).equal(of(Kind.word(1), 1));
    }

    /**
     * 最高位，对有符号数即符号位。
     */
    public SVal msb() {
        return testBit(requireBounded("msb", this) - 1);
    }

    private SVal bits(BigInteger unsigned) {
        return of(kind, unsigned);
    }

    // ========== 不透明项 ==========

    /**
     * 调用一个未解释函数 (或此前定义的具名函数)。
     * 构造节点时函数签名登记到上下文；已作为具名函数定义的名字不再登记。
     */
    public static SVal uninterpreted(String name, Kind resultKind, SVal... args) {
        Objects.requireNonNull(name, "SVal-uninterpreted: name 不能为 null");
        FunctionSignature signature = new FunctionSignature(
                Arrays.stream(args).map(SVal::getKind).toList(), resultKind);
        Op op = Op.uninterpreted(name);
        return new SVal(resultKind, ctx -> {
            if (!ctx.getUserFunctions().contains(name)) {
                ctx.registerUninterpreted(name, signature);
            }
            List<NodeRef> refs = new ArrayList<>(args.length);
            for (SVal a : args) {
                refs.add(a.toNode(ctx));
            }
            return ctx.newExpr(resultKind, new NodeExpr(op, refs));
        });
    }

    /**
     * 求解器原生溢出原语的取反，值为"发生溢出"。
     */
    public static SVal overflow(OverflowOp op, SVal x, SVal y) {
        x.requireBounded(op.getPrimitive(), y);
        return symbolic(Kind.BOOL, Op.overflow(op), x, y);
    }

    /**
     * 一个已渲染好的量化布尔公式。
     */
    public static SVal quantified(String text) {
        return symbolic(Kind.BOOL, Op.quantified(text));
    }

    // ========== 校验 ==========

    private static boolean isIntegral(Kind k) {
        return k.isBounded() || k.getType() == KindType.UNBOUNDED;
    }

    private void requireSameKind(String where, SVal other) {
        if (!kind.equals(other.kind)) {
            logger.error("SVal-{}: 操作数类型不一致: {} vs {}", where, kind, other.kind);
            throw new IllegalArgumentException(where + " 的操作数类型不一致: " + kind + " vs " + other.kind);
        }
    }

    private int requireBounded(String where, SVal other) {
        if (!kind.isBounded() || !other.kind.isBounded()) {
            logger.error("SVal-{}: 需要位向量操作数, 实际为 {} 和 {}", where, kind, other.kind);
            throw new IllegalArgumentException(where + " 需要位向量操作数, 实际为: " + kind + ", " + other.kind);
        }
        if (!where.equals("join") && other != this) {
            requireSameKind(where, other);
        }
        return kind.intSizeOf();
    }

    @Override
    public String toString() {
        return concrete != null ? concrete.toString() : "<symbolic> :: " + kind;
    }
}
