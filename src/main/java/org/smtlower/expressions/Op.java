package org.smtlower.expressions;

import lombok.Getter;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 运算符。简单运算符按种类缓存为单例，带参数的运算符通过专门的工厂方法创建。
 * 此类是不可变的，可用作去重键的一部分。
 */
@Getter
public final class Op {

    private static final Map<OpType, Op> SIMPLE = new EnumMap<>(OpType.class);

    static {
        for (OpType t : OpType.values()) {
            if (t != OpType.EXTRACT && t != OpType.UNINTERPRETED && t != OpType.OVERFLOW
                    && t != OpType.QUANTIFIED) {
                SIMPLE.put(t, new Op(t, -1, -1, null, null));
            }
        }
    }

    private final OpType type;
    private final int high;             // 仅 EXTRACT
    private final int low;              // 仅 EXTRACT
    private final String name;          // UNINTERPRETED 的函数名或 QUANTIFIED 的公式文本
    private final OverflowOp overflow;  // 仅 OVERFLOW

    private final int hashCode;

    private Op(OpType type, int high, int low, String name, OverflowOp overflow) {
        this.type = type;
        this.high = high;
        this.low = low;
        this.name = name;
        this.overflow = overflow;
        this.hashCode = Objects.hash(type, high, low, name, overflow);
    }

    /**
     * @throws IllegalArgumentException 如果该种类需要参数。
     */
    public static Op of(OpType type) {
        Op op = SIMPLE.get(type);
        if (op == null) {
            throw new IllegalArgumentException("运算符 " + type + " 需要参数，请使用对应的工厂方法");
        }
        return op;
    }

    public static Op extract(int high, int low) {
        if (high < low || low < 0) {
            throw new IllegalArgumentException("非法的 extract 区间: [" + high + ":" + low + "]");
        }
        return new Op(OpType.EXTRACT, high, low, null, null);
    }

    public static Op uninterpreted(String name) {
        return new Op(OpType.UNINTERPRETED, -1, -1, Objects.requireNonNull(name, "未解释函数名不能为 null"), null);
    }

    public static Op overflow(OverflowOp overflow) {
        return new Op(OpType.OVERFLOW, -1, -1, null, Objects.requireNonNull(overflow, "overflow 不能为 null"));
    }

    /**
     * 一个已渲染的量化布尔公式，作为不透明的零元项出现。
     */
    public static Op quantified(String text) {
        return new Op(OpType.QUANTIFIED, -1, -1, Objects.requireNonNull(text, "量化公式不能为 null"), null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Op that = (Op) o;
        return type == that.type && high == that.high && low == that.low
                && Objects.equals(name, that.name) && overflow == that.overflow;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return switch (type) {
            case EXTRACT -> "EXTRACT[" + high + ":" + low + "]";
            case UNINTERPRETED -> "UNINTERPRETED " + name;
            case OVERFLOW -> "OVERFLOW " + overflow;
            case QUANTIFIED -> "QUANTIFIED";
            default -> type.name();
        };
    }
}
