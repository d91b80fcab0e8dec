package org.smtlower.symbolic;

import org.smtlower.core.Kind;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * 一个可在任意上下文中重新执行的符号计算。参数在执行时由上下文作为全称输入声明。
 */
@FunctionalInterface
public interface SymbolicComputation {

    SVal run(ExecutionContext ctx);

    static SymbolicComputation constant(SVal value) {
        return ctx -> value;
    }

    static SymbolicComputation of(Kind arg, UnaryOperator<SVal> f) {
        return ctx -> f.apply(ctx.freshInput(arg));
    }

    static SymbolicComputation of(Kind arg1, Kind arg2, BinaryOperator<SVal> f) {
        return ctx -> {
            SVal a = ctx.freshInput(arg1);
            SVal b = ctx.freshInput(arg2);
            return f.apply(a, b);
        };
    }

    static SymbolicComputation of(List<Kind> args, Function<List<SVal>, SVal> f) {
        return ctx -> {
            List<SVal> params = new ArrayList<>(args.size());
            for (Kind k : args) {
                params.add(ctx.freshInput(k));
            }
            return f.apply(params);
        };
    }
}
