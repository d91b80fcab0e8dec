package org.smtlower.lambda;

import lombok.Getter;
import org.smtlower.core.Kind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * 序列化得到的定义：自由名字、参数子句和按缩进量渲染的正文。
 */
@Getter
public final class Definition {

    private final Kind kind;
    private final List<Kind> argKinds;
    private final List<String> frees;
    private final String params;
    private final IntFunction<String> body;

    public Definition(Kind kind, List<Kind> argKinds, List<String> frees, String params, IntFunction<String> body) {
        this.kind = Objects.requireNonNull(kind, "Definition: kind 不能为 null");
        this.argKinds = List.copyOf(argKinds);
        this.frees = List.copyOf(frees);
        this.params = params;
        this.body = Objects.requireNonNull(body, "Definition: body 不能为 null");
    }

    /**
     * @return 形如 {@code ((l1_s0 (_ BitVec 8)) (l1_s1 Bool))} 的参数子句，没有参数时为空。
     */
    public Optional<String> getParams() {
        return Optional.ofNullable(params);
    }
}
