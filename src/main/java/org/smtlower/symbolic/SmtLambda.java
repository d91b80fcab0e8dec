package org.smtlower.symbolic;

import lombok.Getter;
import org.smtlower.core.Kind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * 一个匿名 lambda 定义。正文按缩进量延迟渲染，因为同一正文可能嵌入不同的外层结构。
 */
@Getter
public final class SmtLambda {

    private final Kind kind;
    private final List<String> frees;
    private final String params;
    private final IntFunction<String> body;

    public SmtLambda(Kind kind, List<String> frees, String params, IntFunction<String> body) {
        this.kind = Objects.requireNonNull(kind, "SmtLambda: kind 不能为 null");
        this.frees = List.copyOf(frees);
        this.params = params;
        this.body = Objects.requireNonNull(body, "SmtLambda: body 不能为 null");
    }

    public Optional<String> getParams() {
        return Optional.ofNullable(params);
    }

    /**
     * @return {@code (lambda (params)\n  body)}；没有参数时参数子句为 {@code ()}。
     */
    public String render() {
        return "(lambda " + getParams().orElse("()") + "\n" + body.apply(2) + ")";
    }

    @Override
    public String toString() {
        return render();
    }
}
