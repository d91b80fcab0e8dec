package org.smtlower.symbolic;

import lombok.Getter;
import org.smtlower.core.Kind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * 一个具名函数定义记录。它不会立即渲染为文本，而是登记在上下文中，
 * 由声明输出例程在声明时刻统一渲染。
 */
@Getter
public final class SmtFunctionDef {

    private final String name;
    private final List<Kind> argKinds;
    private final Kind kind;
    private final List<String> frees;
    private final String params;
    private final IntFunction<String> body;

    public SmtFunctionDef(String name, List<Kind> argKinds, Kind kind, List<String> frees, String params,
                          IntFunction<String> body) {
        this.name = Objects.requireNonNull(name, "SmtFunctionDef: name 不能为 null");
        this.argKinds = List.copyOf(argKinds);
        this.kind = Objects.requireNonNull(kind, "SmtFunctionDef: kind 不能为 null");
        this.frees = List.copyOf(frees);
        this.params = params;
        this.body = Objects.requireNonNull(body, "SmtFunctionDef: body 不能为 null");
    }

    public Optional<String> getParams() {
        return Optional.ofNullable(params);
    }

    /**
     * 函数体中是否引用了自身。
     */
    public boolean isRecursive() {
        return frees.contains(name);
    }

    @Override
    public String toString() {
        return name + " :: " + kind + (frees.isEmpty() ? "" : " [refers to: " + String.join(", ", frees) + "]");
    }
}
