package org.smtlower.symbolic;

import lombok.Getter;
import org.smtlower.core.Kind;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 未解释函数的签名：参数类型列表和结果类型。
 */
@Getter
public final class FunctionSignature {

    private final List<Kind> argKinds;
    private final Kind resultKind;

    public FunctionSignature(List<Kind> argKinds, Kind resultKind) {
        this.argKinds = List.copyOf(Objects.requireNonNull(argKinds, "FunctionSignature: argKinds 不能为 null"));
        this.resultKind = Objects.requireNonNull(resultKind, "FunctionSignature: resultKind 不能为 null");
    }

    /**
     * @return {@code (declare-fun name (T1 T2) R)}
     */
    public String smtDeclaration(String name) {
        String args = argKinds.stream().map(Kind::smtType).collect(Collectors.joining(" "));
        return "(declare-fun " + name + " (" + args + ") " + resultKind.smtType() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FunctionSignature that = (FunctionSignature) o;
        return argKinds.equals(that.argKinds) && resultKind.equals(that.resultKind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(argKinds, resultKind);
    }

    @Override
    public String toString() {
        return Stream.concat(argKinds.stream(), Stream.of(resultKind))
                .map(Kind::toString)
                .collect(Collectors.joining(" -> "));
    }
}
