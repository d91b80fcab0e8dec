package org.smtlower.lambda;

import org.smtlower.core.Kind;
import org.smtlower.symbolic.SmtFunctionDef;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 把具名函数定义渲染为 {@code define-fun} (自引用时为 {@code define-fun-rec})，前面附一行类型注释。
 */
public final class DeclarationEmitter {

    private DeclarationEmitter() {
    }

    public static String emit(SmtFunctionDef def) {
        String signature = Stream.concat(def.getArgKinds().stream(), Stream.of(def.getKind()))
                .map(Kind::toString)
                .collect(Collectors.joining(" -> "));
        StringBuilder sb = new StringBuilder();
        sb.append("; ").append(def.getName()).append(" :: ").append(signature);
        if (!def.getFrees().isEmpty()) {
            sb.append(" [Refers to: ").append(String.join(", ", def.getFrees())).append(']');
        }
        sb.append('\n');
        sb.append(def.isRecursive() ? "(define-fun-rec " : "(define-fun ")
                .append(def.getName()).append(' ')
                .append(def.getParams().orElse("()")).append(' ')
                .append(def.getKind().smtType()).append('\n')
                .append(def.getBody().apply(2)).append(')');
        return sb.toString();
    }

    public static String emitAll(List<SmtFunctionDef> defs) {
        return defs.stream().map(DeclarationEmitter::emit).collect(Collectors.joining("\n"));
    }
}
