package org.smtlower.lambda;

import java.util.List;

/**
 * 本不应该发生的内部不一致，例如输出类型与期望不符。
 */
public class InternalInconsistencyException extends LoweringException {

    public InternalInconsistencyException(String title, List<String> details) {
        super("Lowering: Impossible happened.", title, details,
                "This is a bug in the lowering layer. Please report it together with the computation that triggered it.");
    }
}
