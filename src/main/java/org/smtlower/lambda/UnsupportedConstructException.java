package org.smtlower.lambda;

import java.util.List;

/**
 * 被 lowering 的计算使用了不能出现在独立定义中的构造。
 */
public class UnsupportedConstructException extends LoweringException {

    public UnsupportedConstructException(String title, List<String> details) {
        super("Lowering: Unsupported construct.", title, details,
                "Lowered definitions cannot contain this construct. If you need it, please request it as a feature.");
    }
}
