package org.smtlower.lambda;

import org.smtlower.core.Kind;
import org.smtlower.symbolic.Trace;

/**
 * 对一次回放记录的单项检查。检查之间相互独立，由 {@link TraceValidator} 按固定顺序执行。
 */
@FunctionalInterface
public interface TraceCheck {

    CheckOutcome check(Trace trace, Kind expectedKind);
}
