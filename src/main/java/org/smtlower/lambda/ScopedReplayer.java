package org.smtlower.lambda;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtlower.core.Kind;
import org.smtlower.symbolic.ExecutionContext;
import org.smtlower.symbolic.RegistrySnapshot;
import org.smtlower.symbolic.SVal;
import org.smtlower.symbolic.SymbolicComputation;
import org.smtlower.symbolic.Trace;

/**
 * 在子上下文中回放计算，记录其结果为唯一输出，然后提取并校验回放记录。
 */
public final class ScopedReplayer {

    private static final Logger logger = LoggerFactory.getLogger(ScopedReplayer.class);

    private ScopedReplayer() {
    }

    /**
     * 回放并提取记录，不做校验。
     * 计算过程中抛出的异常原样向上传播：那说明计算本身有误，而不是用到了不支持的构造。
     */
    public static Trace record(ExecutionContext child, SymbolicComputation computation) {
        RegistrySnapshot before = child.snapshot();
        SVal result;
        try {
            result = computation.run(child);
        } catch (RuntimeException e) {
            logger.error("lowering 回放失败 (level={}): {}", child.getLambdaLevel(), e.getMessage(), e);
            throw e;
        }
        child.output(result);
        Trace trace = Trace.extract(child, before);
        logger.debug("回放完成: {}", trace);
        return trace;
    }

    /**
     * 回放、提取并校验。失败时把共享登记表回滚到回放之前，父上下文中不留下子上下文的条目。
     * @throws UnsupportedConstructException  如果记录中含有不支持的构造。
     * @throws InternalInconsistencyException 如果输出个数或类型不符合 {@code expectedKind}。
     */
    public static ValidatedTrace replay(ExecutionContext child, Kind expectedKind, SymbolicComputation computation) {
        RegistrySnapshot before = child.snapshot();
        try {
            return TraceValidator.validate(record(child, computation), expectedKind);
        } catch (RuntimeException e) {
            logger.warn("lowering 失败 (level={}), 回滚共享登记表", child.getLambdaLevel());
            child.rollback(before);
            throw e;
        }
    }
}
