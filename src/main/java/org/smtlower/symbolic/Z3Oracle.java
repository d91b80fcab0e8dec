package org.smtlower.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtlower.core.NodeRef;

import java.util.Objects;

/**
 * 用 Z3 检查生成的脚本。每次检查使用一个新的 Solver，底层 Z3 Context 在 {@link #close()} 时释放。
 * 此类不是线程安全的。
 */
public final class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    public static final String SOLVER_NAME = "z3";

    private final Context z3;

    public Z3Oracle() {
        this.z3 = new Context();
        logger.debug("创建 Z3 Context");
    }

    /**
     * 加载脚本并检查可满足性。
     * @throws IllegalStateException 如果求解器返回 UNKNOWN。
     */
    public Status check(String script) {
        Objects.requireNonNull(script, "Z3Oracle-check: script 不能为 null");
        Solver solver = z3.mkSolver();
        solver.fromString(script);
        Status status = solver.check();
        if (status == Status.UNKNOWN) {
            logger.error("Z3 返回 UNKNOWN: {}", solver.getReasonUnknown());
            throw new IllegalStateException("Z3 无法判定脚本: " + solver.getReasonUnknown());
        }
        logger.debug("Z3 检查结果: {}", status);
        return status;
    }

    /**
     * {@code goal} 在会话的约束下是否恒成立：断言其否定，不可满足即为有效。
     * @throws IllegalArgumentException 如果会话配置的求解器不是 Z3。
     */
    public boolean isValid(ExecutionContext ctx, SVal goal) {
        NodeRef node = goal.toNode(ctx);
        return check(ctx, "(assert (not " + node + "))") == Status.UNSATISFIABLE;
    }

    public boolean isSatisfiable(ExecutionContext ctx, SVal condition) {
        NodeRef node = condition.toNode(ctx);
        return check(ctx, "(assert " + node + ")") == Status.SATISFIABLE;
    }

    private Status check(ExecutionContext ctx, String query) {
        SolverConfig config = ctx.getConfig();
        if (!SOLVER_NAME.equalsIgnoreCase(config.getSolverName())) {
            logger.error("Z3Oracle: 会话配置的求解器为 {}, 不是 {}", config.getSolverName(), SOLVER_NAME);
            throw new IllegalArgumentException("会话配置的求解器为 " + config.getSolverName() + ", 无法用 Z3 检查");
        }
        String script = SmtScriptBuilder.build(ctx) + query + "\n";
        if (config.isVerbose()) {
            logger.info("发送给 Z3 的脚本:\n{}", script);
        } else {
            logger.debug("发送给 Z3 的脚本: {} 字符", script.length());
        }
        return check(script);
    }

    @Override
    public void close() {
        z3.close();
        logger.debug("释放 Z3 Context");
    }
}
