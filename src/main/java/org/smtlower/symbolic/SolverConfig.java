package org.smtlower.symbolic;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtlower.core.FpRoundingMode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * 求解器配置。在会话创建时确定，lowering 的子上下文按引用共享。
 * 此类是不可变的。
 */
@Getter
public final class SolverConfig {

    private static final Logger logger = LoggerFactory.getLogger(SolverConfig.class);

    public static final String RESOURCE = "smtlower.properties";

    private final FpRoundingMode roundingMode;
    private final String solverName;   // Z3Oracle 只接受 "z3"
    private final String logic;
    private final boolean verbose;     // 开启时 Z3Oracle 以 info 级别记录完整脚本

    public SolverConfig(FpRoundingMode roundingMode, String solverName, String logic, boolean verbose) {
        this.roundingMode = Objects.requireNonNull(roundingMode, "SolverConfig: roundingMode 不能为 null");
        this.solverName = Objects.requireNonNull(solverName, "SolverConfig: solverName 不能为 null");
        this.logic = logic;
        this.verbose = verbose;
    }

    public static SolverConfig defaults() {
        return new SolverConfig(FpRoundingMode.RNE, "z3", null, false);
    }

    /**
     * 从类路径上的 {@value #RESOURCE} 读取配置；资源不存在时使用默认值。
     */
    public static SolverConfig load() {
        try (InputStream in = SolverConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.debug("未找到 {}，使用默认配置", RESOURCE);
                return defaults();
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            logger.error("读取 {} 失败", RESOURCE, e);
            throw new UncheckedIOException("无法读取配置资源 " + RESOURCE, e);
        }
    }

    /**
     * 识别的键：{@code smtlower.roundingMode}、{@code smtlower.solver}、{@code smtlower.logic}、{@code smtlower.verbose}。
     * @throws IllegalArgumentException 如果舍入模式无法识别。
     */
    public static SolverConfig fromProperties(Properties props) {
        SolverConfig d = defaults();
        String rm = props.getProperty("smtlower.roundingMode");
        FpRoundingMode roundingMode = d.roundingMode;
        if (rm != null) {
            try {
                roundingMode = FpRoundingMode.valueOf(rm.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                logger.error("无法识别的舍入模式: {}", rm);
                throw new IllegalArgumentException("无法识别的舍入模式: " + rm, e);
            }
        }
        String logic = props.getProperty("smtlower.logic");
        SolverConfig cfg = new SolverConfig(roundingMode,
                props.getProperty("smtlower.solver", d.solverName).trim(),
                logic == null || logic.isBlank() ? null : logic.trim(),
                Boolean.parseBoolean(props.getProperty("smtlower.verbose", "false").trim()));
        logger.info("加载求解器配置: {}", cfg);
        return cfg;
    }

    public SolverConfig withRoundingMode(FpRoundingMode rm) {
        return new SolverConfig(rm, solverName, logic, verbose);
    }

    public SolverConfig withLogic(String newLogic) {
        return new SolverConfig(roundingMode, solverName, newLogic, verbose);
    }

    public SolverConfig withVerbose(boolean newVerbose) {
        return new SolverConfig(roundingMode, solverName, logic, newVerbose);
    }

    public Optional<String> getLogic() {
        return Optional.ofNullable(logic);
    }

    @Override
    public String toString() {
        return "SolverConfig{solver=" + solverName + ", roundingMode=" + roundingMode
                + ", logic=" + (logic == null ? "<none>" : logic) + ", verbose=" + verbose + "}";
    }
}
