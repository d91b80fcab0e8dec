package org.smtlower.symbolic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.smtlower.core.FpRoundingMode;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SolverConfigTest {

    @Test
    @DisplayName("默认配置")
    void testDefaults() {
        SolverConfig cfg = SolverConfig.defaults();
        assertAll(
                () -> assertEquals(FpRoundingMode.RNE, cfg.getRoundingMode()),
                () -> assertEquals("z3", cfg.getSolverName()),
                () -> assertTrue(cfg.getLogic().isEmpty()),
                () -> assertFalse(cfg.isVerbose())
        );
    }

    @Test
    @DisplayName("从类路径资源加载配置")
    void testLoad_FromClasspathResource() {
        SolverConfig cfg = SolverConfig.load();
        assertEquals(FpRoundingMode.RTZ, cfg.getRoundingMode());
        assertTrue(cfg.isVerbose());
    }

    @Test
    @DisplayName("从属性读取逻辑名")
    void testFromProperties_WithLogic() {
        Properties p = new Properties();
        p.setProperty("smtlower.logic", " QF_BV ");
        SolverConfig cfg = SolverConfig.fromProperties(p);
        assertEquals("QF_BV", cfg.getLogic().orElseThrow());
    }

    @Test
    @DisplayName("无法识别的舍入模式应抛出异常")
    void testFromProperties_BadRoundingMode_ShouldThrow() {
        Properties p = new Properties();
        p.setProperty("smtlower.roundingMode", "sideways");
        assertThrows(IllegalArgumentException.class, () -> SolverConfig.fromProperties(p));
    }
}
