package org.smtlower.lambda;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ForkManifestTest {

    @Test
    @DisplayName("每个字段在每种目的下都有继承策略")
    void testManifest_ShouldBeTotal() {
        for (ForkPurpose purpose : ForkPurpose.values()) {
            assertEquals(ContextField.values().length, ForkManifest.row(purpose).size(),
                    "row for " + purpose + " should cover every field");
            for (ContextField field : ContextField.values()) {
                assertNotNull(ForkManifest.policy(field, purpose), field + " / " + purpose);
            }
        }
    }

    @Test
    @DisplayName("编号、输入、赋值和缓存总是重新分配")
    void testPerScopeFields_ShouldBeFresh() {
        ContextField[] fresh = {ContextField.NODE_COUNTER, ContextField.LAMBDA_LEVEL, ContextField.INPUTS,
                ContextField.ASSIGNMENTS, ContextField.CONSTANTS, ContextField.EXPR_CACHE, ContextField.OUTPUTS};
        for (ForkPurpose purpose : ForkPurpose.values()) {
            for (ContextField f : fresh) {
                assertEquals(FieldPolicy.FRESH, ForkManifest.policy(f, purpose), f + " / " + purpose);
            }
        }
    }

    @Test
    @DisplayName("具名函数按值继承此前的定义，其余目的按引用共享")
    void testDefinitions_PolicyDependsOnPurpose() {
        assertAll(
                () -> assertEquals(FieldPolicy.COPY, ForkManifest.policy(ContextField.DEFINITIONS, ForkPurpose.NAMED_FUNCTION)),
                () -> assertEquals(FieldPolicy.COPY, ForkManifest.policy(ContextField.USER_FUNCTIONS, ForkPurpose.NAMED_FUNCTION)),
                () -> assertEquals(FieldPolicy.SHARE, ForkManifest.policy(ContextField.DEFINITIONS, ForkPurpose.LAMBDA)),
                () -> assertEquals(FieldPolicy.SHARE, ForkManifest.policy(ContextField.USER_FUNCTIONS, ForkPurpose.CONSTRAINT))
        );
    }
}
