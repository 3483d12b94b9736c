package com.backport.transpiler.checker;

import org.junit.jupiter.api.Test;

import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.exception.CheckerViolationException;
import com.backport.transpiler.version.Version;

import static com.backport.transpiler.model.Nodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NoMatMulOperatorChecker.
 */
class NoMatMulOperatorCheckerTest {

    private final BuildConfig config = BuildConfig.forTarget("3.4");
    private final NoMatMulOperatorChecker checker = new NoMatMulOperatorChecker();

    @Test
    void testMatMulRejected() {
        assertThatThrownBy(() -> checker.check(config, module(assign("c", binOp(name("a"), "@", name("b"))))))
                .isInstanceOf(CheckerViolationException.class)
                .hasMessageStartingWith("[no_matmul_operator]");
    }

    @Test
    void testOtherOperatorsAllowed() {
        assertThatCode(() -> checker.check(config, module(assign("c", binOp(name("a"), "*", name("b"))))))
                .doesNotThrowAnyException();
    }

    @Test
    void testWindow() {
        assertThat(checker.isRequiredFor(Version.parse("3.4"))).isTrue();
        assertThat(checker.isRequiredFor(Version.parse("3.5"))).isFalse();
    }
}
