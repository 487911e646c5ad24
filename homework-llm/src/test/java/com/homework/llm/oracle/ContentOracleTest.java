package com.homework.llm.oracle;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentOracleTest {

    @Test
    void shouldTreatSentinelNullAndBlankAsFailure() {
        assertThat(ContentOracle.isFailure(ContentOracle.FAILURE_SENTINEL)).isTrue();
        assertThat(ContentOracle.isFailure(null)).isTrue();
        assertThat(ContentOracle.isFailure("  ")).isTrue();
        assertThat(ContentOracle.isFailure("{\"problems\":[]}")).isFalse();
    }
}
