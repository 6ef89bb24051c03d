package com.urbanzen.common.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeverityTierTest {

    @Test
    void shouldOrderTiersBySeverity() {
        assertThat(SeverityTier.CRITICAL.isAtLeast(SeverityTier.HIGH)).isTrue();
        assertThat(SeverityTier.HIGH.isAtLeast(SeverityTier.HIGH)).isTrue();
        assertThat(SeverityTier.MEDIUM.isAtLeast(SeverityTier.HIGH)).isFalse();
    }

    @Test
    void shouldParseValuesIgnoringCase() {
        assertThat(SeverityTier.fromValue("Critical")).isEqualTo(SeverityTier.CRITICAL);
        assertThatThrownBy(() -> SeverityTier.fromValue("urgent"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
