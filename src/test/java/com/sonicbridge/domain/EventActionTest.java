package com.sonicbridge.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventAction Tests")
class EventActionTest {

    @Test
    void testIsBlocking_ShouldHoldOnlyForDenyAndDrop() {
        assertThat(EventAction.DENY.isBlocking()).isTrue();
        assertThat(EventAction.DROP.isBlocking()).isTrue();
        assertThat(EventAction.ALLOW.isBlocking()).isFalse();
        assertThat(EventAction.RESET.isBlocking()).isFalse();
    }

    @Test
    void testFromValue_ShouldIgnoreCaseAndRejectUnknown() {
        assertThat(EventAction.fromValue("DROP")).isEqualTo(EventAction.DROP);

        assertThatThrownBy(() -> EventAction.fromValue("permit"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("permit");
    }
}
