package dev.chainevents.components.eventqueue;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EventTypeTest {
    @Test
    void resolves_every_known_tag() {
        assertThat(EventType.of("ACCOUNT")).isEqualTo(EventType.ACCOUNT);
        assertThat(EventType.of("BLOCK")).isEqualTo(EventType.BLOCK);
        assertThat(EventType.of("TRANSACTION")).isEqualTo(EventType.TRANSACTION);
    }

    @Test
    void rejects_unknown_tags() {
        assertThatThrownBy(() -> EventType.of("MEMPOOL"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("MEMPOOL");
        assertThatThrownBy(() -> EventType.of("block"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
