package com.taskmanager.backend.global.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class CacheKeysTest {

    @Test
    void keyIsScopedToOwner() {
        assertThat(CacheKeys.of("p", "tasks", 42L, "skip", 0, "search", null))
                .isEqualTo("p:tasks:owner:42:skip=0:search=~");
    }

    @Test
    void separatorsInValuesCannotForgeAnotherKey() {
        String forged = CacheKeys.of("p", "tasks", 1L, "search", "x:status=done");
        String honest = CacheKeys.of("p", "tasks", 1L, "search", "x", "status", "done");

        assertThat(forged).isNotEqualTo(honest).isEqualTo("p:tasks:owner:1:search=x%3Astatus%3Ddone");
    }

    @Test
    void literalTildeDiffersFromNull() {
        assertThat(CacheKeys.of("p", "tasks", 1L, "search", "~"))
                .isNotEqualTo(CacheKeys.of("p", "tasks", 1L, "search", null));
    }

    @Test
    void oddParameterCountIsRejected() {
        assertThatThrownBy(() -> CacheKeys.of("p", "tasks", 1L, "skip"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
