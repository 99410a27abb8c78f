package org.neuralchilli.acms.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CycleDetectedExceptionTest {

    @Test
    void shouldCreateWithMessage() {
        CycleDetectedException exception = new CycleDetectedException("Cycle detected");

        assertThat(exception).isInstanceOf(RuntimeException.class);
        assertThat(exception.getMessage()).isEqualTo("Cycle detected");
        assertThat(exception.getCause()).isNull();
        assertThat(exception.taskIds()).isEmpty();
    }

    @Test
    void shouldCarryCycleMembers() {
        CycleDetectedException exception = new CycleDetectedException("Cycle detected", List.of("a", "b"));

        assertThat(exception.taskIds()).containsExactly("a", "b");
        assertThatThrownBy(() -> exception.taskIds().add("c"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldCreateWithMessageAndCause() {
        Throwable cause = new IllegalStateException("Root cause");
        CycleDetectedException exception = new CycleDetectedException("Cycle detected", cause);

        assertThat(exception.getMessage()).isEqualTo("Cycle detected");
        assertThat(exception.getCause()).isEqualTo(cause);
    }

    @Test
    void shouldPreserveStackTrace() {
        try {
            methodThatThrowsCycle();
            fail("Should have thrown exception");
        } catch (CycleDetectedException e) {
            assertThat(e.getStackTrace()).isNotEmpty();
            assertThat(e.getStackTrace()[0].getMethodName())
                    .isEqualTo("methodThatThrowsCycle");
        }
    }

    private void methodThatThrowsCycle() {
        throw new CycleDetectedException("Cycle in graph");
    }
}
