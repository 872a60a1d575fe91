package org.neuralchilli.workflowdag.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CycleDetectedExceptionTest {

    @Test
    void shouldCreateWithMessage() {
        CycleDetectedException exception = new CycleDetectedException("Cycle detected");

        assertThat(exception).isInstanceOf(RuntimeException.class);
        assertThat(exception.getMessage()).isEqualTo("Cycle detected");
        assertThat(exception.getCause()).isNull();
    }

    @Test
    void shouldCreateWithMessageAndCause() {
        Throwable cause = new IllegalStateException("Root cause");
        CycleDetectedException exception = new CycleDetectedException("Cycle detected", cause);

        assertThat(exception.getMessage()).isEqualTo("Cycle detected");
        assertThat(exception.getCause()).isEqualTo(cause);
    }
}
