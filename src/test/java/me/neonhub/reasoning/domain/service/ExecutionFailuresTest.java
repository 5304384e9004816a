package me.neonhub.reasoning.domain.service;

import me.neonhub.reasoning.domain.exception.InferenceExecutionException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionFailuresTest {

    @Test
    void returnsRuntimeCauseAsThrown() {
        IllegalStateException cause = new IllegalStateException("boom");

        assertSame(cause, ExecutionFailures.unwrap(new CompletionException(cause)));
    }

    @Test
    void unwrapsNestedWrappers() {
        IllegalArgumentException cause = new IllegalArgumentException("bad");

        assertSame(cause, ExecutionFailures.unwrap(new CompletionException(new ExecutionException(cause))));
    }

    @Test
    void leavesPlainRuntimeExceptionsAlone() {
        UnsupportedOperationException failure = new UnsupportedOperationException("nope");

        assertSame(failure, ExecutionFailures.unwrap(failure));
    }

    @Test
    void wrapsCheckedCause() {
        RuntimeException result = ExecutionFailures.unwrap(new CompletionException(new IOException("io")));

        assertInstanceOf(InferenceExecutionException.class, result);
        assertInstanceOf(IOException.class, result.getCause());
    }

    @Test
    void rethrowsErrors() {
        CompletionException failure = new CompletionException(new OutOfMemoryError("heap"));

        assertThrows(OutOfMemoryError.class, () -> ExecutionFailures.unwrap(failure));
    }
}
