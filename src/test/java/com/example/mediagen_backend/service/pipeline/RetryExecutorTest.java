package com.example.mediagen_backend.service.pipeline;

import com.example.mediagen_backend.engine.GenerationException;
import com.example.mediagen_backend.engine.PermanentGenerationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    private final RetryExecutor executor = new RetryExecutor(0);

    @Test
    void returnsValueWithNumberOfFailedAttempts() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        RetryExecutor.Outcome<String> outcome = executor.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new GenerationException("flaky");
            }
            return "ok";
        }, 3, "images:scene-1", () -> false);

        assertThat(outcome.value()).isEqualTo("ok");
        assertThat(outcome.retryCount()).isEqualTo(2);
    }

    @Test
    void rethrowsLastErrorAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(() -> {
            throw new GenerationException("attempt " + calls.incrementAndGet());
        }, 3, "audio:scene-1", () -> false))
                .isInstanceOf(GenerationException.class)
                .hasMessage("attempt 3");
        assertThat(calls).hasValue(3);
    }

    @Test
    void permanentFailureStopsImmediately() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(() -> {
            calls.incrementAndGet();
            throw new PermanentGenerationException("bad request");
        }, 5, "videos:scene-1", () -> false))
                .isInstanceOf(PermanentGenerationException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void cancellationBetweenAttemptsStopsRetrying() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(() -> {
            calls.incrementAndGet();
            throw new GenerationException("503");
        }, 5, "images:scene-2", () -> true))
                .isInstanceOf(PermanentGenerationException.class)
                .hasMessageContaining("Cancelled");
        assertThat(calls).hasValue(1);
    }

    @Test
    void backoffDoublesBetweenAttempts() throws Exception {
        RetryExecutor timed = new RetryExecutor(40);
        AtomicInteger calls = new AtomicInteger();
        long t0 = System.nanoTime();

        RetryExecutor.Outcome<String> outcome = timed.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new GenerationException("429");
            }
            return "ok";
        }, 3, "images:scene-3", () -> false);

        assertThat(outcome.retryCount()).isEqualTo(2);
        assertThat(Duration.ofNanos(System.nanoTime() - t0)).isGreaterThanOrEqualTo(Duration.ofMillis(120));
    }
}
