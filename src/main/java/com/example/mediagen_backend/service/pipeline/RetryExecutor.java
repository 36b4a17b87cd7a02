package com.example.mediagen_backend.service.pipeline;

import com.example.mediagen_backend.engine.GenerationException;
import com.example.mediagen_backend.engine.PermanentGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Calls a provider up to {@code maxAttempts} times with exponential backoff starting at the base
 * delay. Permanent failures and cancellation stop immediately. Retries resubscribe on the
 * bounded-elastic scheduler since provider calls block.
 */
public class RetryExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryExecutor.class);

    @FunctionalInterface
    public interface Call<T> {
        T call() throws GenerationException;
    }

    /**
     * @param retryCount failed attempts before the successful one.
     */
    public record Outcome<T>(T value, int retryCount) {
    }

    private final Duration baseDelay;

    public RetryExecutor(long baseDelayMs) {
        this.baseDelay = Duration.ofMillis(Math.max(1, baseDelayMs));
    }

    public <T> Outcome<T> execute(Call<T> call, int maxAttempts, String context, BooleanSupplier cancelled)
            throws GenerationException {
        int attempts = Math.max(1, maxAttempts);
        AtomicInteger retries = new AtomicInteger();
        try {
            T value = Mono.fromCallable(call::call)
                    .retryWhen(Retry.backoff(attempts - 1, baseDelay)
                            .jitter(0)
                            .scheduler(Schedulers.boundedElastic())
                            .filter(e -> isRetryable(e) && !cancelled.getAsBoolean())
                            .doBeforeRetry(signal -> {
                                retries.set((int) signal.totalRetries() + 1);
                                LOGGER.warn("Retry {}/{} context={} error={}", signal.totalRetries() + 1, attempts,
                                        context, signal.failure().getMessage());
                            })
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block();
            return new Outcome<>(value, retries.get());
        } catch (RuntimeException e) {
            throw translate(e, context, retries.get() + 1, attempts, cancelled);
        }
    }

    private static boolean isRetryable(Throwable e) {
        return e instanceof GenerationException && !(e instanceof PermanentGenerationException);
    }

    private static GenerationException translate(RuntimeException e, String context, int attempt, int attempts,
                                                 BooleanSupplier cancelled) {
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new PermanentGenerationException("Interrupted during retry backoff", cause);
        }
        if (cause instanceof PermanentGenerationException pe) {
            LOGGER.warn("Permanent failure context={} attempt={} error={}", context, attempt, pe.getMessage());
            return pe;
        }
        if (cause instanceof GenerationException ge) {
            if (attempt < attempts && cancelled.getAsBoolean()) {
                return new PermanentGenerationException("Cancelled after attempt " + attempt + ": " + ge.getMessage(), ge);
            }
            LOGGER.error("Final retry failed context={} attempts={} error={}", context, attempt, ge.getMessage());
            return ge;
        }
        throw e;
    }
}
