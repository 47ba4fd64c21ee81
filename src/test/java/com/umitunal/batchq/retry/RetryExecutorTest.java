package com.umitunal.batchq.retry;

import com.umitunal.batchq.error.ErrorType;
import com.umitunal.batchq.error.ProcessingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetryExecutorTest {

    private RetryOptions.Builder fastOptions() {
        return RetryOptions.newBuilder()
                .withBaseDelay(5)
                .withMaxDelay(50)
                .withRandom(new Random(3));
    }

    @Test
    @DisplayName("Should return value on first success without delay")
    void testImmediateSuccess() {
        // When
        RetryResult<String> result = RetryExecutor.execute(() -> "done", fastOptions().build());

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).isEqualTo("done");
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(result.getTotalDelay()).isZero();
    }

    @Test
    @DisplayName("Should retry transient failures until success")
    void testRetryUntilSuccess() {
        // Given
        AtomicInteger calls = new AtomicInteger(0);
        List<Integer> retriedAttempts = new ArrayList<>();
        RetryOptions options = fastOptions()
                .withOnRetry((attempt, error, delay) -> retriedAttempts.add(attempt))
                .build();

        // When
        RetryResult<Integer> result = RetryExecutor.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw ProcessingException.withStatus(503, "unavailable");
            }
            return calls.get();
        }, options);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).isEqualTo(3);
        assertThat(result.getAttempts()).isEqualTo(3);
        assertThat(retriedAttempts).containsExactly(1, 2);
        assertThat(result.getTotalDelay()).isPositive();
    }

    @Test
    @DisplayName("Should give up after maxRetries + 1 attempts")
    void testExhaustsRetries() {
        // Given
        AtomicInteger calls = new AtomicInteger(0);

        // When
        RetryResult<Object> result = RetryExecutor.execute(() -> {
            calls.incrementAndGet();
            throw new ConnectException("refused");
        }, fastOptions().withMaxRetries(2).build());

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(calls.get()).isEqualTo(3);
        assertThat(result.getAttempts()).isEqualTo(3);
        assertThat(result.getError()).isInstanceOf(ConnectException.class);
    }

    @Test
    @DisplayName("Should not retry when the condition rejects the failure")
    void testNonRetryableFailure() {
        // Given
        AtomicInteger calls = new AtomicInteger(0);

        // When
        RetryResult<Object> result = RetryExecutor.execute(() -> {
            calls.incrementAndGet();
            throw ProcessingException.withStatus(401, "unauthorized");
        }, fastOptions().build());

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(result.getAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should honour retryOn error types")
    void testRetryOnTypes() {
        // Given
        AtomicInteger calls = new AtomicInteger(0);
        RetryOptions options = fastOptions().withMaxRetries(1).retryOn(ErrorType.VALIDATION).build();

        // When
        RetryExecutor.execute(() -> {
            calls.incrementAndGet();
            throw ProcessingException.withStatus(422, "bad field");
        }, options);

        // Then
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("API preset should retry 429 and 408 but not a local timeout")
    void testApiPresetCondition() {
        assertThat(RetryOptions.isTransientApiFailure(ProcessingException.withStatus(429, "slow down"))).isTrue();
        assertThat(RetryOptions.isTransientApiFailure(ProcessingException.withStatus(408, "request timeout"))).isTrue();
        assertThat(RetryOptions.isTransientApiFailure(ProcessingException.withStatus(500, "boom"))).isTrue();
        assertThat(RetryOptions.isTransientApiFailure(new IllegalStateException("read timeout"))).isFalse();
        assertThat(RetryOptions.isTransientApiFailure(ProcessingException.withStatus(404, "missing"))).isFalse();
    }

    @Test
    @DisplayName("Database preset should retry connection and timeout failures")
    void testDatabasePresetCondition() {
        assertThat(RetryOptions.isTransientDatabaseFailure(ProcessingException.withCode("PGRST301", "jwt"))).isTrue();
        assertThat(RetryOptions.isTransientDatabaseFailure(new IllegalStateException("Connection reset"))).isTrue();
        assertThat(RetryOptions.isTransientDatabaseFailure(new IllegalStateException("statement timeout"))).isTrue();
        assertThat(RetryOptions.isTransientDatabaseFailure(new IllegalStateException("duplicate key"))).isFalse();

        RetryOptions options = RetryOptions.databaseOperation().build();
        assertThat(options.getMaxRetries()).isEqualTo(2);
        assertThat(options.getBaseDelayMillis()).isEqualTo(500);
    }

    @Test
    @DisplayName("Should stop retrying when interrupted while sleeping")
    void testInterruptedSleep() {
        // Given
        AtomicInteger calls = new AtomicInteger(0);
        RetryOptions options = fastOptions()
                .withBaseDelay(10000)
                .withMaxDelay(10000)
                .withOnRetry((attempt, error, delay) -> Thread.currentThread().interrupt())
                .build();

        // When
        RetryResult<Object> result = RetryExecutor.execute(() -> {
            calls.incrementAndGet();
            throw ProcessingException.withStatus(503, "unavailable");
        }, options);

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(Thread.interrupted()).isTrue();
    }
}
