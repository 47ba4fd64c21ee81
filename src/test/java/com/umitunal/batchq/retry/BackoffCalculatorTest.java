package com.umitunal.batchq.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class BackoffCalculatorTest {

    @Test
    @DisplayName("Should keep delay within jittered exponential bounds")
    void testDelayBounds() {
        // Given
        BackoffCalculator backoff = new BackoffCalculator(1000, 2.0, 30000, new Random(42));

        // When/Then - attempt n lies in [0.5, 1.0] * base * 2^(n-1)
        for (int i = 0; i < 200; i++) {
            assertThat(backoff.delay(1)).isBetween(500L, 1000L);
            assertThat(backoff.delay(2)).isBetween(1000L, 2000L);
            assertThat(backoff.delay(3)).isBetween(2000L, 4000L);
        }
    }

    @Test
    @DisplayName("Should cap delay at maxDelay")
    void testMaxDelayCap() {
        // Given
        BackoffCalculator backoff = new BackoffCalculator(1000, 2.0, 5000, new Random(7));

        // When/Then
        for (int i = 0; i < 100; i++) {
            assertThat(backoff.delay(20)).isEqualTo(5000L);
        }
    }

    @Test
    @DisplayName("Should produce identical sequences for the same seed")
    void testDeterministicWithSeed() {
        // Given
        BackoffCalculator first = new BackoffCalculator(250, 3.0, 60000, new Random(123));
        BackoffCalculator second = new BackoffCalculator(250, 3.0, 60000, new Random(123));

        // When/Then
        for (int attempt = 1; attempt <= 6; attempt++) {
            assertThat(first.delay(attempt)).isEqualTo(second.delay(attempt));
        }
    }

    @Test
    @DisplayName("Should grow the expected delay with each attempt")
    void testDelayGrowsInExpectation() {
        // Given
        BackoffCalculator backoff = new BackoffCalculator(100, 2.0, 100000, new Random(99));
        long sumFirst = 0;
        long sumSecond = 0;

        // When
        for (int i = 0; i < 500; i++) {
            sumFirst += backoff.delay(1);
            sumSecond += backoff.delay(2);
        }

        // Then
        assertThat(sumSecond).isGreaterThan(sumFirst);
    }

    @Test
    @DisplayName("Should treat attempt below 1 as the first attempt and never go negative")
    void testLowAttemptAndZeroBase() {
        BackoffCalculator backoff = new BackoffCalculator(1000, 2.0, 30000, new Random(1));
        assertThat(backoff.delay(0)).isBetween(500L, 1000L);

        BackoffCalculator zero = new BackoffCalculator(0, 2.0, 30000);
        assertThat(zero.delay(5)).isZero();
    }

    @Test
    @DisplayName("Should reject invalid settings")
    void testInvalidSettings() {
        assertThatThrownBy(() -> new BackoffCalculator(-1, 2.0, 1000))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 0.5, 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("backoffFactor");
    }
}
