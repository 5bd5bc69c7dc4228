package com.example.keyvaultclient.core;

import static com.example.keyvaultclient.core.HttpErrors.httpError;
import static com.example.keyvaultclient.core.HttpErrors.throttled;
import static com.example.keyvaultclient.core.Retry.*;
import static org.junit.jupiter.api.Assertions.*;

import com.azure.core.exception.HttpResponseException;
import com.azure.core.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

public class RetryTest {

  private final List<Duration> sleeps = new ArrayList<>();
  private final Sleeper recordingSleeper = sleeps::add;

  @AfterEach
  void clearInterruptFlag() {
    if (Thread.currentThread().isInterrupted()) Thread.interrupted();
  }

  @Nested
  @DisplayName("Policy")
  class PolicyTests {

    @Test
    void defaultsMatchDocumentedValues() {
      final var policy = Policy.defaults();
      assertEquals(5, policy.maxRetries());
      assertEquals(1L, policy.baseDelaySeconds());
      assertEquals(4, policy.exponentCap());
      assertEquals(6, policy.maxAttempts());
    }

    @Test
    void delayDoublesUntilExponentCap() {
      final var policy = Policy.defaults();
      assertEquals(Duration.ofSeconds(1), policy.delayBeforeRetry(0));
      assertEquals(Duration.ofSeconds(2), policy.delayBeforeRetry(1));
      assertEquals(Duration.ofSeconds(4), policy.delayBeforeRetry(2));
      assertEquals(Duration.ofSeconds(8), policy.delayBeforeRetry(3));
      assertEquals(Duration.ofSeconds(16), policy.delayBeforeRetry(4));
      assertEquals(Duration.ofSeconds(16), policy.delayBeforeRetry(5));
      assertEquals(Duration.ofSeconds(16), policy.delayBeforeRetry(12));
    }

    @Test
    void customCapAndBase() {
      final var policy = new Policy(10, 3L, 2);
      assertEquals(Duration.ofSeconds(3), policy.delayBeforeRetry(0));
      assertEquals(Duration.ofSeconds(12), policy.delayBeforeRetry(2));
      assertEquals(Duration.ofSeconds(12), policy.delayBeforeRetry(7));
    }

    @Test
    void rejectsInvalidValues() {
      assertThrows(IllegalArgumentException.class, () -> new Policy(-1, 1L, 4));
      assertThrows(IllegalArgumentException.class, () -> new Policy(1, -1L, 4));
      assertThrows(IllegalArgumentException.class, () -> new Policy(1, 1L, -1));
      assertThrows(IllegalArgumentException.class, () -> new Policy(1, 1L, 31));
    }

    @Test
    @DisplayName("Rejects delays that overflow a millisecond Duration")
    void rejectsOverflowingDelay() {
      assertThrows(IllegalArgumentException.class, () -> new Policy(5, Long.MAX_VALUE / 2, 4));
      assertThrows(IllegalArgumentException.class, () -> new Policy(5, 1L << 40, 30));
    }

    @Test
    void largestAcceptedDelayStaysPositive() {
      final var policy = new Policy(40, 1L << 20, 30);
      final var delay = policy.delayBeforeRetry(35);
      assertEquals(Duration.ofSeconds(1L << 50), delay);
      assertTrue(delay.toMillis() > 0);
    }

    @Test
    void zeroRetriesIsAllowed() {
      assertEquals(1, Policy.withMaxRetries(0).maxAttempts());
    }
  }

  @Test
  void shouldSucceedOnFirstAttemptWithoutSleeping() {
    final var result =
        onThrottle(() -> "value", Policy.defaults(), recordingSleeper, (a, d, e) -> fail());
    assertEquals("value", result);
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void shouldRetryThrottledCallsUntilSuccess() {
    final var attempts = new int[] {0};
    final var notified = new ArrayList<Integer>();

    final var result =
        onThrottle(
            () -> {
              attempts[0]++;
              if (attempts[0] <= 3) throw throttled();
              return "value";
            },
            Policy.defaults(),
            recordingSleeper,
            (attempt, delay, cause) -> notified.add(attempt));

    assertEquals("value", result);
    assertEquals(4, attempts[0]);
    assertEquals(List.of(0, 1, 2), notified);
    assertEquals(
        List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeps);
  }

  @Test
  void shouldRethrowLastThrottleAfterExhaustingRetries() {
    final var attempts = new int[] {0};

    final var thrown =
        assertThrows(
            HttpResponseException.class,
            () ->
                onThrottle(
                    () -> {
                      attempts[0]++;
                      throw throttled();
                    },
                    Policy.withMaxRetries(3),
                    recordingSleeper,
                    (a, d, e) -> {}));

    assertEquals(429, thrown.getResponse().getStatusCode());
    assertEquals(4, attempts[0]);
    assertEquals(3, sleeps.size());
  }

  @Test
  void shouldNotRetryNonThrottlingErrors() {
    final var attempts = new int[] {0};
    final var notFound = httpError(404);

    final var thrown =
        assertThrows(
            HttpResponseException.class,
            () ->
                onThrottle(
                    () -> {
                      attempts[0]++;
                      throw notFound;
                    },
                    Policy.defaults(),
                    recordingSleeper,
                    (a, d, e) -> {}));

    assertSame(notFound, thrown);
    assertEquals(1, attempts[0]);
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void shouldSkipSleepWhenBaseDelayIsZero() {
    final var attempts = new int[] {0};
    onThrottle(
        () -> {
          if (attempts[0]++ == 0) throw throttled();
          return "ok";
        },
        new Policy(1, 0L, 4),
        recordingSleeper,
        (a, d, e) -> {});
    assertTrue(sleeps.isEmpty());
    assertEquals(2, attempts[0]);
  }

  @Test
  void interruptedDuringDelayReinterruptsAndThrowsOriginal() {
    final var original = throttled();

    final var thrown =
        assertThrows(
            HttpResponseException.class,
            () ->
                onThrottle(
                    () -> {
                      throw original;
                    },
                    Policy.defaults(),
                    delay -> {
                      throw new InterruptedException("stop");
                    },
                    (a, d, e) -> {}));

    assertSame(original, thrown);
    assertTrue(Thread.currentThread().isInterrupted());
  }

  @Test
  void isThrottledLooksThroughCauseChain() {
    assertTrue(isThrottled(throttled()));
    assertTrue(isThrottled(new RuntimeException(new IllegalStateException(throttled()))));
    assertFalse(isThrottled(httpError(503)));
    assertFalse(isThrottled(new RuntimeException("no http here")));
    assertFalse(isThrottled(null));
  }

  @Test
  void isThrottledFalseWhenResponseMissing() {
    assertFalse(isThrottled(new HttpResponseException("no response", (HttpResponse) null)));
  }

  @Test
  void findHttpResponseExceptionReturnsFirstInChain() {
    final var inner = throttled();
    final var wrapped = new RuntimeException(new IllegalStateException(inner));
    assertSame(inner, findHttpResponseException(wrapped));
    assertNull(findHttpResponseException(new RuntimeException("none")));
  }
}
