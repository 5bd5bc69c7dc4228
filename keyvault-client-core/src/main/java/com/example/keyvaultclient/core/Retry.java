package com.example.keyvaultclient.core;

import static java.lang.System.Logger.Level.DEBUG;

import com.azure.core.exception.HttpResponseException;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retry helper for throttled Key Vault calls.
 *
 * <p>Only HTTP 429 (too many requests) responses are retried. Every other failure is rethrown on
 * the attempt that produced it.
 */
public final class Retry {

  private static final System.Logger LOGGER = System.getLogger(Retry.class.getName());

  static final int TOO_MANY_REQUESTS = 429;

  private Retry() {}

  /**
   * Backoff policy for throttled calls.
   *
   * <p>The delay before retry {@code i} (0-based) is {@code baseDelaySeconds * 2^min(i,
   * exponentCap)} seconds, so with the defaults the sequence is 1, 2, 4, 8, 16, 16, ... seconds.
   *
   * @param maxRetries retries after the first attempt, must be >= 0
   * @param baseDelaySeconds delay multiplier in seconds, must be >= 0
   * @param exponentCap largest exponent applied, must be between 0 and 30
   */
  public record Policy(int maxRetries, long baseDelaySeconds, int exponentCap) {

    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final long DEFAULT_BASE_DELAY_SECONDS = 1L;
    public static final int DEFAULT_EXPONENT_CAP = 4;

    public Policy {
      if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
      if (baseDelaySeconds < 0)
        throw new IllegalArgumentException("baseDelaySeconds must be >= 0");
      if (exponentCap < 0 || exponentCap > 30)
        throw new IllegalArgumentException("exponentCap must be between 0 and 30");
      try {
        // the longest delay must fit in a Duration expressed in millis
        Math.multiplyExact(Math.multiplyExact(baseDelaySeconds, 1L << exponentCap), 1000L);
      } catch (final ArithmeticException e) {
        throw new IllegalArgumentException(
            "baseDelaySeconds * 2^exponentCap overflows the maximum delay", e);
      }
    }

    /**
     * Default policy: 5 retries, 1 second base delay, exponent capped at 4.
     *
     * @return default policy
     */
    public static Policy defaults() {
      return withMaxRetries(DEFAULT_MAX_RETRIES);
    }

    /**
     * Default delays with a custom retry budget.
     *
     * @param maxRetries retries after the first attempt
     * @return policy
     */
    public static Policy withMaxRetries(final int maxRetries) {
      return new Policy(maxRetries, DEFAULT_BASE_DELAY_SECONDS, DEFAULT_EXPONENT_CAP);
    }

    /** Total attempts including the first. */
    public int maxAttempts() {
      return maxRetries + 1;
    }

    /**
     * Calculates the delay before a retry.
     *
     * @param attemptIndex 0-based index of the attempt that just failed
     * @return delay before the next attempt
     */
    public Duration delayBeforeRetry(final int attemptIndex) {
      final var exponent = Math.min(Math.max(attemptIndex, 0), exponentCap);
      return Duration.ofSeconds(Math.multiplyExact(baseDelaySeconds, 1L << exponent));
    }
  }

  /** Blocks the calling thread for a delay. */
  @FunctionalInterface
  public interface Sleeper {
    /**
     * Sleeps for the given delay.
     *
     * @param delay how long to block
     * @throws InterruptedException if interrupted while sleeping
     */
    void sleep(final Duration delay) throws InterruptedException;

    /**
     * Sleeper backed by {@link Thread#sleep(long)}.
     *
     * @return sleeper
     */
    static Sleeper threadSleep() {
      return delay -> Thread.sleep(delay.toMillis());
    }
  }

  /** Callback invoked before each backoff sleep. */
  @FunctionalInterface
  interface RetryListener {
    void beforeRetry(final int attemptIndex, final Duration delay, final RuntimeException cause);
  }

  /**
   * Runs {@code op}, retrying with exponential backoff while it fails with a throttling error.
   *
   * @param op operation to execute
   * @param policy backoff policy
   * @param sleeper sleeps between attempts
   * @param listener notified before every sleep
   * @param <T> result type
   * @return operation result
   * @throws RuntimeException the last throttling error once retries are exhausted, or the first
   *     non-throttling error, unchanged
   */
  static <T> T onThrottle(
      final Supplier<? extends T> op,
      final Policy policy,
      final Sleeper sleeper,
      final RetryListener listener) {
    var attempt = 0;
    while (true) {
      try {
        return op.get();
      } catch (final RuntimeException e) {
        if (!isThrottled(e) || attempt >= policy.maxRetries()) throw e;

        final var delay = policy.delayBeforeRetry(attempt);
        listener.beforeRetry(attempt, delay, e);
        LOGGER.log(DEBUG, "Throttled on attempt {0}, sleeping {1}", attempt + 1, delay);

        if (!delay.isZero()) {
          try {
            sleeper.sleep(delay);
          } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw e;
          }
        }
        attempt++;
      }
    }
  }

  /**
   * Finds the first {@link HttpResponseException} in a throwable cause chain.
   *
   * @param t the throwable to search
   * @return the first HttpResponseException, or null if none found
   */
  static HttpResponseException findHttpResponseException(final Throwable t) {
    Throwable cur = t;
    while (cur != null) {
      if (cur instanceof HttpResponseException hre) return hre;
      cur = cur.getCause();
    }
    return null;
  }

  /**
   * Detects throttling: an HTTP 429 response anywhere in the cause chain.
   *
   * @param t the throwable to check
   * @return true if the service asked the caller to back off
   */
  static boolean isThrottled(final Throwable t) {
    final var hre = findHttpResponseException(t);
    return hre != null
        && hre.getResponse() != null
        && hre.getResponse().getStatusCode() == TOO_MANY_REQUESTS;
  }
}
