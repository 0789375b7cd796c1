package org.moxie.attestgate.config;

import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.TransientNetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Bounded retry schedule: at most {@code maxAttempts} tries, waiting {@code interval} after the first
 * failure and multiplying the wait by {@code backoff} after each further one.
 */
public record RetryPolicy(int maxAttempts, Duration interval, double backoff) {

  private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }

    if (interval == null || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be non-negative");
    }

    if (backoff < 1.0) {
      throw new IllegalArgumentException("backoff must be >= 1.0");
    }
  }

  public static RetryPolicy once() {
    return new RetryPolicy(1, Duration.ZERO, 1.0);
  }

  public static RetryPolicy fixed(int maxAttempts, Duration interval) {
    return new RetryPolicy(maxAttempts, interval, 1.0);
  }

  /**
   * Wait before attempt {@code attempt + 1}, where {@code attempt} is 1-based.
   */
  public Duration delayAfter(int attempt) {
    double factor = Math.pow(backoff, Math.max(0, attempt - 1));
    return Duration.ofMillis((long) (interval.toMillis() * factor));
  }

  public void pause(int attempt) throws InterruptedException {
    Duration delay = delayAfter(attempt);
    if (!delay.isZero()) {
      Thread.sleep(delay.toMillis());
    }
  }

  /**
   * Run {@code call}, repeating it only while it fails with {@link TransientNetworkException}.
   * Every other failure, and the last transient one, is thrown to the caller.
   */
  public <T> T run(String operation, RetryableCall<T> call) throws AttestationException {
    for (int attempt = 1; ; attempt++) {
      try {
        return call.call();
      } catch (TransientNetworkException e) {
        if (attempt >= maxAttempts || Thread.currentThread().isInterrupted()) {
          throw e;
        }

        log.warn("{} failed (attempt {}/{}): {}", operation, attempt, maxAttempts, e.getMessage());

        try {
          pause(attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new TransientNetworkException("Interrupted while retrying " + operation, ie);
        }
      }
    }
  }

  @FunctionalInterface
  public interface RetryableCall<T> {
    T call() throws AttestationException;
  }
}
