package org.moxie.attestgate.config;

import org.junit.jupiter.api.Test;
import org.moxie.attestgate.attestation.ConfigurationException;
import org.moxie.attestgate.attestation.TransientNetworkException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

  @Test
  void delayAfter_growsByBackoff() {
    RetryPolicy policy = new RetryPolicy(4, Duration.ofMillis(100), 2.0);

    assertEquals(Duration.ofMillis(100), policy.delayAfter(1));
    assertEquals(Duration.ofMillis(200), policy.delayAfter(2));
    assertEquals(Duration.ofMillis(400), policy.delayAfter(3));
  }

  @Test
  void run_transientFailureThenSuccess_retries() throws Exception {
    AtomicInteger calls = new AtomicInteger();

    String result = RetryPolicy.fixed(3, Duration.ZERO).run("eth_chainId", () -> {
      if (calls.incrementAndGet() < 3) throw new TransientNetworkException("timeout");
      return "0x72";
    });

    assertEquals("0x72", result);
    assertEquals(3, calls.get());
  }

  @Test
  void run_exhausted_throwsLastFailure() {
    AtomicInteger calls = new AtomicInteger();

    assertThrows(TransientNetworkException.class, () -> RetryPolicy.fixed(2, Duration.ZERO).run("eth_call", () -> {
      calls.incrementAndGet();
      throw new TransientNetworkException("timeout");
    }));

    assertEquals(2, calls.get());
  }

  @Test
  void run_nonTransientFailure_isNotRetried() {
    AtomicInteger calls = new AtomicInteger();

    assertThrows(ConfigurationException.class, () -> RetryPolicy.fixed(5, Duration.ZERO).run("eth_call", () -> {
      calls.incrementAndGet();
      throw new ConfigurationException("bad address");
    }));

    assertEquals(1, calls.get());
  }

  @Test
  void constructor_rejectsNonsense() {
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, 1.0));
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, Duration.ofMillis(-1), 1.0));
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, Duration.ZERO, 0.5));
  }
}
