package org.moxie.attestgate.policy;

import org.junit.jupiter.api.Test;
import org.moxie.attestgate.Fixtures;
import org.moxie.attestgate.attestation.PolicyVerdict;

import static org.junit.jupiter.api.Assertions.*;

class TimeWindowPolicyTest {

  private final TimeWindowPolicy policy = new TimeWindowPolicy("/intensity/");

  @Test
  void evaluate_blockAfterLowestTimestampAndValidRange_passes() {
    PolicyVerdict verdict = policy.evaluate(context(Fixtures.INTENSITY_URL, 1_700_000_000L, 1_700_000_100L));

    assertEquals(Boolean.TRUE, verdict.passed());
    assertEquals("2024-01-01T00:00Z", verdict.detail().get("rangeStart"));
    assertEquals(true, verdict.detail().get("rangeValid"));
  }

  @Test
  void evaluate_blockBeforeLowestTimestamp_fails() {
    PolicyVerdict verdict = policy.evaluate(context(Fixtures.INTENSITY_URL, 1_700_000_000L, 1_699_999_999L));

    assertEquals(Boolean.FALSE, verdict.passed());
    assertEquals(false, verdict.detail().get("afterLowestUsedTimestamp"));
  }

  @Test
  void evaluate_zeroLowestTimestamp_isNotConstraining() {
    PolicyVerdict verdict = policy.evaluate(context(Fixtures.INTENSITY_URL, 0, 5));

    assertEquals(Boolean.TRUE, verdict.passed());
  }

  @Test
  void evaluate_reversedRange_fails() {
    String url = "https://api.carbonintensity.org.uk/intensity/2024-01-02T00:00Z/2024-01-01T00:00Z";

    PolicyVerdict verdict = policy.evaluate(context(url, 0, 1_700_000_100L));

    assertEquals(Boolean.FALSE, verdict.passed());
    assertEquals(false, verdict.detail().get("rangeValid"));
  }

  @Test
  void evaluate_urlWithoutRange_passesOnTimestampAlone() {
    PolicyVerdict verdict = policy.evaluate(context("https://api.example.org/price", 10, 20));

    assertEquals(Boolean.TRUE, verdict.passed());
    assertNull(verdict.detail().get("rangeValid"));
  }

  private static PolicyContext context(String url, long lowestUsedTimestamp, long blockTimestamp) {
    return new PolicyContext(Fixtures.reference(),
                             Fixtures.payload(url, lowestUsedTimestamp),
                             Fixtures.facts(100, 120, blockTimestamp),
                             null,
                             null);
  }
}
