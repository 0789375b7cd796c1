package org.moxie.attestgate.policy;

import org.moxie.attestgate.attestation.AttestationVerdict;
import org.moxie.attestgate.attestation.PolicyVerdict;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The attestation block must not precede the oldest data the attestation used, and a time range
 * in the request URL, when there is one, must be non-empty.
 */
public class TimeWindowPolicy implements AttestationPolicy {

  private final String rangeMarker;

  public TimeWindowPolicy(String rangeMarker) {
    this.rangeMarker = rangeMarker;
  }

  @Override
  public String name() {
    return AttestationVerdict.TIME_WINDOW;
  }

  @Override
  public PolicyVerdict evaluate(PolicyContext context) {
    BigInteger lowestUsedTimestamp = context.payload().claim().lowestUsedTimestamp();
    long       blockTimestamp      = context.facts().blockTimestamp();

    boolean afterLowest = lowestUsedTimestamp.signum() == 0 ||
                          BigInteger.valueOf(blockTimestamp).compareTo(lowestUsedTimestamp) >= 0;

    Optional<RequestRange> range = RequestRange.parse(context.payload().claim().requestBody().url(), rangeMarker);

    Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("blockTimestamp", blockTimestamp);
    detail.put("lowestUsedTimestamp", lowestUsedTimestamp);
    detail.put("afterLowestUsedTimestamp", afterLowest);

    if (range.isPresent()) {
      detail.put("rangeStart", range.get().startIso());
      detail.put("rangeEnd", range.get().endIso());
      detail.put("rangeValid", range.get().valid());
    } else {
      detail.put("rangeValid", null);
    }

    return PolicyVerdict.of(afterLowest && range.map(RequestRange::valid).orElse(true), detail);
  }
}
