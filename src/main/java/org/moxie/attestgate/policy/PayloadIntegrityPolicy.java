package org.moxie.attestgate.policy;

import org.moxie.attestgate.attestation.AttestationVerdict;
import org.moxie.attestgate.attestation.Hex;
import org.moxie.attestgate.attestation.PolicyVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recomputes the SHA-256 digest of the attested response bytes and compares it with the configured
 * digest and the digest recorded at submission time.
 * <p>
 * With neither reference digest available the check passes vacuously, unless strict mode is on.
 * A disagreement is always a failure and is flagged as {@code mismatch} in the detail.
 */
public class PayloadIntegrityPolicy implements AttestationPolicy {

  private static final Logger log = LoggerFactory.getLogger(PayloadIntegrityPolicy.class);

  private final String  expectedDigest;
  private final boolean strict;

  public PayloadIntegrityPolicy(String expectedDigest, boolean strict) {
    this.expectedDigest = expectedDigest;
    this.strict         = strict;
  }

  @Override
  public String name() {
    return AttestationVerdict.PAYLOAD_INTEGRITY;
  }

  @Override
  public PolicyVerdict evaluate(PolicyContext context) {
    String  recordedDigest = context.submission() == null ? null : prefixed(context.submission().computedMic());
    String  expected       = prefixed(expectedDigest);
    boolean hasReference   = expected != null || recordedDigest != null;
    String  computedDigest = context.attestedData() == null ? null : Numeric.toHexString(Hash.sha256(context.attestedData()));

    Boolean matchesExpected = expected == null || computedDigest == null ? null : Hex.sameValue(computedDigest, expected);
    Boolean matchesRecorded = recordedDigest == null || computedDigest == null ? null : Hex.sameValue(computedDigest, recordedDigest);
    boolean mismatch        = Boolean.FALSE.equals(matchesExpected) || Boolean.FALSE.equals(matchesRecorded);

    Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("computedDigest", computedDigest);
    detail.put("expectedDigest", expected);
    detail.put("recordedDigest", recordedDigest);
    detail.put("matchesExpected", matchesExpected);
    detail.put("matchesRecorded", matchesRecorded);
    detail.put("vacuous", !hasReference);
    detail.put("strict", strict);
    detail.put("mismatch", mismatch);

    if (computedDigest == null && hasReference) {
      detail.put("reason", "attested-data-missing");
      return PolicyVerdict.indeterminate(detail);
    }

    if (mismatch) {
      log.warn("Digest mismatch for {}: computed {}, expected {}, recorded {}",
               context.reference().txHash(), computedDigest, expected, recordedDigest);
      detail.put("reason", "digest-mismatch");
      return PolicyVerdict.fail(detail);
    }

    if (!hasReference && strict) {
      detail.put("reason", "no-reference-digest");
      return PolicyVerdict.fail(detail);
    }

    return PolicyVerdict.pass(detail);
  }

  private static String prefixed(String digest) {
    if (digest == null || digest.isBlank()) return null;

    String trimmed = digest.trim();
    return trimmed.startsWith("0x") || trimmed.startsWith("0X") ? trimmed : "0x" + trimmed;
  }
}
