package org.moxie.attestgate.policy;

import org.moxie.attestgate.attestation.PolicyVerdict;

/**
 * One independent check over an attestation. Implementations hold no per-run state and may be
 * evaluated concurrently with each other.
 */
public interface AttestationPolicy {

  /**
   * Key under which the verdict is reported.
   */
  String name();

  /**
   * Decide the check for one run. A thrown exception is reported as an indeterminate verdict.
   */
  PolicyVerdict evaluate(PolicyContext context) throws Exception;
}
