package org.moxie.attestgate.attestation;

/**
 * Failure taxonomy shared by the verification and reward paths.
 */
public enum ErrorCategory {

  /** Missing or invalid required input. Fatal, never retried. */
  CONFIGURATION(false),

  /** RPC/HTTP failure reaching the ledger or a remote service. Retried with backoff. */
  TRANSIENT_NETWORK(true),

  /** The attestation network has not produced the proof (or the receipt) yet. The caller polls. */
  PROOF_UNAVAILABLE(true),

  /** A policy returned a negative or indeterminate verdict. Asking again does not change the fact. */
  POLICY_FAILURE(false),

  /** The ledger refused the state change, e.g. its replay guard fired. */
  REPLAY_REJECTED(false),

  /** A recomputed payload digest disagrees with an expected or recorded one. */
  INTEGRITY_MISMATCH(false);

  private final boolean retryable;

  ErrorCategory(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
