package org.moxie.attestgate.attestation;

/**
 * The proof artifact for an attestation does not exist yet.
 */
public class ProofUnavailableException extends AttestationException {

  public ProofUnavailableException(String message) {
    super(ErrorCategory.PROOF_UNAVAILABLE, message);
  }

  public ProofUnavailableException(String message, Throwable cause) {
    super(ErrorCategory.PROOF_UNAVAILABLE, message, cause);
  }
}
