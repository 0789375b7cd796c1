package org.moxie.attestgate.attestation;

/**
 * A network call failed in a way that may succeed when repeated.
 */
public class TransientNetworkException extends AttestationException {

  public TransientNetworkException(String message) {
    super(ErrorCategory.TRANSIENT_NETWORK, message);
  }

  public TransientNetworkException(String message, Throwable cause) {
    super(ErrorCategory.TRANSIENT_NETWORK, message, cause);
  }
}
