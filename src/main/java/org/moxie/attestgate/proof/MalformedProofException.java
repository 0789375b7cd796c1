package org.moxie.attestgate.proof;

import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.ErrorCategory;

/**
 * A stored artifact exists but does not have any layout we know how to read.
 */
public class MalformedProofException extends AttestationException {

  public MalformedProofException(String message) {
    super(ErrorCategory.CONFIGURATION, message);
  }

  public MalformedProofException(String message, Throwable cause) {
    super(ErrorCategory.CONFIGURATION, message, cause);
  }
}
