package org.moxie.attestgate.ledger;

import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.ErrorCategory;

/**
 * The ledger answered, but with an error.
 */
public class LedgerException extends AttestationException {

  public LedgerException(ErrorCategory category, String message) {
    super(category, message);
  }

  public LedgerException(ErrorCategory category, String message, Throwable cause) {
    super(category, message, cause);
  }
}
