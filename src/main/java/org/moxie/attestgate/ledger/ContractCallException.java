package org.moxie.attestgate.ledger;

import org.moxie.attestgate.attestation.ErrorCategory;

/**
 * A read-only contract call or gas estimate did not produce a usable result.
 */
public class ContractCallException extends LedgerException {

  public ContractCallException(String message) {
    super(ErrorCategory.CONFIGURATION, message);
  }

  public ContractCallException(String message, Throwable cause) {
    super(ErrorCategory.CONFIGURATION, message, cause);
  }
}
