package org.moxie.attestgate.ledger;

import org.moxie.attestgate.attestation.ErrorCategory;

/**
 * The ledger refused a state-changing transaction, e.g. because the contract's replay guard reverted it.
 */
public class TransactionRejectedException extends LedgerException {

  public TransactionRejectedException(String message) {
    super(ErrorCategory.REPLAY_REJECTED, message);
  }

  public TransactionRejectedException(String message, Throwable cause) {
    super(ErrorCategory.REPLAY_REJECTED, message, cause);
  }
}
