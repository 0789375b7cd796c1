package org.moxie.attestgate.attestation;

/**
 * The transaction is known but has not been included in a block yet.
 */
public class ReceiptPendingException extends ProofUnavailableException {

  public ReceiptPendingException(String txHash) {
    super("Receipt not available yet for " + txHash);
  }
}
