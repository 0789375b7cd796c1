package org.moxie.attestgate.attestation;

/**
 * The ledger does not know the attestation transaction at all.
 */
public class TransactionNotFoundException extends ConfigurationException {

  public TransactionNotFoundException(String txHash) {
    super("Transaction not found: " + txHash);
  }
}
