package org.moxie.attestgate.ledger;

import java.math.BigInteger;

/**
 * A transaction as returned by {@code eth_getTransactionByHash}. {@code blockNumber} is null while pending.
 */
public record LedgerTransaction(String hash, String from, String to, Long blockNumber, String input, BigInteger value) {

  public boolean isPending() {
    return blockNumber == null;
  }
}
