package org.moxie.attestgate.ledger;

import java.math.BigInteger;

/**
 * Current fee market of the ledger. The EIP-1559 fields are null when the node does not report them.
 */
public record FeeEstimate(BigInteger gasPrice, BigInteger maxFeePerGas, BigInteger maxPriorityFeePerGas) {

  public static FeeEstimate legacy(BigInteger gasPrice) {
    return new FeeEstimate(gasPrice, null, null);
  }
}
