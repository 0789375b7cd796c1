package org.moxie.attestgate.policy;

import org.moxie.attestgate.attestation.AttestationReference;
import org.moxie.attestgate.attestation.ChainMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guards every run against talking to the wrong chain. Unlike the other checks this one is fatal,
 * so it throws instead of producing a verdict.
 */
public class ChainIdentityPolicy {

  private static final Logger log = LoggerFactory.getLogger(ChainIdentityPolicy.class);

  private final long expectedChainId;

  public ChainIdentityPolicy(long expectedChainId) {
    this.expectedChainId = expectedChainId;
  }

  public void enforce(long reportedChainId, AttestationReference reference) throws ChainMismatchException {
    if (reportedChainId != expectedChainId) {
      log.error("Ledger reports chain {} but {} is configured", reportedChainId, expectedChainId);
      throw new ChainMismatchException(expectedChainId, reportedChainId);
    }

    if (reference.chainId() != expectedChainId) {
      log.error("Attestation {} was made on chain {}, ledger is chain {}", reference.txHash(), reference.chainId(), reportedChainId);
      throw new ChainMismatchException(reference.chainId(), reportedChainId);
    }
  }

  public long getExpectedChainId() {
    return expectedChainId;
  }
}
