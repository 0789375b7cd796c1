package org.moxie.attestgate.attestation;

/**
 * The ledger reports a different chain than the one the pipeline was configured for.
 */
public class ChainMismatchException extends ConfigurationException {

  private final long expectedChainId;
  private final long reportedChainId;

  public ChainMismatchException(long expectedChainId, long reportedChainId) {
    super("Chain id mismatch. Expected " + expectedChainId + ", got " + reportedChainId + ".");
    this.expectedChainId = expectedChainId;
    this.reportedChainId = reportedChainId;
  }

  public long getExpectedChainId() {
    return expectedChainId;
  }

  public long getReportedChainId() {
    return reportedChainId;
  }
}
