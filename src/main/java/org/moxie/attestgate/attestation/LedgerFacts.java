package org.moxie.attestgate.attestation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.moxie.attestgate.ledger.LedgerLog;

import java.util.List;

/**
 * Read-only facts the ledger reported about an attestation transaction at the time of a verification run.
 *
 * @param chainId        chain identifier reported by the ledger
 * @param blockNumber    height of the block containing the transaction
 * @param blockTimestamp unix timestamp (seconds) of that block
 * @param currentHeight  chain height when the facts were read
 * @param receiptStatus  execution status of the transaction
 * @param receiptTarget  address the transaction was sent to
 * @param logs           event logs emitted by the attestation contract in this transaction
 * @param logsInBlock    attestation-contract logs for this transaction found by a block-range log query
 * @param requestFeeWei  attestation fee advertised by the contract, null when it could not be read
 */
@JsonIgnoreProperties(value = {"confirmations"}, allowGetters = true, ignoreUnknown = true)
public record LedgerFacts(@JsonProperty("chainId") long chainId,
                          @JsonProperty("blockNumber") long blockNumber,
                          @JsonProperty("blockTimestamp") long blockTimestamp,
                          @JsonProperty("currentHeight") long currentHeight,
                          @JsonProperty("receiptStatus") ReceiptStatus receiptStatus,
                          @JsonProperty("receiptTarget") String receiptTarget,
                          @JsonProperty("logs") List<LedgerLog> logs,
                          @JsonProperty("logsInBlock") int logsInBlock,
                          @JsonProperty("requestFeeWei") String requestFeeWei)
{
  public LedgerFacts {
    logs = logs == null ? List.of() : List.copyOf(logs);
  }

  /**
   * Number of blocks at or after the containing block, the containing block included.
   */
  @JsonProperty("confirmations")
  public long confirmations() {
    return currentHeight - blockNumber + 1;
  }

  public LedgerFacts atHeight(long height) {
    return new LedgerFacts(chainId, blockNumber, blockTimestamp, height, receiptStatus, receiptTarget, logs, logsInBlock, requestFeeWei);
  }
}
