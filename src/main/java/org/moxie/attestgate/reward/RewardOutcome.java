package org.moxie.attestgate.reward;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.moxie.attestgate.attestation.AttestationVerdict;
import org.moxie.attestgate.ledger.LedgerReceipt;

import java.math.BigInteger;

/**
 * Result of one pass through the reward gate. Persisted as the reward report of the attestation.
 */
@JsonIgnoreProperties(value = {"success"}, allowGetters = true, ignoreUnknown = true)
public record RewardOutcome(@JsonProperty("status") RewardStatus status,
                            @JsonProperty("dryRun") boolean dryRun,
                            @JsonProperty("callData") String callData,
                            @JsonProperty("estimatedGas") BigInteger estimatedGas,
                            @JsonProperty("gasPrice") BigInteger gasPrice,
                            @JsonProperty("rewardTxHash") String rewardTxHash,
                            @JsonProperty("blockNumber") Long blockNumber,
                            @JsonProperty("gasUsed") BigInteger gasUsed,
                            @JsonProperty("reason") String reason,
                            @JsonProperty("record") RewardRecord record,
                            @JsonProperty("transactionRequest") TransactionRequest transactionRequest,
                            @JsonProperty("verdict") AttestationVerdict verdict)
{
  @JsonProperty("success")
  public boolean success() {
    return status == RewardStatus.EXECUTED || status == RewardStatus.DRY_RUN || status == RewardStatus.AWAITING_SIGNATURE;
  }

  static RewardOutcome notVerified(AttestationVerdict verdict) {
    return new RewardOutcome(RewardStatus.VERIFICATION_NOT_PASSED, false, null, null, null, null, null, null,
                             "unmet policies: " + verdict.unmetPolicies(), null, null, verdict);
  }

  static RewardOutcome alreadyExecuted(AttestationVerdict verdict, RewardRecord record) {
    return new RewardOutcome(RewardStatus.ALREADY_EXECUTED, false, null, null, null, record.rewardTxHash(), record.blockNumber(), null,
                             "reward already recorded on the ledger", record, null, verdict);
  }

  static RewardOutcome dryRun(AttestationVerdict verdict, String callData, BigInteger estimatedGas, BigInteger gasPrice, TransactionRequest request) {
    return new RewardOutcome(RewardStatus.DRY_RUN, true, callData, estimatedGas, gasPrice, null, null, null, null, null, request, verdict);
  }

  static RewardOutcome awaitingSignature(AttestationVerdict verdict, String callData, BigInteger estimatedGas, BigInteger gasPrice, TransactionRequest request) {
    return new RewardOutcome(RewardStatus.AWAITING_SIGNATURE, false, callData, estimatedGas, gasPrice, null, null, null,
                             "sign and broadcast the transaction request, then check it with reward.tx_hash", null, request, verdict);
  }

  static RewardOutcome rejected(AttestationVerdict verdict, String callData, String rewardTxHash, LedgerReceipt receipt, String reason) {
    return new RewardOutcome(RewardStatus.REJECTED_BY_LEDGER, false, callData, null, null, rewardTxHash,
                             receipt == null ? null : receipt.blockNumber(),
                             receipt == null ? null : receipt.gasUsed(),
                             reason, null, null, verdict);
  }

  static RewardOutcome pending(AttestationVerdict verdict, String callData, String rewardTxHash, String reason) {
    return new RewardOutcome(RewardStatus.PENDING_CONFIRMATION, false, callData, null, null, rewardTxHash, null, null, reason, null, null, verdict);
  }

  static RewardOutcome executed(AttestationVerdict verdict, String callData, LedgerReceipt receipt, RewardRecord record) {
    return new RewardOutcome(RewardStatus.EXECUTED, false, callData, null, null, receipt.transactionHash(), receipt.blockNumber(),
                             receipt.gasUsed(), null, record, null, verdict);
  }
}
