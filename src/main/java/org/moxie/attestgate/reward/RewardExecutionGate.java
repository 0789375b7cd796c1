package org.moxie.attestgate.reward;

import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.AttestationVerdict;
import org.moxie.attestgate.attestation.Hex;
import org.moxie.attestgate.attestation.ReceiptStatus;
import org.moxie.attestgate.config.Mode;
import org.moxie.attestgate.config.SignerMode;
import org.moxie.attestgate.ledger.ContractCallException;
import org.moxie.attestgate.ledger.FeeEstimate;
import org.moxie.attestgate.ledger.LedgerClient;
import org.moxie.attestgate.ledger.LedgerReceipt;
import org.moxie.attestgate.ledger.TransactionRejectedException;
import org.moxie.attestgate.storage.RewardOutcomeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Function;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The only path by which a reward reaches the ledger.
 * <p>
 * A reward is attempted only for a verified {@link AttestationVerdict}, only in {@link Mode#REAL},
 * and only when no reward for the same attestation is already on the ledger. Within one process the
 * look-up and the submission for one attestation hash happen under a lock, so two callers cannot both
 * pass the look-up. Across processes the contract's own replay guard decides, and its rejection is
 * reported as {@link RewardStatus#REJECTED_BY_LEDGER}.
 * <p>
 * With an {@link SignerMode#EXTERNAL} signer the gate never submits. It hands out an unsigned
 * {@link TransactionRequest} and checks the resulting transaction later through {@link #checkSubmission}.
 */
public class RewardExecutionGate {

  private static final Logger log = LoggerFactory.getLogger(RewardExecutionGate.class);

  private static final int LOCK_STRIPES = 64;

  private final LedgerClient       ledger;
  private final RewardLedger       rewardLedger;
  private final RewardOutcomeStore outcomes;
  private final int                requiredConfirmations;
  private final SignerMode         signerMode;
  private final String             signerAddress;
  private final ReentrantLock[]    locks = new ReentrantLock[LOCK_STRIPES];

  public RewardExecutionGate(LedgerClient ledger, RewardLedger rewardLedger, RewardOutcomeStore outcomes, int requiredConfirmations) {
    this(ledger, rewardLedger, outcomes, requiredConfirmations, SignerMode.LOCAL_KEY, null);
  }

  /**
   * @param signerAddress sender put into external transaction requests, or null to leave it to the wallet
   */
  public RewardExecutionGate(LedgerClient ledger,
                             RewardLedger rewardLedger,
                             RewardOutcomeStore outcomes,
                             int requiredConfirmations,
                             SignerMode signerMode,
                             String signerAddress)
  {
    this.ledger                = ledger;
    this.rewardLedger          = rewardLedger;
    this.outcomes              = outcomes;
    this.requiredConfirmations = requiredConfirmations;
    this.signerMode            = signerMode;
    this.signerAddress         = signerAddress;

    for (int i = 0; i < locks.length; i++) {
      locks[i] = new ReentrantLock();
    }
  }

  /**
   * Reward the attestation behind {@code verdict}, unless something stops it. Every outcome, including
   * a refusal for an unverified verdict, is persisted as the reward report of the attestation.
   *
   * @param intent what to reward; not read when the verdict is unverified, so it may be null then
   */
  public RewardOutcome executeIfVerified(AttestationVerdict verdict, RewardIntent intent, Mode mode, ExecutionMode executionMode)
      throws AttestationException, InterruptedException
  {
    mode.requireReal("reward execution");

    if (!verdict.verified()) {
      log.warn("Refusing reward for {}: attestation not verified {}", verdict.txHash(), verdict.unmetPolicies());
      return persist(RewardOutcome.notVerified(verdict));
    }

    if (intent == null || !intent.attestationTxHash().equalsIgnoreCase(verdict.txHash())) {
      throw new IllegalArgumentException("Reward intent is for " + (intent == null ? "nothing" : intent.attestationTxHash()) +
                                         " but the verdict is for " + verdict.txHash());
    }

    ReentrantLock lock = lockFor(verdict.txHash());
    lock.lockInterruptibly();

    try {
      Optional<RewardRecord> existing = rewardLedger.findRecord(verdict.txHash(), verdict.blockNumber());

      if (existing.isPresent()) {
        log.warn("Reward for {} already executed in {}", verdict.txHash(), existing.get().rewardTxHash());
        return persist(RewardOutcome.alreadyExecuted(verdict, existing.get()));
      }

      String   contract = rewardLedger.getContract();
      Function call     = rewardLedger.executeReward(intent);
      String   callData = FunctionEncoder.encode(call);

      if (executionMode == ExecutionMode.DRY_RUN || signerMode == SignerMode.EXTERNAL) {
        BigInteger         estimatedGas = estimate(contract, call);
        FeeEstimate        fees         = ledger.getFeeEstimate();
        TransactionRequest request      = signerMode == SignerMode.EXTERNAL ? transactionRequest(contract, callData, estimatedGas, fees) : null;

        if (executionMode == ExecutionMode.DRY_RUN) {
          log.info("Dry run for {}: contract={}, estimatedGas={}, gasPrice={}, callData={}",
                   verdict.txHash(), contract, estimatedGas, fees.gasPrice(), callData);

          return persist(RewardOutcome.dryRun(verdict, callData, estimatedGas, fees.gasPrice(), request));
        }

        log.info("Reward for {} handed to an external signer: {}", verdict.txHash(), request);
        return persist(RewardOutcome.awaitingSignature(verdict, callData, estimatedGas, fees.gasPrice(), request));
      }

      String rewardTxHash;

      try {
        rewardTxHash = ledger.submit(contract, call);
      } catch (TransactionRejectedException e) {
        log.warn("Reward for {} rejected: {}", verdict.txHash(), e.getMessage());
        return persist(RewardOutcome.rejected(verdict, callData, null, null, e.getMessage()));
      }

      Optional<LedgerReceipt> receipt;

      try {
        receipt = ledger.waitForConfirmations(rewardTxHash, requiredConfirmations);
      } catch (AttestationException e) {
        log.warn("Reward {} for {} was broadcast, but waiting for it failed: {}", rewardTxHash, verdict.txHash(), e.getMessage());
        return persist(RewardOutcome.pending(verdict, callData, rewardTxHash, "confirmation wait failed: " + e.getMessage()));
      }

      return persist(settle(verdict, callData, rewardTxHash, receipt));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Re-read the state of a reward transaction submitted earlier, without waiting. The transaction only
   * counts as the reward of {@code verdict} when it went to the reward contract and its receipt carries
   * a {@code RewardExecuted} event for the verdict's attestation.
   */
  public RewardOutcome checkSubmission(AttestationVerdict verdict, String rewardTxHash, Mode mode) throws AttestationException {
    mode.requireReal("reward submission check");

    if (!verdict.verified()) {
      log.warn("Not accepting reward {} for {}: attestation not verified {}", rewardTxHash, verdict.txHash(), verdict.unmetPolicies());
      return persist(RewardOutcome.notVerified(verdict));
    }

    Optional<LedgerReceipt> receipt = ledger.getReceipt(rewardTxHash);

    if (receipt.isPresent() && receipt.get().status() != ReceiptStatus.FAILURE) {
      Optional<String> mismatch = mismatch(verdict, receipt.get());

      if (mismatch.isPresent()) {
        log.warn("Reward {} does not pay {}: {}", rewardTxHash, verdict.txHash(), mismatch.get());
        return persist(RewardOutcome.rejected(verdict, null, rewardTxHash, receipt.get(), mismatch.get()));
      }

      long depth = receipt.get().confirmationsAt(ledger.getBlockHeight());

      if (depth < requiredConfirmations) {
        log.info("Reward {} has {}/{} confirmations", rewardTxHash, depth, requiredConfirmations);
        return persist(RewardOutcome.pending(verdict, null, rewardTxHash, depth + "/" + requiredConfirmations + " confirmations"));
      }
    }

    return persist(settle(verdict, null, rewardTxHash, receipt));
  }

  private RewardOutcome settle(AttestationVerdict verdict, String callData, String rewardTxHash, Optional<LedgerReceipt> receipt)
      throws AttestationException
  {
    if (receipt.isEmpty()) {
      log.warn("Reward {} for {} not confirmed yet", rewardTxHash, verdict.txHash());
      return RewardOutcome.pending(verdict, callData, rewardTxHash, "not confirmed within the wait budget");
    }

    if (receipt.get().status() == ReceiptStatus.FAILURE) {
      log.warn("Reward {} for {} reverted", rewardTxHash, verdict.txHash());
      return RewardOutcome.rejected(verdict, callData, rewardTxHash, receipt.get(), "transaction reverted");
    }

    Optional<String> mismatch = mismatch(verdict, receipt.get());

    if (mismatch.isPresent()) {
      log.warn("Reward {} does not pay {}: {}", rewardTxHash, verdict.txHash(), mismatch.get());
      return RewardOutcome.rejected(verdict, callData, rewardTxHash, receipt.get(), mismatch.get());
    }

    log.info("Reward for {} executed in {} (block {})", verdict.txHash(), rewardTxHash, receipt.get().blockNumber());
    return RewardOutcome.executed(verdict, callData, receipt.get(), recordFor(verdict, receipt.get()).orElseThrow());
  }

  private Optional<String> mismatch(AttestationVerdict verdict, LedgerReceipt receipt) throws AttestationException {
    String contract = rewardLedger.getContract();

    if (!Hex.sameValue(receipt.to(), contract)) {
      return Optional.of("transaction was sent to " + receipt.to() + ", not to the reward contract " + contract);
    }

    if (recordFor(verdict, receipt).isEmpty()) {
      return Optional.of("transaction recorded no reward for " + verdict.txHash());
    }

    return Optional.empty();
  }

  private Optional<RewardRecord> recordFor(AttestationVerdict verdict, LedgerReceipt receipt) throws AttestationException {
    List<RewardRecord> records = rewardLedger.recordsIn(receipt);

    return records.stream()
                  .filter(r -> Hex.sameValue(r.attestationTxHash(), verdict.txHash()))
                  .findFirst();
  }

  private TransactionRequest transactionRequest(String contract, String callData, BigInteger estimatedGas, FeeEstimate fees)
      throws AttestationException
  {
    BigInteger gas = estimatedGas == null ? null : estimatedGas.multiply(BigInteger.valueOf(12)).divide(BigInteger.TEN);
    return TransactionRequest.of(signerAddress, contract, callData, ledger.getChainId(), gas, fees);
  }

  private BigInteger estimate(String contract, Function call) throws AttestationException {
    try {
      return ledger.estimateGas(contract, call);
    } catch (ContractCallException e) {
      log.warn("Gas estimate failed: {}", e.getMessage());
      return null;
    }
  }

  private RewardOutcome persist(RewardOutcome outcome) throws AttestationException {
    outcomes.save(outcome);
    return outcome;
  }

  private ReentrantLock lockFor(String txHash) {
    return locks[Math.floorMod(txHash.toLowerCase().hashCode(), locks.length)];
  }
}
