package org.moxie.attestgate.reward;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.moxie.attestgate.Fixtures;
import org.moxie.attestgate.attestation.AttestationVerdict;
import org.moxie.attestgate.attestation.ConfigurationException;
import org.moxie.attestgate.attestation.ReceiptStatus;
import org.moxie.attestgate.attestation.TransientNetworkException;
import org.moxie.attestgate.config.Mode;
import org.moxie.attestgate.config.SignerMode;
import org.moxie.attestgate.ledger.FeeEstimate;
import org.moxie.attestgate.ledger.LedgerLog;
import org.moxie.attestgate.ledger.LedgerReceipt;
import org.moxie.attestgate.producers.ObjectMapperProducer;
import org.moxie.attestgate.storage.RewardOutcomeStore;
import org.web3j.abi.FunctionEncoder;

import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RewardExecutionGateTest {

  private static final int CONFIRMATIONS = 12;

  @TempDir
  Path reportDirectory;

  private final ObjectMapper mapper = ObjectMapperProducer.create();

  private FakeLedger          ledger;
  private RewardOutcomeStore  outcomes;
  private RewardExecutionGate gate;

  @BeforeEach
  void setUp() {
    ledger   = new FakeLedger();
    outcomes = new RewardOutcomeStore(reportDirectory, mapper);
    gate     = gate(Fixtures.REWARD_CONTRACT);
  }

  private RewardExecutionGate gate(String contract) {
    return new RewardExecutionGate(ledger, new RewardLedger(ledger, contract, 0, 30), outcomes, CONFIRMATIONS);
  }

  private static RewardIntent intent(AttestationVerdict verdict) {
    return RewardIntent.of(verdict, null, "slot-2024-01-01T00:00Z", Fixtures.PARTICIPANT, BigInteger.valueOf(150));
  }

  @Test
  void executeIfVerified_simulationMode_throwsBeforeTouchingLedger() {
    AttestationVerdict verdict = Fixtures.verdict(true);

    assertThrows(IllegalStateException.class,
                 () -> gate.executeIfVerified(verdict, intent(verdict), Mode.SIMULATION, ExecutionMode.EXECUTE));

    assertEquals(0, ledger.submissions.get());
    assertFalse(Files.exists(reportDirectory.resolve(Fixtures.TX_HASH + ".reward.json")));
  }

  @Test
  void executeIfVerified_unverified_refusesWithoutWriting() throws Exception {
    AttestationVerdict verdict = Fixtures.verdict(true, true, null, true);
    long               height  = ledger.getBlockHeight();

    RewardOutcome outcome = gate.executeIfVerified(verdict, intent(verdict), Mode.REAL, ExecutionMode.EXECUTE);

    assertEquals(RewardStatus.VERIFICATION_NOT_PASSED, outcome.status());
    assertFalse(outcome.success());
    assertTrue(outcome.reason().contains(AttestationVerdict.PAYLOAD_INTEGRITY));
    assertEquals(0, ledger.submissions.get());
    assertEquals(height, ledger.getBlockHeight());
    assertEquals(RewardStatus.VERIFICATION_NOT_PASSED, outcomes.load(Fixtures.TX_HASH).orElseThrow().status());
  }

  @Test
  void executeIfVerified_dryRun_estimatesWithoutSubmitting() throws Exception {
    AttestationVerdict verdict = Fixtures.verdict(true);
    RewardIntent       intent  = intent(verdict);

    RewardOutcome outcome = gate.executeIfVerified(verdict, intent, Mode.REAL, ExecutionMode.DRY_RUN);

    assertEquals(RewardStatus.DRY_RUN, outcome.status());
    assertTrue(outcome.success());
    assertTrue(outcome.dryRun());
    assertEquals(BigInteger.valueOf(50_000), outcome.estimatedGas());
    assertEquals(BigInteger.valueOf(25_000_000_000L), outcome.gasPrice());
    assertNull(outcome.transactionRequest());
    assertEquals(FunctionEncoder.encode(new RewardLedger(ledger, Fixtures.REWARD_CONTRACT, 0, 30).executeReward(intent)), outcome.callData());
    assertEquals(0, ledger.submissions.get());
    assertTrue(ledger.getLogs(Fixtures.REWARD_CONTRACT, 0, Long.MAX_VALUE).isEmpty());
  }

  @Test
  void executeIfVerified_execute_recordsRewardOnce() throws Exception {
    AttestationVerdict verdict = Fixtures.verdict(true);

    RewardOutcome first = gate.executeIfVerified(verdict, intent(verdict), Mode.REAL, ExecutionMode.EXECUTE);

    assertEquals(RewardStatus.EXECUTED, first.status());
    assertNotNull(first.rewardTxHash());
    assertEquals(BigInteger.valueOf(61_000), first.gasUsed());
    assertEquals(Fixtures.TX_HASH, first.record().attestationTxHash());
    assertEquals(Fixtures.ATTESTED_DIGEST, first.record().payloadHash());
    assertEquals(RewardIntent.slotKeyOf("slot-2024-01-01T00:00Z"), first.record().slotKey());
    assertEquals(BigInteger.valueOf(150), first.record().quantity());
    assertTrue(first.record().participant().equalsIgnoreCase(Fixtures.PARTICIPANT));

    RewardOutcome second = gate.executeIfVerified(verdict, intent(verdict), Mode.REAL, ExecutionMode.EXECUTE);

    assertEquals(RewardStatus.ALREADY_EXECUTED, second.status());
    assertEquals(first.rewardTxHash(), second.rewardTxHash());
    assertEquals(1, ledger.submissions.get());
    assertEquals(RewardStatus.ALREADY_EXECUTED, outcomes.load(Fixtures.TX_HASH).orElseThrow().status());
  }

  @Test
  void executeIfVerified_concurrentCallers_submitOnce() throws Exception {
    AttestationVerdict verdict  = Fixtures.verdict(true);
    int                callers  = 8;
    ExecutorService    pool     = Executors.newFixedThreadPool(callers);
    CountDownLatch     start    = new CountDownLatch(1);
    List<Future<RewardOutcome>> futures = new ArrayList<>();

    try {
      for (int i = 0; i < callers; i++) {
        Callable<RewardOutcome> call = () -> {
          start.await();
          return gate.executeIfVerified(verdict, intent(verdict), Mode.REAL, ExecutionMode.EXECUTE);
        };
        futures.add(pool.submit(call));
      }

      start.countDown();

      List<RewardStatus> statuses = new ArrayList<>();
      for (Future<RewardOutcome> future : futures) {
        statuses.add(future.get().status());
      }

      Map<RewardStatus, Long> counts = statuses.stream().collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));

      assertEquals(1L, counts.get(RewardStatus.EXECUTED));
      assertEquals(callers - 1L, counts.get(RewardStatus.ALREADY_EXECUTED));
      assertEquals(1, ledger.submissions.get());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void executeIfVerified_rewardFromAnotherProcess_isAlreadyExecuted() throws Exception {
    AttestationVerdict verdict = Fixtures.verdict(true);
    ledger.recordForeignReward(Fixtures.REWARD_CONTRACT, Fixtures.TX_HASH);

    RewardOutcome outcome = gate.executeIfVerified(verdict, intent(verdict), Mode.REAL, ExecutionMode.EXECUTE);

    assertEquals(RewardStatus.ALREADY_EXECUTED, outcome.status());
    assertEquals(0, ledger.submissions.get());
  }

  @Test
  void executeIfVerified_contractReplayGuard_isRejectedByLedger() throws Exception {
    AttestationVerdict verdict = Fixtures.verdict(true);
    // the earlier reward sits before the configured scan start, so only the contract sees it
    ledger.recordForeignReward(Fixtures.REWARD_CONTRACT, Fixtures.TX_HASH);
    RewardExecutionGate lateScanner = new RewardExecutionGate(ledger, new RewardLedger(ledger, Fixtures.REWARD_CONTRACT, ledger.getBlockHeight() + 1, 30), outcomes, CONFIRMATIONS);

    RewardOutcome outcome = lateScanner.executeIfVerified(verdict, intent(verdict), Mode.REAL, ExecutionMode.EXECUTE);

    assertEquals(RewardStatus.REJECTED_BY_LEDGER, outcome.status());
    assertTrue(outcome.reason().contains("already executed"));
    assertNull(outcome.rewardTxHash());
  }

  @Test
  void executeIfVerified_revertedTransaction_isRejectedByLedger() throws Exception {
    AttestationVerdict verdict = Fixtures.verdict(true);
    ledger.revertNext = true;

    RewardOutcome outcome = gate.executeIfVerified(verdict, intent(verdict), Mode.REAL, ExecutionMode.EXECUTE);

    assertEquals(RewardStatus.REJECTED_BY_LEDGER, outcome.status());
    assertNotNull(outcome.rewardTxHash());
    assertEquals(BigInteger.valueOf(30_000), outcome.gasUsed());
  }

  @Test
  void executeIfVerified_notConfirmedInTime_isPendingAndCanBeCheckedLater() throws Exception {
    AttestationVerdict verdict = Fixtures.verdict(true);
    ledger.mineOnWait = false;

    RewardOutcome pending = gate.executeIfVerified(verdict, intent(verdict), Mode.REAL, ExecutionMode.EXECUTE);

    assertEquals(RewardStatus.PENDING_CONFIRMATION, pending.status());
    assertNotNull(pending.rewardTxHash());

    RewardOutcome stillPending = gate.checkSubmission(verdict, pending.rewardTxHash(), Mode.REAL);
    assertEquals(RewardStatus.PENDING_CONFIRMATION, stillPending.status());
    assertEquals("1/12 confirmations", stillPending.reason());

    ledger.mine(CONFIRMATIONS);

    RewardOutcome executed = gate.checkSubmission(verdict, pending.rewardTxHash(), Mode.REAL);
    assertEquals(RewardStatus.EXECUTED, executed.status());
    assertEquals(Fixtures.TX_HASH, executed.record().attestationTxHash());
    assertEquals(1, ledger.submissions.get());
  }

  @Test
  void checkSubmission_unknownTransaction_isPending() throws Exception {
    RewardOutcome outcome = gate.checkSubmission(Fixtures.verdict(true), Fixtures.OTHER_TX_HASH, Mode.REAL);

    assertEquals(RewardStatus.PENDING_CONFIRMATION, outcome.status());
  }

  @Test
  void executeIfVerified_unverifiedWithoutIntent_isRecorded() throws Exception {
    RewardOutcome outcome = gate.executeIfVerified(Fixtures.verdict(false), null, Mode.REAL, ExecutionMode.EXECUTE);

    assertEquals(RewardStatus.VERIFICATION_NOT_PASSED, outcome.status());
    assertEquals(RewardStatus.VERIFICATION_NOT_PASSED, outcomes.load(Fixtures.TX_HASH).orElseThrow().status());
  }

  @Test
  void executeIfVerified_waitFailsAfterBroadcast_persistsPendingWithTxHash() throws Exception {
    AttestationVerdict verdict = Fixtures.verdict(true);
    ledger.waitFailure = new TransientNetworkException("eth_getTransactionReceipt failed: connection reset");

    RewardOutcome outcome = gate.executeIfVerified(verdict, intent(verdict), Mode.REAL, ExecutionMode.EXECUTE);

    assertEquals(RewardStatus.PENDING_CONFIRMATION, outcome.status());
    assertNotNull(outcome.rewardTxHash());
    assertTrue(outcome.reason().contains("connection reset"));
    assertEquals(1, ledger.submissions.get());

    RewardOutcome stored = outcomes.load(Fixtures.TX_HASH).orElseThrow();

    assertEquals(RewardStatus.PENDING_CONFIRMATION, stored.status());
    assertEquals(outcome.rewardTxHash(), stored.rewardTxHash());
  }

  @Test
  void checkSubmission_simulationMode_throws() {
    assertThrows(IllegalStateException.class, () -> gate.checkSubmission(Fixtures.verdict(true), Fixtures.OTHER_TX_HASH, Mode.SIMULATION));
    assertFalse(Files.exists(reportDirectory.resolve(Fixtures.TX_HASH + ".reward.json")));
  }

  @Test
  void checkSubmission_unverified_isNotPassed() throws Exception {
    ledger.addReceipt(new LedgerReceipt(Fixtures.OTHER_TX_HASH, 500, Fixtures.REWARD_CONTRACT, ReceiptStatus.SUCCESS, BigInteger.ONE, List.of()));

    RewardOutcome outcome = gate.checkSubmission(Fixtures.verdict(true, false, true, true), Fixtures.OTHER_TX_HASH, Mode.REAL);

    assertEquals(RewardStatus.VERIFICATION_NOT_PASSED, outcome.status());
    assertNull(outcome.rewardTxHash());
  }

  @Test
  void checkSubmission_transactionToAnotherContract_isRejected() throws Exception {
    ledger.addReceipt(new LedgerReceipt(Fixtures.OTHER_TX_HASH, 500, Fixtures.ATTESTATION_CONTRACT, ReceiptStatus.SUCCESS, BigInteger.ONE, List.of()));

    RewardOutcome outcome = gate.checkSubmission(Fixtures.verdict(true), Fixtures.OTHER_TX_HASH, Mode.REAL);

    assertEquals(RewardStatus.REJECTED_BY_LEDGER, outcome.status());
    assertTrue(outcome.reason().contains("not to the reward contract"));
  }

  @Test
  void checkSubmission_rewardForAnotherAttestation_isRejected() throws Exception {
    String    otherAttestation = "0x" + "77".repeat(32);
    LedgerLog otherReward      = new LedgerLog(Fixtures.REWARD_CONTRACT,
                                               List.of(RewardLedger.REWARD_EXECUTED_TOPIC, otherAttestation, Fixtures.ATTESTED_DIGEST, Fixtures.SLOT_KEY),
                                               "0x" + "00".repeat(64),
                                               500,
                                               Fixtures.OTHER_TX_HASH,
                                               0);

    ledger.addReceipt(new LedgerReceipt(Fixtures.OTHER_TX_HASH, 500, Fixtures.REWARD_CONTRACT, ReceiptStatus.SUCCESS, BigInteger.ONE, List.of(otherReward)));

    RewardOutcome outcome = gate.checkSubmission(Fixtures.verdict(true), Fixtures.OTHER_TX_HASH, Mode.REAL);

    assertEquals(RewardStatus.REJECTED_BY_LEDGER, outcome.status());
    assertTrue(outcome.reason().contains("recorded no reward for " + Fixtures.TX_HASH));
    assertEquals(RewardStatus.REJECTED_BY_LEDGER, outcomes.load(Fixtures.TX_HASH).orElseThrow().status());
  }

  @Test
  void executeIfVerified_externalSigner_handsOutRequestWithoutSubmitting() throws Exception {
    AttestationVerdict verdict = Fixtures.verdict(true);
    RewardExecutionGate external = new RewardExecutionGate(ledger, new RewardLedger(ledger, Fixtures.REWARD_CONTRACT, 0, 30), outcomes,
                                                           CONFIRMATIONS, SignerMode.EXTERNAL, Fixtures.PARTICIPANT);
    ledger.fees = new FeeEstimate(BigInteger.valueOf(30), BigInteger.valueOf(60), BigInteger.valueOf(2));
    long height = ledger.getBlockHeight();

    RewardOutcome outcome = external.executeIfVerified(verdict, intent(verdict), Mode.REAL, ExecutionMode.EXECUTE);

    assertEquals(RewardStatus.AWAITING_SIGNATURE, outcome.status());
    assertTrue(outcome.success());
    assertEquals(0, ledger.submissions.get());
    assertEquals(height, ledger.getBlockHeight());

    TransactionRequest request = outcome.transactionRequest();

    assertEquals(Fixtures.PARTICIPANT, request.from());
    assertEquals(Fixtures.REWARD_CONTRACT, request.to());
    assertEquals(outcome.callData(), request.data());
    assertEquals("0x0", request.value());
    assertEquals("0x72", request.chainId());
    assertEquals("0xea60", request.gas());
    assertEquals("0x3c", request.maxFeePerGas());
    assertEquals("0x2", request.maxPriorityFeePerGas());
    assertNull(request.gasPrice());

    String json = mapper.writeValueAsString(outcomes.load(Fixtures.TX_HASH).orElseThrow());

    assertTrue(json.contains("\"AWAITING_SIGNATURE\""));
    assertTrue(json.contains("\"maxFeePerGas\":\"0x3c\""));
    assertFalse(json.contains("\"gasPrice\":\"0x"));
  }

  @Test
  void executeIfVerified_externalSignerDryRun_includesLegacyRequest() throws Exception {
    AttestationVerdict verdict = Fixtures.verdict(true);
    RewardExecutionGate external = new RewardExecutionGate(ledger, new RewardLedger(ledger, Fixtures.REWARD_CONTRACT, 0, 30), outcomes,
                                                           CONFIRMATIONS, SignerMode.EXTERNAL, null);

    RewardOutcome outcome = external.executeIfVerified(verdict, intent(verdict), Mode.REAL, ExecutionMode.DRY_RUN);

    assertEquals(RewardStatus.DRY_RUN, outcome.status());
    assertNull(outcome.transactionRequest().from());
    assertEquals("0x5d21dba00", outcome.transactionRequest().gasPrice());
    assertNull(outcome.transactionRequest().maxFeePerGas());
    assertEquals(0, ledger.submissions.get());
  }

  @Test
  void executeIfVerified_externalSignerThenCheck_isExecuted() throws Exception {
    AttestationVerdict verdict = Fixtures.verdict(true);
    RewardIntent       intent  = intent(verdict);
    RewardLedger       rewards = new RewardLedger(ledger, Fixtures.REWARD_CONTRACT, 0, 30);

    new RewardExecutionGate(ledger, rewards, outcomes, CONFIRMATIONS, SignerMode.EXTERNAL, null)
        .executeIfVerified(verdict, intent, Mode.REAL, ExecutionMode.EXECUTE);

    // the wallet broadcasts the request
    String rewardTxHash = ledger.submit(Fixtures.REWARD_CONTRACT, rewards.executeReward(intent));
    ledger.mine(CONFIRMATIONS);

    RewardOutcome outcome = gate.checkSubmission(verdict, rewardTxHash, Mode.REAL);

    assertEquals(RewardStatus.EXECUTED, outcome.status());
    assertEquals(rewardTxHash, outcome.rewardTxHash());
  }

  @Test
  void executeIfVerified_intentForOtherAttestation_isRejected() {
    AttestationVerdict verdict = Fixtures.verdict(true);
    RewardIntent       foreign = new RewardIntent(Fixtures.OTHER_TX_HASH, Fixtures.ATTESTED_DIGEST, Fixtures.SLOT_KEY, Fixtures.PARTICIPANT, BigInteger.ONE);

    assertThrows(IllegalArgumentException.class, () -> gate.executeIfVerified(verdict, foreign, Mode.REAL, ExecutionMode.EXECUTE));
    assertEquals(0, ledger.submissions.get());
  }

  @Test
  void executeIfVerified_noRewardContract_isConfigurationError() {
    AttestationVerdict verdict = Fixtures.verdict(true);

    assertThrows(ConfigurationException.class,
                 () -> gate(null).executeIfVerified(verdict, intent(verdict), Mode.REAL, ExecutionMode.DRY_RUN));
  }

  @Test
  void outcome_isReadableBackWithVerdict() throws Exception {
    AttestationVerdict verdict = Fixtures.verdict(true);
    gate.executeIfVerified(verdict, intent(verdict), Mode.REAL, ExecutionMode.EXECUTE);

    RewardOutcome stored = outcomes.load(Fixtures.TX_HASH).orElseThrow();

    assertEquals(RewardStatus.EXECUTED, stored.status());
    assertTrue(stored.verdict().verified());
    assertEquals(150, mapper.readTree(reportDirectory.resolve(Fixtures.TX_HASH + ".reward.json").toFile()).path("record").path("quantity").asInt());
    assertTrue(mapper.readTree(reportDirectory.resolve(Fixtures.TX_HASH + ".reward.json").toFile()).path("success").asBoolean());
  }
}
