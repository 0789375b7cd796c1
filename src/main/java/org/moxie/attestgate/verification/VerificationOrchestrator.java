package org.moxie.attestgate.verification;

import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.AttestationReference;
import org.moxie.attestgate.attestation.AttestationVerdict;
import org.moxie.attestgate.attestation.LedgerFacts;
import org.moxie.attestgate.attestation.PolicyVerdict;
import org.moxie.attestgate.ledger.LedgerClient;
import org.moxie.attestgate.policy.AttestationPolicy;
import org.moxie.attestgate.policy.ChainIdentityPolicy;
import org.moxie.attestgate.policy.PolicyContext;
import org.moxie.attestgate.proof.ProofPayload;
import org.moxie.attestgate.proof.ProofStore;
import org.moxie.attestgate.proof.SubmissionRecord;
import org.moxie.attestgate.storage.FailureReport;
import org.moxie.attestgate.storage.ReportStorageException;
import org.moxie.attestgate.storage.VerificationReportStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs one verification of an attestation from ledger reads to persisted verdict.
 * <p>
 * The chain identity is checked before anything else and aborts the run on mismatch. The remaining
 * policies are evaluated concurrently; a policy that throws contributes an indeterminate verdict
 * rather than aborting the run. Every run that completes replaces the stored report for its
 * transaction, and a run that aborts stores a failure report instead.
 */
public class VerificationOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(VerificationOrchestrator.class);

  private final LedgerClient            ledger;
  private final ProofStore              proofStore;
  private final ChainIdentityPolicy     chainIdentity;
  private final LedgerFactsReader       factsReader;
  private final List<AttestationPolicy> policies;
  private final ExecutorService         executor;
  private final VerificationReportStore reports;
  private final Clock                   clock;

  public VerificationOrchestrator(LedgerClient ledger,
                                  ProofStore proofStore,
                                  ChainIdentityPolicy chainIdentity,
                                  List<AttestationPolicy> policies,
                                  ExecutorService executor,
                                  VerificationReportStore reports,
                                  Clock clock)
  {
    this.ledger        = ledger;
    this.proofStore    = proofStore;
    this.chainIdentity = chainIdentity;
    this.factsReader   = new LedgerFactsReader(ledger);
    this.policies      = List.copyOf(policies);
    this.executor      = executor;
    this.reports       = reports;
    this.clock         = clock;
  }

  public AttestationVerdict verify(AttestationReference reference) throws AttestationException, InterruptedException {
    Instant started = clock.instant();

    log.info("Verifying attestation {} on chain {}", reference.txHash(), reference.chainId());

    try {
      AttestationVerdict verdict = evaluate(reference);
      reports.save(verdict);

      if (verdict.verified()) log.info("Attestation {} verified", reference.txHash());
      else                    log.warn("Attestation {} not verified, unmet policies: {}", reference.txHash(), verdict.unmetPolicies());

      return verdict;
    } catch (AttestationException e) {
      log.warn("Verification of {} aborted: {}", reference.txHash(), e.getMessage());
      saveFailure(reference, e, started);
      throw e;
    } catch (RuntimeException e) {
      log.error("Verification of {} failed unexpectedly", reference.txHash(), e);
      saveFailure(reference, e, started);
      throw e;
    }
  }

  private void saveFailure(AttestationReference reference, Exception failure, Instant started) {
    try {
      reports.saveFailure(FailureReport.of(reference.txHash(), failure, started));
    } catch (ReportStorageException storageFailure) {
      failure.addSuppressed(storageFailure);
    }
  }

  public Optional<AttestationVerdict> loadReport(String txHash) throws AttestationException {
    return reports.load(txHash);
  }

  private AttestationVerdict evaluate(AttestationReference reference) throws AttestationException, InterruptedException {
    long reportedChainId = ledger.getChainId();
    chainIdentity.enforce(reportedChainId, reference);

    String           key        = reference.txHash();
    ProofPayload     payload    = proofStore.readProof(key);
    SubmissionRecord submission = proofStore.readSubmissionRecord(key).orElse(null);
    byte[]           attested   = proofStore.readAttestedData(key).orElse(null);
    LedgerFacts      facts      = factsReader.read(reference, reportedChainId);

    PolicyContext context = new PolicyContext(reference, payload, facts, submission, attested);

    Map<String, CompletableFuture<PolicyVerdict>> pending = new LinkedHashMap<>();

    for (AttestationPolicy policy : policies) {
      pending.put(policy.name(), CompletableFuture.supplyAsync(() -> evaluateSafely(policy, context), executor));
    }

    Map<String, PolicyVerdict> verdicts = new LinkedHashMap<>();

    try {
      for (Map.Entry<String, CompletableFuture<PolicyVerdict>> entry : pending.entrySet()) {
        verdicts.put(entry.getKey(), entry.getValue().get());
      }
    } catch (InterruptedException e) {
      pending.values().forEach(future -> future.cancel(true));
      throw e;
    } catch (ExecutionException e) {
      throw new IllegalStateException("Policy evaluation escaped its error handling", e.getCause());
    }

    return AttestationVerdict.aggregate(reference, facts, verdicts, clock.instant());
  }

  private static PolicyVerdict evaluateSafely(AttestationPolicy policy, PolicyContext context) {
    try {
      return policy.evaluate(context);
    } catch (Exception e) {
      log.warn("Policy {} failed for {}", policy.name(), context.reference().txHash(), e);

      Map<String, Object> detail = new LinkedHashMap<>();
      detail.put("error", e.getClass().getSimpleName() + ": " + e.getMessage());
      return PolicyVerdict.indeterminate(detail);
    }
  }
}
