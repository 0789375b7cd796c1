package org.moxie.attestgate.producers;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.moxie.attestgate.attestation.ConfigurationException;
import org.moxie.attestgate.config.Config;
import org.moxie.attestgate.ledger.LedgerClient;
import org.moxie.attestgate.policy.AttestationPolicy;
import org.moxie.attestgate.policy.ChainIdentityPolicy;
import org.moxie.attestgate.policy.ConfirmationDepthPolicy;
import org.moxie.attestgate.policy.PayloadIntegrityPolicy;
import org.moxie.attestgate.policy.ProofValidityPolicy;
import org.moxie.attestgate.policy.TimeWindowPolicy;
import org.moxie.attestgate.policy.VerificationSignature;
import org.moxie.attestgate.proof.ProofStore;
import org.moxie.attestgate.reward.RewardExecutionGate;
import org.moxie.attestgate.reward.RewardLedger;
import org.moxie.attestgate.storage.RewardOutcomeStore;
import org.moxie.attestgate.storage.VerificationReportStore;
import org.moxie.attestgate.verification.VerificationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the verification orchestrator and the reward gate from {@link Config}.
 */
@ApplicationScoped
public class PipelineProducer {

  private static final Logger log = LoggerFactory.getLogger(PipelineProducer.class);

  @Produces
  @Singleton
  public Clock produceClock() {
    return Clock.systemUTC();
  }

  @Produces
  @Singleton
  @Named("policyExecutor")
  public ExecutorService producePolicyExecutor(Config config) {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory factory = runnable -> {
      Thread thread = new Thread(runnable, "policy-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };

    return Executors.newFixedThreadPool(config.getVerificationThreads(), factory);
  }

  public void closePolicyExecutor(@Disposes @Named("policyExecutor") ExecutorService executor) {
    executor.shutdownNow();
  }

  @Produces
  @Singleton
  public VerificationOrchestrator produceOrchestrator(LedgerClient ledger,
                                                     ProofStore proofStore,
                                                     Config config,
                                                     @Named("policyExecutor") ExecutorService executor,
                                                     ObjectMapper mapper,
                                                     Clock clock)
  {
    List<AttestationPolicy> policies;

    try {
      policies = List.of(new ConfirmationDepthPolicy(config.getRequiredConfirmations()),
                         new ProofValidityPolicy(ledger, config.getVerificationContract(), VerificationSignature.byNames(config.getVerificationSignatures())),
                         new PayloadIntegrityPolicy(config.getExpectedPayloadDigest().orElse(null), config.isStrictIntegrityCheck()),
                         new TimeWindowPolicy(config.getRangeMarker()));
    } catch (ConfigurationException e) {
      throw new IllegalStateException("Invalid configuration: " + e.getMessage(), e);
    }

    log.info("Verification policies: {}", policies.stream().map(AttestationPolicy::name).toList());

    return new VerificationOrchestrator(ledger,
                                        proofStore,
                                        new ChainIdentityPolicy(config.getChainId()),
                                        policies,
                                        executor,
                                        new VerificationReportStore(config.getReportDirectory(), mapper),
                                        clock);
  }

  @Produces
  @Singleton
  public RewardExecutionGate produceRewardGate(LedgerClient ledger, Config config, ObjectMapper mapper) {
    RewardLedger rewardLedger = new RewardLedger(ledger,
                                                 config.getRewardContract().orElse(null),
                                                 config.getRewardFromBlock(),
                                                 config.getLogChunkBlocks());

    if (config.getRewardContract().isEmpty()) {
      log.info("No reward.contract configured, reward execution disabled");
    } else {
      log.info("Rewards on {} signed by {}", config.getRewardContract().get(), config.getSignerMode());
    }

    return new RewardExecutionGate(ledger,
                                   rewardLedger,
                                   new RewardOutcomeStore(config.getReportDirectory(), mapper),
                                   config.getRequiredConfirmations(),
                                   config.getSignerMode(),
                                   config.getSignerAddress().orElse(null));
  }
}
