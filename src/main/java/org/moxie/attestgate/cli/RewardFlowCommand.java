package org.moxie.attestgate.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.AttestationReference;
import org.moxie.attestgate.attestation.AttestationVerdict;
import org.moxie.attestgate.config.Config;
import org.moxie.attestgate.reward.ExecutionMode;
import org.moxie.attestgate.reward.RewardExecutionGate;
import org.moxie.attestgate.reward.RewardIntent;
import org.moxie.attestgate.reward.RewardOutcome;
import org.moxie.attestgate.verification.VerificationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * One command-line run: verify an attestation and, for {@link Command#REWARD}, pass the verdict to the
 * reward gate. Reports go to {@code out} as JSON, diagnostics to {@code err}, and the result is an
 * {@link ExitCode}.
 */
public class RewardFlowCommand {

  private static final Logger log = LoggerFactory.getLogger(RewardFlowCommand.class);

  public enum Command {
    VERIFY,
    REWARD
  }

  private final Config                   config;
  private final VerificationOrchestrator orchestrator;
  private final RewardExecutionGate      gate;
  private final ObjectMapper             mapper;
  private final PrintStream              out;
  private final PrintStream              err;

  public RewardFlowCommand(Config config,
                           VerificationOrchestrator orchestrator,
                           RewardExecutionGate gate,
                           ObjectMapper mapper,
                           PrintStream out,
                           PrintStream err)
  {
    this.config       = config;
    this.orchestrator = orchestrator;
    this.gate         = gate;
    this.mapper       = mapper;
    this.out          = out;
    this.err          = err;
  }

  /**
   * @param attestationTxHash overrides {@code attestation.tx_hash} when not null
   * @param rewardTxHash      re-read this earlier reward submission instead of submitting
   */
  public ExitCode run(Command command, String attestationTxHash, boolean execute, String rewardTxHash) {
    String txHash = attestationTxHash != null ? attestationTxHash : config.getAttestationTxHash().orElse(null);

    if (txHash == null) {
      err.println("Missing required setting: attestation.tx_hash");
      return ExitCode.CONFIGURATION;
    }

    try {
      if (command == Command.REWARD) {
        config.getMode().requireReal("reward flow");
      }

      AttestationVerdict verdict = orchestrator.verify(AttestationReference.of(txHash, config));
      print(verdict);

      if (!verdict.verified()) {
        err.println("Attestation " + txHash + " not verified: " + verdict.unmetPolicies());

        if (verdict.integrityMismatch()) {
          err.println("Payload digest mismatch: " + verdict.policy(AttestationVerdict.PAYLOAD_INTEGRITY).detail());
        }

        if (command == Command.VERIFY) {
          return ExitCode.VERIFICATION_FAILED;
        }
      }

      if (command == Command.VERIFY) {
        return ExitCode.OK;
      }

      RewardOutcome outcome;

      if (rewardTxHash != null) {
        outcome = gate.checkSubmission(verdict, rewardTxHash, config.getMode());
      } else {
        outcome = gate.executeIfVerified(verdict, intentFor(verdict), config.getMode(), ExecutionMode.of(execute));
      }

      print(outcome);

      if (!outcome.success()) {
        err.println("Reward " + outcome.status() + (outcome.reason() == null ? "" : ": " + outcome.reason()));
      }

      return ExitCode.of(outcome.status());
    } catch (AttestationException e) {
      log.debug("Run for {} failed", txHash, e);
      err.println(e.getCategory() + ": " + e.getMessage());
      return ExitCode.of(e.getCategory());
    } catch (IllegalArgumentException | IllegalStateException e) {
      err.println("CONFIGURATION: " + e.getMessage());
      return ExitCode.CONFIGURATION;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      err.println("Interrupted");
      return ExitCode.TRANSIENT;
    }
  }

  /**
   * The gate records the refusal of an unverified verdict without reading an intent, so none is built.
   */
  private RewardIntent intentFor(AttestationVerdict verdict) {
    if (!verdict.verified()) return null;

    return RewardIntent.of(verdict,
                           config.getPayloadHash().orElse(null),
                           config.getSlotKey().orElse(null),
                           config.getParticipant().orElse(null),
                           config.getQuantity().orElse(null));
  }

  private void print(Object report) {
    try {
      out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
    } catch (JsonProcessingException e) {
      log.warn("Could not render report", e);
    }
  }
}
