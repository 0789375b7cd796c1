package org.moxie.attestgate.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.microprofile.config.ConfigProvider;
import org.moxie.attestgate.attestation.ConfigurationException;
import org.moxie.attestgate.config.Config;
import org.moxie.attestgate.ledger.LedgerClient;
import org.moxie.attestgate.producers.HttpClientProducer;
import org.moxie.attestgate.producers.LedgerClientProducer;
import org.moxie.attestgate.producers.ObjectMapperProducer;
import org.moxie.attestgate.producers.PipelineProducer;
import org.moxie.attestgate.producers.ProofStoreProducer;
import org.moxie.attestgate.proof.ProofStore;
import org.moxie.attestgate.reward.RewardExecutionGate;
import org.moxie.attestgate.verification.VerificationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;
import org.web3j.protocol.Web3j;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;

/**
 * Command-line entry point.
 * <pre>
 *   reward-flow [verify|reward] [--attestation 0x..] [--execute] [--reward-tx 0x..]
 * </pre>
 * Settings not given as arguments come from the MicroProfile configuration.
 */
public class RewardFlow {

  private static final Logger log = LoggerFactory.getLogger(RewardFlow.class);

  private static final String USAGE = "usage: reward-flow [verify|reward] [--attestation <txHash>] [--execute] [--reward-tx <txHash>]";

  private RewardFlow() {}

  public static void main(String[] argv) {
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();

    System.exit(run(argv).getCode());
  }

  static ExitCode run(String[] argv) {
    Arguments arguments;

    try {
      arguments = Arguments.parse(argv);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(USAGE);
      return ExitCode.CONFIGURATION;
    }

    Config config;

    try {
      config = Config.load(ConfigProvider.getConfig());
    } catch (ConfigurationException e) {
      System.err.println("CONFIGURATION: " + e.getMessage());
      return ExitCode.CONFIGURATION;
    }

    ObjectMapper         mapper        = ObjectMapperProducer.create();
    HttpClient           http          = HttpClientProducer.create(config);
    LedgerClientProducer ledgerFactory = new LedgerClientProducer();
    Web3j                web3j         = ledgerFactory.produceWeb3j(config);
    PipelineProducer     pipeline      = new PipelineProducer();
    ExecutorService      executor      = pipeline.producePolicyExecutor(config);

    try {
      LedgerClient             ledger       = ledgerFactory.produceLedgerClient(web3j, config);
      ProofStore               proofStore   = new ProofStoreProducer().produceProofStore(http, mapper, config);
      VerificationOrchestrator orchestrator = pipeline.produceOrchestrator(ledger, proofStore, config, executor, mapper, pipeline.produceClock());
      RewardExecutionGate      gate         = pipeline.produceRewardGate(ledger, config, mapper);

      RewardFlowCommand command = new RewardFlowCommand(config, orchestrator, gate, mapper, System.out, System.err);

      ExitCode code = command.run(arguments.command(),
                                  arguments.attestationTxHash(),
                                  arguments.execute() || config.isExecute(),
                                  arguments.rewardTxHash() != null ? arguments.rewardTxHash() : config.getRewardTxHash().orElse(null));

      log.debug("Exiting with {}", code);
      return code;
    } catch (IllegalStateException e) {
      System.err.println("CONFIGURATION: " + e.getMessage());
      return ExitCode.CONFIGURATION;
    } finally {
      pipeline.closePolicyExecutor(executor);
      ledgerFactory.closeWeb3j(web3j);
    }
  }

  record Arguments(RewardFlowCommand.Command command, String attestationTxHash, boolean execute, String rewardTxHash) {

    static Arguments parse(String[] argv) {
      RewardFlowCommand.Command command     = RewardFlowCommand.Command.REWARD;
      String                    attestation = null;
      String                    rewardTx    = null;
      boolean                   execute     = false;

      for (int i = 0; i < argv.length; i++) {
        switch (argv[i]) {
          case "verify"        -> command     = RewardFlowCommand.Command.VERIFY;
          case "reward"        -> command     = RewardFlowCommand.Command.REWARD;
          case "--execute"     -> execute     = true;
          case "--dry-run"     -> execute     = false;
          case "--attestation" -> attestation = valueOf(argv, ++i, "--attestation");
          case "--reward-tx"   -> rewardTx    = valueOf(argv, ++i, "--reward-tx");
          default              -> throw new IllegalArgumentException("Unknown argument: " + argv[i]);
        }
      }

      return new Arguments(command, attestation, execute, rewardTx);
    }

    private static String valueOf(String[] argv, int index, String flag) {
      if (index >= argv.length) {
        throw new IllegalArgumentException(flag + " needs a value");
      }

      return argv[index];
    }
  }
}
