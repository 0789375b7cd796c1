package org.moxie.attestgate.config;

import org.moxie.attestgate.attestation.ConfigurationException;
import org.moxie.attestgate.attestation.Hex;

import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Typed view over the MicroProfile configuration of the pipeline.
 * <p>
 * Property names are dotted and lower-case ({@code ledger.chain_id}); the usual MicroProfile mapping
 * lets each one be set from the environment as well ({@code LEDGER_CHAIN_ID}).
 */
public class Config {

  public static final int    DEFAULT_REQUIRED_CONFIRMATIONS = 12;
  public static final String DEFAULT_RANGE_MARKER           = "/intensity/";
  public static final String DEFAULT_SIGNATURES             = "verifyJsonApi,verifyWeb2Json";
  public static final int    DEFAULT_LOG_CHUNK_BLOCKS       = 30;

  private String      ledgerRpcUrl;
  private long        chainId;
  private int         requiredConfirmations;
  private Duration    requestTimeout;
  private RetryPolicy ledgerRetryPolicy;
  private RetryPolicy confirmationPolicy;

  private String       attestationContract;
  private String       verificationContract;
  private List<String> verificationSignatures;
  private int          verificationThreads;
  private Mode         mode;

  private String  expectedPayloadDigest;
  private boolean strictIntegrityCheck;
  private String  rangeMarker;

  private Path        proofDirectory;
  private String      proofFileName;
  private String      submissionFileName;
  private String      attestedDataFileName;
  private String      dataAvailabilityUrl;
  private RetryPolicy proofPollingPolicy;
  private Path        reportDirectory;

  private String     rewardContract;
  private String     signerKey;
  private SignerMode signerMode;
  private String     signerAddress;
  private long       rewardFromBlock;
  private int        logChunkBlocks;
  private BigInteger fallbackGasLimit;

  private String     attestationTxHash;
  private String     slotKey;
  private String     participant;
  private BigInteger quantity;
  private String     payloadHash;
  private String     rewardTxHash;
  private boolean    execute;

  protected Config() {}

  /**
   * Read and validate every setting. Required values that are missing, and values that cannot be
   * parsed, are reported together in one {@link ConfigurationException}.
   */
  public static Config load(org.eclipse.microprofile.config.Config source) throws ConfigurationException {
    Reader reader = new Reader(source);
    Config config = new Config();

    config.ledgerRpcUrl          = reader.required("ledger.rpc_url");
    Long chainId                 = reader.requiredValue("ledger.chain_id", Long::parseLong);
    config.chainId               = chainId == null ? 0L : chainId;
    config.requiredConfirmations = reader.value("ledger.required_confirmations", Integer::parseInt, DEFAULT_REQUIRED_CONFIRMATIONS);
    config.requestTimeout        = Duration.ofMillis(reader.value("ledger.request_timeout_ms", Long::parseLong, 15_000L));
    config.ledgerRetryPolicy     = new RetryPolicy(reader.value("ledger.retry.max_attempts", Integer::parseInt, 3),
                                                   Duration.ofMillis(reader.value("ledger.retry.interval_ms", Long::parseLong, 500L)),
                                                   reader.value("ledger.retry.backoff", Double::parseDouble, 2.0));
    config.confirmationPolicy    = RetryPolicy.fixed(reader.value("reward.confirmation.max_attempts", Integer::parseInt, 60),
                                                     Duration.ofMillis(reader.value("reward.confirmation.interval_ms", Long::parseLong, 5_000L)));

    config.attestationContract    = reader.requiredAddress("attestation.contract");
    config.verificationContract   = reader.requiredAddress("verification.contract");
    config.verificationSignatures = Arrays.stream(reader.optional("verification.signatures").orElse(DEFAULT_SIGNATURES).split(","))
                                          .map(String::trim)
                                          .filter(s -> !s.isEmpty())
                                          .toList();
    config.verificationThreads    = reader.value("verification.threads", Integer::parseInt, 4);
    config.mode                   = Mode.resolve(reader.optional("attestation.use_simulation").orElse(null),
                                                 reader.optional("attestation.mode").orElse("real"));

    config.expectedPayloadDigest = reader.optional("integrity.expected_digest").orElse(null);
    config.strictIntegrityCheck  = reader.value("integrity.strict", Boolean::parseBoolean, false);
    config.rangeMarker           = reader.optional("time_window.range_marker").orElse(DEFAULT_RANGE_MARKER);

    config.proofDirectory       = Path.of(reader.optional("proof.directory").orElse("out"));
    config.proofFileName        = reader.optional("proof.file").orElse("da_proof.json");
    config.submissionFileName   = reader.optional("proof.submission_file").orElse("request_submission.json");
    config.attestedDataFileName = reader.optional("proof.attested_data_file").orElse("api_response.json");
    config.dataAvailabilityUrl  = reader.optional("proof.da.url").orElse(null);
    config.proofPollingPolicy   = RetryPolicy.fixed(reader.value("proof.da.max_attempts", Integer::parseInt, 40),
                                                    Duration.ofMillis(reader.value("proof.da.interval_ms", Long::parseLong, 15_000L)));
    config.reportDirectory      = Path.of(reader.optional("report.directory").orElse("out/reports"));

    config.rewardContract   = reader.optionalAddress("reward.contract");
    config.signerKey        = reader.optional("reward.signer_key").orElse(null);
    config.signerMode       = SignerMode.resolve(reader.optional("reward.signer_mode").orElse(null));
    config.signerAddress    = reader.optionalAddress("reward.signer_address");
    config.rewardFromBlock  = reader.value("reward.from_block", Long::parseLong, 0L);
    config.logChunkBlocks   = reader.value("reward.log_chunk_blocks", Integer::parseInt, DEFAULT_LOG_CHUNK_BLOCKS);
    config.fallbackGasLimit = reader.value("reward.gas_limit", BigInteger::new, BigInteger.valueOf(300_000));

    config.attestationTxHash = reader.optional("attestation.tx_hash").orElse(null);
    config.slotKey           = reader.optional("reward.slot_key").orElse(null);
    config.participant       = reader.optionalAddress("reward.participant");
    config.quantity          = reader.value("reward.quantity", BigInteger::new, null);
    config.payloadHash       = reader.optional("reward.payload_hash").orElse(null);
    config.rewardTxHash      = reader.optional("reward.tx_hash").orElse(null);
    config.execute           = reader.value("reward.execute", Boolean::parseBoolean, false);

    if (config.requiredConfirmations < 1) {
      reader.problem("ledger.required_confirmations must be at least 1");
    }

    if (config.signerMode == null) {
      reader.problem("reward.signer_mode must be one of local_key, external: " + reader.optional("reward.signer_mode").orElse(""));
    }

    if (config.logChunkBlocks < 1) {
      reader.problem("reward.log_chunk_blocks must be at least 1");
    }

    if (config.verificationSignatures.isEmpty()) {
      reader.problem("verification.signatures must name at least one signature");
    }

    if (config.expectedPayloadDigest != null && !Hex.isHash(config.expectedPayloadDigest)) {
      reader.problem("integrity.expected_digest must be a 0x-prefixed 32-byte hex digest");
    }

    reader.throwIfInvalid();
    return config;
  }

  public String getLedgerRpcUrl() {
    return ledgerRpcUrl;
  }

  public long getChainId() {
    return chainId;
  }

  public int getRequiredConfirmations() {
    return requiredConfirmations;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public RetryPolicy getLedgerRetryPolicy() {
    return ledgerRetryPolicy;
  }

  public RetryPolicy getConfirmationPolicy() {
    return confirmationPolicy;
  }

  public String getAttestationContract() {
    return attestationContract;
  }

  public String getVerificationContract() {
    return verificationContract;
  }

  public List<String> getVerificationSignatures() {
    return verificationSignatures;
  }

  public int getVerificationThreads() {
    return verificationThreads;
  }

  public Mode getMode() {
    return mode;
  }

  public Optional<String> getExpectedPayloadDigest() {
    return Optional.ofNullable(expectedPayloadDigest);
  }

  public boolean isStrictIntegrityCheck() {
    return strictIntegrityCheck;
  }

  public String getRangeMarker() {
    return rangeMarker;
  }

  public Path getProofDirectory() {
    return proofDirectory;
  }

  public String getProofFileName() {
    return proofFileName;
  }

  public String getSubmissionFileName() {
    return submissionFileName;
  }

  public String getAttestedDataFileName() {
    return attestedDataFileName;
  }

  public Optional<String> getDataAvailabilityUrl() {
    return Optional.ofNullable(dataAvailabilityUrl);
  }

  public RetryPolicy getProofPollingPolicy() {
    return proofPollingPolicy;
  }

  public Path getReportDirectory() {
    return reportDirectory;
  }

  public Optional<String> getRewardContract() {
    return Optional.ofNullable(rewardContract);
  }

  public String requireRewardContract() throws ConfigurationException {
    return getRewardContract().orElseThrow(() -> new ConfigurationException("Missing required setting: reward.contract"));
  }

  public Optional<String> getSignerKey() {
    return Optional.ofNullable(signerKey);
  }

  public SignerMode getSignerMode() {
    return signerMode;
  }

  public Optional<String> getSignerAddress() {
    return Optional.ofNullable(signerAddress);
  }

  public long getRewardFromBlock() {
    return rewardFromBlock;
  }

  public int getLogChunkBlocks() {
    return logChunkBlocks;
  }

  public BigInteger getFallbackGasLimit() {
    return fallbackGasLimit;
  }

  public Optional<String> getAttestationTxHash() {
    return Optional.ofNullable(attestationTxHash);
  }

  public Optional<String> getSlotKey() {
    return Optional.ofNullable(slotKey);
  }

  public Optional<String> getParticipant() {
    return Optional.ofNullable(participant);
  }

  public Optional<BigInteger> getQuantity() {
    return Optional.ofNullable(quantity);
  }

  public Optional<String> getPayloadHash() {
    return Optional.ofNullable(payloadHash);
  }

  public Optional<String> getRewardTxHash() {
    return Optional.ofNullable(rewardTxHash);
  }

  public boolean isExecute() {
    return execute;
  }

  private static class Reader {

    private final org.eclipse.microprofile.config.Config source;
    private final StringBuilder                          problems = new StringBuilder();

    private Reader(org.eclipse.microprofile.config.Config source) {
      this.source = source;
    }

    Optional<String> optional(String name) {
      return source.getOptionalValue(name, String.class)
                   .map(String::trim)
                   .filter(value -> !value.isEmpty());
    }

    String required(String name) {
      Optional<String> value = optional(name);

      if (value.isEmpty()) {
        problem("Missing required setting: " + name);
        return null;
      }

      return value.get();
    }

    <T> T value(String name, Function<String, T> parser, T defaultValue) {
      Optional<String> raw = optional(name);
      if (raw.isEmpty()) return defaultValue;

      try {
        return parser.apply(raw.get());
      } catch (RuntimeException e) {
        problem("Invalid value for " + name + ": " + raw.get());
        return defaultValue;
      }
    }

    <T> T requiredValue(String name, Function<String, T> parser) {
      String raw = required(name);
      if (raw == null) return null;

      return value(name, parser, null);
    }

    String requiredAddress(String name) {
      String value = required(name);

      if (value != null && !Hex.isAddress(value)) {
        problem("Not a 20-byte hex address for " + name + ": " + value);
      }

      return value;
    }

    String optionalAddress(String name) {
      String value = optional(name).orElse(null);

      if (value != null && !Hex.isAddress(value)) {
        problem("Not a 20-byte hex address for " + name + ": " + value);
      }

      return value;
    }

    void problem(String message) {
      if (problems.length() > 0) problems.append("; ");
      problems.append(message);
    }

    void throwIfInvalid() throws ConfigurationException {
      if (problems.length() > 0) {
        throw new ConfigurationException(problems.toString());
      }
    }
  }
}
