package org.moxie.attestgate.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.moxie.attestgate.reward.RewardOutcome;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Latest reward outcome per attestation, {@code <txHash>.reward.json}.
 */
public class RewardOutcomeStore {

  private final JsonArtifactStore store;

  public RewardOutcomeStore(Path directory, ObjectMapper mapper) {
    this.store = new JsonArtifactStore(directory, mapper);
  }

  public Path save(RewardOutcome outcome) throws ReportStorageException {
    return store.write(name(outcome.verdict().txHash()), outcome);
  }

  public Optional<RewardOutcome> load(String attestationTxHash) throws ReportStorageException {
    return store.read(name(attestationTxHash), RewardOutcome.class);
  }

  private static String name(String txHash) {
    return txHash.toLowerCase() + ".reward.json";
  }
}
