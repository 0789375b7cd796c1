package org.moxie.attestgate.proof;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.ProofMissingException;
import org.moxie.attestgate.attestation.ProofUnavailableException;
import org.moxie.attestgate.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Optional;

/**
 * Proof artifacts on the local filesystem.
 * <p>
 * Each artifact is looked up first under {@code <root>/<txHash>/} and then directly under {@code <root>},
 * the single-run layout the acquisition scripts write. Shared artifacts are only used when the shared
 * submission record is absent or names the same transaction.
 */
public class FileProofStore implements ProofStore {

  private static final Logger log = LoggerFactory.getLogger(FileProofStore.class);

  private final Path         root;
  private final String       proofFile;
  private final String       submissionFile;
  private final String       attestedDataFile;
  private final ObjectMapper mapper;

  public FileProofStore(Path root, String proofFile, String submissionFile, String attestedDataFile, ObjectMapper mapper) {
    this.root             = root;
    this.proofFile        = proofFile;
    this.submissionFile   = submissionFile;
    this.attestedDataFile = attestedDataFile;
    this.mapper           = mapper;
  }

  public static FileProofStore from(Config config, ObjectMapper mapper) {
    return new FileProofStore(config.getProofDirectory(),
                              config.getProofFileName(),
                              config.getSubmissionFileName(),
                              config.getAttestedDataFileName(),
                              mapper);
  }

  @Override
  public ProofPayload readProof(String key) throws AttestationException {
    Path location = locate(key, proofFile);

    if (!Files.isRegularFile(location)) {
      throw new ProofMissingException(key, location);
    }

    log.debug("Reading proof for {} from {}", key, location);

    try {
      return ProofNormalizer.normalize(mapper.readTree(location.toFile()));
    } catch (JsonProcessingException e) {
      throw new MalformedProofException("Proof artifact " + location + " is not valid JSON", e);
    } catch (IOException e) {
      throw new ProofUnavailableException("Could not read " + location, e);
    }
  }

  @Override
  public Optional<SubmissionRecord> readSubmissionRecord(String key) throws AttestationException {
    Path location = locate(key, submissionFile);
    if (!Files.isRegularFile(location)) return Optional.empty();

    return Optional.of(readSubmission(location));
  }

  @Override
  public Optional<byte[]> readAttestedData(String key) throws AttestationException {
    Path location = locate(key, attestedDataFile);
    if (!Files.isRegularFile(location)) return Optional.empty();

    try {
      return Optional.of(Files.readAllBytes(location));
    } catch (IOException e) {
      throw new ProofUnavailableException("Could not read " + location, e);
    }
  }

  /**
   * Store a fetched proof artifact under {@code <root>/<key>/}, replacing any earlier copy. Keys are
   * lower-cased, so one transaction has one directory however its hash was spelled.
   */
  public Path writeProof(String key, JsonNode artifact) throws AttestationException {
    Path directory = root.resolve(directoryName(key));
    Path target    = directory.resolve(proofFile);

    try {
      Files.createDirectories(directory);
      Path temp = Files.createTempFile(directory, proofFile, ".tmp");
      mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), artifact);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new ProofUnavailableException("Could not store proof at " + target, e);
    }

    log.info("Stored proof for {} at {}", key, target);
    return target;
  }

  private Path locate(String key, String fileName) throws AttestationException {
    Path keyed = root.resolve(directoryName(key)).resolve(fileName);
    if (Files.isRegularFile(keyed)) return keyed;

    Path shared = root.resolve(fileName);
    if (Files.isRegularFile(shared) && sharedArtifactsBelongTo(key)) return shared;

    return keyed;
  }

  private static String directoryName(String key) {
    return key.toLowerCase(Locale.ROOT);
  }

  private boolean sharedArtifactsBelongTo(String key) throws AttestationException {
    Path sharedSubmission = root.resolve(submissionFile);
    if (!Files.isRegularFile(sharedSubmission)) return true;

    String txHash = readSubmission(sharedSubmission).txHash();

    if (txHash != null && !txHash.equalsIgnoreCase(key)) {
      log.debug("Shared artifacts in {} belong to {}, not {}", root, txHash, key);
      return false;
    }

    return true;
  }

  private SubmissionRecord readSubmission(Path location) throws AttestationException {
    try {
      return mapper.readValue(location.toFile(), SubmissionRecord.class);
    } catch (JsonProcessingException e) {
      throw new MalformedProofException("Submission record " + location + " is not valid JSON", e);
    } catch (IOException e) {
      throw new ProofUnavailableException("Could not read " + location, e);
    }
  }
}
