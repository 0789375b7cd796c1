package org.moxie.attestgate.proof;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.ConfigurationException;
import org.moxie.attestgate.attestation.ProofMissingException;
import org.moxie.attestgate.attestation.ProofUnavailableException;
import org.moxie.attestgate.config.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link ProofStore} that fetches missing proofs from the data-availability layer and keeps them
 * in a {@link FileProofStore}.
 * <p>
 * A proof is requested by the ABI-encoded attestation request from the submission record. When the
 * record names a voting round only that round is asked; otherwise the rounds around the DA layer's
 * latest round are tried, then the round-less endpoint.
 */
public class DataAvailabilityProofStore implements ProofStore {

  private static final Logger log = LoggerFactory.getLogger(DataAvailabilityProofStore.class);

  static final String ROUND_ENDPOINT        = "/api/v1/fdc/proof-by-request-round";
  static final String LATEST_ENDPOINT       = "/api/v0/fdc/get-proof-round-bytes";
  static final String LATEST_ROUND_ENDPOINT = "/api/v0/fsp/latest-voting-round";

  private final FileProofStore cache;
  private final HttpClient     httpClient;
  private final ObjectMapper   mapper;
  private final String         baseUrl;
  private final RetryPolicy    pollingPolicy;
  private final Duration       requestTimeout;

  public DataAvailabilityProofStore(FileProofStore cache,
                                    HttpClient httpClient,
                                    ObjectMapper mapper,
                                    String baseUrl,
                                    RetryPolicy pollingPolicy,
                                    Duration requestTimeout)
  {
    this.cache          = cache;
    this.httpClient     = httpClient;
    this.mapper         = mapper;
    this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.pollingPolicy  = pollingPolicy;
    this.requestTimeout = requestTimeout;
  }

  @Override
  public ProofPayload readProof(String key) throws AttestationException {
    try {
      return cache.readProof(key);
    } catch (ProofMissingException e) {
      log.info("No stored proof for {}, asking the data-availability layer", key);
    }

    SubmissionRecord submission = cache.readSubmissionRecord(key)
                                       .orElseThrow(() -> new ConfigurationException("No submission record for " + key + ", cannot request its proof"));

    String requestBytes = submission.abiEncodedRequest();

    if (requestBytes == null || !requestBytes.startsWith("0x")) {
      throw new ConfigurationException("Submission record for " + key + " has no abiEncodedRequest");
    }

    String lastStatus = "no response";

    for (int attempt = 1; attempt <= pollingPolicy.maxAttempts(); attempt++) {
      Fetch fetch = submission.votingRoundId() != null
                    ? fetchRound(submission.votingRoundId(), requestBytes)
                    : fetchAroundLatest(requestBytes);

      if (fetch.hasProof()) {
        ObjectNode artifact = mapper.createObjectNode();

        if (fetch.votingRoundId() == null) artifact.putNull("votingRoundId");
        else                               artifact.put("votingRoundId", fetch.votingRoundId());

        artifact.put("requestBytes", requestBytes);
        artifact.put("daBase", baseUrl);
        artifact.put("endpoint", fetch.endpoint());
        artifact.put("fetchedAtIso", Instant.now().toString());
        artifact.set("response", fetch.body());

        cache.writeProof(key, artifact);
        log.info("Proof for {} fetched from round {}", key, fetch.votingRoundId());

        return ProofNormalizer.normalize(artifact);
      }

      lastStatus = fetch.status();
      log.info("Proof for {} not ready (attempt {}/{}, {})", key, attempt, pollingPolicy.maxAttempts(), lastStatus);

      if (attempt < pollingPolicy.maxAttempts()) {
        try {
          pollingPolicy.pause(attempt);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new ProofUnavailableException("Interrupted while waiting for the proof of " + key, e);
        }
      }
    }

    throw new ProofUnavailableException("Proof for " + key + " not available after " + pollingPolicy.maxAttempts() + " attempts (" + lastStatus + ")");
  }

  @Override
  public Optional<SubmissionRecord> readSubmissionRecord(String key) throws AttestationException {
    return cache.readSubmissionRecord(key);
  }

  @Override
  public Optional<byte[]> readAttestedData(String key) throws AttestationException {
    return cache.readAttestedData(key);
  }

  private Fetch fetchAroundLatest(String requestBytes) {
    OptionalLong latest = latestVotingRound();

    if (latest.isPresent()) {
      for (long round = latest.getAsLong() - 2; round <= latest.getAsLong() + 1; round++) {
        Fetch fetch = fetchRound(round, requestBytes);
        if (fetch.hasProof()) return fetch;
      }
    }

    ObjectNode request = mapper.createObjectNode();
    request.put("requestBytes", requestBytes);

    return post(LATEST_ENDPOINT, request, null);
  }

  private Fetch fetchRound(long votingRoundId, String requestBytes) {
    ObjectNode request = mapper.createObjectNode();
    request.put("votingRoundId", votingRoundId);
    request.put("requestBytes", requestBytes);

    return post(ROUND_ENDPOINT, request, votingRoundId);
  }

  private OptionalLong latestVotingRound() {
    try {
      HttpResponse<String> response = httpClient.send(HttpRequest.newBuilder(URI.create(baseUrl + LATEST_ROUND_ENDPOINT))
                                                                 .timeout(requestTimeout)
                                                                 .header("Accept", "application/json")
                                                                 .GET()
                                                                 .build(),
                                                      HttpResponse.BodyHandlers.ofString());

      if (response.statusCode() != 200) return OptionalLong.empty();

      JsonNode round = mapper.readTree(response.body()).path("voting_round_id");
      return round.canConvertToLong() || round.isTextual() ? OptionalLong.of(round.asLong()) : OptionalLong.empty();
    } catch (IOException e) {
      log.warn("Could not read the latest voting round: {}", e.getMessage());
      return OptionalLong.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return OptionalLong.empty();
    }
  }

  private Fetch post(String endpoint, JsonNode request, Long votingRoundId) {
    try {
      HttpResponse<String> response = httpClient.send(HttpRequest.newBuilder(URI.create(baseUrl + endpoint))
                                                                 .timeout(requestTimeout)
                                                                 .header("Content-Type", "application/json")
                                                                 .header("Accept", "application/json")
                                                                 .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(request)))
                                                                 .build(),
                                                      HttpResponse.BodyHandlers.ofString());

      if (response.statusCode() != 200) {
        return new Fetch(endpoint, votingRoundId, null, "HTTP " + response.statusCode());
      }

      return new Fetch(endpoint, votingRoundId, mapper.readTree(response.body()), "HTTP 200");
    } catch (IOException e) {
      log.warn("Proof request to {} failed: {}", endpoint, e.getMessage());
      return new Fetch(endpoint, votingRoundId, null, e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return new Fetch(endpoint, votingRoundId, null, "interrupted");
    }
  }

  private record Fetch(String endpoint, Long votingRoundId, JsonNode body, String status) {

    boolean hasProof() {
      return body != null && body.path("proof").isArray() && body.path("proof").size() > 0;
    }
  }
}
