package org.moxie.attestgate.proof;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What the acquisition step recorded when it submitted the attestation request.
 * Every field is optional; older runs only wrote {@code txHash} and {@code blockNumber}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmissionRecord(@JsonProperty("txHash") String txHash,
                               @JsonProperty("computedMic") String computedMic,
                               @JsonProperty("abiEncodedRequest") String abiEncodedRequest,
                               @JsonProperty("blockNumber") Long blockNumber,
                               @JsonProperty("votingRoundId") Long votingRoundId)
{}
