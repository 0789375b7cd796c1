package org.moxie.attestgate.proof;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

public record AttestationClaim(@JsonProperty("attestationType") String attestationType,
                               @JsonProperty("sourceId") String sourceId,
                               @JsonProperty("votingRound") BigInteger votingRound,
                               @JsonProperty("lowestUsedTimestamp") BigInteger lowestUsedTimestamp,
                               @JsonProperty("requestBody") RequestBody requestBody,
                               @JsonProperty("responseBody") ResponseBody responseBody)
{}
