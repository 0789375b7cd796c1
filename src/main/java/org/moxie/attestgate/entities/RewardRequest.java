package org.moxie.attestgate.entities;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Body of {@code POST /v1/rewards}. Without {@code execute} the gate only dry-runs. With
 * {@code rewardTxHash} the state of an earlier submission is re-read instead.
 */
public record RewardRequest(
  @JsonProperty("attestationTxHash") String attestationTxHash,
  @JsonProperty("slotKey") String slotKey,
  @JsonProperty("participant") String participant,
  @JsonProperty("quantity") BigInteger quantity,
  @JsonProperty("payloadHash") String payloadHash,
  @JsonProperty("execute") Boolean execute,
  @JsonProperty("rewardTxHash") String rewardTxHash
) {
  public boolean executeRequested() {
    return Boolean.TRUE.equals(execute);
  }
}
