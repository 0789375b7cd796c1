package org.moxie.attestgate.reward;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * A {@code RewardExecuted} event found on the ledger.
 */
public record RewardRecord(@JsonProperty("attestationTxHash") String attestationTxHash,
                           @JsonProperty("payloadHash") String payloadHash,
                           @JsonProperty("slotKey") String slotKey,
                           @JsonProperty("participant") String participant,
                           @JsonProperty("quantity") BigInteger quantity,
                           @JsonProperty("rewardTxHash") String rewardTxHash,
                           @JsonProperty("blockNumber") long blockNumber)
{}
