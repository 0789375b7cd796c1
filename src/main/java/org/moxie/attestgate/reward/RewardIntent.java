package org.moxie.attestgate.reward;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.moxie.attestgate.attestation.AttestationVerdict;
import org.moxie.attestgate.attestation.Hex;
import org.moxie.attestgate.attestation.PolicyVerdict;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The reward an operator wants paid for one verified attestation.
 *
 * @param slotKey  bytes32 identifying the flexibility slot being rewarded
 * @param quantity shifted load in kW, as an unsigned integer
 */
public record RewardIntent(@JsonProperty("attestationTxHash") String attestationTxHash,
                           @JsonProperty("payloadHash") String payloadHash,
                           @JsonProperty("slotKey") String slotKey,
                           @JsonProperty("participant") String participant,
                           @JsonProperty("quantity") BigInteger quantity)
{
  public RewardIntent {
    Objects.requireNonNull(quantity, "quantity cannot be null");

    if (!Hex.isHash(attestationTxHash)) throw new IllegalArgumentException("attestationTxHash is not bytes32: " + attestationTxHash);
    if (!Hex.isHash(payloadHash))       throw new IllegalArgumentException("payloadHash is not bytes32: " + payloadHash);
    if (!Hex.isHash(slotKey))           throw new IllegalArgumentException("slotKey is not bytes32: " + slotKey);
    if (!Hex.isAddress(participant))    throw new IllegalArgumentException("participant is not an address: " + participant);
    if (quantity.signum() < 0)          throw new IllegalArgumentException("quantity cannot be negative");
  }

  /**
   * Build the intent for a verdict. Without an explicit {@code payloadHash} the digest the integrity
   * check computed over the attested data is used.
   */
  public static RewardIntent of(AttestationVerdict verdict, String payloadHash, String slotKey, String participant, BigInteger quantity) {
    String digest = payloadHash;

    if (digest == null) {
      PolicyVerdict integrity = verdict.policy(AttestationVerdict.PAYLOAD_INTEGRITY);
      Object        computed  = integrity == null ? null : integrity.detail().get("computedDigest");

      if (computed == null) {
        throw new IllegalArgumentException("No payload hash given and none was computed for " + verdict.txHash());
      }

      digest = computed.toString();
    }

    if (slotKey == null) {
      throw new IllegalArgumentException("A slot key is required");
    }

    if (quantity == null) {
      throw new IllegalArgumentException("A reward quantity is required");
    }

    return new RewardIntent(verdict.txHash(), digest, slotKeyOf(slotKey), participant, quantity);
  }

  /**
   * Slot keys may be given as bytes32 or as a human-readable label, which is hashed with keccak-256.
   */
  public static String slotKeyOf(String value) {
    Objects.requireNonNull(value, "slot key cannot be null");
    return Hex.isHash(value) ? value : Hash.sha3String(value);
  }
}
