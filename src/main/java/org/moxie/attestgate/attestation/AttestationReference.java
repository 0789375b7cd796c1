package org.moxie.attestgate.attestation;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.moxie.attestgate.config.Config;

import java.util.Objects;

/**
 * Identifies one attestation attempt: the submitted transaction, the contract it targeted and the chain it lives on.
 */
public record AttestationReference(@JsonProperty("txHash") String txHash,
                                   @JsonProperty("targetContract") String targetContract,
                                   @JsonProperty("chainId") long chainId)
{
  public AttestationReference {
    Objects.requireNonNull(txHash, "txHash cannot be null");
    Objects.requireNonNull(targetContract, "targetContract cannot be null");

    if (!Hex.isHash(txHash)) {
      throw new IllegalArgumentException("Not a 32-byte transaction hash: " + txHash);
    }
  }

  public static AttestationReference of(String txHash, Config config) {
    return new AttestationReference(txHash, config.getAttestationContract(), config.getChainId());
  }
}
