package org.moxie.attestgate.proof;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Canonical proof for one attestation: the Merkle path and the attested claim it proves.
 */
public record ProofPayload(@JsonProperty("merkleProof") List<String> merkleProof,
                           @JsonProperty("claim") AttestationClaim claim)
{
  public ProofPayload {
    merkleProof = merkleProof == null ? List.of() : List.copyOf(merkleProof);
  }
}
