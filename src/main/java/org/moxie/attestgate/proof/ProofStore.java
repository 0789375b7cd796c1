package org.moxie.attestgate.proof;

import org.moxie.attestgate.attestation.AttestationException;

import java.util.Optional;

/**
 * Read side of the artifacts an attestation run produces, keyed by the attestation transaction hash.
 */
public interface ProofStore {

  /**
   * @throws org.moxie.attestgate.attestation.ProofMissingException if no proof exists for {@code key}
   */
  ProofPayload readProof(String key) throws AttestationException;

  Optional<SubmissionRecord> readSubmissionRecord(String key) throws AttestationException;

  /**
   * The exact bytes of the attested Web2 response, as they were digested at submission time.
   */
  Optional<byte[]> readAttestedData(String key) throws AttestationException;
}
