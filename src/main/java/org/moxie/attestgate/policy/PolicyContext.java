package org.moxie.attestgate.policy;

import org.moxie.attestgate.attestation.AttestationReference;
import org.moxie.attestgate.attestation.LedgerFacts;
import org.moxie.attestgate.proof.ProofPayload;
import org.moxie.attestgate.proof.SubmissionRecord;

/**
 * Everything a policy may look at for one run.
 *
 * @param submission   the acquisition step's record, or null when none was stored
 * @param attestedData exact bytes of the attested response, or null when none was stored
 */
public record PolicyContext(AttestationReference reference,
                            ProofPayload payload,
                            LedgerFacts facts,
                            SubmissionRecord submission,
                            byte[] attestedData)
{}
