package org.moxie.attestgate.policy;

import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.AttestationVerdict;
import org.moxie.attestgate.attestation.PolicyVerdict;
import org.moxie.attestgate.ledger.AbiMismatchException;
import org.moxie.attestgate.ledger.LedgerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Type;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks the on-ledger verifier whether the Merkle proof is valid.
 * <p>
 * The configured {@link VerificationSignature}s are tried in order. A signature is skipped only when
 * the verifier does not understand it ({@link AbiMismatchException}); any other failure ends the
 * evaluation.
 */
public class ProofValidityPolicy implements AttestationPolicy {

  private static final Logger log = LoggerFactory.getLogger(ProofValidityPolicy.class);

  private final LedgerClient                ledger;
  private final String                      verificationContract;
  private final List<VerificationSignature> signatures;

  public ProofValidityPolicy(LedgerClient ledger, String verificationContract, List<VerificationSignature> signatures) {
    this.ledger               = ledger;
    this.verificationContract = verificationContract;
    this.signatures           = List.copyOf(signatures);
  }

  @Override
  public String name() {
    return AttestationVerdict.PROOF_VALIDITY;
  }

  @Override
  public PolicyVerdict evaluate(PolicyContext context) throws AttestationException {
    Map<String, Object>       detail    = new LinkedHashMap<>();
    List<Map<String, Object>> fallbacks = new ArrayList<>();

    detail.put("verificationContract", verificationContract);
    detail.put("merkleProofLength", context.payload().merkleProof().size());

    for (VerificationSignature signature : signatures) {
      try {
        List<Type> result = ledger.call(verificationContract, signature.toFunction(context.payload()));
        boolean    proved = ((Bool) result.get(0)).getValue();

        detail.put("signature", signature.signature());
        detail.put("fallbacks", fallbacks);
        detail.put("proved", proved);

        log.info("{} answered {} for {}", signature.name(), proved, context.reference().txHash());
        return PolicyVerdict.of(proved, detail);
      } catch (AbiMismatchException e) {
        log.info("{} not accepted by {}: {}", signature.name(), verificationContract, e.getMessage());

        Map<String, Object> fallback = new LinkedHashMap<>();
        fallback.put("signature", signature.signature());
        fallback.put("reason", e.getMessage());
        fallbacks.add(fallback);
      }
    }

    detail.put("signature", null);
    detail.put("fallbacks", fallbacks);
    detail.put("reason", "no-signature-accepted");
    return PolicyVerdict.indeterminate(detail);
  }
}
