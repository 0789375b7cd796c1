package org.moxie.attestgate.policy;

import org.moxie.attestgate.attestation.AttestationVerdict;
import org.moxie.attestgate.attestation.LedgerFacts;
import org.moxie.attestgate.attestation.PolicyVerdict;
import org.moxie.attestgate.attestation.ReceiptStatus;

import java.util.LinkedHashMap;
import java.util.Map;

public class ConfirmationDepthPolicy implements AttestationPolicy {

  private final int requiredConfirmations;

  public ConfirmationDepthPolicy(int requiredConfirmations) {
    this.requiredConfirmations = requiredConfirmations;
  }

  @Override
  public String name() {
    return AttestationVerdict.CONFIRMATION_DEPTH;
  }

  @Override
  public PolicyVerdict evaluate(PolicyContext context) {
    LedgerFacts         facts  = context.facts();
    Map<String, Object> detail = new LinkedHashMap<>();

    detail.put("blockNumber", facts.blockNumber());
    detail.put("currentHeight", facts.currentHeight());
    detail.put("confirmations", facts.confirmations());
    detail.put("requiredConfirmations", requiredConfirmations);

    if (facts.receiptStatus() == ReceiptStatus.UNKNOWN || facts.blockNumber() <= 0) {
      detail.put("reason", "receipt-unknown");
      return PolicyVerdict.indeterminate(detail);
    }

    return PolicyVerdict.of(facts.confirmations() >= requiredConfirmations, detail);
  }
}
