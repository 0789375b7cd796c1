package org.moxie.attestgate.attestation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate result of one verification run, and the only input the reward gate is allowed to read.
 */
@JsonIgnoreProperties(value = {"txHash", "blockNumber", "confirmations"}, allowGetters = true, ignoreUnknown = true)
public record AttestationVerdict(@JsonProperty("reference") AttestationReference reference,
                                 @JsonProperty("facts") LedgerFacts facts,
                                 @JsonProperty("policies") Map<String, PolicyVerdict> policies,
                                 @JsonProperty("verified") boolean verified,
                                 @JsonProperty("checkedAt") String checkedAt)
{
  public static final String CONFIRMATION_DEPTH = "confirmationDepth";
  public static final String PROOF_VALIDITY     = "proofValidity";
  public static final String PAYLOAD_INTEGRITY  = "payloadIntegrity";
  public static final String TIME_WINDOW        = "timeWindow";

  public static final List<String> REQUIRED_POLICIES = List.of(CONFIRMATION_DEPTH, PROOF_VALIDITY, PAYLOAD_INTEGRITY, TIME_WINDOW);

  public AttestationVerdict {
    Objects.requireNonNull(reference, "reference cannot be null");
    policies = policies == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(policies));
  }

  /**
   * Build the verdict for a run. {@code verified} is true only when every required policy
   * reported {@code passed == TRUE}; a missing, failed or indeterminate policy makes it false.
   */
  public static AttestationVerdict aggregate(AttestationReference reference,
                                             LedgerFacts facts,
                                             Map<String, PolicyVerdict> policies,
                                             Instant checkedAt)
  {
    boolean verified = true;

    for (String name : REQUIRED_POLICIES) {
      PolicyVerdict verdict = policies.get(name);
      verified &= verdict != null && verdict.proven();
    }

    return new AttestationVerdict(reference, facts, policies, verified, checkedAt.toString());
  }

  public PolicyVerdict policy(String name) {
    return policies.get(name);
  }

  @JsonProperty("txHash")
  public String txHash() {
    return reference.txHash();
  }

  @JsonProperty("blockNumber")
  public Long blockNumber() {
    return facts == null ? null : facts.blockNumber();
  }

  @JsonProperty("confirmations")
  public Long confirmations() {
    return facts == null ? null : facts.confirmations();
  }

  /**
   * True when the integrity policy found a digest that disagrees with a reference digest.
   */
  @JsonIgnore
  public boolean integrityMismatch() {
    PolicyVerdict integrity = policies.get(PAYLOAD_INTEGRITY);
    return integrity != null && Boolean.TRUE.equals(integrity.detail().get("mismatch"));
  }

  /**
   * Names of the required policies that did not pass, with their tri-state value.
   */
  @JsonIgnore
  public Map<String, Boolean> unmetPolicies() {
    Map<String, Boolean> unmet = new LinkedHashMap<>();

    for (String name : REQUIRED_POLICIES) {
      PolicyVerdict verdict = policies.get(name);
      if (verdict == null || !verdict.proven()) {
        unmet.put(name, verdict == null ? null : verdict.passed());
      }
    }

    return unmet;
  }

  public AttestationVerdict withCheckedAt(String timestamp) {
    return new AttestationVerdict(reference, facts, policies, verified, timestamp);
  }
}
