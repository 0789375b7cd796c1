package org.moxie.attestgate;

import org.moxie.attestgate.attestation.AttestationReference;
import org.moxie.attestgate.attestation.AttestationVerdict;
import org.moxie.attestgate.attestation.LedgerFacts;
import org.moxie.attestgate.attestation.PolicyVerdict;
import org.moxie.attestgate.attestation.ReceiptStatus;
import org.moxie.attestgate.policy.PolicyContext;
import org.moxie.attestgate.proof.AttestationClaim;
import org.moxie.attestgate.proof.ProofPayload;
import org.moxie.attestgate.proof.RequestBody;
import org.moxie.attestgate.proof.ResponseBody;
import org.moxie.attestgate.proof.SubmissionRecord;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data for one attestation on chain 114.
 */
public final class Fixtures {

  public static final long   CHAIN_ID              = 114;
  public static final String TX_HASH               = "0x" + "ab".repeat(32);
  public static final String OTHER_TX_HASH         = "0x" + "cd".repeat(32);
  public static final String ATTESTATION_CONTRACT  = "0x" + "11".repeat(20);
  public static final String VERIFICATION_CONTRACT = "0x" + "22".repeat(20);
  public static final String REWARD_CONTRACT       = "0x" + "33".repeat(20);
  public static final String PARTICIPANT           = "0x" + "44".repeat(20);
  public static final String SLOT_KEY              = "0x" + "55".repeat(32);
  public static final String ATTESTATION_TYPE      = "0x4a736f6e417069" + "00".repeat(25);
  public static final String SOURCE_ID             = "0x57454232" + "00".repeat(28);
  public static final String INTENSITY_URL         = "https://api.carbonintensity.org.uk/intensity/2024-01-01T00:00Z/2024-01-01T00:30Z";

  public static final byte[] ATTESTED_DATA = "{\"data\":[{\"intensity\":{\"actual\":187}}]}".getBytes(StandardCharsets.UTF_8);
  public static final String ATTESTED_DIGEST = Numeric.toHexString(Hash.sha256(ATTESTED_DATA));

  private Fixtures() {}

  public static AttestationReference reference() {
    return new AttestationReference(TX_HASH, ATTESTATION_CONTRACT, CHAIN_ID);
  }

  public static LedgerFacts facts(long blockNumber, long currentHeight, long blockTimestamp) {
    return new LedgerFacts(CHAIN_ID, blockNumber, blockTimestamp, currentHeight, ReceiptStatus.SUCCESS, ATTESTATION_CONTRACT, List.of(), 1, "1000");
  }

  public static ProofPayload payload(String url, long lowestUsedTimestamp) {
    return new ProofPayload(List.of("0x" + "01".repeat(32), "0x" + "02".repeat(32)),
                            new AttestationClaim(ATTESTATION_TYPE,
                                                 SOURCE_ID,
                                                 BigInteger.valueOf(1_000_000),
                                                 BigInteger.valueOf(lowestUsedTimestamp),
                                                 new RequestBody(url, "GET", "{}", "{}", "", ".data[0].intensity.actual", "{\"type\":\"uint256\"}"),
                                                 new ResponseBody("0x" + "00".repeat(31) + "bb")));
  }

  public static PolicyContext context(LedgerFacts facts, SubmissionRecord submission, byte[] attestedData) {
    return new PolicyContext(reference(), payload(INTENSITY_URL, 1_700_000_000L), facts, submission, attestedData);
  }

  public static SubmissionRecord submission(String computedMic) {
    return new SubmissionRecord(TX_HASH, computedMic, "0x" + "ee".repeat(64), 100L, 1_000_000L);
  }

  /**
   * A verdict whose four required policies all carry {@code passed}; the integrity detail records
   * {@link #ATTESTED_DIGEST} as the computed digest.
   */
  public static AttestationVerdict verdict(Boolean passed) {
    return verdict(passed, passed, passed, passed);
  }

  public static AttestationVerdict verdict(Boolean depth, Boolean proof, Boolean integrity, Boolean window) {
    Map<String, Object> integrityDetail = new LinkedHashMap<>();
    integrityDetail.put("computedDigest", ATTESTED_DIGEST);

    Map<String, PolicyVerdict> policies = new LinkedHashMap<>();
    policies.put(AttestationVerdict.CONFIRMATION_DEPTH, PolicyVerdict.of(depth, Map.of()));
    policies.put(AttestationVerdict.PROOF_VALIDITY, PolicyVerdict.of(proof, Map.of()));
    policies.put(AttestationVerdict.PAYLOAD_INTEGRITY, PolicyVerdict.of(integrity, integrityDetail));
    policies.put(AttestationVerdict.TIME_WINDOW, PolicyVerdict.of(window, Map.of()));

    return AttestationVerdict.aggregate(reference(), facts(100, 120, 1_700_000_100L), policies, Instant.parse("2024-01-01T00:00:00Z"));
  }
}
