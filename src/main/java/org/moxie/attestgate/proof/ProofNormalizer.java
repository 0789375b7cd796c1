package org.moxie.attestgate.proof;

import com.fasterxml.jackson.databind.JsonNode;
import org.moxie.attestgate.attestation.Hex;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads every proof layout the data-availability layer has produced into one {@link ProofPayload}.
 * <p>
 * Accepted wrappers: a fetch record holding the DA answer under {@code response}, the same with a
 * second {@code response} level, and a bare {@code {proof, data}} or {@code {proof, response}} object.
 * Inside the claim, the request fields may sit under {@code request} or directly on the claim, and
 * field names may be snake_case or camelCase.
 */
public final class ProofNormalizer {

  private ProofNormalizer() {}

  public static ProofPayload normalize(JsonNode root) throws MalformedProofException {
    JsonNode payload = locatePayload(root);
    JsonNode claim   = payload.has("response") ? payload.get("response") : payload.get("data");

    if (claim == null || !claim.isObject()) {
      throw new MalformedProofException("Proof payload has no attested claim");
    }

    JsonNode request      = claim.has("request") ? claim.get("request") : claim;
    JsonNode requestBody  = request.path("requestBody");
    JsonNode responseBody = claim.has("responseBody") ? claim.get("responseBody") : request.path("responseBody");

    List<String> merkleProof = new ArrayList<>();

    for (JsonNode node : payload.path("proof")) {
      String hash = node.asText();

      if (!Hex.isHash(hash)) {
        throw new MalformedProofException("Merkle proof entry is not bytes32: " + hash);
      }

      merkleProof.add(hash);
    }

    return new ProofPayload(merkleProof,
                            new AttestationClaim(bytes32(text(request, "attestationType")),
                                                 bytes32(text(request, "sourceId")),
                                                 integer(request.get("votingRound"), "votingRound"),
                                                 integer(request.get("lowestUsedTimestamp"), "lowestUsedTimestamp"),
                                                 new RequestBody(text(requestBody, "url"),
                                                                 text(requestBody, "httpMethod"),
                                                                 text(requestBody, "headers"),
                                                                 text(requestBody, "queryParams"),
                                                                 text(requestBody, "body"),
                                                                 text(requestBody, "postProcessJq", "postprocessJq"),
                                                                 text(requestBody, "abiSignature", "abi_signature")),
                                                 new ResponseBody(text(responseBody, "abiEncodedData", "abi_encoded_data"))));
  }

  /**
   * Hex values pass through unchanged; anything else is UTF-8 encoded and right-padded to 32 bytes.
   */
  public static String bytes32(String value) throws MalformedProofException {
    if (value == null || value.isEmpty()) {
      return Numeric.toHexString(new byte[32]);
    }

    if (Hex.isHash(value)) {
      return value;
    }

    byte[] raw = value.getBytes(StandardCharsets.UTF_8);

    if (raw.length > 32) {
      throw new MalformedProofException("Value does not fit in bytes32: " + value);
    }

    byte[] padded = new byte[32];
    System.arraycopy(raw, 0, padded, 0, raw.length);
    return Numeric.toHexString(padded);
  }

  private static JsonNode locatePayload(JsonNode root) throws MalformedProofException {
    if (root == null || !root.isObject()) {
      throw new MalformedProofException("Proof artifact is not a JSON object");
    }

    JsonNode response = root.path("response");

    if (response.has("proof")) return response;
    if (response.path("response").has("proof")) return response.get("response");
    if (root.has("proof") && (root.has("data") || root.has("response"))) return root;

    throw new MalformedProofException("Could not locate proof payload in artifact");
  }

  private static String text(JsonNode node, String... names) {
    for (String name : names) {
      JsonNode value = node.get(name);
      if (value != null && !value.isNull()) return value.asText();
    }

    return null;
  }

  private static BigInteger integer(JsonNode node, String field) throws MalformedProofException {
    if (node == null || node.isNull()) return BigInteger.ZERO;
    if (node.isIntegralNumber()) return node.bigIntegerValue();

    String value = node.asText().trim();

    try {
      return value.startsWith("0x") ? Numeric.decodeQuantity(value) : new BigInteger(value);
    } catch (RuntimeException e) {
      throw new MalformedProofException("Invalid " + field + ": " + value, e);
    }
  }
}
