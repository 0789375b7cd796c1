package org.moxie.attestgate.policy;

import org.moxie.attestgate.attestation.ConfigurationException;
import org.moxie.attestgate.proof.AttestationClaim;
import org.moxie.attestgate.proof.MalformedProofException;
import org.moxie.attestgate.proof.ProofPayload;
import org.moxie.attestgate.proof.RequestBody;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.DynamicStruct;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.utils.Numeric;

import java.util.ArrayList;
import java.util.List;

/**
 * One call shape of the on-ledger proof verifier, and how to build its arguments from a {@link ProofPayload}.
 */
public record VerificationSignature(String name, String signature, ArgumentBuilder argumentBuilder) {

  @FunctionalInterface
  public interface ArgumentBuilder {
    List<Type> build(ProofPayload payload) throws MalformedProofException;
  }

  public static final VerificationSignature JSON_API = new VerificationSignature(
      "verifyJsonApi",
      "verifyJsonApi(((bytes32,bytes32,uint256,uint256,(string,string,string)),(bytes)),bytes32[])",
      payload -> {
        AttestationClaim claim = payload.claim();
        RequestBody      body  = claim.requestBody();

        DynamicStruct request = new DynamicStruct(bytes32(claim.attestationType()),
                                                  bytes32(claim.sourceId()),
                                                  new Uint256(claim.votingRound()),
                                                  new Uint256(claim.lowestUsedTimestamp()),
                                                  new DynamicStruct(new Utf8String(body.url()),
                                                                    new Utf8String(body.postProcessJq()),
                                                                    new Utf8String(body.abiSignature())));

        return List.of(new DynamicStruct(request, responseBody(payload)), merkleProof(payload));
      });

  public static final VerificationSignature WEB2_JSON = new VerificationSignature(
      "verifyWeb2Json",
      "verifyWeb2Json((bytes32[],(bytes32,bytes32,uint64,uint64,(string,string,string,string,string,string,string),(bytes))))",
      payload -> {
        AttestationClaim claim = payload.claim();
        RequestBody      body  = claim.requestBody();

        DynamicStruct data = new DynamicStruct(bytes32(claim.attestationType()),
                                               bytes32(claim.sourceId()),
                                               new Uint64(claim.votingRound()),
                                               new Uint64(claim.lowestUsedTimestamp()),
                                               new DynamicStruct(new Utf8String(body.url()),
                                                                 new Utf8String(body.httpMethod()),
                                                                 new Utf8String(body.headers()),
                                                                 new Utf8String(body.queryParams()),
                                                                 new Utf8String(body.body()),
                                                                 new Utf8String(body.postProcessJq()),
                                                                 new Utf8String(body.abiSignature())),
                                               responseBody(payload));

        return List.of(new DynamicStruct(merkleProof(payload), data));
      });

  public static VerificationSignature byName(String name) throws ConfigurationException {
    if (JSON_API.name().equals(name)) return JSON_API;
    if (WEB2_JSON.name().equals(name)) return WEB2_JSON;

    throw new ConfigurationException("Unknown verification signature: " + name);
  }

  public static List<VerificationSignature> byNames(List<String> names) throws ConfigurationException {
    List<VerificationSignature> signatures = new ArrayList<>();

    for (String name : names) {
      signatures.add(byName(name));
    }

    return signatures;
  }

  public Function toFunction(ProofPayload payload) throws MalformedProofException {
    return new Function(name, argumentBuilder.build(payload), List.of(new TypeReference<Bool>() {}));
  }

  private static Bytes32 bytes32(String hex) throws MalformedProofException {
    try {
      return new Bytes32(Numeric.hexStringToByteArray(hex));
    } catch (RuntimeException e) {
      throw new MalformedProofException("Not a bytes32 value: " + hex, e);
    }
  }

  private static DynamicArray<Bytes32> merkleProof(ProofPayload payload) throws MalformedProofException {
    List<Bytes32> nodes = new ArrayList<>();

    for (String node : payload.merkleProof()) {
      nodes.add(bytes32(node));
    }

    return new DynamicArray<>(Bytes32.class, nodes);
  }

  private static DynamicStruct responseBody(ProofPayload payload) throws MalformedProofException {
    String encoded = payload.claim().responseBody().abiEncodedData();

    try {
      return new DynamicStruct(new DynamicBytes(Numeric.hexStringToByteArray(encoded)));
    } catch (RuntimeException e) {
      throw new MalformedProofException("abiEncodedData is not hex", e);
    }
  }
}
