package org.moxie.attestgate.controllers;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.AttestationReference;
import org.moxie.attestgate.attestation.AttestationVerdict;
import org.moxie.attestgate.config.Config;
import org.moxie.attestgate.verification.VerificationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
@Path("/v1/attestations/{txHash}/verification")
@Produces(MediaType.APPLICATION_JSON)
public class AttestationController {

  private static final Logger log = LoggerFactory.getLogger(AttestationController.class);

  @Inject
  Config config;

  @Inject
  ObjectMapper mapper;

  @Inject
  VerificationOrchestrator orchestrator;

  /**
   * Run a fresh verification and return its verdict. The stored report is replaced.
   */
  @POST
  public Response verify(@PathParam("txHash") String txHash) {
    AttestationReference reference = reference(txHash);

    try {
      return JsonResponses.ok(mapper, orchestrator.verify(reference));
    } catch (AttestationException e) {
      throw JsonResponses.failure(mapper, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WebApplicationException("Verification interrupted", 503);
    }
  }

  /**
   * The report of the latest completed verification.
   */
  @GET
  public Response getReport(@PathParam("txHash") String txHash) {
    reference(txHash);

    try {
      AttestationVerdict verdict = orchestrator.loadReport(txHash)
                                               .orElseThrow(() -> new WebApplicationException("No verification report for " + txHash, 404));
      return JsonResponses.ok(mapper, verdict);
    } catch (AttestationException e) {
      log.warn("Failed to load report for {}", txHash, e);
      throw JsonResponses.failure(mapper, e);
    }
  }

  private AttestationReference reference(String txHash) {
    try {
      return AttestationReference.of(txHash, config);
    } catch (IllegalArgumentException e) {
      throw JsonResponses.failure(mapper, 400, e);
    }
  }
}
