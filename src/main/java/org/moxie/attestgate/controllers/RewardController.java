package org.moxie.attestgate.controllers;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.AttestationReference;
import org.moxie.attestgate.attestation.AttestationVerdict;
import org.moxie.attestgate.config.Config;
import org.moxie.attestgate.entities.RewardRequest;
import org.moxie.attestgate.reward.ExecutionMode;
import org.moxie.attestgate.reward.RewardExecutionGate;
import org.moxie.attestgate.reward.RewardIntent;
import org.moxie.attestgate.reward.RewardOutcome;
import org.moxie.attestgate.verification.VerificationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Every request verifies the attestation again before the gate sees it.
 */
@ApplicationScoped
@Path("/v1/rewards")
public class RewardController {

  private static final Logger log = LoggerFactory.getLogger(RewardController.class);

  @Inject
  Config config;

  @Inject
  ObjectMapper mapper;

  @Inject
  VerificationOrchestrator orchestrator;

  @Inject
  RewardExecutionGate gate;

  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  public Response reward(String body) {
    RewardRequest request = parse(body);

    try {
      AttestationVerdict verdict = orchestrator.verify(AttestationReference.of(request.attestationTxHash(), config));
      RewardOutcome      outcome;

      if (request.rewardTxHash() != null) {
        outcome = gate.checkSubmission(verdict, request.rewardTxHash(), config.getMode());
      } else {
        RewardIntent intent = verdict.verified()
                              ? RewardIntent.of(verdict, request.payloadHash(), request.slotKey(), request.participant(), request.quantity())
                              : null;

        outcome = gate.executeIfVerified(verdict, intent, config.getMode(), ExecutionMode.of(request.executeRequested()));
      }

      log.info("Reward request for {} finished with {}", request.attestationTxHash(), outcome.status());
      return JsonResponses.ok(mapper, outcome);
    } catch (AttestationException e) {
      throw JsonResponses.failure(mapper, e);
    } catch (IllegalArgumentException e) {
      throw JsonResponses.failure(mapper, 400, e);
    } catch (IllegalStateException e) {
      throw JsonResponses.failure(mapper, 409, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WebApplicationException("Reward request interrupted", 503);
    }
  }

  private RewardRequest parse(String body) {
    try {
      RewardRequest request = mapper.readValue(body, RewardRequest.class);

      if (request.attestationTxHash() == null) {
        throw new WebApplicationException("attestationTxHash is required", 400);
      }

      return request;
    } catch (IOException e) {
      throw new WebApplicationException("Malformed reward request", 400);
    }
  }
}
