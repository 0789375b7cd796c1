package org.moxie.attestgate.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.TransactionNotFoundException;
import org.moxie.attestgate.entities.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON rendering for the REST controllers, and the mapping of domain failures to HTTP statuses.
 */
final class JsonResponses {

  private static final Logger log = LoggerFactory.getLogger(JsonResponses.class);

  private JsonResponses() {}

  static Response ok(ObjectMapper mapper, Object entity) {
    return json(mapper, 200, entity);
  }

  static WebApplicationException failure(ObjectMapper mapper, AttestationException e) {
    return new WebApplicationException(e, json(mapper, statusOf(e), new ErrorResponse(e.getClass().getSimpleName(), e.getCategory(), e.getMessage())));
  }

  static WebApplicationException failure(ObjectMapper mapper, int status, RuntimeException e) {
    return new WebApplicationException(e, json(mapper, status, new ErrorResponse(e.getClass().getSimpleName(), null, e.getMessage())));
  }

  static int statusOf(AttestationException e) {
    if (e instanceof TransactionNotFoundException) return 404;

    return switch (e.getCategory()) {
      case CONFIGURATION                       -> 422;
      case TRANSIENT_NETWORK                   -> 503;
      case PROOF_UNAVAILABLE, REPLAY_REJECTED  -> 409;
      case POLICY_FAILURE, INTEGRITY_MISMATCH  -> 422;
    };
  }

  private static Response json(ObjectMapper mapper, int status, Object entity) {
    try {
      return Response.status(status)
                     .type(MediaType.APPLICATION_JSON_TYPE)
                     .entity(mapper.writeValueAsString(entity))
                     .build();
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize response", e);
      throw new WebApplicationException("Failed to serialize response", 500);
    }
  }
}
