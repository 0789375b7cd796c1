package org.moxie.attestgate.entities;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.moxie.attestgate.attestation.ErrorCategory;

public record ErrorResponse(
  @JsonProperty("error") String error,
  @JsonProperty("category") ErrorCategory category,
  @JsonProperty("message") String message
) {}
