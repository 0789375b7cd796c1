package org.moxie.attestgate.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.ErrorCategory;

import java.time.Instant;

/**
 * Written in place of a verdict when a verification run aborts with an error.
 */
public record FailureReport(@JsonProperty("txHash") String txHash,
                            @JsonProperty("verified") boolean verified,
                            @JsonProperty("category") ErrorCategory category,
                            @JsonProperty("error") String error,
                            @JsonProperty("message") String message,
                            @JsonProperty("checkedAt") String checkedAt)
{
  /**
   * @param exception the abort reason; anything but an {@link AttestationException} has no category
   */
  public static FailureReport of(String txHash, Exception exception, Instant checkedAt) {
    return new FailureReport(txHash,
                             false,
                             exception instanceof AttestationException attestation ? attestation.getCategory() : null,
                             exception.getClass().getSimpleName(),
                             exception.getMessage(),
                             checkedAt.toString());
  }
}
