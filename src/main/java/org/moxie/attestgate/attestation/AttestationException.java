package org.moxie.attestgate.attestation;

/**
 * Base exception for everything that can stop an attestation from being verified or rewarded.
 * Every instance carries the {@link ErrorCategory} that decides whether it is retried,
 * how it is reported and which exit code a command-line run ends with.
 */
public class AttestationException extends Exception {

  private final ErrorCategory category;

  public AttestationException(ErrorCategory category, String message) {
    super(message);
    this.category = category;
  }

  public AttestationException(ErrorCategory category, String message, Throwable cause) {
    super(message, cause);
    this.category = category;
  }

  public ErrorCategory getCategory() {
    return category;
  }
}
