package org.moxie.attestgate.attestation;

/**
 * A required input is missing or invalid, or the environment does not match what was configured.
 */
public class ConfigurationException extends AttestationException {

  public ConfigurationException(String message) {
    super(ErrorCategory.CONFIGURATION, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(ErrorCategory.CONFIGURATION, message, cause);
  }
}
