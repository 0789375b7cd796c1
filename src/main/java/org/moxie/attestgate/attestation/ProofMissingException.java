package org.moxie.attestgate.attestation;

import java.nio.file.Path;

/**
 * No proof artifact is stored for the requested attestation.
 */
public class ProofMissingException extends ProofUnavailableException {

  public ProofMissingException(String key, Path location) {
    super("No proof artifact for " + key + " at " + location);
  }
}
