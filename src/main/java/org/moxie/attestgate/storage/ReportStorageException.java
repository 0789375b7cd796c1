package org.moxie.attestgate.storage;

import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.ErrorCategory;

public class ReportStorageException extends AttestationException {

  public ReportStorageException(String message, Throwable cause) {
    super(ErrorCategory.CONFIGURATION, message, cause);
  }
}
