package org.moxie.attestgate.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.moxie.attestgate.attestation.AttestationVerdict;

import java.nio.file.Path;
import java.util.Optional;

/**
 * One verification report per attestation, {@code <txHash>.verification.json}, replaced by every new run.
 * A run that aborts leaves {@code <txHash>.verification-error.json} instead.
 */
public class VerificationReportStore {

  private final JsonArtifactStore store;

  public VerificationReportStore(Path directory, ObjectMapper mapper) {
    this.store = new JsonArtifactStore(directory, mapper);
  }

  public Path save(AttestationVerdict verdict) throws ReportStorageException {
    Path written = store.write(reportName(verdict.txHash()), verdict);
    store.delete(failureName(verdict.txHash()));
    return written;
  }

  public Path saveFailure(FailureReport failure) throws ReportStorageException {
    return store.write(failureName(failure.txHash()), failure);
  }

  public Optional<AttestationVerdict> load(String txHash) throws ReportStorageException {
    return store.read(reportName(txHash), AttestationVerdict.class);
  }

  public Optional<FailureReport> loadFailure(String txHash) throws ReportStorageException {
    return store.read(failureName(txHash), FailureReport.class);
  }

  private static String reportName(String txHash) {
    return txHash.toLowerCase() + ".verification.json";
  }

  private static String failureName(String txHash) {
    return txHash.toLowerCase() + ".verification-error.json";
  }
}
