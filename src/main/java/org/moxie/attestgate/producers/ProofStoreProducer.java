package org.moxie.attestgate.producers;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.moxie.attestgate.config.Config;
import org.moxie.attestgate.proof.DataAvailabilityProofStore;
import org.moxie.attestgate.proof.FileProofStore;
import org.moxie.attestgate.proof.ProofStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;

/**
 * Proofs are read from {@code proof.directory}; when {@code proof.da.url} is set, missing proofs are
 * fetched from the data-availability layer into that directory.
 */
@ApplicationScoped
public class ProofStoreProducer {

  private static final Logger log = LoggerFactory.getLogger(ProofStoreProducer.class);

  @Produces
  @Singleton
  public ProofStore produceProofStore(HttpClient httpClient, ObjectMapper mapper, Config config) {
    FileProofStore files = FileProofStore.from(config, mapper);

    if (config.getDataAvailabilityUrl().isEmpty()) {
      log.info("Reading proofs from {}", config.getProofDirectory());
      return files;
    }

    log.info("Reading proofs from {}, fetching missing ones from {}", config.getProofDirectory(), config.getDataAvailabilityUrl().get());
    return new DataAvailabilityProofStore(files,
                                          httpClient,
                                          mapper,
                                          config.getDataAvailabilityUrl().get(),
                                          config.getProofPollingPolicy(),
                                          config.getRequestTimeout());
  }
}
