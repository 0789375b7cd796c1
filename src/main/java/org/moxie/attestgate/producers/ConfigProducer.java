package org.moxie.attestgate.producers;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.ConfigProvider;
import org.moxie.attestgate.attestation.ConfigurationException;
import org.moxie.attestgate.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link Config} once at startup. Invalid configuration fails the deployment.
 */
@ApplicationScoped
public class ConfigProducer {

  private static final Logger log = LoggerFactory.getLogger(ConfigProducer.class);

  @Produces
  @Singleton
  public Config produceConfig() {
    try {
      return Config.load(ConfigProvider.getConfig());
    } catch (ConfigurationException e) {
      log.error("Invalid configuration: {}", e.getMessage());
      throw new IllegalStateException("Invalid configuration: " + e.getMessage(), e);
    }
  }
}
