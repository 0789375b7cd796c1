package org.moxie.attestgate.services;

import io.helidon.microprofile.cdi.RuntimeStart;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.config.Config;
import org.moxie.attestgate.ledger.LedgerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs what the service is configured against and checks once that the ledger is the expected chain.
 */
@ApplicationScoped
public class StartupCheck {

  private static final Logger log = LoggerFactory.getLogger(StartupCheck.class);

  @Inject
  Config config;

  @Inject
  LedgerClient ledger;

  void onStartup(@Observes @RuntimeStart io.helidon.config.Config runtimeConfig) {
    log.info("=== Attestation Gate ===");
    log.info("Mode: {}", config.getMode());
    log.info("Ledger: {} (chain {})", config.getLedgerRpcUrl(), config.getChainId());
    log.info("Attestation contract: {}", config.getAttestationContract());
    log.info("Verification contract: {}", config.getVerificationContract());
    log.info("Reward contract: {}", config.getRewardContract().orElse("<none>"));
    log.info("Required confirmations: {}", config.getRequiredConfirmations());
    log.info("========================");

    try {
      long reported = ledger.getChainId();

      if (reported != config.getChainId()) {
        log.error("[ALERT] Ledger reports chain {} but chain {} is configured, every verification will abort", reported, config.getChainId());
      } else {
        log.info("Ledger chain identity confirmed");
      }
    } catch (AttestationException e) {
      log.error("[ALERT] Startup chain check failed: unable to reach the ledger", e);
    }
  }
}
