package org.moxie.attestgate.producers;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import okhttp3.OkHttpClient;
import org.moxie.attestgate.config.Config;
import org.moxie.attestgate.ledger.LedgerClient;
import org.moxie.attestgate.ledger.Web3jLedgerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@ApplicationScoped
public class LedgerClientProducer {

  private static final Logger log = LoggerFactory.getLogger(LedgerClientProducer.class);

  @Produces
  @Singleton
  public Web3j produceWeb3j(Config config) {
    OkHttpClient okHttp = new OkHttpClient.Builder()
                                          .connectTimeout(config.getRequestTimeout())
                                          .callTimeout(config.getRequestTimeout())
                                          .build();

    log.info("Using ledger at {} (chain {})", config.getLedgerRpcUrl(), config.getChainId());
    return Web3j.build(new HttpService(config.getLedgerRpcUrl(), okHttp));
  }

  public void closeWeb3j(@Disposes Web3j web3j) {
    web3j.shutdown();
  }

  @Produces
  @Singleton
  public LedgerClient produceLedgerClient(Web3j web3j, Config config) {
    return new Web3jLedgerClient(web3j, config);
  }
}
