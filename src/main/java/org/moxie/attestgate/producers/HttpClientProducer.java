package org.moxie.attestgate.producers;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.moxie.attestgate.config.Config;

import java.net.http.HttpClient;

@ApplicationScoped
public class HttpClientProducer {

  @Produces
  @ApplicationScoped
  public HttpClient getClient(Config config) {
    return create(config);
  }

  public static HttpClient create(Config config) {
    return HttpClient.newBuilder()
                     .connectTimeout(config.getRequestTimeout())
                     .followRedirects(HttpClient.Redirect.NORMAL)
                     .build();
  }
}
