package org.moxie.attestgate;

import java.net.http.HttpResponse;

import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

public final class HttpStubs {

  private HttpStubs() {}

  @SuppressWarnings("unchecked")
  public static HttpResponse<String> response(int statusCode, String body) {
    HttpResponse<String> response = mock(HttpResponse.class);
    lenient().when(response.statusCode()).thenReturn(statusCode);
    lenient().when(response.body()).thenReturn(body);
    return response;
  }
}
