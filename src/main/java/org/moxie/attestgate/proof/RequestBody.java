package org.moxie.attestgate.proof;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Union of both request layouts the attestation network has used. Fields a layout does not carry are empty strings.
 */
public record RequestBody(@JsonProperty("url") String url,
                          @JsonProperty("httpMethod") String httpMethod,
                          @JsonProperty("headers") String headers,
                          @JsonProperty("queryParams") String queryParams,
                          @JsonProperty("body") String body,
                          @JsonProperty("postProcessJq") String postProcessJq,
                          @JsonProperty("abiSignature") String abiSignature)
{
  public RequestBody {
    url           = url == null ? "" : url;
    httpMethod    = httpMethod == null ? "" : httpMethod;
    headers       = headers == null ? "" : headers;
    queryParams   = queryParams == null ? "" : queryParams;
    body          = body == null ? "" : body;
    postProcessJq = postProcessJq == null ? "" : postProcessJq;
    abiSignature  = abiSignature == null ? "" : abiSignature;
  }
}
