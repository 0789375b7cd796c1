package org.moxie.attestgate.proof;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ResponseBody(@JsonProperty("abiEncodedData") String abiEncodedData) {

  public ResponseBody {
    abiEncodedData = abiEncodedData == null || abiEncodedData.isEmpty() ? "0x" : abiEncodedData;
  }
}
