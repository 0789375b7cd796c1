package org.moxie.attestgate.ledger;

import org.moxie.attestgate.attestation.ErrorCategory;

/**
 * A JSON-RPC {@code error} object returned by the node.
 */
public class JsonRpcException extends LedgerException {

  private final String method;
  private final int    code;
  private final String data;

  public JsonRpcException(String method, int code, String message, String data) {
    super(ErrorCategory.CONFIGURATION, method + " failed with RPC error " + code + ": " + message);
    this.method = method;
    this.code   = code;
    this.data   = data;
  }

  public String getMethod() {
    return method;
  }

  public int getCode() {
    return code;
  }

  public String getData() {
    return data;
  }

  /**
   * Execution reverted, either with JSON-RPC code 3 or with a message that says so.
   */
  public boolean isRevert() {
    return code == 3 || (getMessage() != null && getMessage().toLowerCase().contains("revert"));
  }

  public boolean hasRevertData() {
    return data != null && !data.isEmpty() && !"0x".equalsIgnoreCase(data);
  }
}
