package org.moxie.attestgate.attestation;

public enum ReceiptStatus {
  SUCCESS,
  FAILURE,
  UNKNOWN;

  /**
   * Map the hex {@code status} quantity of a JSON-RPC receipt.
   */
  public static ReceiptStatus fromQuantity(String quantity) {
    if (quantity == null || quantity.isEmpty()) return UNKNOWN;

    return switch (quantity.toLowerCase()) {
      case "0x1" -> SUCCESS;
      case "0x0" -> FAILURE;
      default    -> UNKNOWN;
    };
  }
}
