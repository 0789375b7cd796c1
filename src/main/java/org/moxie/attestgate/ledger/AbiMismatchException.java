package org.moxie.attestgate.ledger;

/**
 * The contract does not understand the call shape, or answered with data that does not decode
 * as the declared outputs: empty return data, a revert without reason, or undecodable bytes.
 */
public class AbiMismatchException extends ContractCallException {

  public AbiMismatchException(String message) {
    super(message);
  }

  public AbiMismatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
