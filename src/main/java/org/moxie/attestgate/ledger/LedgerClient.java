package org.moxie.attestgate.ledger;

import org.moxie.attestgate.attestation.AttestationException;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Access to a remote EVM ledger.
 * <p>
 * Implementations retry transient transport failures internally and surface everything else
 * immediately. A {@link Function} carries both the ABI fragment and the argument values of a call.
 */
public interface LedgerClient {

  long getChainId() throws AttestationException;

  Optional<LedgerTransaction> getTransaction(String txHash) throws AttestationException;

  Optional<LedgerReceipt> getReceipt(String txHash) throws AttestationException;

  long getBlockHeight() throws AttestationException;

  Optional<LedgerBlock> getBlock(long number) throws AttestationException;

  default List<LedgerLog> getLogs(String address, long fromHeight, long toHeight) throws AttestationException {
    return getLogs(address, fromHeight, toHeight, List.of());
  }

  /**
   * Logs of {@code address} in the inclusive block range, filtered on the node.
   *
   * @param topics topic filter by position; a null entry matches any value
   */
  List<LedgerLog> getLogs(String address, long fromHeight, long toHeight, List<String> topics) throws AttestationException;

  /**
   * Execute a read-only call and decode its outputs.
   *
   * @throws AbiMismatchException  if the result is empty or does not decode as the function's outputs
   * @throws ContractCallException if the call reverted with a reason
   */
  List<Type> call(String address, Function function) throws AttestationException;

  BigInteger estimateGas(String address, Function function) throws AttestationException;

  BigInteger getGasPrice() throws AttestationException;

  /**
   * Gas price plus EIP-1559 fee caps, for transactions that are signed outside this process.
   */
  FeeEstimate getFeeEstimate() throws AttestationException;

  /**
   * Sign and broadcast a state-changing call.
   *
   * @return hash of the submitted transaction
   * @throws TransactionRejectedException if the node refuses the transaction
   */
  String submit(String address, Function function) throws AttestationException;

  /**
   * Poll until the transaction is buried under {@code confirmations} blocks, or has failed.
   *
   * @return the receipt once the depth is reached or the transaction reverted; empty when the
   *         polling budget ran out first
   */
  Optional<LedgerReceipt> waitForConfirmations(String txHash, int confirmations) throws AttestationException;
}
