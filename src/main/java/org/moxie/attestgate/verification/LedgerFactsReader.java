package org.moxie.attestgate.verification;

import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.AttestationReference;
import org.moxie.attestgate.attestation.ConfigurationException;
import org.moxie.attestgate.attestation.Hex;
import org.moxie.attestgate.attestation.LedgerFacts;
import org.moxie.attestgate.attestation.ReceiptPendingException;
import org.moxie.attestgate.attestation.TransactionNotFoundException;
import org.moxie.attestgate.ledger.LedgerBlock;
import org.moxie.attestgate.ledger.LedgerClient;
import org.moxie.attestgate.ledger.LedgerException;
import org.moxie.attestgate.ledger.LedgerLog;
import org.moxie.attestgate.ledger.LedgerReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;

import java.util.List;

/**
 * Collects the {@link LedgerFacts} for an attestation transaction.
 */
public class LedgerFactsReader {

  private static final Logger log = LoggerFactory.getLogger(LedgerFactsReader.class);

  private final LedgerClient ledger;

  public LedgerFactsReader(LedgerClient ledger) {
    this.ledger = ledger;
  }

  /**
   * @throws TransactionNotFoundException if the ledger does not know the transaction
   * @throws ReceiptPendingException      if the transaction, or its block, is not available yet
   * @throws ConfigurationException       if the transaction was not sent to the attestation contract
   */
  public LedgerFacts read(AttestationReference reference, long chainId) throws AttestationException {
    String txHash = reference.txHash();

    ledger.getTransaction(txHash).orElseThrow(() -> new TransactionNotFoundException(txHash));

    LedgerReceipt receipt = ledger.getReceipt(txHash).orElseThrow(() -> new ReceiptPendingException(txHash));

    if (!Hex.sameValue(receipt.to(), reference.targetContract())) {
      throw new ConfigurationException("Attestation " + txHash + " was sent to " + receipt.to() + ", not to " + reference.targetContract());
    }

    long        height = ledger.getBlockHeight();
    LedgerBlock block  = ledger.getBlock(receipt.blockNumber()).orElseThrow(() -> new ReceiptPendingException(txHash));

    List<LedgerLog> logs = receipt.logs().stream()
                                  .filter(entry -> entry.isFrom(reference.targetContract()))
                                  .toList();

    int logsInBlock = (int) ledger.getLogs(reference.targetContract(), receipt.blockNumber(), receipt.blockNumber())
                                  .stream()
                                  .filter(entry -> entry.isInTransaction(txHash))
                                  .count();

    return new LedgerFacts(chainId,
                           receipt.blockNumber(),
                           block.timestamp(),
                           height,
                           receipt.status(),
                           receipt.to(),
                           logs,
                           logsInBlock,
                           requestFee(reference.targetContract()));
  }

  private String requestFee(String contract) throws AttestationException {
    Function requestFee = new Function("requestFee", List.of(), List.of(new TypeReference<Uint256>() {}));

    try {
      List<Type> result = ledger.call(contract, requestFee);
      return ((Uint256) result.get(0)).getValue().toString();
    } catch (LedgerException e) {
      log.debug("requestFee() not readable on {}: {}", contract, e.getMessage());
      return null;
    }
  }
}
