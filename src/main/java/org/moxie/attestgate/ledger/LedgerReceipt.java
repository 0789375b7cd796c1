package org.moxie.attestgate.ledger;

import org.moxie.attestgate.attestation.ReceiptStatus;

import java.math.BigInteger;
import java.util.List;

public record LedgerReceipt(String transactionHash,
                           long blockNumber,
                           String to,
                           ReceiptStatus status,
                           BigInteger gasUsed,
                           List<LedgerLog> logs)
{
  public LedgerReceipt {
    logs = logs == null ? List.of() : List.copyOf(logs);
  }

  public long confirmationsAt(long currentHeight) {
    return currentHeight - blockNumber + 1;
  }
}
