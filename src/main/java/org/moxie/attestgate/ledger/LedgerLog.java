package org.moxie.attestgate.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One event-log entry as reported by the ledger.
 */
public record LedgerLog(@JsonProperty("address") String address,
                        @JsonProperty("topics") List<String> topics,
                        @JsonProperty("data") String data,
                        @JsonProperty("blockNumber") long blockNumber,
                        @JsonProperty("transactionHash") String transactionHash,
                        @JsonProperty("logIndex") long logIndex)
{
  public LedgerLog {
    topics = topics == null ? List.of() : List.copyOf(topics);
  }

  public boolean isFrom(String contract) {
    return address != null && address.equalsIgnoreCase(contract);
  }

  public boolean isInTransaction(String txHash) {
    return transactionHash != null && transactionHash.equalsIgnoreCase(txHash);
  }

  public String topic(int index) {
    return index < topics.size() ? topics.get(index) : null;
  }
}
