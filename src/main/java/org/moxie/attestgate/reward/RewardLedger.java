package org.moxie.attestgate.reward;

import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.ConfigurationException;
import org.moxie.attestgate.attestation.Hex;
import org.moxie.attestgate.ledger.LedgerClient;
import org.moxie.attestgate.ledger.LedgerLog;
import org.moxie.attestgate.ledger.LedgerReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The reward executor contract: its {@code executeReward} call and its {@code RewardExecuted} events.
 * <p>
 * The contract itself refuses a second reward for the same attestation hash. {@link #findRecord}
 * lets callers see an earlier reward before they spend gas on a transaction that would revert.
 */
public class RewardLedger {

  private static final Logger log = LoggerFactory.getLogger(RewardLedger.class);

  public static final Event REWARD_EXECUTED = new Event("RewardExecuted",
                                                        List.of(new TypeReference<Bytes32>(true) {},
                                                                new TypeReference<Bytes32>(true) {},
                                                                new TypeReference<Bytes32>(true) {},
                                                                new TypeReference<Address>() {},
                                                                new TypeReference<Uint256>() {}));

  public static final String REWARD_EXECUTED_TOPIC = EventEncoder.encode(REWARD_EXECUTED);

  private final LedgerClient ledger;
  private final String       contract;
  private final long         fromBlock;
  private final int          chunkBlocks;

  /**
   * @param contract    reward executor address, or null when rewards are not configured
   * @param chunkBlocks largest block range asked for in one {@code eth_getLogs} request
   */
  public RewardLedger(LedgerClient ledger, String contract, long fromBlock, int chunkBlocks) {
    if (chunkBlocks < 1) {
      throw new IllegalArgumentException("chunkBlocks must be at least 1: " + chunkBlocks);
    }

    this.ledger      = ledger;
    this.contract    = contract;
    this.fromBlock   = fromBlock;
    this.chunkBlocks = chunkBlocks;
  }

  public String getContract() throws ConfigurationException {
    if (contract == null) {
      throw new ConfigurationException("Missing required setting: reward.contract");
    }

    return contract;
  }

  public Function executeReward(RewardIntent intent) {
    return new Function("executeReward",
                        List.of(new Bytes32(Numeric.hexStringToByteArray(intent.attestationTxHash())),
                                new Bytes32(Numeric.hexStringToByteArray(intent.payloadHash())),
                                new Bytes32(Numeric.hexStringToByteArray(intent.slotKey())),
                                new Address(intent.participant()),
                                new Uint256(intent.quantity())),
                        List.of());
  }

  /**
   * Look for a reward already paid for {@code attestationTxHash}.
   * <p>
   * The scan starts at the configured start block, or at {@code earliestBlock} when that is later, and
   * walks up to the current head in ranges of at most {@code chunkBlocks} blocks. The node filters on
   * the event topic and the attestation hash.
   *
   * @param earliestBlock first block a reward can be in, usually the attestation's own block, or null
   */
  public Optional<RewardRecord> findRecord(String attestationTxHash, Long earliestBlock) throws AttestationException {
    String       address = getContract();
    long         height  = ledger.getBlockHeight();
    List<String> topics  = List.of(REWARD_EXECUTED_TOPIC, attestationTxHash.toLowerCase());
    long         start   = earliestBlock == null ? fromBlock : Math.max(fromBlock, earliestBlock);

    for (long from = start; from <= height; from += chunkBlocks) {
      long to = Math.min(height, from + chunkBlocks - 1);

      for (LedgerLog entry : ledger.getLogs(address, from, to, topics)) {
        if (isRewardEvent(entry) && Hex.sameValue(entry.topic(1), attestationTxHash)) {
          RewardRecord record = decode(entry);
          log.info("Found reward for {} in {} (block {})", attestationTxHash, record.rewardTxHash(), record.blockNumber());
          return Optional.of(record);
        }
      }
    }

    log.debug("No reward for {} in blocks {}..{}", attestationTxHash, start, height);
    return Optional.empty();
  }

  /**
   * Rewards recorded by one reward transaction.
   */
  public List<RewardRecord> inspect(String rewardTxHash) throws AttestationException {
    Optional<LedgerReceipt> receipt = ledger.getReceipt(rewardTxHash);
    return receipt.isPresent() ? recordsIn(receipt.get()) : List.of();
  }

  public List<RewardRecord> recordsIn(LedgerReceipt receipt) throws ConfigurationException {
    String             address = getContract();
    List<RewardRecord> records = new ArrayList<>();

    for (LedgerLog entry : receipt.logs()) {
      if (entry.isFrom(address) && isRewardEvent(entry)) {
        records.add(decode(entry));
      }
    }

    return records;
  }

  private static boolean isRewardEvent(LedgerLog entry) {
    return Hex.sameValue(entry.topic(0), REWARD_EXECUTED_TOPIC) && entry.topics().size() == 4;
  }

  private static RewardRecord decode(LedgerLog entry) {
    List<Type> values = FunctionReturnDecoder.decode(entry.data(), REWARD_EXECUTED.getNonIndexedParameters());

    return new RewardRecord(entry.topic(1),
                            entry.topic(2),
                            entry.topic(3),
                            values.isEmpty() ? null : ((Address) values.get(0)).getValue(),
                            values.size() < 2 ? null : (BigInteger) values.get(1).getValue(),
                            entry.transactionHash(),
                            entry.blockNumber());
  }
}
