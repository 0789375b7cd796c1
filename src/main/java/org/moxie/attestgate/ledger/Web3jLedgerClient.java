package org.moxie.attestgate.ledger;

import org.moxie.attestgate.attestation.AttestationException;
import org.moxie.attestgate.attestation.ConfigurationException;
import org.moxie.attestgate.attestation.ErrorCategory;
import org.moxie.attestgate.attestation.ReceiptStatus;
import org.moxie.attestgate.attestation.TransientNetworkException;
import org.moxie.attestgate.config.Config;
import org.moxie.attestgate.config.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.ClientConnectionException;
import org.web3j.tx.RawTransactionManager;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link LedgerClient} on top of a web3j {@link Web3j} connection.
 * <p>
 * Reads are retried on transport failures with the configured {@link RetryPolicy}. Transactions are
 * signed locally with the configured signer key by a {@link RawTransactionManager} and broadcast
 * exactly once.
 */
public class Web3jLedgerClient implements LedgerClient {

  private static final Logger log = LoggerFactory.getLogger(Web3jLedgerClient.class);

  private static final int     LIMIT_EXCEEDED = -32005;
  private static final Pattern HTTP_STATUS    = Pattern.compile("Invalid response received: (\\d{3})");

  private final Web3j       web3j;
  private final RetryPolicy retryPolicy;
  private final RetryPolicy confirmationPolicy;
  private final BigInteger  fallbackGasLimit;
  private final long        chainId;
  private final Credentials credentials;

  public Web3jLedgerClient(Web3j web3j, Config config) {
    this.web3j              = web3j;
    this.retryPolicy        = config.getLedgerRetryPolicy();
    this.confirmationPolicy = config.getConfirmationPolicy();
    this.fallbackGasLimit   = config.getFallbackGasLimit();
    this.chainId            = config.getChainId();
    this.credentials        = config.getSignerKey().map(Credentials::create).orElse(null);
  }

  @Override
  public long getChainId() throws AttestationException {
    return read("eth_chainId", web3j.ethChainId()).getChainId().longValueExact();
  }

  @Override
  public Optional<LedgerTransaction> getTransaction(String txHash) throws AttestationException {
    Optional<org.web3j.protocol.core.methods.response.Transaction> result = read("eth_getTransactionByHash", web3j.ethGetTransactionByHash(txHash)).getTransaction();
    if (result.isEmpty()) return Optional.empty();

    org.web3j.protocol.core.methods.response.Transaction transaction = result.get();

    return Optional.of(new LedgerTransaction(transaction.getHash(),
                                             transaction.getFrom(),
                                             transaction.getTo(),
                                             transaction.getBlockNumberRaw() == null ? null : transaction.getBlockNumber().longValueExact(),
                                             transaction.getInput(),
                                             transaction.getValueRaw() == null ? BigInteger.ZERO : transaction.getValue()));
  }

  @Override
  public Optional<LedgerReceipt> getReceipt(String txHash) throws AttestationException {
    Optional<TransactionReceipt> result = read("eth_getTransactionReceipt", web3j.ethGetTransactionReceipt(txHash)).getTransactionReceipt();
    if (result.isEmpty()) return Optional.empty();

    TransactionReceipt receipt = result.get();
    List<LedgerLog>    logs    = new ArrayList<>();

    if (receipt.getLogs() != null) {
      for (Log entry : receipt.getLogs()) {
        logs.add(toLedgerLog(entry));
      }
    }

    return Optional.of(new LedgerReceipt(receipt.getTransactionHash(),
                                         receipt.getBlockNumberRaw() == null ? 0L : receipt.getBlockNumber().longValueExact(),
                                         receipt.getTo(),
                                         ReceiptStatus.fromQuantity(receipt.getStatus()),
                                         receipt.getGasUsedRaw() == null ? null : receipt.getGasUsed(),
                                         logs));
  }

  @Override
  public long getBlockHeight() throws AttestationException {
    return read("eth_blockNumber", web3j.ethBlockNumber()).getBlockNumber().longValueExact();
  }

  @Override
  public Optional<LedgerBlock> getBlock(long number) throws AttestationException {
    EthBlock.Block block = read("eth_getBlockByNumber", web3j.ethGetBlockByNumber(blockAt(number), false)).getBlock();
    if (block == null) return Optional.empty();

    return Optional.of(new LedgerBlock(block.getNumber().longValueExact(), block.getHash(), block.getTimestamp().longValueExact()));
  }

  @Override
  public List<LedgerLog> getLogs(String address, long fromHeight, long toHeight, List<String> topics) throws AttestationException {
    EthFilter filter = new EthFilter(blockAt(fromHeight), blockAt(toHeight), address);

    for (String topic : topics) {
      if (topic == null) filter.addNullTopic();
      else               filter.addSingleTopic(topic);
    }

    List<LedgerLog> logs = new ArrayList<>();

    for (EthLog.LogResult<?> result : read("eth_getLogs", web3j.ethGetLogs(filter)).getLogs()) {
      if (result instanceof EthLog.LogObject entry) {
        logs.add(toLedgerLog(entry));
      }
    }

    return logs;
  }

  @Override
  public List<Type> call(String address, Function function) throws AttestationException {
    String result;

    try {
      result = read("eth_call", web3j.ethCall(callTransaction(address, function), DefaultBlockParameterName.LATEST)).getValue();
    } catch (JsonRpcException e) {
      throw asCallFailure(function, e);
    }

    if (result == null || result.isEmpty() || "0x".equalsIgnoreCase(result)) {
      throw new AbiMismatchException(function.getName() + " returned no data from " + address);
    }

    List<Type> decoded;

    try {
      decoded = FunctionReturnDecoder.decode(result, function.getOutputParameters());
    } catch (RuntimeException e) {
      throw new AbiMismatchException(function.getName() + " returned data that does not decode: " + e.getMessage(), e);
    }

    if (decoded.size() != function.getOutputParameters().size()) {
      throw new AbiMismatchException(function.getName() + " returned " + decoded.size() + " values, expected " + function.getOutputParameters().size());
    }

    return decoded;
  }

  @Override
  public BigInteger estimateGas(String address, Function function) throws AttestationException {
    try {
      return read("eth_estimateGas", web3j.ethEstimateGas(callTransaction(address, function))).getAmountUsed();
    } catch (JsonRpcException e) {
      throw asCallFailure(function, e);
    }
  }

  @Override
  public BigInteger getGasPrice() throws AttestationException {
    return read("eth_gasPrice", web3j.ethGasPrice()).getGasPrice();
  }

  /**
   * Fee caps the way wallets derive them: twice the latest base fee plus the suggested tip. Nodes that
   * predate EIP-1559 only get a gas price.
   */
  @Override
  public FeeEstimate getFeeEstimate() throws AttestationException {
    BigInteger gasPrice = getGasPrice();
    BigInteger tip;

    try {
      tip = read("eth_maxPriorityFeePerGas", web3j.ethMaxPriorityFeePerGas()).getMaxPriorityFeePerGas();
    } catch (JsonRpcException e) {
      log.debug("No priority fee suggestion from the node: {}", e.getMessage());
      return FeeEstimate.legacy(gasPrice);
    }

    EthBlock.Block latest = read("eth_getBlockByNumber", web3j.ethGetBlockByNumber(DefaultBlockParameterName.LATEST, false)).getBlock();

    if (latest == null || latest.getBaseFeePerGasRaw() == null) {
      return FeeEstimate.legacy(gasPrice);
    }

    return new FeeEstimate(gasPrice, latest.getBaseFeePerGas().shiftLeft(1).add(tip), tip);
  }

  @Override
  public String submit(String address, Function function) throws AttestationException {
    if (credentials == null) {
      throw new ConfigurationException("Missing required setting: reward.signer_key");
    }

    BigInteger gasPrice = getGasPrice();
    BigInteger gasLimit = gasLimitFor(address, function);

    RawTransactionManager transactionManager = new RawTransactionManager(web3j, credentials, chainId);
    EthSendTransaction    sent;

    log.info("Submitting {} to {} from {} (gasLimit={}, gasPrice={})", function.getName(), address, credentials.getAddress(), gasLimit, gasPrice);

    try {
      sent = transactionManager.sendTransaction(gasPrice, gasLimit, address, FunctionEncoder.encode(function), BigInteger.ZERO);
    } catch (ClientConnectionException e) {
      throw connectionFailure("eth_sendRawTransaction", e);
    } catch (IOException e) {
      throw new TransientNetworkException("eth_sendRawTransaction failed: " + e.getMessage(), e);
    }

    if (sent.hasError()) {
      throw new TransactionRejectedException(function.getName() + " rejected by ledger: " + sent.getError().getMessage());
    }

    log.info("Submitted {} as {}", function.getName(), sent.getTransactionHash());
    return sent.getTransactionHash();
  }

  @Override
  public Optional<LedgerReceipt> waitForConfirmations(String txHash, int confirmations) throws AttestationException {
    for (int attempt = 1; attempt <= confirmationPolicy.maxAttempts(); attempt++) {
      Optional<LedgerReceipt> receipt = getReceipt(txHash);

      if (receipt.isPresent()) {
        if (receipt.get().status() == ReceiptStatus.FAILURE) {
          return receipt;
        }

        long depth = receipt.get().confirmationsAt(getBlockHeight());

        if (depth >= confirmations) {
          return receipt;
        }

        log.debug("{} has {}/{} confirmations", txHash, depth, confirmations);
      } else {
        log.debug("{} not mined yet", txHash);
      }

      if (attempt < confirmationPolicy.maxAttempts()) {
        try {
          confirmationPolicy.pause(attempt);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new TransientNetworkException("Interrupted while waiting for " + txHash, e);
        }
      }
    }

    log.warn("{} did not reach {} confirmations after {} polls", txHash, confirmations, confirmationPolicy.maxAttempts());
    return Optional.empty();
  }

  private BigInteger gasLimitFor(String address, Function function) throws AttestationException {
    try {
      BigInteger estimate = estimateGas(address, function);
      return estimate.multiply(BigInteger.valueOf(12)).divide(BigInteger.TEN);
    } catch (ContractCallException e) {
      log.warn("Gas estimate for {} failed, using fallback limit {}: {}", function.getName(), fallbackGasLimit, e.getMessage());
      return fallbackGasLimit;
    }
  }

  private ContractCallException asCallFailure(Function function, JsonRpcException e) throws JsonRpcException {
    if (!e.isRevert()) throw e;

    if (e.hasRevertData()) {
      return new ContractCallException(function.getName() + " reverted: " + e.getData(), e);
    }

    return new AbiMismatchException(function.getName() + " reverted without reason", e);
  }

  private Transaction callTransaction(String address, Function function) {
    return Transaction.createEthCallTransaction(credentials == null ? null : credentials.getAddress(), address, FunctionEncoder.encode(function));
  }

  private <T extends Response<?>> T read(String method, Request<?, T> request) throws AttestationException {
    return retryPolicy.run(method, () -> send(method, request));
  }

  private static <T extends Response<?>> T send(String method, Request<?, T> request) throws AttestationException {
    T response;

    try {
      response = request.send();
    } catch (ClientConnectionException e) {
      throw connectionFailure(method, e);
    } catch (IOException e) {
      throw new TransientNetworkException(method + " failed: " + e.getMessage(), e);
    }

    if (response.hasError()) {
      Response.Error error = response.getError();

      if (error.getCode() == LIMIT_EXCEEDED) {
        throw new TransientNetworkException(method + " rate limited: " + error.getMessage());
      }

      throw new JsonRpcException(method, error.getCode(), error.getMessage(), error.getData());
    }

    return response;
  }

  /**
   * {@link org.web3j.protocol.http.HttpService} reports non-2xx answers as a connection failure that
   * carries the status code in its message. Rate limits and server errors are worth retrying.
   */
  private static AttestationException connectionFailure(String method, ClientConnectionException e) {
    Matcher status = HTTP_STATUS.matcher(String.valueOf(e.getMessage()));

    if (status.find()) {
      int code = Integer.parseInt(status.group(1));

      if (code != 429 && code < 500) {
        return new LedgerException(ErrorCategory.CONFIGURATION, method + " returned HTTP " + code + ": " + e.getMessage(), e);
      }
    }

    return new TransientNetworkException(method + " failed: " + e.getMessage(), e);
  }

  private static LedgerLog toLedgerLog(Log entry) {
    return new LedgerLog(entry.getAddress(),
                         entry.getTopics(),
                         entry.getData(),
                         entry.getBlockNumberRaw() == null ? 0L : entry.getBlockNumber().longValueExact(),
                         entry.getTransactionHash(),
                         entry.getLogIndexRaw() == null ? 0L : entry.getLogIndex().longValueExact());
  }

  private static DefaultBlockParameter blockAt(long number) {
    return DefaultBlockParameter.valueOf(BigInteger.valueOf(number));
  }
}
