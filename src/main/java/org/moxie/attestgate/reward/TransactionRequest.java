package org.moxie.attestgate.reward;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.moxie.attestgate.ledger.FeeEstimate;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * An unsigned {@code eth_sendTransaction} request, quantities hex-encoded, for a wallet to sign and
 * broadcast. Either the two EIP-1559 fee caps or {@code gasPrice} is set, never both.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransactionRequest(@JsonProperty("from") String from,
                                 @JsonProperty("to") String to,
                                 @JsonProperty("data") String data,
                                 @JsonProperty("value") String value,
                                 @JsonProperty("chainId") String chainId,
                                 @JsonProperty("gas") String gas,
                                 @JsonProperty("gasPrice") String gasPrice,
                                 @JsonProperty("maxFeePerGas") String maxFeePerGas,
                                 @JsonProperty("maxPriorityFeePerGas") String maxPriorityFeePerGas)
{
  static TransactionRequest of(String from, String to, String data, long chainId, BigInteger gas, FeeEstimate fees) {
    boolean eip1559 = fees.maxFeePerGas() != null;

    return new TransactionRequest(from,
                                  to,
                                  data,
                                  "0x0",
                                  Numeric.encodeQuantity(BigInteger.valueOf(chainId)),
                                  quantity(gas),
                                  eip1559 ? null : quantity(fees.gasPrice()),
                                  eip1559 ? quantity(fees.maxFeePerGas()) : null,
                                  eip1559 ? quantity(fees.maxPriorityFeePerGas()) : null);
  }

  private static String quantity(BigInteger value) {
    return value == null ? null : Numeric.encodeQuantity(value);
  }
}
