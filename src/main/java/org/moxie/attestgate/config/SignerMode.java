package org.moxie.attestgate.config;

import java.util.Locale;

/**
 * Who signs reward transactions.
 */
public enum SignerMode {
  /** Signed in-process with {@code reward.signer_key}. */
  LOCAL_KEY,
  /** Handed out as an unsigned transaction request for a wallet to sign and broadcast. */
  EXTERNAL;

  /**
   * @return the mode named by {@code value}, or null when the name is not recognised
   */
  public static SignerMode resolve(String value) {
    if (value == null) return LOCAL_KEY;

    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "local", "local_key", "private_key" -> LOCAL_KEY;
      case "external", "metamask", "wallet"    -> EXTERNAL;
      default                                  -> null;
    };
  }
}
