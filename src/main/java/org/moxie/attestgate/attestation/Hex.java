package org.moxie.attestgate.attestation;

import java.util.regex.Pattern;

/**
 * Shape checks for the hex strings that flow through the pipeline.
 */
public final class Hex {

  private static final Pattern HASH    = Pattern.compile("^0x[0-9a-fA-F]{64}$");
  private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

  private Hex() {}

  public static boolean isHash(String value) {
    return value != null && HASH.matcher(value).matches();
  }

  public static boolean isAddress(String value) {
    return value != null && ADDRESS.matcher(value).matches();
  }

  public static boolean sameValue(String left, String right) {
    return left != null && right != null && left.equalsIgnoreCase(right);
  }
}
