package org.moxie.attestgate.config;

import java.util.Locale;
import java.util.Set;

/**
 * Execution context of an entry point. {@code SIMULATION} runs are demos against local data and
 * must never reach code that writes rewards to a real ledger.
 */
public enum Mode {
  SIMULATION,
  REAL;

  private static final Set<String> SIMULATION_VALUES = Set.of("1", "true", "yes", "on", "simulation");
  private static final Set<String> REAL_VALUES       = Set.of("0", "false", "no", "off", "real");

  /**
   * Resolve the mode from the two settings that can select it. A recognised {@code useSimulation}
   * flag wins; otherwise {@code mode} is read, and anything but "simulation" means {@code REAL}.
   */
  public static Mode resolve(String useSimulation, String mode) {
    if (useSimulation != null) {
      String flag = useSimulation.trim().toLowerCase(Locale.ROOT);
      if (SIMULATION_VALUES.contains(flag)) return SIMULATION;
      if (REAL_VALUES.contains(flag))       return REAL;
    }

    if (mode != null && "simulation".equals(mode.trim().toLowerCase(Locale.ROOT))) {
      return SIMULATION;
    }

    return REAL;
  }

  /**
   * Fail unless this is a real run.
   *
   * @param context name of the operation that requires real mode, used in the message
   */
  public void requireReal(String context) {
    if (this != REAL) {
      throw new IllegalStateException(context + " requires real attestation mode, but the run is in " + name().toLowerCase(Locale.ROOT) + " mode");
    }
  }
}
