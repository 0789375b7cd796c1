package org.moxie.attestgate.reward;

/**
 * Whether the gate may broadcast a transaction. {@link #DRY_RUN} only estimates.
 */
public enum ExecutionMode {
  DRY_RUN,
  EXECUTE;

  public static ExecutionMode of(boolean execute) {
    return execute ? EXECUTE : DRY_RUN;
  }
}
