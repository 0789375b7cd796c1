package org.moxie.attestgate.cli;

import org.moxie.attestgate.attestation.ErrorCategory;
import org.moxie.attestgate.reward.RewardStatus;

public enum ExitCode {
  OK(0),
  CONFIGURATION(2),
  VERIFICATION_FAILED(3),
  LEDGER_REJECTED(4),
  PENDING(5),
  TRANSIENT(6);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  public static ExitCode of(ErrorCategory category) {
    return switch (category) {
      case CONFIGURATION                      -> CONFIGURATION;
      case TRANSIENT_NETWORK                  -> TRANSIENT;
      case PROOF_UNAVAILABLE                  -> PENDING;
      case POLICY_FAILURE, INTEGRITY_MISMATCH -> VERIFICATION_FAILED;
      case REPLAY_REJECTED                    -> LEDGER_REJECTED;
    };
  }

  public static ExitCode of(RewardStatus status) {
    return switch (status) {
      case EXECUTED, DRY_RUN, AWAITING_SIGNATURE -> OK;
      case VERIFICATION_NOT_PASSED               -> VERIFICATION_FAILED;
      case ALREADY_EXECUTED, REJECTED_BY_LEDGER  -> LEDGER_REJECTED;
      case PENDING_CONFIRMATION                  -> PENDING;
    };
  }
}
