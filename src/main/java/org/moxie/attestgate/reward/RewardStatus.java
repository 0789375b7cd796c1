package org.moxie.attestgate.reward;

public enum RewardStatus {
  EXECUTED,
  DRY_RUN,
  AWAITING_SIGNATURE,
  ALREADY_EXECUTED,
  VERIFICATION_NOT_PASSED,
  PENDING_CONFIRMATION,
  REJECTED_BY_LEDGER
}
