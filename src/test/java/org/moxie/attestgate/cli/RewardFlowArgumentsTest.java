package org.moxie.attestgate.cli;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RewardFlowArgumentsTest {

  @Test
  void parse_noArguments_dryRunsRewardFlow() {
    RewardFlow.Arguments arguments = RewardFlow.Arguments.parse(new String[0]);

    assertEquals(RewardFlowCommand.Command.REWARD, arguments.command());
    assertFalse(arguments.execute());
    assertNull(arguments.attestationTxHash());
    assertNull(arguments.rewardTxHash());
  }

  @Test
  void parse_allOptions() {
    RewardFlow.Arguments arguments = RewardFlow.Arguments.parse(new String[] {"reward", "--attestation", "0xaa", "--execute", "--reward-tx", "0xbb"});

    assertEquals("0xaa", arguments.attestationTxHash());
    assertEquals("0xbb", arguments.rewardTxHash());
    assertTrue(arguments.execute());
  }

  @Test
  void parse_verify() {
    assertEquals(RewardFlowCommand.Command.VERIFY, RewardFlow.Arguments.parse(new String[] {"verify"}).command());
  }

  @Test
  void parse_missingValue_throws() {
    assertThrows(IllegalArgumentException.class, () -> RewardFlow.Arguments.parse(new String[] {"--attestation"}));
  }

  @Test
  void parse_unknownArgument_throws() {
    assertThrows(IllegalArgumentException.class, () -> RewardFlow.Arguments.parse(new String[] {"--force"}));
  }
}
