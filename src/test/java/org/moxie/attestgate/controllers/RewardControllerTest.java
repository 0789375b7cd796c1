package org.moxie.attestgate.controllers;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.moxie.attestgate.Fixtures;
import org.moxie.attestgate.attestation.AttestationReference;
import org.moxie.attestgate.attestation.AttestationVerdict;
import org.moxie.attestgate.attestation.TransactionNotFoundException;
import org.moxie.attestgate.config.Config;
import org.moxie.attestgate.config.Mode;
import org.moxie.attestgate.producers.ObjectMapperProducer;
import org.moxie.attestgate.reward.ExecutionMode;
import org.moxie.attestgate.reward.RewardExecutionGate;
import org.moxie.attestgate.reward.RewardIntent;
import org.moxie.attestgate.reward.RewardOutcome;
import org.moxie.attestgate.reward.RewardStatus;
import org.moxie.attestgate.verification.VerificationOrchestrator;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RewardControllerTest {

  @Mock
  private Config config;

  @Mock
  private VerificationOrchestrator orchestrator;

  @Mock
  private RewardExecutionGate gate;

  private final ObjectMapper mapper = ObjectMapperProducer.create();

  private RewardController controller;

  @BeforeEach
  void setUp() throws Exception {
    controller              = new RewardController();
    controller.config       = config;
    controller.mapper       = mapper;
    controller.orchestrator = orchestrator;
    controller.gate         = gate;

    when(config.getAttestationContract()).thenReturn(Fixtures.ATTESTATION_CONTRACT);
    when(config.getChainId()).thenReturn(Fixtures.CHAIN_ID);
    when(config.getMode()).thenReturn(Mode.REAL);
    when(orchestrator.verify(any(AttestationReference.class))).thenReturn(Fixtures.verdict(true));
  }

  private static String body(String extra) {
    return "{\"attestationTxHash\":\"" + Fixtures.TX_HASH + "\",\"slotKey\":\"" + Fixtures.SLOT_KEY + "\",\"participant\":\"" +
           Fixtures.PARTICIPANT + "\",\"quantity\":150" + extra + "}";
  }

  private static RewardOutcome outcome(RewardStatus status) {
    return new RewardOutcome(status, status == RewardStatus.DRY_RUN, "0x", null, null, null, null, null, null, null, null, Fixtures.verdict(true));
  }

  @Test
  void reward_withoutExecuteFlag_dryRunsAfterVerifying() throws Exception {
    when(gate.executeIfVerified(any(), any(), eq(Mode.REAL), eq(ExecutionMode.DRY_RUN))).thenReturn(outcome(RewardStatus.DRY_RUN));

    Response response = controller.reward(body(""));

    assertEquals(200, response.getStatus());
    assertTrue(((String) response.getEntity()).contains("\"DRY_RUN\""));

    ArgumentCaptor<RewardIntent> intent = ArgumentCaptor.forClass(RewardIntent.class);
    verify(orchestrator).verify(any());
    verify(gate).executeIfVerified(any(AttestationVerdict.class), intent.capture(), eq(Mode.REAL), eq(ExecutionMode.DRY_RUN));
    assertEquals(BigInteger.valueOf(150), intent.getValue().quantity());
    assertEquals(Fixtures.ATTESTED_DIGEST, intent.getValue().payloadHash());
  }

  @Test
  void reward_withRewardTxHash_checksSubmission() throws Exception {
    when(gate.checkSubmission(any(), eq(Fixtures.OTHER_TX_HASH), eq(Mode.REAL))).thenReturn(outcome(RewardStatus.EXECUTED));

    Response response = controller.reward(body(",\"rewardTxHash\":\"" + Fixtures.OTHER_TX_HASH + "\""));

    assertEquals(200, response.getStatus());
    verify(gate, never()).executeIfVerified(any(), any(), any(), any());
  }

  @Test
  void reward_unverifiedAttestation_passesVerdictToGateWithoutIntent() throws Exception {
    when(orchestrator.verify(any())).thenReturn(Fixtures.verdict(false));
    when(gate.executeIfVerified(any(), isNull(), eq(Mode.REAL), any())).thenReturn(outcome(RewardStatus.VERIFICATION_NOT_PASSED));

    Response response = controller.reward(body(",\"execute\":true"));

    assertTrue(((String) response.getEntity()).contains("\"VERIFICATION_NOT_PASSED\""));
    verify(gate).executeIfVerified(argThat(verdict -> !verdict.verified()), isNull(), eq(Mode.REAL), eq(ExecutionMode.EXECUTE));
  }

  @Test
  void reward_simulationMode_isConflict() throws Exception {
    when(config.getMode()).thenReturn(Mode.SIMULATION);
    when(gate.executeIfVerified(any(), any(), eq(Mode.SIMULATION), any())).thenThrow(new IllegalStateException("reward execution requires real attestation mode"));

    WebApplicationException e = assertThrows(WebApplicationException.class, () -> controller.reward(body(",\"execute\":true")));

    assertEquals(409, e.getResponse().getStatus());
  }

  @Test
  void reward_missingSlotKey_isBadRequest() {
    String noSlot = "{\"attestationTxHash\":\"" + Fixtures.TX_HASH + "\",\"participant\":\"" + Fixtures.PARTICIPANT + "\",\"quantity\":1}";

    WebApplicationException e = assertThrows(WebApplicationException.class, () -> controller.reward(noSlot));

    assertEquals(400, e.getResponse().getStatus());
  }

  @Test
  void reward_malformedBody_isBadRequest() {
    assertEquals(400, assertThrows(WebApplicationException.class, () -> controller.reward("{not json")).getResponse().getStatus());
    assertEquals(400, assertThrows(WebApplicationException.class, () -> controller.reward("{}")).getResponse().getStatus());
  }

  @Test
  void reward_unknownAttestation_isNotFound() throws Exception {
    when(orchestrator.verify(any())).thenThrow(new TransactionNotFoundException(Fixtures.TX_HASH));

    WebApplicationException e = assertThrows(WebApplicationException.class, () -> controller.reward(body("")));

    assertEquals(404, e.getResponse().getStatus());
    verifyNoInteractions(gate);
  }
}
