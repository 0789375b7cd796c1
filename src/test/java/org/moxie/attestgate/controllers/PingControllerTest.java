package org.moxie.attestgate.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.Test;
import org.moxie.attestgate.config.Config;
import org.moxie.attestgate.config.Mode;
import org.moxie.attestgate.producers.ObjectMapperProducer;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PingControllerTest {

  @Test
  void getPing_reportsModeAndChain() throws Exception {
    Config config = mock(Config.class);
    when(config.getMode()).thenReturn(Mode.SIMULATION);
    when(config.getChainId()).thenReturn(114L);
    when(config.getRewardContract()).thenReturn(Optional.empty());

    PingController controller = new PingController();
    controller.config = config;
    controller.mapper = ObjectMapperProducer.create();

    Response response = controller.getPing();
    JsonNode body     = new ObjectMapper().readTree((String) response.getEntity());

    assertEquals(200, response.getStatus());
    assertEquals("PONG", body.get("status").asText());
    assertEquals("SIMULATION", body.get("mode").asText());
    assertEquals(114, body.get("chainId").asLong());
    assertFalse(body.get("rewardsEnabled").asBoolean());
  }
}
