package org.moxie.attestgate.controllers;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.moxie.attestgate.config.Config;

import java.util.LinkedHashMap;
import java.util.Map;

@ApplicationScoped
@Path("/v1/ping")
public class PingController {

  @Inject
  Config config;

  @Inject
  ObjectMapper mapper;

  @GET
  @Produces(MediaType.APPLICATION_JSON)
  public Response getPing() {
    Map<String, Object> status = new LinkedHashMap<>();
    status.put("status", "PONG");
    status.put("mode", config.getMode());
    status.put("chainId", config.getChainId());
    status.put("rewardsEnabled", config.getRewardContract().isPresent());

    return JsonResponses.ok(mapper, status);
  }
}
