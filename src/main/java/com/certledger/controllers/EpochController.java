package com.certledger.controllers;

import com.certledger.TokenomicsCoordinator;
import com.certledger.TokenomicsPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * Epoch, statistics and policy routes.
 */
public class EpochController implements Controller {

    private final TokenomicsCoordinator coordinator;
    private final TokenomicsPolicy policy;
    private final ObjectMapper objectMapper;

    public EpochController(TokenomicsCoordinator coordinator, TokenomicsPolicy policy, ObjectMapper objectMapper) {
        this.coordinator = coordinator;
        this.policy = policy.copy();
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/epochs/current", ctx -> ctx.json(coordinator.getEpochStatus()));
        app.get("/api/epochs/transitions", ctx -> ctx.json(coordinator.getTransitions()));
        app.get("/api/epochs", ctx -> ctx.json(coordinator.listEpochs()));
        app.post("/api/epochs/advance", this::advance);
        app.get("/api/stats", ctx -> ctx.json(coordinator.getStatistics()));
        app.get("/api/policy", ctx -> ctx.json(policy));
    }

    private void advance(Context ctx) {
        String operatorId;
        try {
            JsonNode node = objectMapper.readTree(ctx.body());
            operatorId = node != null && node.hasNonNull("operatorId") ? node.get("operatorId").asText() : null;
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Map.of("error", "Malformed body: " + e.getOriginalMessage()));
            return;
        }
        ctx.json(coordinator.advanceEpoch(operatorId));
    }
}
