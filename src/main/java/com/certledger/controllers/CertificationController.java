package com.certledger.controllers;

import com.certledger.TokenomicsCoordinator;
import com.certledger.models.Certificate;
import com.certledger.models.CertificationResult;
import com.certledger.models.CertificationStatus;
import com.certledger.models.SubmissionRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Submission and certificate routes. Domain exceptions propagate to the
 * handlers registered in {@code Main}.
 */
public class CertificationController implements Controller {

    private final TokenomicsCoordinator coordinator;
    private final ObjectMapper objectMapper;

    public CertificationController(TokenomicsCoordinator coordinator, ObjectMapper objectMapper) {
        this.coordinator = coordinator;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/certifications", this::submit);
        // count before {id} so it is not read as a contribution id
        app.get("/api/certificates/count", this::countCertificates);
        app.get("/api/certificates/{id}", this::getCertificate);
        app.get("/api/certificates/{id}/onchain-ref", this::getOnChainRef);
        app.put("/api/certificates/{id}/onchain-ref", this::putOnChainRef);
        app.get("/api/balances/{contributorId}", this::getBalance);
        app.get("/api/evaluations/{id}", this::getEvaluations);
    }

    private void submit(Context ctx) {
        SubmissionRequest request;
        try {
            request = objectMapper.readValue(ctx.body(), SubmissionRequest.class);
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Map.of("error", "Malformed submission: " + e.getOriginalMessage()));
            return;
        }
        if (request == null) {
            ctx.status(400).json(Map.of("error", "Submission body required"));
            return;
        }
        CertificationResult result = coordinator.submitForCertification(
            request.getContributionId(), request.getContributorId(), request.getMetrics());
        ctx.status(result.getStatus() == CertificationStatus.CERTIFIED ? 201 : 200).json(result);
    }

    private void countCertificates(Context ctx) {
        ctx.json(Map.of("count", coordinator.getTotalCertified()));
    }

    private void getCertificate(Context ctx) {
        String id = ctx.pathParam("id");
        Optional<Certificate> certificate = coordinator.getCertificate(id);
        if (certificate.isEmpty()) {
            ctx.status(404).json(Map.of("error", "Certificate not found: " + id));
            return;
        }
        ctx.json(certificate.get());
    }

    private void getOnChainRef(Context ctx) {
        String id = ctx.pathParam("id");
        if (coordinator.getCertificate(id).isEmpty()) {
            ctx.status(404).json(Map.of("error", "Certificate not found: " + id));
            return;
        }
        Map<String, Object> body = new HashMap<>();
        body.put("contributionId", id);
        body.put("onChainRef", coordinator.onChainRefFor(id).orElse(null));
        ctx.json(body);
    }

    private void putOnChainRef(Context ctx) {
        String id = ctx.pathParam("id");
        String ref;
        try {
            JsonNode node = objectMapper.readTree(ctx.body());
            ref = node != null && node.hasNonNull("onChainRef") ? node.get("onChainRef").asText() : null;
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Map.of("error", "Malformed body: " + e.getOriginalMessage()));
            return;
        }
        ctx.json(coordinator.attachOnChainRef(id, ref));
    }

    private void getBalance(Context ctx) {
        String contributorId = ctx.pathParam("contributorId");
        Map<String, Object> body = new HashMap<>();
        body.put("contributorId", contributorId);
        body.put("balance", coordinator.getBalance(contributorId));
        body.put("certificates", coordinator.getCertificatesFor(contributorId));
        ctx.json(body);
    }

    private void getEvaluations(Context ctx) {
        ctx.json(coordinator.getEvaluations(ctx.pathParam("id")));
    }
}
