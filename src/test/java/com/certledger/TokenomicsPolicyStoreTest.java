package com.certledger;

import com.certledger.models.Tier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TokenomicsPolicyStoreTest {

    @TempDir
    Path tempDir;

    private TokenomicsPolicyStore store() {
        return new TokenomicsPolicyStore(new ObjectMapper(), tempDir.resolve("policy.json"));
    }

    @Test
    void firstStartWritesDefaults() {
        TokenomicsPolicy policy = store().loadOrDefault(new TokenomicsPolicy());

        assertTrue(Files.exists(tempDir.resolve("policy.json")));
        assertEquals(1_000_000L, policy.getBaseBudget());
        assertEquals(0.5, policy.getDecayFactor());
        assertEquals(0.01, policy.getFounderThresholds().get(Tier.BRONZE));
        assertEquals(2_000L, policy.rewardFor(Tier.GOLD));
    }

    @Test
    void storedValuesOverlayDefaults() throws Exception {
        Files.writeString(tempDir.resolve("policy.json"),
            "{\"baseBudget\":5000,\"rewards\":{\"GOLD\":700},\"epochNames\":[\"genesis\"],\"unknownKnob\":true}");

        TokenomicsPolicy policy = store().loadOrDefault(new TokenomicsPolicy());

        assertEquals(5_000L, policy.getBaseBudget());
        assertEquals(700L, policy.rewardFor(Tier.GOLD));
        assertEquals(500L, policy.rewardFor(Tier.SILVER));
        assertEquals(0.5, policy.getDecayFactor());
        assertEquals("genesis", policy.epochName(0));
        assertEquals("epoch-1", policy.epochName(1));
    }

    @Test
    void savedPolicyLoadsBack() {
        TokenomicsPolicy custom = new TokenomicsPolicy();
        custom.setDecayFactor(0.8);
        custom.setThresholdStep(0.05);
        store().save(custom);

        TokenomicsPolicy loaded = store().loadOrDefault(new TokenomicsPolicy());

        assertEquals(0.8, loaded.getDecayFactor());
        assertEquals(0.05, loaded.getThresholdStep());
    }

    @Test
    void unreadableFileFallsBackToDefaults() throws Exception {
        Files.writeString(tempDir.resolve("policy.json"), "{broken");

        TokenomicsPolicy policy = store().loadOrDefault(new TokenomicsPolicy());

        assertEquals(1_000_000L, policy.getBaseBudget());
    }

    @Test
    void storedDecayOutsideRangeIsRefused() throws Exception {
        Files.writeString(tempDir.resolve("policy.json"), "{\"decayFactor\":1.5}");

        assertThrows(IllegalArgumentException.class, () -> store().loadOrDefault(new TokenomicsPolicy()));
    }

    @Test
    void validateRejectsUnorderedThresholds() {
        TokenomicsPolicy policy = new TokenomicsPolicy();
        policy.getBaseThresholds().put(Tier.SILVER, 0.80);

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
            () -> TokenomicsPolicyStore.validate(policy));
        assertTrue(error.getMessage().contains("baseThresholds.GOLD"));
    }

    @Test
    void validateRejectsRejectedThresholdAndBadRewards() {
        TokenomicsPolicy withRejected = new TokenomicsPolicy();
        withRejected.getFounderThresholds().put(Tier.REJECTED, 0.0);
        assertThrows(IllegalArgumentException.class, () -> TokenomicsPolicyStore.validate(withRejected));

        TokenomicsPolicy zeroReward = new TokenomicsPolicy();
        zeroReward.getRewards().put(Tier.BRONZE, 0L);
        assertThrows(IllegalArgumentException.class, () -> TokenomicsPolicyStore.validate(zeroReward));

        TokenomicsPolicy noBudget = new TokenomicsPolicy();
        noBudget.setBaseBudget(0);
        assertThrows(IllegalArgumentException.class, () -> TokenomicsPolicyStore.validate(noBudget));

        assertDoesNotThrow(() -> TokenomicsPolicyStore.validate(new TokenomicsPolicy()));
    }
}
