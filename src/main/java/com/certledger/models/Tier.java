package com.certledger.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reward classes ordered by reward magnitude; the ordinal is the order.
 */
public enum Tier {
    REJECTED,
    BRONZE,
    SILVER,
    GOLD,
    FOUNDER;

    public boolean isRewarded() {
        return this != REJECTED;
    }

    /**
     * Rewarded tiers, highest first.
     */
    public static List<Tier> rewardedDescending() {
        List<Tier> tiers = new ArrayList<>();
        for (Tier tier : values()) {
            if (tier.isRewarded()) {
                tiers.add(tier);
            }
        }
        Collections.reverse(tiers);
        return tiers;
    }
}
