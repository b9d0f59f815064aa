/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.billing;

/**
 * Requester classification used for pricing, estimation and model access.
 *
 * <ul>
 * <li>{@link #GUEST} - unauthenticated chat, fixed per-message cap</li>
 * <li>{@link #TRIAL} - unauthenticated trial chat, same policy as guest</li>
 * <li>{@link #FREE} - authenticated user with no purchased balance, draws the daily free allowance</li>
 * <li>{@link #PAID} - authenticated user with a positive purchased balance</li>
 * </ul>
 */
public enum UserTier {

    GUEST("guest"),

    TRIAL("trial"),

    FREE("free"),

    PAID("paid");

    private final String value;

    UserTier(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isAuthenticated() {
        return this == FREE || this == PAID;
    }

    public static UserTier fromValue(String value) {
        for (UserTier tier : values()) {
            if (tier.value.equals(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown user tier: " + value);
    }
}
