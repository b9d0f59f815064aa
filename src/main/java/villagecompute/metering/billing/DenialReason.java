/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.billing;

/**
 * Why a billing resolution refused to fund a call.
 */
public enum DenialReason {

    PREMIUM_REQUIRES_BALANCE("premium_requires_balance"),

    PREMIUM_REQUIRES_ACCOUNT("premium_requires_account"),

    INSUFFICIENT_BALANCE("insufficient_balance"),

    INSUFFICIENT_FREE_ALLOWANCE("insufficient_free_allowance"),

    GUEST_LIMIT_EXCEEDED("guest_limit_exceeded");

    private final String value;

    DenialReason(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
