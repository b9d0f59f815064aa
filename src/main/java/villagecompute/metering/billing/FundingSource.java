/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.billing;

/**
 * Who pays for an inference call. Determined per request, never stored.
 */
public enum FundingSource {

    /** Authenticated paid user charged against purchased wallets. */
    PERSONAL_BALANCE("personal_balance"),

    /** Authenticated free user charged against the daily free-tier wallet. */
    FREE_ALLOWANCE("free_allowance"),

    /** Group chat member whose call is charged to the conversation owner. */
    OWNER_BALANCE("owner_balance"),

    /** Unauthenticated guest or trial user under the fixed per-message cap. */
    GUEST_FIXED("guest_fixed");

    private final String value;

    FundingSource(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static FundingSource fromValue(String value) {
        for (FundingSource source : values()) {
            if (source.value.equals(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown funding source: " + value);
    }
}
