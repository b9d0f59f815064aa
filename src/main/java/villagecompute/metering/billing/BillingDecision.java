/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.billing;

/**
 * Result of {@link BillingResolver#resolveBilling(BillingInput)}: a funding source, or a denial reason.
 */
public record BillingDecision(FundingSource fundingSource, DenialReason denialReason) {

    public static BillingDecision funded(FundingSource source) {
        return new BillingDecision(source, null);
    }

    public static BillingDecision denied(DenialReason reason) {
        return new BillingDecision(null, reason);
    }

    public boolean isDenied() {
        return denialReason != null;
    }
}
