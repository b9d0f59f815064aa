/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.billing;

import java.math.BigDecimal;

/**
 * Remaining funds, in cents, for each dimension that caps a group-funded call.
 *
 * <p>
 * Each dimension is {@code ceiling - spent - reserved}; values may be zero or negative. The effective budget is the
 * minimum of the three.
 */
public record GroupRemaining(double conversationRemainingCents, double memberRemainingCents,
        double ownerRemainingCents) {

    /**
     * Computes remaining cents per dimension.
     *
     * @param conversationBudget
     *            conversation ceiling in dollars
     * @param conversationSpent
     *            conversation spending so far in dollars
     * @param memberBudget
     *            member ceiling in dollars ({@code 0} when the member has no budget row)
     * @param memberSpent
     *            member spending so far in dollars
     * @param ownerBalanceCents
     *            owner's purchased balance in cents, before reservations
     * @param reserved
     *            in-flight reservations per scope
     * @return remaining cents per dimension
     */
    public static GroupRemaining compute(BigDecimal conversationBudget, BigDecimal conversationSpent,
            BigDecimal memberBudget, BigDecimal memberSpent, double ownerBalanceCents, GroupReservedTotals reserved) {
        double conversationRemaining = toCents(conversationBudget) - toCents(conversationSpent)
                - reserved.conversationTotal();
        double memberRemaining = toCents(memberBudget) - toCents(memberSpent) - reserved.memberTotal();
        double ownerRemaining = ownerBalanceCents - reserved.payerTotal();
        return new GroupRemaining(conversationRemaining, memberRemaining, ownerRemaining);
    }

    public double effectiveCents() {
        return Math.min(conversationRemainingCents, Math.min(memberRemainingCents, ownerRemainingCents));
    }

    private static double toCents(BigDecimal dollars) {
        return dollars == null ? 0 : dollars.movePointRight(2).doubleValue();
    }
}
