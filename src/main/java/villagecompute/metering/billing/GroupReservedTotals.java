/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.billing;

/**
 * In-flight reservation totals, in cents, for the three scopes that gate a group-funded call.
 *
 * @param memberTotal
 *            reserved against the member's budget in this conversation
 * @param conversationTotal
 *            reserved against the conversation budget
 * @param payerTotal
 *            reserved against the paying owner's wallets (shared with the owner's personal reservations)
 */
public record GroupReservedTotals(double memberTotal, double conversationTotal, double payerTotal) {

    public static final GroupReservedTotals NONE = new GroupReservedTotals(0, 0, 0);
}
