/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.services;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.metering.billing.GroupReservedTotals;
import villagecompute.metering.billing.PricingPolicy;
import villagecompute.metering.config.MeteringConfig;
import villagecompute.metering.exceptions.BalanceReservedException;
import villagecompute.metering.integration.reservation.ReservationStore;
import villagecompute.metering.observability.BillingMetrics;

/**
 * Race guard for in-flight spending.
 *
 * <p>
 * Each inference call reserves its worst-case cost on one counter per scope it draws from before the provider is
 * called. The store applies the increment atomically and returns the new total, which is then checked against that
 * scope's ceiling. A total above the ceiling means concurrent reservations have claimed the headroom: every counter
 * touched is rolled back and {@link BalanceReservedException} is thrown.
 *
 * <p>
 * <b>Scope Keys:</b>
 * <ul>
 * <li>{@code chat:reserved:{userId}} - payer's personal reservations</li>
 * <li>{@code chat:group-reserved:{conversationId}:{memberId}} - member's share of a group budget</li>
 * <li>{@code chat:conversation-reserved:{conversationId}} - conversation-wide group budget</li>
 * </ul>
 */
@ApplicationScoped
public class ReservationService {

    private static final Logger LOG = Logger.getLogger(ReservationService.class);

    static final String SCOPE_PERSONAL = "personal";
    static final String SCOPE_GROUP = "group";

    /** Reservations are rounded up to the precision of wallet balances (8 dollar decimals). */
    private static final double RESERVATION_PRECISION = 1e6;

    @Inject
    ReservationStore store;

    @Inject
    MeteringConfig config;

    @Inject
    BillingMetrics metrics;

    /**
     * Ceilings for the three counters of a group reservation, in cents.
     */
    public record GroupCeilings(double payerCents, double memberCents, double conversationCents) {
    }

    public static String userKey(UUID userId) {
        return "chat:reserved:" + userId;
    }

    public static String memberKey(UUID conversationId, UUID memberId) {
        return "chat:group-reserved:" + conversationId + ":" + memberId;
    }

    public static String conversationKey(UUID conversationId) {
        return "chat:conversation-reserved:" + conversationId;
    }

    /**
     * Rounds raw worst-case cents up so a reservation never under-covers the charge.
     */
    public static double roundUpCents(double rawCents) {
        return Math.ceil(rawCents * RESERVATION_PRECISION) / RESERVATION_PRECISION;
    }

    public double getUserReservedTotal(UUID userId) {
        return store.get(userKey(userId));
    }

    public GroupReservedTotals getGroupReservedTotals(UUID payerId, UUID conversationId, UUID memberId) {
        return new GroupReservedTotals(store.get(memberKey(conversationId, memberId)),
                store.get(conversationKey(conversationId)), store.get(userKey(payerId)));
    }

    /**
     * Reserves against the requester's own funds.
     *
     * @param userId
     *            payer
     * @param rawCents
     *            worst-case cost in raw cents
     * @param ceilingCents
     *            most the payer may have in flight: raw balance plus cushion, or the raw free allowance
     * @return held reservation
     * @throws BalanceReservedException
     *             if concurrent reservations leave no room
     */
    public Reservation reservePersonal(UUID userId, double rawCents, double ceilingCents) {
        double amount = roundUpCents(rawCents);
        String key = userKey(userId);
        double newTotal = store.increment(key, amount, config.reservationTtlSeconds());

        if (exceeds(newTotal, ceilingCents)) {
            store.increment(key, -amount, config.reservationTtlSeconds());
            metrics.recordReservation(SCOPE_PERSONAL, "rejected");
            LOG.infof("Reservation rejected: key=%s, amount=%.8f¢, newTotal=%.8f¢, ceiling=%.8f¢", key, amount,
                    newTotal, ceilingCents);
            throw new BalanceReservedException(
                    "Balance is reserved by other requests in progress, please retry shortly");
        }

        metrics.recordReservation(SCOPE_PERSONAL, "accepted");
        LOG.debugf("Reserved %.8f¢ on %s (total %.8f¢)", amount, key, newTotal);
        return new Reservation(List.of(key), amount, SCOPE_PERSONAL, this);
    }

    /**
     * Reserves against an owner-funded group conversation: the owner's personal counter, the member's counter and the
     * conversation counter. Each new total is checked against its own ceiling. On a rejection or a store failure the
     * counters already incremented are rolled back.
     */
    public Reservation reserveGroup(UUID payerId, UUID conversationId, UUID memberId, double rawCents,
            GroupCeilings ceilings) {
        double amount = roundUpCents(rawCents);
        List<String> keys = List.of(userKey(payerId), memberKey(conversationId, memberId),
                conversationKey(conversationId));
        double[] limits = {ceilings.payerCents(), ceilings.memberCents(), ceilings.conversationCents()};

        List<String> incremented = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            String key = keys.get(i);
            double newTotal;
            try {
                newTotal = store.increment(key, amount, config.reservationTtlSeconds());
            } catch (RuntimeException e) {
                LOG.errorf(e, "Group reservation failed on %s, rolling back %d counter(s)", key, incremented.size());
                rollBack(incremented, amount);
                throw e;
            }
            incremented.add(key);
            if (exceeds(newTotal, limits[i])) {
                rollBack(incremented, amount);
                metrics.recordReservation(SCOPE_GROUP, "rejected");
                LOG.infof("Group reservation rejected: key=%s, amount=%.8f¢, newTotal=%.8f¢, ceiling=%.8f¢", key,
                        amount, newTotal, limits[i]);
                throw new BalanceReservedException(
                        "Group budget is reserved by other requests in progress, please retry shortly");
            }
        }

        metrics.recordReservation(SCOPE_GROUP, "accepted");
        LOG.debugf("Reserved %.8f¢ on group conversation %s for member %s", amount, conversationId, memberId);
        return new Reservation(keys, amount, SCOPE_GROUP, this);
    }

    /**
     * Decrements every key of the reservation. Called once, from {@link Reservation#close()}.
     *
     * <p>
     * A store failure is logged and not rethrown: the turn has already committed or rolled back, and the counter
     * expires with its TTL.
     */
    void release(Reservation reservation) {
        for (String key : reservation.getKeys()) {
            try {
                store.increment(key, -reservation.getAmountCents(), config.reservationTtlSeconds());
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to release %.8f¢ on %s; counter will expire after %ds",
                        reservation.getAmountCents(), key, config.reservationTtlSeconds());
            }
        }
        metrics.recordReservation(reservation.getScope(), "released");
    }

    private void rollBack(List<String> keys, double amount) {
        for (String key : keys) {
            try {
                store.increment(key, -amount, config.reservationTtlSeconds());
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to roll back %.8f¢ on %s; counter will expire after %ds", amount, key,
                        config.reservationTtlSeconds());
            }
        }
    }

    private static boolean exceeds(double newTotal, double ceilingCents) {
        return newTotal > ceilingCents + PricingPolicy.FLOAT_TOLERANCE_CENTS;
    }
}
