/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.services;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import villagecompute.metering.api.types.UserTierInfoType;
import villagecompute.metering.billing.UserTier;
import villagecompute.metering.config.MeteringConfig;
import villagecompute.metering.data.models.LedgerEntry;
import villagecompute.metering.data.models.Wallet;

/**
 * Wallet-backed balances and tier classification.
 *
 * <p>
 * <b>Tier Rules:</b>
 * <ul>
 * <li>No user id: {@code guest}</li>
 * <li>Sum of {@code purchased} wallets &gt; 0: {@code paid}</li>
 * <li>Otherwise: {@code free}, funded by the {@code free_tier} wallet</li>
 * </ul>
 *
 * <p>
 * <b>Free Allowance Renewal:</b> renewal is lazy and driven by the ledger. When the latest {@code renewal} entry of the
 * free-tier wallet predates today's UTC midnight, the wallet is topped up to the configured allowance (never lowered)
 * and a renewal entry records the delta. The wallet row is locked, so two racing requests renew once.
 */
@ApplicationScoped
public class BalanceService {

    private static final Logger LOG = Logger.getLogger(BalanceService.class);

    @Inject
    MeteringConfig config;

    /**
     * Classifies a user and returns raw balances in fractional cents. Renews the free allowance first when due.
     *
     * @param userId
     *            requesting user, or null for guests
     * @return tier with purchased balance and free allowance
     */
    public UserTierInfoType getUserTierInfo(UUID userId) {
        if (userId == null) {
            return UserTierInfoType.GUEST;
        }

        renewFreeAllowanceIfDue(userId);

        // Own transaction: a fresh session sees charges committed since the caller's last read
        return QuarkusTransaction.requiringNew().call(() -> {
            List<Wallet> wallets = Wallet.findByUserId(userId);
            if (wallets.isEmpty()) {
                return new UserTierInfoType(UserTier.FREE, 0, 0);
            }

            double balanceCents = toCents(Wallet.sumBalance(wallets, Wallet.TYPE_PURCHASED));
            double freeAllowanceCents = toCents(Wallet.sumBalance(wallets, Wallet.TYPE_FREE_TIER));
            UserTier tier = balanceCents > 0 ? UserTier.PAID : UserTier.FREE;
            return new UserTierInfoType(tier, balanceCents, freeAllowanceCents);
        });
    }

    /**
     * Tops the free-tier wallet up to the daily allowance if no renewal happened since today's UTC midnight.
     *
     * @param userId
     *            wallet owner
     * @return true if the wallet balance was raised
     */
    public boolean renewFreeAllowanceIfDue(UUID userId) {
        return QuarkusTransaction.requiringNew().call(() -> {
            Optional<Wallet> walletOpt = Wallet.findByUserAndTypeForUpdate(userId, Wallet.TYPE_FREE_TIER);
            if (walletOpt.isEmpty()) {
                return false;
            }
            Wallet wallet = walletOpt.get();

            Optional<LedgerEntry> lastRenewal = LedgerEntry.findLatest(wallet.id, LedgerEntry.TYPE_RENEWAL);
            if (lastRenewal.isPresent() && !lastRenewal.get().createdAt.isBefore(startOfTodayUtc())) {
                return false;
            }

            BigDecimal allowance = config.freeAllowanceDollars();
            if (wallet.balance.compareTo(allowance) >= 0) {
                return false;
            }

            BigDecimal delta = allowance.subtract(wallet.balance);
            wallet.balance = allowance;
            LedgerEntry.renewal(wallet.id, delta, allowance);

            LOG.infof("Renewed free allowance: userId=%s, walletId=%s, delta=%s", userId, wallet.id,
                    delta.toPlainString());
            return true;
        });
    }

    /**
     * Creates the standard wallets for a new user: an empty purchased wallet charged first and a free-tier wallet
     * holding today's allowance.
     *
     * @param userId
     *            new user
     * @return created wallets in charge order
     */
    @Transactional
    public List<Wallet> provisionWallets(UUID userId) {
        if (!Wallet.findByUserId(userId).isEmpty()) {
            throw new IllegalStateException("Wallets already provisioned for user " + userId);
        }

        Wallet purchased = Wallet.create(userId, Wallet.TYPE_PURCHASED, Wallet.PRIORITY_PURCHASED, BigDecimal.ZERO);
        BigDecimal allowance = config.freeAllowanceDollars();
        Wallet freeTier = Wallet.create(userId, Wallet.TYPE_FREE_TIER, Wallet.PRIORITY_FREE_TIER, allowance);
        LedgerEntry.renewal(freeTier.id, allowance, allowance);

        LOG.infof("Provisioned wallets: userId=%s, freeAllowance=%s", userId, allowance.toPlainString());
        return List.of(purchased, freeTier);
    }

    static Instant startOfTodayUtc() {
        return LocalDate.now(ZoneOffset.UTC).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    static double toCents(BigDecimal dollars) {
        return dollars.movePointRight(2).doubleValue();
    }
}
