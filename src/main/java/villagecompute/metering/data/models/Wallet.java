/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.data.models;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.LockModeType;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;

/**
 * A user's spendable funds of one kind.
 *
 * <p>
 * A user holds several wallets, charged in ascending {@code priority} order. Balances are dollars at 8 decimal
 * places and may go negative (the purchased wallet absorbs the cushion). Wallets are mutated only by charge
 * settlement and free-allowance renewal, always inside a transaction with the wallet row locked.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK)</li>
 * <li>{@code user_id} (UUID) - owning user</li>
 * <li>{@code type} (TEXT) - {@code purchased} or {@code free_tier}</li>
 * <li>{@code balance} (NUMERIC(20,8)) - dollars</li>
 * <li>{@code priority} (INT) - charge order, lower first</li>
 * <li>{@code created_at} (TIMESTAMPTZ)</li>
 * </ul>
 */
@Entity
@Table(
        name = "wallets")
@NamedQuery(
        name = Wallet.QUERY_FIND_BY_USER_ID,
        query = Wallet.JPQL_FIND_BY_USER_ID)
@NamedQuery(
        name = Wallet.QUERY_FIND_BY_USER_AND_TYPE,
        query = Wallet.JPQL_FIND_BY_USER_AND_TYPE)
public class Wallet extends PanacheEntityBase {

    public static final String TYPE_PURCHASED = "purchased";
    public static final String TYPE_FREE_TIER = "free_tier";

    public static final int PRIORITY_PURCHASED = 0;
    public static final int PRIORITY_FREE_TIER = 1;

    public static final String JPQL_FIND_BY_USER_ID = "FROM Wallet WHERE userId = ?1 ORDER BY priority ASC";
    public static final String QUERY_FIND_BY_USER_ID = "Wallet.findByUserId";

    public static final String JPQL_FIND_BY_USER_AND_TYPE = "FROM Wallet WHERE userId = ?1 AND type = ?2";
    public static final String QUERY_FIND_BY_USER_AND_TYPE = "Wallet.findByUserAndType";

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            nullable = false)
    public String type;

    @Column(
            nullable = false,
            precision = 20,
            scale = 8)
    public BigDecimal balance = BigDecimal.ZERO;

    @Column(
            nullable = false)
    public int priority;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt = Instant.now();

    /**
     * Finds all wallets for a user in charge order.
     *
     * @param userId
     *            the user UUID
     * @return wallets ordered by priority ascending
     */
    public static List<Wallet> findByUserId(UUID userId) {
        return find("#" + QUERY_FIND_BY_USER_ID, userId).list();
    }

    /**
     * Finds all wallets for a user in charge order, locking them for update until the transaction ends.
     *
     * @param userId
     *            the user UUID
     * @return locked wallets ordered by priority ascending
     */
    public static List<Wallet> findByUserIdForUpdate(UUID userId) {
        return find(JPQL_FIND_BY_USER_ID, userId).withLock(LockModeType.PESSIMISTIC_WRITE).list();
    }

    public static Optional<Wallet> findByUserAndType(UUID userId, String type) {
        return find("#" + QUERY_FIND_BY_USER_AND_TYPE, userId, type).firstResultOptional();
    }

    public static Optional<Wallet> findByUserAndTypeForUpdate(UUID userId, String type) {
        return find(JPQL_FIND_BY_USER_AND_TYPE, userId, type).withLock(LockModeType.PESSIMISTIC_WRITE)
                .firstResultOptional();
    }

    /**
     * Sum of balances of the given type for a user, in dollars.
     */
    public static BigDecimal sumBalance(List<Wallet> wallets, String type) {
        BigDecimal total = BigDecimal.ZERO;
        for (Wallet wallet : wallets) {
            if (type.equals(wallet.type)) {
                total = total.add(wallet.balance);
            }
        }
        return total;
    }

    public static Wallet create(UUID userId, String type, int priority, BigDecimal balance) {
        Wallet wallet = new Wallet();
        wallet.userId = userId;
        wallet.type = type;
        wallet.priority = priority;
        wallet.balance = balance;
        wallet.createdAt = Instant.now();
        wallet.persist();
        return wallet;
    }
}
