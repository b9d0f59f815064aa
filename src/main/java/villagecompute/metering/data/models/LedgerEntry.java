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
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;

import org.hibernate.annotations.Check;

/**
 * Append-only accounting row recording one wallet balance change.
 *
 * <p>
 * Exactly one of {@code usage_record_id} and {@code source_wallet_id} is set. The database enforces this with a CHECK
 * constraint; code does not re-derive it.
 *
 * <p>
 * <b>Entry Types:</b> {@code usage_charge}, {@code renewal}.
 */
@Entity
@Table(
        name = "ledger_entries")
@Check(
        name = "ledger_entries_one_reference",
        constraints = "(CASE WHEN usage_record_id IS NOT NULL THEN 1 ELSE 0 END"
                + " + CASE WHEN source_wallet_id IS NOT NULL THEN 1 ELSE 0 END) = 1")
@NamedQuery(
        name = LedgerEntry.QUERY_FIND_LATEST_BY_WALLET_AND_TYPE,
        query = LedgerEntry.JPQL_FIND_LATEST_BY_WALLET_AND_TYPE)
@NamedQuery(
        name = LedgerEntry.QUERY_FIND_BY_USAGE_RECORD,
        query = LedgerEntry.JPQL_FIND_BY_USAGE_RECORD)
public class LedgerEntry extends PanacheEntityBase {

    public static final String TYPE_USAGE_CHARGE = "usage_charge";
    public static final String TYPE_RENEWAL = "renewal";

    public static final String JPQL_FIND_LATEST_BY_WALLET_AND_TYPE = "FROM LedgerEntry WHERE walletId = ?1 AND entryType = ?2 ORDER BY createdAt DESC";
    public static final String QUERY_FIND_LATEST_BY_WALLET_AND_TYPE = "LedgerEntry.findLatestByWalletAndType";

    public static final String JPQL_FIND_BY_USAGE_RECORD = "FROM LedgerEntry WHERE usageRecordId = ?1 ORDER BY createdAt ASC";
    public static final String QUERY_FIND_BY_USAGE_RECORD = "LedgerEntry.findByUsageRecord";

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "wallet_id",
            nullable = false)
    public UUID walletId;

    /** Signed dollars: negative for charges, positive for credits. */
    @Column(
            nullable = false,
            precision = 20,
            scale = 8)
    public BigDecimal amount;

    @Column(
            name = "balance_after",
            nullable = false,
            precision = 20,
            scale = 8)
    public BigDecimal balanceAfter;

    @Column(
            name = "entry_type",
            nullable = false)
    public String entryType;

    @Column(
            name = "usage_record_id")
    public UUID usageRecordId;

    @Column(
            name = "source_wallet_id")
    public UUID sourceWalletId;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt = Instant.now();

    /**
     * Finds the most recent entry of a type for a wallet (e.g., the last free-allowance renewal).
     *
     * @param walletId
     *            the wallet UUID
     * @param entryType
     *            entry type constant
     * @return the latest entry if any
     */
    public static Optional<LedgerEntry> findLatest(UUID walletId, String entryType) {
        return find("#" + QUERY_FIND_LATEST_BY_WALLET_AND_TYPE, walletId, entryType).firstResultOptional();
    }

    public static List<LedgerEntry> findByUsageRecord(UUID usageRecordId) {
        return find("#" + QUERY_FIND_BY_USAGE_RECORD, usageRecordId).list();
    }

    /**
     * Records a usage charge against a wallet.
     */
    public static LedgerEntry usageCharge(UUID walletId, BigDecimal amount, BigDecimal balanceAfter,
            UUID usageRecordId) {
        LedgerEntry entry = new LedgerEntry();
        entry.walletId = walletId;
        entry.amount = amount;
        entry.balanceAfter = balanceAfter;
        entry.entryType = TYPE_USAGE_CHARGE;
        entry.usageRecordId = usageRecordId;
        entry.createdAt = Instant.now();
        entry.persist();
        return entry;
    }

    /**
     * Records a free-allowance renewal. The wallet is its own source.
     */
    public static LedgerEntry renewal(UUID walletId, BigDecimal amount, BigDecimal balanceAfter) {
        LedgerEntry entry = new LedgerEntry();
        entry.walletId = walletId;
        entry.amount = amount;
        entry.balanceAfter = balanceAfter;
        entry.entryType = TYPE_RENEWAL;
        entry.sourceWalletId = walletId;
        entry.createdAt = Instant.now();
        entry.persist();
        return entry;
    }
}
