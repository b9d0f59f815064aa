package villagecompute.metering.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.metering.config.MeteringConfig;
import villagecompute.metering.data.models.GuestUsage;
import villagecompute.metering.exceptions.DailyLimitExceededException;

import java.time.Instant;
import java.util.Optional;

/**
 * Daily message quota for guest and trial turns.
 *
 * <p>
 * Counters reset lazily: a record whose {@code reset_at} predates today's UTC midnight counts as zero. The counter is
 * only incremented after a turn succeeds, so failed turns do not consume quota.
 */
@ApplicationScoped
public class GuestUsageService {

    private static final Logger LOG = Logger.getLogger(GuestUsageService.class);

    @Inject
    MeteringConfig config;

    /**
     * Messages the guest has sent today, read in a new transaction so counts committed by
     * {@link #recordMessage(String, String)} are always visible.
     */
    public int getMessageCount(String guestToken, String ipHash) {
        return QuarkusTransaction.requiringNew().call(() -> {
            Optional<GuestUsage> usage = GuestUsage.findHighest(guestToken, ipHash);
            if (usage.isEmpty() || needsReset(usage.get())) {
                return 0;
            }
            return usage.get().messageCount;
        });
    }

    /**
     * Rejects the turn if today's quota is used up.
     *
     * @throws DailyLimitExceededException
     *             when the guest has reached the daily limit
     */
    public void checkQuota(String guestToken, String ipHash) {
        requireIdentity(ipHash);
        int count = getMessageCount(guestToken, ipHash);
        if (count >= config.guestDailyMessageLimit()) {
            LOG.infof("Guest daily limit reached: count=%d, limit=%d", count, config.guestDailyMessageLimit());
            throw new DailyLimitExceededException(
                    "Daily guest message limit of " + config.guestDailyMessageLimit() + " reached");
        }
    }

    /**
     * Counts one successful guest message.
     *
     * @return today's count after the increment
     */
    public int recordMessage(String guestToken, String ipHash) {
        requireIdentity(ipHash);
        return QuarkusTransaction.requiringNew().call(() -> {
            Instant today = BalanceService.startOfTodayUtc();
            GuestUsage usage = GuestUsage.findForUpdate(guestToken, ipHash).orElse(null);
            if (usage == null) {
                usage = new GuestUsage();
                usage.guestToken = guestToken;
                usage.ipHash = ipHash;
                usage.messageCount = 0;
                usage.resetAt = today;
            } else if (needsReset(usage)) {
                usage.messageCount = 0;
                usage.resetAt = today;
            }
            usage.messageCount++;
            if (usage.guestToken == null) {
                usage.guestToken = guestToken;
            }
            usage.persist();
            return usage.messageCount;
        });
    }

    private static boolean needsReset(GuestUsage usage) {
        return usage.resetAt == null || usage.resetAt.isBefore(BalanceService.startOfTodayUtc());
    }

    private static void requireIdentity(String ipHash) {
        if (ipHash == null || ipHash.isBlank()) {
            throw new IllegalArgumentException("Guest turns require an address hash");
        }
    }
}
