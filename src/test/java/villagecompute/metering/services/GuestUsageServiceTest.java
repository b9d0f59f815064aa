package villagecompute.metering.services;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.UUID;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;

import jakarta.inject.Inject;

import org.junit.jupiter.api.Test;

import villagecompute.metering.data.models.GuestUsage;
import villagecompute.metering.exceptions.DailyLimitExceededException;
import villagecompute.metering.testing.H2TestResource;

/**
 * Tests for the guest daily message quota.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class GuestUsageServiceTest {

    @Inject
    GuestUsageService guestUsageService;

    @Test
    void testRecordMessage_CountsUpToLimit() {
        String token = "token-" + UUID.randomUUID();
        String ip = "ip-" + UUID.randomUUID();

        for (int i = 1; i <= 5; i++) {
            assertDoesNotThrow(() -> guestUsageService.checkQuota(token, ip));
            assertEquals(i, guestUsageService.recordMessage(token, ip));
        }

        assertThrows(DailyLimitExceededException.class, () -> guestUsageService.checkQuota(token, ip));
    }

    @Test
    void testCheckQuota_NewTokenSameAddressStillLimited() {
        // Given: a guest used today's messages, then cleared their token
        String ip = "ip-" + UUID.randomUUID();
        for (int i = 0; i < 5; i++) {
            guestUsageService.recordMessage("token-" + UUID.randomUUID(), ip);
        }

        // Then: the address match still counts
        assertEquals(5, guestUsageService.getMessageCount("fresh-token", ip));
        assertThrows(DailyLimitExceededException.class, () -> guestUsageService.checkQuota("fresh-token", ip));
    }

    @Test
    void testRecordMessage_WithoutTokenMatchesByAddress() {
        String ip = "ip-" + UUID.randomUUID();

        assertEquals(1, guestUsageService.recordMessage(null, ip));
        assertEquals(2, guestUsageService.recordMessage(null, ip));
        assertEquals(2, guestUsageService.getMessageCount(null, ip));
    }

    @Test
    void testRecordMessage_ResetsOnNewDay() {
        // Given: yesterday's counter at the limit
        String token = "token-" + UUID.randomUUID();
        String ip = "ip-" + UUID.randomUUID();
        QuarkusTransaction.requiringNew().run(() -> {
            GuestUsage usage = new GuestUsage();
            usage.guestToken = token;
            usage.ipHash = ip;
            usage.messageCount = 5;
            usage.resetAt = BalanceService.startOfTodayUtc().minus(Duration.ofDays(1));
            usage.persist();
        });

        // Then: stale count reads as zero and the next message starts over
        assertEquals(0, guestUsageService.getMessageCount(token, ip));
        assertDoesNotThrow(() -> guestUsageService.checkQuota(token, ip));
        assertEquals(1, guestUsageService.recordMessage(token, ip));
    }

    @Test
    void testCheckQuota_AddressHashRequired() {
        assertThrows(IllegalArgumentException.class, () -> guestUsageService.checkQuota("token", null));
        assertThrows(IllegalArgumentException.class, () -> guestUsageService.recordMessage("token", " "));
    }
}
