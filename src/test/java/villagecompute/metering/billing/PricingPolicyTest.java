package villagecompute.metering.billing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Tests for fee, storage and per-tier policy constants.
 */
class PricingPolicyTest {

    @Test
    void testApplyFees_FifteenPercent() {
        assertEquals(0.15, PricingPolicy.TOTAL_FEE_RATE, 1e-12);
        assertEquals(1.15, PricingPolicy.applyFees(1.0), 1e-12);
    }

    @Test
    void testStorageCostPerCharacter() {
        // $0.50/GB-month for 50 years at 1000 chars/KB
        assertEquals(3e-7, PricingPolicy.STORAGE_COST_PER_CHARACTER, 1e-18);
    }

    @Test
    void testCalculateMessageCost_FeeNotAppliedToStorage() {
        ModelPricing basic = new ModelPricing("test/basic", 0.0000005, 0.0000015, 16_000, false);
        double modelCost = PricingPolicy.estimateModelCost(basic, 10, 8);

        double cost = PricingPolicy.calculateMessageCost(modelCost, 30, 31);

        assertEquals(0.000017, modelCost, 1e-15);
        assertEquals(0.000017 * 1.15 + 61 * 3e-7, cost, 1e-15);
    }

    @Test
    void testTierPolicy_AvailableCents() {
        assertEquals(1, TierPolicy.forTier(UserTier.GUEST).availableCents(500, 500));
        assertEquals(1, TierPolicy.forTier(UserTier.TRIAL).availableCents(500, 500));
        assertEquals(5, TierPolicy.forTier(UserTier.FREE).availableCents(500, 5));
        assertEquals(1_050, TierPolicy.forTier(UserTier.PAID).availableCents(1_000, 5));
    }

    @Test
    void testTierPolicy_PremiumAccessOnlyForPaid() {
        assertTrue(TierPolicy.forTier(UserTier.PAID).premiumAccess());
        assertFalse(TierPolicy.forTier(UserTier.FREE).premiumAccess());
        assertFalse(TierPolicy.forTier(UserTier.GUEST).premiumAccess());
    }

    @Test
    void testTierPolicy_NullTierRejected() {
        assertThrows(IllegalArgumentException.class, () -> TierPolicy.forTier(null));
    }
}
