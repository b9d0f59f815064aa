package villagecompute.metering.billing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.OptionalInt;

import org.junit.jupiter.api.Test;

/**
 * Tests for output budgeting across tiers.
 *
 * <p>
 * Basic model throughout: $0.0000005 prompt and $0.0000015 completion per token before the 15% fee, 16k context.
 */
class BudgetCalculatorTest {

    private static final ModelPricing BASIC = new ModelPricing("test/basic", 0.0000005, 0.0000015, 16_000, false);

    /** 30 characters. */
    private static final long PROMPT_CHARS = 30;

    @Test
    void testEstimateTokens_ConservativeForFreeAndGuest() {
        assertEquals(15, BudgetCalculator.estimateTokensForTier(UserTier.FREE, 30));
        assertEquals(15, BudgetCalculator.estimateTokensForTier(UserTier.GUEST, 29));
        assertEquals(8, BudgetCalculator.estimateTokensForTier(UserTier.PAID, 30));
        assertEquals(0, BudgetCalculator.estimateTokensForTier(UserTier.PAID, 0));
    }

    @Test
    void testOutputCostPerToken_StandardStorageRatioForEveryTier() {
        double free = BudgetCalculator.outputCostPerToken(0.000001725, UserTier.FREE);
        double paid = BudgetCalculator.outputCostPerToken(0.000001725, UserTier.PAID);

        // 4 stored chars per output token regardless of tier
        assertEquals(0.000001725 + 4 * PricingPolicy.STORAGE_COST_PER_CHARACTER, free, 1e-15);
        assertEquals(free, paid, 1e-15);
    }

    @Test
    void testCalculateBudget_FreeTierFiveCents() {
        // Given: 5¢ free allowance
        BudgetResult result = BudgetCalculator
                .calculateBudget(BudgetInput.forModel(UserTier.FREE, 0, 5, PROMPT_CHARS, BASIC));

        // Then: affordable with room well beyond the minimum response
        assertTrue(result.canAfford());
        assertTrue(result.maxOutputTokens() > PricingPolicy.MINIMUM_OUTPUT_TOKENS);
        assertEquals(15, result.estimatedInputTokens());
        assertEquals(0.002942625, result.estimatedMinimumCost(), 1e-12);
        assertTrue(result.notices().contains(BudgetNotice.FREE_TIER_NOTICE));
    }

    @Test
    void testCalculateBudget_ExactMinimumAffordsOneThousandTokens() {
        // Given: allowance exactly equal to the minimum cost (1000 output tokens)
        double minimumCents = 0.2942625;

        BudgetResult result = BudgetCalculator
                .calculateBudget(BudgetInput.forModel(UserTier.FREE, 0, minimumCents, PROMPT_CHARS, BASIC));

        assertTrue(result.canAfford());
        assertEquals(1000, result.maxOutputTokens());
    }

    @Test
    void testCalculateBudget_BelowMinimumCannotAfford() {
        // Given: allowance that funds 999 output tokens
        double cents = (0.000017625 + 999 * 0.000002925) * 100;

        BudgetResult result = BudgetCalculator
                .calculateBudget(BudgetInput.forModel(UserTier.FREE, 0, cents, PROMPT_CHARS, BASIC));

        assertFalse(result.canAfford());
        assertEquals(0, result.maxOutputTokens());
        assertTrue(result.notices().contains(BudgetNotice.INSUFFICIENT_FREE));
    }

    @Test
    void testCalculateBudget_PaidTierIncludesCushion() {
        // Given: paid balance of zero, only the 50¢ cushion
        BudgetResult result = BudgetCalculator
                .calculateBudget(BudgetInput.forModel(UserTier.PAID, 0, 0, PROMPT_CHARS, BASIC));

        assertTrue(result.canAfford());
        assertEquals(0.5, result.effectiveBalance(), 1e-12);
        assertFalse(result.notices().contains(BudgetNotice.LOW_BALANCE));
    }

    @Test
    void testCalculateBudget_PaidLowBalanceWarning() {
        // Given: -49¢ balance leaves 1¢ of cushion, about 3400 output tokens
        BudgetResult result = BudgetCalculator
                .calculateBudget(BudgetInput.forModel(UserTier.PAID, -49, 0, PROMPT_CHARS, BASIC));

        assertTrue(result.canAfford());
        assertTrue(result.maxOutputTokens() < 10_000);
        assertTrue(result.notices().contains(BudgetNotice.LOW_BALANCE));
    }

    @Test
    void testCalculateBudget_GuestCappedAtOneCent() {
        BudgetResult result = BudgetCalculator
                .calculateBudget(BudgetInput.forModel(UserTier.GUEST, 1_000, 1_000, PROMPT_CHARS, BASIC));

        assertEquals(0.01, result.effectiveBalance(), 1e-12);
        assertTrue(result.canAfford());
        assertTrue(result.notices().contains(BudgetNotice.GUEST_NOTICE));
    }

    @Test
    void testCalculateBudget_MonotonicInBalance() {
        int previous = -1;
        for (int cents = 0; cents <= 200; cents += 5) {
            BudgetResult result = BudgetCalculator
                    .calculateBudget(BudgetInput.forModel(UserTier.PAID, cents, 0, PROMPT_CHARS, BASIC));
            assertTrue(result.maxOutputTokens() >= previous, "maxOutputTokens decreased at " + cents + "¢");
            previous = result.maxOutputTokens();
        }
    }

    @Test
    void testCalculateBudget_NonIncreasingInReserved() {
        int previous = Integer.MAX_VALUE;
        for (int reserved = 0; reserved <= 1_050; reserved += 25) {
            BudgetResult result = BudgetCalculator
                    .calculateBudget(BudgetInput.forModel(UserTier.PAID, 1_000 - reserved, 0, PROMPT_CHARS, BASIC));
            assertTrue(result.maxOutputTokens() <= previous, "maxOutputTokens increased at reserved=" + reserved);
            previous = result.maxOutputTokens();
        }
    }

    @Test
    void testCalculateBudget_CapacityPercent() {
        // 40000 chars = 10000 tokens at the standard ratio, plus 1000 reserved output
        BudgetResult result = BudgetCalculator
                .calculateBudget(BudgetInput.forModel(UserTier.PAID, 10_000, 0, 40_000, BASIC));

        assertEquals(11_000, result.currentUsage());
        assertEquals(68.75, result.capacityPercent(), 1e-9);
        assertTrue(result.notices().contains(BudgetNotice.CAPACITY_WARNING));
    }

    @Test
    void testCalculateBudget_ZeroContextLength() {
        ModelPricing unknownContext = new ModelPricing("test/unknown", 0.0000005, 0.0000015, 0, false);

        BudgetResult result = BudgetCalculator
                .calculateBudget(BudgetInput.forModel(UserTier.PAID, 100, 0, PROMPT_CHARS, unknownContext));

        assertEquals(0, result.capacityPercent());
    }

    @Test
    void testComputeSafeMaxTokens_ContextBinding() {
        assertEquals(OptionalInt.of(2_000), BudgetCalculator.computeSafeMaxTokens(2_000, 16_000, 100));
        assertEquals(OptionalInt.empty(), BudgetCalculator.computeSafeMaxTokens(50_000, 16_000, 100));
        assertEquals(15_900, BudgetCalculator.effectiveMaxOutputTokens(50_000, 16_000, 100));
        assertEquals(0, BudgetCalculator.effectiveMaxOutputTokens(50_000, 16_000, 20_000));
    }

    @Test
    void testComputeWorstCaseCents() {
        double cents = BudgetCalculator.computeWorstCaseCents(0.000017625, 1_000, 0.000002925);

        assertEquals(0.2942625, cents, 1e-9);
    }

    @Test
    void testComputeWorstCaseCents_PaidCoversMaximumLengthReply() {
        // Given: $10.00 paid balance and a 4000-character prompt
        long promptChars = 4_000;
        BudgetResult budget = BudgetCalculator
                .calculateBudget(BudgetInput.forModel(UserTier.PAID, 1_000, 0, promptChars, BASIC));
        double reservedCents = BudgetCalculator.computeWorstCaseCents(budget.estimatedInputCost(),
                budget.maxOutputTokens(), budget.outputCostPerToken());

        // When: the reply uses every allowed token at the standard character ratio
        long outputChars = (long) budget.maxOutputTokens() * PricingPolicy.CHARS_PER_TOKEN_STANDARD;
        double modelCost = PricingPolicy.estimateModelCost(BASIC, budget.estimatedInputTokens(),
                budget.maxOutputTokens());
        double chargedCents = PricingPolicy.calculateMessageCost(modelCost, promptChars, outputChars) * 100;

        // Then: the settled charge fits inside the reservation and the available funds
        assertTrue(chargedCents <= reservedCents + PricingPolicy.FLOAT_TOLERANCE_CENTS,
                "charge " + chargedCents + " exceeds reservation " + reservedCents);
        assertTrue(reservedCents <= 1_050 + PricingPolicy.FLOAT_TOLERANCE_CENTS);
    }
}
