package villagecompute.metering.services;

import java.time.Instant;

import io.quarkus.cache.Cache;
import io.quarkus.cache.CacheName;
import io.quarkus.cache.CacheResult;
import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.metering.billing.ModelPricing;
import villagecompute.metering.data.models.ModelPrice;
import villagecompute.metering.exceptions.ModelNotFoundException;

/**
 * Per-model provider prices and context windows, read from {@code model_prices}.
 *
 * <p>
 * Lookups go through the {@code model-pricing} cache (Caffeine-backed, TTL and size in {@code application.yaml}).
 * Unknown models are not cached, so a model added later becomes visible on the next lookup.
 */
@ApplicationScoped
public class ModelCatalogService {

    private static final Logger LOG = Logger.getLogger(ModelCatalogService.class);

    static final String CACHE_NAME = "model-pricing";

    @Inject
    @CacheName(CACHE_NAME)
    Cache pricingCache;

    /**
     * Returns pricing for a model.
     *
     * @param modelId
     *            provider model identifier, e.g. {@code openai/gpt-4o-mini}
     * @return prices before fees, context length and premium flag
     * @throws ModelNotFoundException
     *             if the model is not in the catalog
     */
    @CacheResult(
            cacheName = CACHE_NAME)
    public ModelPricing getPricing(String modelId) {
        return QuarkusTransaction.requiringNew().call(() -> {
            ModelPrice price = ModelPrice.findById(modelId);
            if (price == null) {
                throw new ModelNotFoundException("Model not found: " + modelId);
            }
            LOG.debugf("Loaded model pricing: model=%s", modelId);
            return price.toPricing();
        });
    }

    /**
     * Inserts or replaces a catalog entry and evicts it from the cache once the write has committed.
     */
    public ModelPricing upsertPricing(ModelPricing pricing) {
        QuarkusTransaction.requiringNew().run(() -> {
            ModelPrice price = ModelPrice.findById(pricing.modelId());
            if (price == null) {
                price = new ModelPrice();
                price.modelId = pricing.modelId();
            }
            price.inputPricePerToken = pricing.inputPricePerToken();
            price.outputPricePerToken = pricing.outputPricePerToken();
            price.contextLength = pricing.contextLength();
            price.premium = pricing.premium();
            price.updatedAt = Instant.now();
            price.persist();
        });

        // Evict only after commit
        pricingCache.invalidate(pricing.modelId()).await().indefinitely();
        LOG.infof("Updated model pricing: model=%s, input=%s, output=%s, context=%d, premium=%s", pricing.modelId(),
                pricing.inputPricePerToken(), pricing.outputPricePerToken(), pricing.contextLength(),
                pricing.premium());
        return pricing;
    }

    public void invalidateAll() {
        pricingCache.invalidateAll().await().indefinitely();
    }
}
