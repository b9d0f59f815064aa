/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.config;

import java.math.BigDecimal;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Runtime settings of the metering engine, read from {@code application.yaml} under the {@code villagecompute.metering}
 * prefix and validated at startup.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code villagecompute.metering.free-allowance-cents} - daily free allowance (default: 5)</li>
 * <li>{@code villagecompute.metering.guest-daily-message-limit} - guest messages per UTC day (default: 5)</li>
 * <li>{@code villagecompute.metering.reservation.ttl-seconds} - reservation counter TTL (default: 180)</li>
 * <li>{@code villagecompute.metering.reservation.store} - {@code memory} or {@code redis} (default: memory)</li>
 * <li>{@code villagecompute.metering.reservation.redis-url} - Redis endpoint for the networked store</li>
 * <li>{@code villagecompute.metering.provider.name} - provider label recorded on completions</li>
 * </ul>
 *
 * <p>
 * Pricing constants are not configurable; they live in {@link villagecompute.metering.billing.PricingPolicy}.
 */
@ApplicationScoped
@Startup
public class MeteringConfig {

    private static final Logger LOG = Logger.getLogger(MeteringConfig.class);

    public static final String STORE_MEMORY = "memory";
    public static final String STORE_REDIS = "redis";

    @ConfigProperty(
            name = "villagecompute.metering.free-allowance-cents",
            defaultValue = "5")
    int freeAllowanceCents;

    @ConfigProperty(
            name = "villagecompute.metering.guest-daily-message-limit",
            defaultValue = "5")
    int guestDailyMessageLimit;

    @ConfigProperty(
            name = "villagecompute.metering.reservation.ttl-seconds",
            defaultValue = "180")
    int reservationTtlSeconds;

    @ConfigProperty(
            name = "villagecompute.metering.reservation.store",
            defaultValue = STORE_MEMORY)
    String reservationStore;

    @ConfigProperty(
            name = "villagecompute.metering.reservation.redis-url",
            defaultValue = "redis://localhost:6379")
    String redisUrl;

    @ConfigProperty(
            name = "villagecompute.metering.provider.name",
            defaultValue = "openrouter")
    String providerName;

    /**
     * Rejects settings the engine cannot run with.
     *
     * @throws MeteringConfigurationException
     *             if any value is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        if (freeAllowanceCents < 0) {
            throw fail("villagecompute.metering.free-allowance-cents must be >= 0, got " + freeAllowanceCents);
        }
        if (guestDailyMessageLimit < 0) {
            throw fail("villagecompute.metering.guest-daily-message-limit must be >= 0, got "
                    + guestDailyMessageLimit);
        }
        if (reservationTtlSeconds <= 0) {
            throw fail("villagecompute.metering.reservation.ttl-seconds must be positive, got "
                    + reservationTtlSeconds);
        }
        if (!STORE_MEMORY.equals(reservationStore) && !STORE_REDIS.equals(reservationStore)) {
            throw fail("villagecompute.metering.reservation.store must be 'memory' or 'redis', got '"
                    + reservationStore + "'");
        }
        if (STORE_REDIS.equals(reservationStore) && (redisUrl == null || redisUrl.isBlank())) {
            throw fail("villagecompute.metering.reservation.redis-url is required when the redis store is selected");
        }
        LOG.infof("Metering configured: freeAllowance=%d¢, guestDailyLimit=%d, reservationStore=%s, ttl=%ds",
                freeAllowanceCents, guestDailyMessageLimit, reservationStore, reservationTtlSeconds);
    }

    private MeteringConfigurationException fail(String message) {
        LOG.fatal(message);
        return new MeteringConfigurationException(message);
    }

    public int freeAllowanceCents() {
        return freeAllowanceCents;
    }

    /** Free allowance in wallet dollars. */
    public BigDecimal freeAllowanceDollars() {
        return BigDecimal.valueOf(freeAllowanceCents).movePointLeft(2);
    }

    public int guestDailyMessageLimit() {
        return guestDailyMessageLimit;
    }

    public int reservationTtlSeconds() {
        return reservationTtlSeconds;
    }

    public String reservationStore() {
        return reservationStore;
    }

    public String redisUrl() {
        return redisUrl;
    }

    public String providerName() {
        return providerName;
    }

    /**
     * Exception thrown when metering configuration is invalid.
     */
    public static class MeteringConfigurationException extends RuntimeException {

        public MeteringConfigurationException(String message) {
            super(message);
        }

        public MeteringConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
