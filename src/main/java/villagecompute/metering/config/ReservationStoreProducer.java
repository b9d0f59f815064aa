/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.config;

import java.net.URI;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import redis.clients.jedis.JedisPooled;
import villagecompute.metering.integration.reservation.InMemoryReservationStore;
import villagecompute.metering.integration.reservation.JedisReservationStore;
import villagecompute.metering.integration.reservation.ReservationStore;

/**
 * Produces the {@link ReservationStore} selected by {@code villagecompute.metering.reservation.store}.
 *
 * <p>
 * The in-memory store only guards a single instance. Horizontally scaled deployments must select {@code redis}.
 */
@ApplicationScoped
public class ReservationStoreProducer {

    private static final Logger LOG = Logger.getLogger(ReservationStoreProducer.class);

    @Inject
    MeteringConfig config;

    @Produces
    @ApplicationScoped
    public ReservationStore reservationStore() {
        if (MeteringConfig.STORE_REDIS.equals(config.reservationStore())) {
            LOG.infof("Using Redis reservation store at %s", URI.create(config.redisUrl()).getHost());
            return new JedisReservationStore(new JedisPooled(URI.create(config.redisUrl())));
        }
        LOG.info("Using in-memory reservation store");
        return new InMemoryReservationStore();
    }

    public void close(@Disposes ReservationStore store) {
        if (store instanceof JedisReservationStore jedisStore) {
            jedisStore.close();
        }
    }
}
