/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.integration.reservation;

import java.util.List;

import org.jboss.logging.Logger;

import redis.clients.jedis.JedisPooled;

/**
 * Networked reservation store for multi-instance deployments. The increment, delete-at-zero and TTL refresh run as one
 * server-side Lua script so concurrent callers on different hosts serialize on the Redis key.
 */
public class JedisReservationStore implements ReservationStore, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(JedisReservationStore.class);

    static final String INCREMENT_SCRIPT = "local val = redis.call('INCRBYFLOAT', KEYS[1], ARGV[1]) "
            + "local num = tonumber(val) "
            + "if num <= 0 then redis.call('DEL', KEYS[1]) return '0' end "
            + "redis.call('EXPIRE', KEYS[1], tonumber(ARGV[2])) "
            + "return val";

    private final JedisPooled jedis;

    public JedisReservationStore(JedisPooled jedis) {
        this.jedis = jedis;
    }

    @Override
    public double increment(String key, double deltaCents, int ttlSeconds) {
        Object result = jedis.eval(INCREMENT_SCRIPT, List.of(key),
                List.of(Double.toString(deltaCents), Integer.toString(ttlSeconds)));
        return parse(key, result);
    }

    @Override
    public double get(String key) {
        return parse(key, jedis.get(key));
    }

    @Override
    public void close() {
        jedis.close();
    }

    private static double parse(String key, Object value) {
        if (value == null) {
            return 0;
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            LOG.errorf(e, "Reservation counter %s holds a non-numeric value: %s", key, value);
            throw new IllegalStateException("Corrupt reservation counter: " + key, e);
        }
    }
}
