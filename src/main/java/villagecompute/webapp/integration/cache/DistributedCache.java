/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.webapp.integration.cache;

/**
 * Key/value store shared by all request threads (and, for networked implementations, by all instances).
 *
 * <p>
 * Values are opaque byte arrays; typed access goes through {@link JsonCacheClient}. Implementations report
 * infrastructure failures with {@link villagecompute.webapp.exceptions.CacheAccessException}.
 */
public interface DistributedCache {

    /**
     * Reads an entry. A successful read restarts the entry's sliding expiration window.
     *
     * @param key
     *            cache key
     * @return the stored bytes, or null on a miss
     */
    byte[] get(String key);

    /**
     * Stores an entry, replacing any previous value for the key.
     *
     * @param key
     *            cache key
     * @param value
     *            payload
     * @param options
     *            expiration settings
     */
    void set(String key, byte[] value, CacheEntryOptions options);

    /**
     * Restarts the sliding expiration window of an entry without reading it.
     *
     * @param key
     *            cache key
     */
    void refresh(String key);

    void remove(String key);
}
