/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.webapp.integration.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.webapp.config.CacheProfileConfig;

/**
 * In-process {@link DistributedCache} backed by Caffeine.
 *
 * <p>
 * Each entry carries its own {@link CacheEntryOptions}; a variable {@link Expiry} turns them into Caffeine expiration
 * times:
 * <ul>
 * <li><b>Create/update:</b> min(sliding window, absolute lifetime)</li>
 * <li><b>Read:</b> sliding window restarts, never past the absolute deadline</li>
 * </ul>
 *
 * <p>
 * Sized by {@code villagecompute.cache.maximum-entries}. Networked stores (Redis, Infinispan) can replace this bean
 * without touching callers.
 */
@ApplicationScoped
public class CaffeineDistributedCache implements DistributedCache {

    private static final Logger LOG = Logger.getLogger(CaffeineDistributedCache.class);

    @Inject
    CacheProfileConfig cacheProfileConfig;

    private Ticker ticker;
    private Cache<String, StoredEntry> store;

    public CaffeineDistributedCache() {
    }

    public CaffeineDistributedCache(Ticker ticker, long maximumEntries) {
        this.ticker = ticker;
        this.store = buildStore(ticker, maximumEntries);
    }

    @PostConstruct
    void init() {
        ticker = Ticker.systemTicker();
        store = buildStore(ticker, cacheProfileConfig.maximumEntries());
        LOG.infof("Initialized distributed cache (maximum entries: %d)", cacheProfileConfig.maximumEntries());
    }

    @Override
    public byte[] get(String key) {
        StoredEntry entry = store.getIfPresent(key);
        if (entry == null) {
            LOG.debugf("Cache miss: key=%s", key);
            return null;
        }
        return entry.value().clone();
    }

    @Override
    public void set(String key, byte[] value, CacheEntryOptions options) {
        long now = ticker.read();
        long absoluteDeadline = options.absoluteExpirationRelativeToNow() == null ? Long.MAX_VALUE
                : now + options.absoluteExpirationRelativeToNow().toNanos();
        store.put(key, new StoredEntry(value.clone(), options, absoluteDeadline));
        LOG.debugf("Cached entry: key=%s, bytes=%d", key, value.length);
    }

    @Override
    public void refresh(String key) {
        store.getIfPresent(key);
    }

    @Override
    public void remove(String key) {
        store.invalidate(key);
    }

    private static Cache<String, StoredEntry> buildStore(Ticker ticker, long maximumEntries) {
        return Caffeine.newBuilder().maximumSize(maximumEntries).ticker(ticker).executor(Runnable::run)
                .expireAfter(new OptionsExpiry()).build();
    }

    /**
     * Cached payload with the options it was written with.
     *
     * @param absoluteDeadline
     *            ticker value after which the entry is gone, {@link Long#MAX_VALUE} when unbounded
     */
    record StoredEntry(byte[] value, CacheEntryOptions options, long absoluteDeadline) {
    }

    static final class OptionsExpiry implements Expiry<String, StoredEntry> {

        @Override
        public long expireAfterCreate(String key, StoredEntry entry, long currentTime) {
            return remaining(entry, currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, StoredEntry entry, long currentTime, long currentDuration) {
            return remaining(entry, currentTime);
        }

        @Override
        public long expireAfterRead(String key, StoredEntry entry, long currentTime, long currentDuration) {
            if (entry.options().slidingExpiration() == null) {
                return currentDuration;
            }
            return remaining(entry, currentTime);
        }

        private long remaining(StoredEntry entry, long currentTime) {
            long untilDeadline = entry.absoluteDeadline() == Long.MAX_VALUE ? Long.MAX_VALUE
                    : Math.max(0L, entry.absoluteDeadline() - currentTime);
            if (entry.options().slidingExpiration() == null) {
                return untilDeadline;
            }
            return Math.min(entry.options().slidingExpiration().toNanos(), untilDeadline);
        }
    }
}
