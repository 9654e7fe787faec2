/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.webapp.integration.cache;

import java.time.Duration;

/**
 * Expiration settings for a cache entry.
 *
 * <p>
 * A sliding expiration removes the entry after a period without access; an absolute expiration caps its lifetime
 * regardless of access. When both are set the entry expires at whichever comes first.
 *
 * @param slidingExpiration
 *            inactivity window, or null
 * @param absoluteExpirationRelativeToNow
 *            maximum lifetime from the time of the write, or null
 */
public record CacheEntryOptions(Duration slidingExpiration, Duration absoluteExpirationRelativeToNow) {

    public CacheEntryOptions {
        if (slidingExpiration == null && absoluteExpirationRelativeToNow == null) {
            throw new IllegalArgumentException("At least one of sliding or absolute expiration is required");
        }
        requirePositive("slidingExpiration", slidingExpiration);
        requirePositive("absoluteExpirationRelativeToNow", absoluteExpirationRelativeToNow);
    }

    public static CacheEntryOptions sliding(Duration slidingExpiration) {
        return new CacheEntryOptions(slidingExpiration, null);
    }

    public static CacheEntryOptions absolute(Duration absoluteExpirationRelativeToNow) {
        return new CacheEntryOptions(null, absoluteExpirationRelativeToNow);
    }

    private static void requirePositive(String name, Duration duration) {
        if (duration != null && (duration.isZero() || duration.isNegative())) {
            throw new IllegalArgumentException(name + " must be positive: " + duration);
        }
    }
}
