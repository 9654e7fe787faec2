/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.webapp.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Map;

/**
 * Named cache profiles and sizing for the in-process distributed cache.
 *
 * <p>
 * Configuration prefix: {@code villagecompute.cache}
 *
 * <p>
 * <b>Example (application.properties):</b>
 *
 * <pre>
 * villagecompute.cache.maximum-entries=10000
 * villagecompute.cache.profiles.sitemap-nodes.duration=PT24H
 * </pre>
 *
 * @see CacheProfileName
 */
@ConfigMapping(
        prefix = "villagecompute.cache")
public interface CacheProfileConfig {

    /**
     * Maximum number of entries kept by the cache before size-based eviction kicks in.
     *
     * @return maximum entries (default: 10000)
     */
    @WithDefault("10000")
    long maximumEntries();

    /**
     * @return cache profiles keyed by {@link CacheProfileName} constants
     */
    Map<String, CacheProfile> profiles();

    /**
     * Looks up a profile by name.
     *
     * @param name
     *            profile name
     * @return the profile
     * @throws IllegalStateException
     *             if the profile is not configured
     */
    default CacheProfile profile(String name) {
        CacheProfile profile = profiles().get(name);
        if (profile == null) {
            throw new IllegalStateException(
                    "Cache profile '" + name + "' is not configured (villagecompute.cache.profiles." + name + ")");
        }
        return profile;
    }

    interface CacheProfile {

        /**
         * Lifetime of entries cached under this profile. Used as a sliding expiration for server-side caching and as
         * {@code max-age} for HTTP caching.
         */
        Duration duration();
    }
}
