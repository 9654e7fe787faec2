/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.webapp.integration.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.webapp.exceptions.CacheAccessException;

import java.io.IOException;
import java.util.Optional;

/**
 * Typed access to the {@link DistributedCache} using JSON payloads.
 *
 * <p>
 * Values are serialized with the application {@link ObjectMapper}, so anything the REST layer can serialize can be
 * cached. A payload that cannot be read back is reported as a {@link CacheAccessException} rather than a miss, which
 * lets callers log it before recomputing.
 */
@ApplicationScoped
public class JsonCacheClient {

    @Inject
    DistributedCache cache;

    @Inject
    ObjectMapper objectMapper;

    public JsonCacheClient() {
    }

    public JsonCacheClient(DistributedCache cache, ObjectMapper objectMapper) {
        this.cache = cache;
        this.objectMapper = objectMapper;
    }

    /**
     * Reads and deserializes a cached value.
     *
     * @param key
     *            cache key
     * @param type
     *            target type
     * @return the cached value, or empty on a miss
     * @throws CacheAccessException
     *             if the cache fails or the payload cannot be deserialized
     */
    public <T> Optional<T> tryGet(String key, TypeReference<T> type) {
        byte[] payload = cache.get(key);
        if (payload == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(payload, type));
        } catch (IOException e) {
            throw new CacheAccessException("Failed to deserialize cache entry " + key, e);
        }
    }

    /**
     * Serializes and stores a value.
     *
     * @param key
     *            cache key
     * @param value
     *            value to cache
     * @param options
     *            expiration settings
     * @throws CacheAccessException
     *             if the value cannot be serialized or the cache fails
     */
    public <T> void set(String key, T value, CacheEntryOptions options) {
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CacheAccessException("Failed to serialize cache entry " + key, e);
        }
        cache.set(key, payload, options);
    }
}
