package com.phoenix.worker.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;

/**
 * Results of completed activities keyed by (instance id, activity name, input hash), so a repeated
 * invocation with identical input is answered without calling the external service again.
 */
public class IdempotencyStore {

    private static final Object MARKER = new Object();

    private final Cache<String, Object> results;
    private final JsonMapper canonicalMapper;

    public IdempotencyStore(Duration ttl, long maxEntries) {
        this.results = CacheBuilder.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maxEntries)
            .build();
        this.canonicalMapper = JsonMapper.builder()
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .findAndAddModules()
            .build();
    }

    public String key(UUID instanceId, String activity, Object input) {
        return instanceId + ":" + activity + ":" + hash(input);
    }

    /**
     * @return the remembered result; a remembered {@code null} is reported as {@link NullResult#INSTANCE}
     */
    public Optional<Object> find(String key) {
        return Optional.ofNullable(results.getIfPresent(key));
    }

    public static Object unwrap(Object remembered) {
        return remembered == NullResult.INSTANCE ? null : remembered;
    }

    public void remember(String key, Object value) {
        results.put(key, value == null ? NullResult.INSTANCE : value);
    }

    /**
     * @return true when the key was not seen before
     */
    public boolean markIfAbsent(String key) {
        return results.asMap().putIfAbsent(key, MARKER) == null;
    }

    public void forget(String key) {
        results.invalidate(key);
    }

    private String hash(Object input) {
        byte[] canonical;
        try {
            canonical = canonicalMapper.writeValueAsBytes(input);
        } catch (JsonProcessingException e) {
            canonical = String.valueOf(input).getBytes(StandardCharsets.UTF_8);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public enum NullResult {
        INSTANCE
    }
}
