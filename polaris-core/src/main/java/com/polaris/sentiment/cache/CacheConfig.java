/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.cache;

import com.polaris.sentiment.config.ConfigSource;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of the result cache.
 *
 * <p><b>Environment Variable Override:</b>
 * <pre>
 * CACHE_ENABLED=true          (cache.enabled)
 * CACHE_MAX_SIZE_MB=64        (cache.max.size.mb)
 * CACHE_ENTRY_TTL=10m         (cache.entry.ttl)
 * CACHE_RECORD_STATS=true     (cache.record.stats)
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * CacheConfig config = CacheConfig.builder()
 *     .maxSizeMb(128)
 *     .entryTtl(Duration.ofMinutes(5))
 *     .build();
 *
 * ResultCache cache = CacheFactory.create(config);
 * }</pre>
 */
public final class CacheConfig {

    static final String ENV_ENABLED = "CACHE_ENABLED";
    static final String ENV_MAX_SIZE_MB = "CACHE_MAX_SIZE_MB";
    static final String ENV_ENTRY_TTL = "CACHE_ENTRY_TTL";
    static final String ENV_RECORD_STATS = "CACHE_RECORD_STATS";

    public static final int DEFAULT_MAX_SIZE_MB = 64;
    public static final Duration DEFAULT_ENTRY_TTL = Duration.ofMinutes(10);

    private final boolean enabled;
    private final int maxSizeMb;
    private final Duration entryTtl;
    private final boolean recordStats;

    private CacheConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.maxSizeMb = builder.maxSizeMb;
        this.entryTtl = builder.entryTtl;
        this.recordStats = builder.recordStats;
        validate();
    }

    public static CacheConfig defaults() {
        return builder().build();
    }

    public static CacheConfig from(ConfigSource source) {
        Builder builder = builder();
        source.getBoolean(ENV_ENABLED, "cache.enabled").ifPresent(builder::enabled);
        source.getInt(ENV_MAX_SIZE_MB, "cache.max.size.mb").ifPresent(builder::maxSizeMb);
        source.getDuration(ENV_ENTRY_TTL, "cache.entry.ttl").ifPresent(builder::entryTtl);
        source.getBoolean(ENV_RECORD_STATS, "cache.record.stats").ifPresent(builder::recordStats);
        return builder.build();
    }

    private void validate() {
        if (maxSizeMb <= 0) {
            throw new IllegalArgumentException("maxSizeMb must be positive: " + maxSizeMb);
        }
        if (entryTtl.isZero() || entryTtl.isNegative()) {
            throw new IllegalArgumentException("entryTtl must be positive: " + entryTtl);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getMaxSizeMb() {
        return maxSizeMb;
    }

    public Duration getEntryTtl() {
        return entryTtl;
    }

    public boolean isRecordStats() {
        return recordStats;
    }

    @Override
    public String toString() {
        return "CacheConfig{enabled=" + enabled +
                ", maxSizeMb=" + maxSizeMb +
                ", entryTtl=" + entryTtl +
                ", recordStats=" + recordStats + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean enabled = true;
        private int maxSizeMb = DEFAULT_MAX_SIZE_MB;
        private Duration entryTtl = DEFAULT_ENTRY_TTL;
        private boolean recordStats = true;

        private Builder() {
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder maxSizeMb(int maxSizeMb) {
            this.maxSizeMb = maxSizeMb;
            return this;
        }

        public Builder entryTtl(Duration entryTtl) {
            this.entryTtl = Objects.requireNonNull(entryTtl, "entryTtl cannot be null");
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public CacheConfig build() {
            return new CacheConfig(this);
        }
    }
}
