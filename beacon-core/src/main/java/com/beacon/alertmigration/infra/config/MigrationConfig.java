/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.infra.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Limits and defaults used while migrating legacy alerts.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via environment variable or system
 * property using the pattern {@code MIGRATION_<PROPERTY_NAME>}:
 * <pre>
 * MIGRATION_MAX_TITLE_LENGTH=190
 * MIGRATION_MAX_RULE_GROUP_NAME_LENGTH=190
 * MIGRATION_BASE_INTERVAL_SECONDS=10
 * MIGRATION_SILENCE_DURATION_DAYS=365
 * MIGRATION_SILENCE_CREATED_BY="Alert Migration"
 * MIGRATION_CASE_INSENSITIVE_TITLES=false
 * MIGRATION_CHANNEL_CACHE_MAX_SIZE=10000
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * MigrationConfig config = MigrationConfig.builder()
 *     .maxTitleLength(190)
 *     .caseInsensitiveTitles(true)
 *     .build();
 * }</pre>
 */
public final class MigrationConfig {

    private static final Logger logger = LoggerFactory.getLogger(MigrationConfig.class);

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_MAX_TITLE_LENGTH = "MIGRATION_MAX_TITLE_LENGTH";
    static final String ENV_MAX_RULE_GROUP_NAME_LENGTH = "MIGRATION_MAX_RULE_GROUP_NAME_LENGTH";
    static final String ENV_BASE_INTERVAL_SECONDS = "MIGRATION_BASE_INTERVAL_SECONDS";
    static final String ENV_SILENCE_DURATION_DAYS = "MIGRATION_SILENCE_DURATION_DAYS";
    static final String ENV_SILENCE_CREATED_BY = "MIGRATION_SILENCE_CREATED_BY";
    static final String ENV_CASE_INSENSITIVE_TITLES = "MIGRATION_CASE_INSENSITIVE_TITLES";
    static final String ENV_CHANNEL_CACHE_MAX_SIZE = "MIGRATION_CHANNEL_CACHE_MAX_SIZE";

    // ========================================================================
    // DEFAULTS
    // ========================================================================

    public static final int DEFAULT_MAX_TITLE_LENGTH = 190;
    public static final int DEFAULT_MAX_RULE_GROUP_NAME_LENGTH = 190;

    /**
     * Smallest accepted rule group name limit. The longest interval suffix,
     * {@code " - 2562047788015215h59m59s"}, is 26 characters.
     */
    public static final int MIN_RULE_GROUP_NAME_LENGTH = 32;
    public static final long DEFAULT_BASE_INTERVAL_SECONDS = 10;
    public static final Duration DEFAULT_SILENCE_DURATION = Duration.ofDays(365);
    public static final String DEFAULT_SILENCE_CREATED_BY = "Alert Migration";
    public static final long DEFAULT_CHANNEL_CACHE_MAX_SIZE = 10_000;

    private final int maxTitleLength;
    private final int maxRuleGroupNameLength;
    private final long baseIntervalSeconds;
    private final Duration silenceDuration;
    private final String silenceCreatedBy;
    private final boolean caseInsensitiveTitles;
    private final long channelCacheMaxSize;

    private MigrationConfig(Builder builder) {
        this.maxTitleLength = builder.maxTitleLength;
        this.maxRuleGroupNameLength = builder.maxRuleGroupNameLength;
        this.baseIntervalSeconds = builder.baseIntervalSeconds;
        this.silenceDuration = builder.silenceDuration;
        this.silenceCreatedBy = builder.silenceCreatedBy;
        this.caseInsensitiveTitles = builder.caseInsensitiveTitles;
        this.channelCacheMaxSize = builder.channelCacheMaxSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MigrationConfig defaults() {
        return builder().build();
    }

    /**
     * Builds a config from defaults overridden by environment variables and
     * system properties. Unparsable values are logged and ignored.
     */
    public static MigrationConfig fromEnvironment() {
        Builder builder = builder();
        readInt(ENV_MAX_TITLE_LENGTH, builder::maxTitleLength);
        readInt(ENV_MAX_RULE_GROUP_NAME_LENGTH, builder::maxRuleGroupNameLength);
        readLong(ENV_BASE_INTERVAL_SECONDS, builder::baseIntervalSeconds);
        readLong(ENV_SILENCE_DURATION_DAYS, days -> builder.silenceDuration(Duration.ofDays(days)));
        readLong(ENV_CHANNEL_CACHE_MAX_SIZE, builder::channelCacheMaxSize);

        String createdBy = getEnvOrProperty(ENV_SILENCE_CREATED_BY);
        if (createdBy != null && !createdBy.isBlank()) {
            builder.silenceCreatedBy(createdBy);
        }
        String caseInsensitive = getEnvOrProperty(ENV_CASE_INSENSITIVE_TITLES);
        if (caseInsensitive != null) {
            builder.caseInsensitiveTitles(Boolean.parseBoolean(caseInsensitive.trim()));
        }
        return builder.build();
    }

    // ==================== Getters ====================

    public int getMaxTitleLength() {
        return maxTitleLength;
    }

    public int getMaxRuleGroupNameLength() {
        return maxRuleGroupNameLength;
    }

    public long getBaseIntervalSeconds() {
        return baseIntervalSeconds;
    }

    public Duration getSilenceDuration() {
        return silenceDuration;
    }

    public String getSilenceCreatedBy() {
        return silenceCreatedBy;
    }

    public boolean isCaseInsensitiveTitles() {
        return caseInsensitiveTitles;
    }

    public long getChannelCacheMaxSize() {
        return channelCacheMaxSize;
    }

    @Override
    public String toString() {
        return "MigrationConfig{" +
                "maxTitleLength=" + maxTitleLength +
                ", maxRuleGroupNameLength=" + maxRuleGroupNameLength +
                ", baseIntervalSeconds=" + baseIntervalSeconds +
                ", silenceDuration=" + silenceDuration +
                ", silenceCreatedBy='" + silenceCreatedBy + '\'' +
                ", caseInsensitiveTitles=" + caseInsensitiveTitles +
                ", channelCacheMaxSize=" + channelCacheMaxSize +
                '}';
    }

    // ==================== Configuration Helpers ====================

    private interface IntSetter {
        void set(int value);
    }

    private interface LongSetter {
        void set(long value);
    }

    private static void readInt(String key, IntSetter setter) {
        String raw = getEnvOrProperty(key);
        if (raw == null) {
            return;
        }
        try {
            setter.set(Integer.parseInt(raw.trim()));
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring invalid value for {}: '{}' ({})", key, raw, e.getMessage());
        }
    }

    private static void readLong(String key, LongSetter setter) {
        String raw = getEnvOrProperty(key);
        if (raw == null) {
            return;
        }
        try {
            setter.set(Long.parseLong(raw.trim()));
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring invalid value for {}: '{}' ({})", key, raw, e.getMessage());
        }
    }

    /**
     * Get value from environment variable, falling back to system property.
     */
    private static String getEnvOrProperty(String key) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value;
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private int maxTitleLength = DEFAULT_MAX_TITLE_LENGTH;
        private int maxRuleGroupNameLength = DEFAULT_MAX_RULE_GROUP_NAME_LENGTH;
        private long baseIntervalSeconds = DEFAULT_BASE_INTERVAL_SECONDS;
        private Duration silenceDuration = DEFAULT_SILENCE_DURATION;
        private String silenceCreatedBy = DEFAULT_SILENCE_CREATED_BY;
        private boolean caseInsensitiveTitles = false;
        private long channelCacheMaxSize = DEFAULT_CHANNEL_CACHE_MAX_SIZE;

        private Builder() {
        }

        public Builder maxTitleLength(int maxTitleLength) {
            if (maxTitleLength <= 0) {
                throw new IllegalArgumentException("maxTitleLength must be positive, got: " + maxTitleLength);
            }
            this.maxTitleLength = maxTitleLength;
            return this;
        }

        public Builder maxRuleGroupNameLength(int maxRuleGroupNameLength) {
            if (maxRuleGroupNameLength < MIN_RULE_GROUP_NAME_LENGTH) {
                throw new IllegalArgumentException("maxRuleGroupNameLength must be at least "
                        + MIN_RULE_GROUP_NAME_LENGTH + ", got: " + maxRuleGroupNameLength);
            }
            this.maxRuleGroupNameLength = maxRuleGroupNameLength;
            return this;
        }

        public Builder baseIntervalSeconds(long baseIntervalSeconds) {
            if (baseIntervalSeconds <= 0) {
                throw new IllegalArgumentException(
                        "baseIntervalSeconds must be positive, got: " + baseIntervalSeconds);
            }
            this.baseIntervalSeconds = baseIntervalSeconds;
            return this;
        }

        public Builder silenceDuration(Duration silenceDuration) {
            if (silenceDuration == null || silenceDuration.isNegative() || silenceDuration.isZero()) {
                throw new IllegalArgumentException("silenceDuration must be positive, got: " + silenceDuration);
            }
            this.silenceDuration = silenceDuration;
            return this;
        }

        public Builder silenceCreatedBy(String silenceCreatedBy) {
            this.silenceCreatedBy = silenceCreatedBy;
            return this;
        }

        public Builder caseInsensitiveTitles(boolean caseInsensitiveTitles) {
            this.caseInsensitiveTitles = caseInsensitiveTitles;
            return this;
        }

        public Builder channelCacheMaxSize(long channelCacheMaxSize) {
            if (channelCacheMaxSize < 0) {
                throw new IllegalArgumentException(
                        "channelCacheMaxSize must not be negative, got: " + channelCacheMaxSize);
            }
            this.channelCacheMaxSize = channelCacheMaxSize;
            return this;
        }

        public MigrationConfig build() {
            return new MigrationConfig(this);
        }
    }
}
