/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.infra.channel;

import com.beacon.alertmigration.api.model.NotificationChannel;
import com.beacon.alertmigration.api.spi.ChannelResolver;
import com.beacon.alertmigration.infra.config.MigrationConfig;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.Optional;

/**
 * Caffeine-backed decorator for a slow channel resolver (typically one that
 * queries storage). Many alerts share the same few channels, so each
 * reference is looked up once per run; misses are cached too.
 *
 * <pre>{@code
 * ChannelResolver resolver = new CachingChannelResolver(jdbcResolver, config);
 * }</pre>
 */
public class CachingChannelResolver implements ChannelResolver {

    private final ChannelResolver delegate;
    private final Cache<Long, Optional<NotificationChannel>> byIdCache;
    private final Cache<String, Optional<NotificationChannel>> byUidCache;

    public CachingChannelResolver(ChannelResolver delegate, MigrationConfig config) {
        this(delegate, config.getChannelCacheMaxSize());
    }

    public CachingChannelResolver(ChannelResolver delegate, long maxSize) {
        this.delegate = delegate;
        this.byIdCache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
        this.byUidCache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
    }

    @Override
    public Optional<NotificationChannel> byId(long id) {
        return byIdCache.get(id, delegate::byId);
    }

    @Override
    public Optional<NotificationChannel> byUid(String uid) {
        return byUidCache.get(uid, delegate::byUid);
    }

    public CacheStats idStats() {
        return byIdCache.stats();
    }

    public CacheStats uidStats() {
        return byUidCache.stats();
    }

    public void invalidateAll() {
        byIdCache.invalidateAll();
        byUidCache.invalidateAll();
    }
}
