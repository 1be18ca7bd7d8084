/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.infra.channel;

import com.beacon.alertmigration.api.model.NotificationChannel;
import com.beacon.alertmigration.api.spi.ChannelResolver;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves channels from a snapshot loaded up front, indexed by id and uid.
 */
public class InMemoryChannelResolver implements ChannelResolver {

    private final Map<Long, NotificationChannel> byId = new HashMap<>();
    private final Map<String, NotificationChannel> byUid = new HashMap<>();

    public InMemoryChannelResolver(Collection<NotificationChannel> channels) {
        for (NotificationChannel channel : channels) {
            byId.put(channel.id(), channel);
            if (channel.uid() != null && !channel.uid().isEmpty()) {
                byUid.put(channel.uid(), channel);
            }
        }
    }

    @Override
    public Optional<NotificationChannel> byId(long id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public Optional<NotificationChannel> byUid(String uid) {
        return Optional.ofNullable(byUid.get(uid));
    }

    public int size() {
        return byId.size();
    }
}
