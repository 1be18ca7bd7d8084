/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.spi;

import com.beacon.alertmigration.api.model.NotificationChannel;

import java.util.Optional;

/**
 * Looks up legacy notification channels. A miss is not an error: the
 * reference is skipped and routing for it is lost.
 */
public interface ChannelResolver {

    Optional<NotificationChannel> byId(long id);

    Optional<NotificationChannel> byUid(String uid);
}
