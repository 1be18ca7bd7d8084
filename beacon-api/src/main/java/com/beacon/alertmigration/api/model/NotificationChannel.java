/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

/**
 * A legacy notification channel. Only the name matters to migration: it is
 * turned into a routing label so legacy routing can be reproduced.
 */
public record NotificationChannel(
        long id,
        String uid,
        String name,
        String type
) {}
