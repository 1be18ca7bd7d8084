/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reference to a legacy notification channel as stored in alert settings.
 * Either the numeric id or the uid is set; the id wins when both are.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationChannelReference(
        @JsonProperty("id") Long id,
        @JsonProperty("uid") String uid
) {
    public static NotificationChannelReference ofId(long id) {
        return new NotificationChannelReference(id, null);
    }

    public static NotificationChannelReference ofUid(String uid) {
        return new NotificationChannelReference(null, uid);
    }

    public boolean hasId() {
        return id != null && id > 0;
    }

    public boolean hasUid() {
        return uid != null && !uid.isEmpty();
    }
}
