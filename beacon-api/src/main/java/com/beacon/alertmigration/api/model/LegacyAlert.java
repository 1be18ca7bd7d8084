/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

import java.time.Duration;
import java.util.Objects;

/**
 * A dashboard-bound alert definition from the legacy alerting subsystem.
 *
 * <p>The settings document is kept as raw JSON because its shape is only
 * loosely defined: it is parsed into {@link DashboardAlertSettings} at the
 * start of migration, and a malformed document fails that alert.
 *
 * @param orgId       owning organisation
 * @param id          legacy alert id
 * @param dashboardId legacy numeric dashboard id
 * @param panelId     panel the alert is attached to
 * @param name        display name, used as the candidate rule title
 * @param message     free-text message template
 * @param frequency   evaluation frequency in seconds
 * @param forDuration pending period before firing
 * @param state       legacy state string ("paused", "ok", "alerting", ...)
 * @param settings    raw settings JSON document
 */
public record LegacyAlert(
        long orgId,
        long id,
        long dashboardId,
        long panelId,
        String name,
        String message,
        long frequency,
        Duration forDuration,
        String state,
        String settings
) {
    public static final String PAUSED_STATE = "paused";

    public LegacyAlert {
        Objects.requireNonNull(name, "name");
        if (message == null) message = "";
        if (forDuration == null) forDuration = Duration.ZERO;
        if (state == null) state = "";
        if (settings == null) settings = "{}";
    }

    public boolean isPaused() {
        return PAUSED_STATE.equals(state);
    }
}
