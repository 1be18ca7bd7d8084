/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

import java.util.List;

/**
 * Outcome of one alert within a batch migration.
 */
public record AlertMigrationStatus(
        long alertId,
        String alertName,
        Status status,
        MigrationResult result,     // null when FAILED
        MigrationStage failedStage, // null unless FAILED
        String error                // null unless FAILED
) {
    public enum Status {
        MIGRATED,
        DEGRADED,
        FAILED
    }

    public static AlertMigrationStatus migrated(LegacyAlert alert, MigrationResult result) {
        Status status = result.isDegraded() ? Status.DEGRADED : Status.MIGRATED;
        return new AlertMigrationStatus(alert.id(), alert.name(), status, result, null, null);
    }

    public static AlertMigrationStatus failed(LegacyAlert alert, MigrationStage stage, String error) {
        return new AlertMigrationStatus(alert.id(), alert.name(), Status.FAILED, null, stage, error);
    }

    public List<MigrationIssue> issues() {
        return result == null ? List.of() : result.issues();
    }
}
