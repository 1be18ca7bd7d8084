/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

/**
 * A non-fatal finding recorded while migrating one alert.
 *
 * @param stage    where it happened
 * @param severity INFO for lossy but expected approximations, DEGRADED when
 *                 something the caller asked for could not be done
 * @param message  human readable description
 */
public record MigrationIssue(
        MigrationStage stage,
        Severity severity,
        String message
) {
    public enum Severity {
        INFO,
        DEGRADED
    }

    public static MigrationIssue info(MigrationStage stage, String message) {
        return new MigrationIssue(stage, Severity.INFO, message);
    }

    public static MigrationIssue degraded(MigrationStage stage, String message) {
        return new MigrationIssue(stage, Severity.DEGRADED, message);
    }
}
