/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

import java.util.List;

/**
 * Per-alert outcomes of migrating a batch of alerts, in input order.
 */
public record MigrationReport(
        List<AlertMigrationStatus> statuses,
        Stats stats
) {
    public MigrationReport {
        statuses = List.copyOf(statuses);
    }

    public static MigrationReport of(List<AlertMigrationStatus> statuses) {
        int migrated = 0, degraded = 0, failed = 0;
        for (AlertMigrationStatus status : statuses) {
            switch (status.status()) {
                case MIGRATED -> migrated++;
                case DEGRADED -> degraded++;
                case FAILED -> failed++;
            }
        }
        return new MigrationReport(statuses, new Stats(statuses.size(), migrated, degraded, failed));
    }

    public List<MigratedAlertRule> rules() {
        return statuses.stream()
                .filter(s -> s.result() != null)
                .map(s -> s.result().rule())
                .toList();
    }

    public List<SilenceRecord> silences() {
        return statuses.stream()
                .filter(s -> s.result() != null)
                .flatMap(s -> s.result().silences().stream())
                .toList();
    }

    public record Stats(int total, int migrated, int degraded, int failed) {}
}
