/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

import java.util.List;

/**
 * Successful migration of one alert.
 *
 * @param rule     the migrated rule
 * @param silences silences handed to the silence sink for this rule
 * @param issues   non-fatal findings, in the order they were recorded
 */
public record MigrationResult(
        MigratedAlertRule rule,
        List<SilenceRecord> silences,
        List<MigrationIssue> issues
) {
    public MigrationResult {
        silences = List.copyOf(silences);
        issues = List.copyOf(issues);
    }

    public boolean isDegraded() {
        return issues.stream().anyMatch(i -> i.severity() == MigrationIssue.Severity.DEGRADED);
    }
}
