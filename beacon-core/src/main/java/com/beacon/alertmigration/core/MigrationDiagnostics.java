/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.core;

import com.beacon.alertmigration.api.model.MigrationIssue;
import com.beacon.alertmigration.api.model.MigrationStage;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the non-fatal findings of migrating one alert.
 * Not thread-safe; one instance per alert.
 */
public final class MigrationDiagnostics {

    private final List<MigrationIssue> issues = new ArrayList<>();

    public void info(MigrationStage stage, String message) {
        issues.add(MigrationIssue.info(stage, message));
    }

    public void degraded(MigrationStage stage, String message) {
        issues.add(MigrationIssue.degraded(stage, message));
    }

    public List<MigrationIssue> issues() {
        return List.copyOf(issues);
    }

    public boolean isEmpty() {
        return issues.isEmpty();
    }
}
