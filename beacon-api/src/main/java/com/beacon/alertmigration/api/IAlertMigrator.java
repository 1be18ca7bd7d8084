/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api;

import com.beacon.alertmigration.api.exceptions.AlertMigrationException;
import com.beacon.alertmigration.api.model.DashboardUpgradeInfo;
import com.beacon.alertmigration.api.model.LegacyAlert;
import com.beacon.alertmigration.api.model.MigrationReport;
import com.beacon.alertmigration.api.model.MigrationResult;

import java.util.List;

/**
 * Contract for migrating legacy dashboard alerts into unified alert rules.
 *
 * <p>An implementation instance represents one migration run for one
 * organisation: title uniqueness is tracked per target folder across all
 * calls made on the same instance.
 */
public interface IAlertMigrator {

    /**
     * Migrates a single legacy alert.
     *
     * @param alert legacy alert definition
     * @param info  target folder and dashboard
     * @return the migrated rule with the silences and issues produced for it
     * @throws AlertMigrationException if the alert cannot be migrated; no
     *         rule is produced in that case
     */
    MigrationResult migrateAlert(LegacyAlert alert, DashboardUpgradeInfo info);

    /**
     * Migrates all alerts of one dashboard, in order. Failures are reported
     * per alert and do not stop the batch.
     */
    MigrationReport migrateDashboardAlerts(List<LegacyAlert> alerts, DashboardUpgradeInfo info);

    /**
     * Sets a listener for per-alert progress.
     *
     * @param listener the listener (null to disable)
     */
    default void setMigrationListener(MigrationListener listener) {
    }
}
