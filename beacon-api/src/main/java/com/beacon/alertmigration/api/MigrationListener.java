/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api;

import com.beacon.alertmigration.api.exceptions.AlertMigrationException;
import com.beacon.alertmigration.api.model.LegacyAlert;
import com.beacon.alertmigration.api.model.MigrationResult;

/**
 * Callback interface for migration progress.
 * Allows UI and monitoring systems to follow a migration run as it happens.
 *
 * <h2>Usage</h2>
 * <pre>
 * migrator.setMigrationListener(new MigrationListener() {
 *     {@literal @}Override
 *     public void onAlertMigrated(LegacyAlert alert, MigrationResult result) {
 *         System.out.printf("%s -> %s%n", alert.name(), result.rule().title());
 *     }
 *
 *     {@literal @}Override
 *     public void onAlertFailed(LegacyAlert alert, AlertMigrationException error) {
 *         System.err.printf("%s failed at %s%n", alert.name(), error.getStage());
 *     }
 * });
 * </pre>
 */
public interface MigrationListener {

    /**
     * Called after an alert was migrated, including degraded migrations.
     */
    void onAlertMigrated(LegacyAlert alert, MigrationResult result);

    /**
     * Called when an alert could not be migrated.
     */
    void onAlertFailed(LegacyAlert alert, AlertMigrationException error);
}
