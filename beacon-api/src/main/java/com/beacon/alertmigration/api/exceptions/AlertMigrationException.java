/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.exceptions;

import com.beacon.alertmigration.api.model.MigrationStage;

/**
 * Thrown when a legacy alert cannot be migrated at all.
 *
 * <p>Unchecked, like the other pipeline failures; the failing stage is
 * carried so callers can report it without parsing the message.
 */
public class AlertMigrationException extends RuntimeException {

    private final MigrationStage stage;

    public AlertMigrationException(MigrationStage stage, String message) {
        super(stage.label() + ": " + message);
        this.stage = stage;
    }

    public AlertMigrationException(MigrationStage stage, String message, Throwable cause) {
        super(stage.label() + ": " + message, cause);
        this.stage = stage;
    }

    public MigrationStage getStage() {
        return stage;
    }
}
