/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

/**
 * Steps of migrating a single alert, in execution order.
 */
public enum MigrationStage {
    SETTINGS("parse settings"),
    CONDITION("transform conditions"),
    CHANNELS("resolve channels"),
    ANNOTATIONS("build annotations"),
    QUERIES("queries"),
    STATES("translate states"),
    NAMING("deduplicate title"),
    SILENCES("create silences");

    private final String label;

    MigrationStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
