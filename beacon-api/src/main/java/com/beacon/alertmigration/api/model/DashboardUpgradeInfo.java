/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

import java.util.Objects;

/**
 * Where a dashboard's alerts end up. Supplied by the caller and fixed for
 * the duration of one migration.
 */
public record DashboardUpgradeInfo(
        String dashboardUid,
        String dashboardName,
        String newFolderUid,
        String newFolderName
) {
    public DashboardUpgradeInfo {
        Objects.requireNonNull(newFolderUid, "newFolderUid");
        if (dashboardUid == null) dashboardUid = "";
        if (dashboardName == null) dashboardName = "";
        if (newFolderName == null) newFolderName = "";
    }

    public DashboardUpgradeInfo(String dashboardUid, String dashboardName, String newFolderUid) {
        this(dashboardUid, dashboardName, newFolderUid, "");
    }
}
