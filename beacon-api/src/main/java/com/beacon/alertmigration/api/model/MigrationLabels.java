/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

/**
 * Well-known label and annotation names written onto migrated rules.
 */
public final class MigrationLabels {

    /** Marks a rule as migrated and routed through its legacy channels. */
    public static final String USE_LEGACY_CHANNELS_LABEL = "__legacy_use_channels__";

    /** Label used by rule-specific silences. Value is the rule uid. */
    public static final String RULE_UID_LABEL = "rule_uid";

    /** Standard alert name label matched by silences. */
    public static final String ALERT_NAME_LABEL = "alertname";

    public static final String DASHBOARD_UID_ANNOTATION = "__dashboardUid__";
    public static final String PANEL_ID_ANNOTATION = "__panelId__";
    public static final String ALERT_ID_ANNOTATION = "__alertId__";
    public static final String MESSAGE_ANNOTATION = "message";

    private static final String CONTACT_LABEL_PREFIX = "__legacy_c_";
    private static final String CONTACT_LABEL_SUFFIX = "__";

    private MigrationLabels() {
    }

    /**
     * Builds the routing label name for a legacy channel. Notification
     * policies match on the verbatim channel name.
     */
    public static String contactLabel(String channelName) {
        return CONTACT_LABEL_PREFIX + (channelName == null ? "" : channelName) + CONTACT_LABEL_SUFFIX;
    }
}
