/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A unified alerting rule produced from one legacy alert.
 *
 * <p>Every migrated rule lives alone in its own rule group, so
 * {@code ruleGroupIndex} is always 1 and {@code version} starts at 1.
 * Instances are built once and never mutated; {@link #withLabel} returns
 * a copy.
 */
public record MigratedAlertRule(
        long orgId,
        String uid,
        String title,
        String condition,
        List<AlertQuery> queries,
        long intervalSeconds,
        long version,
        String namespaceUid,
        String dashboardUid,
        long panelId,
        String ruleGroup,
        int ruleGroupIndex,
        Duration forDuration,
        Instant updated,
        Map<String, String> labels,
        Map<String, String> annotations,
        boolean paused,
        NoDataState noDataState,
        ExecutionErrorState execErrState
) {
    public static final long INITIAL_VERSION = 1;
    public static final int SINGLETON_GROUP_INDEX = 1;

    public MigratedAlertRule {
        Objects.requireNonNull(uid, "uid");
        Objects.requireNonNull(title, "title");
        queries = List.copyOf(queries);
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        annotations = Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
    }

    /**
     * Returns a copy carrying one more label (or a replaced value).
     */
    public MigratedAlertRule withLabel(String name, String value) {
        Map<String, String> newLabels = new LinkedHashMap<>(labels);
        newLabels.put(name, value);
        return new MigratedAlertRule(
                orgId, uid, title, condition, queries, intervalSeconds, version,
                namespaceUid, dashboardUid, panelId, ruleGroup, ruleGroupIndex,
                forDuration, updated, newLabels, annotations, paused,
                noDataState, execErrState
        );
    }
}
