/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

import java.time.Duration;
import java.util.Objects;

/**
 * One query of a unified alert rule. The model is kept as raw JSON since
 * each datasource defines its own shape.
 *
 * @param refId         reference id used by the condition
 * @param queryType     optional query type
 * @param timeRange     relative time range evaluated by the query
 * @param datasourceUid datasource the query runs against
 * @param model         raw JSON query model
 */
public record AlertQuery(
        String refId,
        String queryType,
        RelativeTimeRange timeRange,
        String datasourceUid,
        String model
) {
    /**
     * Datasource uid reserved for server-side expressions.
     */
    public static final String EXPRESSION_DATASOURCE_UID = "__expr__";

    public AlertQuery {
        Objects.requireNonNull(refId, "refId");
        if (queryType == null) queryType = "";
        if (timeRange == null) timeRange = RelativeTimeRange.NONE;
        if (datasourceUid == null) datasourceUid = "";
        if (model == null) model = "{}";
    }

    public boolean isExpression() {
        return EXPRESSION_DATASOURCE_UID.equals(datasourceUid);
    }

    public AlertQuery withModel(String newModel) {
        return new AlertQuery(refId, queryType, timeRange, datasourceUid, newModel);
    }

    /**
     * Time range relative to evaluation time: {@code from} before now up to
     * {@code to} before now.
     */
    public record RelativeTimeRange(Duration from, Duration to) {
        public static final RelativeTimeRange NONE = new RelativeTimeRange(Duration.ZERO, Duration.ZERO);

        public RelativeTimeRange {
            if (from == null) from = Duration.ZERO;
            if (to == null) to = Duration.ZERO;
        }
    }
}
