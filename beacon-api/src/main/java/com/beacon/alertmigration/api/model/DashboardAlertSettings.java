/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed form of the legacy alert settings document.
 * Only the fields migration reads are mapped; everything else is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DashboardAlertSettings(
        @JsonProperty("conditions") List<JsonNode> conditions,
        @JsonProperty("notifications") List<NotificationChannelReference> notifications,
        @JsonProperty("noDataState") String noDataState,
        @JsonProperty("executionErrorState") String executionErrorState,
        @JsonProperty("alertRuleTags") JsonNode alertRuleTags
) {
    public DashboardAlertSettings {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        notifications = notifications == null ? List.of() : List.copyOf(notifications);
        if (noDataState == null) noDataState = "";
        if (executionErrorState == null) executionErrorState = "";
    }

    /**
     * Returns the alert rule tags in document order. Tags are read only
     * when {@code alertRuleTags} is a JSON object; any other shape means no
     * tags. Values that are not strings become empty strings.
     */
    public Map<String, String> tags() {
        Map<String, String> tags = new LinkedHashMap<>();
        if (alertRuleTags == null || !alertRuleTags.isObject()) {
            return tags;
        }
        alertRuleTags.fields().forEachRemaining(field -> {
            JsonNode value = field.getValue();
            tags.put(field.getKey(), value.isTextual() ? value.textValue() : "");
        });
        return tags;
    }
}
