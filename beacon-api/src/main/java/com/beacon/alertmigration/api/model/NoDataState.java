/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a unified rule reports when its queries return no series.
 */
public enum NoDataState {
    ALERTING("Alerting"),
    NO_DATA("NoData"),
    OK("OK");

    private final String value;

    NoDataState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
