/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

import java.util.Optional;

/**
 * Legacy "if no data" options. Stored as free text, so lookups may miss.
 */
public enum NoDataOption {
    OK("ok"),
    NO_DATA("no_data"),
    ALERTING("alerting"),
    KEEP_STATE("keep_state");

    private final String value;

    NoDataOption(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<NoDataOption> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (NoDataOption option : values()) {
            if (option.value.equals(value)) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }
}
