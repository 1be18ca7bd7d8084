/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

import java.util.Optional;

/**
 * Legacy "if execution error or timeout" options. Stored as free text,
 * so lookups may miss.
 */
public enum ExecutionErrorOption {
    ALERTING("alerting"),
    KEEP_STATE("keep_state"),
    OK("ok");

    private final String value;

    ExecutionErrorOption(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ExecutionErrorOption> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ExecutionErrorOption option : values()) {
            if (option.value.equals(value)) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }
}
