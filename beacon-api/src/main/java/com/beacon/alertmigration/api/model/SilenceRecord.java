/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

import java.time.Instant;
import java.util.List;

/**
 * A silence created to compensate for a legacy "keep last state" option.
 * It matches only the synthetic alert one specific rule would raise.
 */
public record SilenceRecord(
        String id,
        Kind kind,
        List<Matcher> matchers,
        Instant startsAt,
        Instant endsAt,
        String createdBy,
        String comment
) {
    public SilenceRecord {
        matchers = List.copyOf(matchers);
    }

    public enum Kind {
        ERROR("error"),
        NO_DATA("no-data");

        private final String tag;

        Kind(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }

    /**
     * Label matcher. Migration only ever needs equality matching.
     */
    public record Matcher(String name, String value, Type type) {
        public enum Type {
            EQUAL
        }

        public static Matcher equal(String name, String value) {
            return new Matcher(name, value, Type.EQUAL);
        }
    }
}
