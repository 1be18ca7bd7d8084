/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.core.naming;

import com.beacon.alertmigration.infra.config.MigrationConfig;

/**
 * Computes the naming and scheduling fields of a migrated rule: the
 * deduplicated title, the rule group name and the evaluation interval.
 */
public class NameBuilder {

    private final MigrationConfig config;

    public NameBuilder(MigrationConfig config) {
        this.config = config;
    }

    /**
     * Deduplicates a candidate title within the given folder scope.
     */
    public String dedupTitle(String candidate, TitleDeduplicator folderScope) {
        return folderScope.deduplicate(candidate);
    }

    /**
     * Builds {@code "<dashboard title> - <interval>"}, e.g. "Ops - 1m".
     * Only the dashboard title is truncated to fit the maximum length; the
     * suffix is always kept whole.
     */
    public String groupName(long intervalSeconds, String dashboardTitle) {
        String suffix = " - " + PrometheusDurations.formatSeconds(intervalSeconds);
        int room = Math.max(0, config.getMaxRuleGroupNameLength() - suffix.length());
        return truncate(dashboardTitle == null ? "" : dashboardTitle, room) + suffix;
    }

    /**
     * Rounds a legacy frequency down to a multiple of the scheduler base
     * interval. Frequencies at or below the base interval become the base.
     */
    public long adjustInterval(long frequencySeconds) {
        long base = config.getBaseIntervalSeconds();
        if (frequencySeconds <= base) {
            return base;
        }
        return frequencySeconds - (frequencySeconds % base);
    }

    /**
     * Cuts {@code value} to at most {@code maxLength} chars without splitting
     * a surrogate pair.
     */
    public static String truncate(String value, int maxLength) {
        if (value.length() <= maxLength) {
            return value;
        }
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }
}
