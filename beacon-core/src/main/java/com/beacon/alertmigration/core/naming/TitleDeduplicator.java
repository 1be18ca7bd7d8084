/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.core.naming;

import com.beacon.alertmigration.api.exceptions.AlertMigrationException;
import com.beacon.alertmigration.api.model.MigrationStage;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Hands out rule titles that are unique within one folder for one
 * migration run.
 *
 * <p>One instance per folder; never share an instance between folders.
 * Methods are synchronized because each decision depends on all earlier
 * decisions for the same folder.
 *
 * <p>Collisions are resolved by appending {@code " #2"}, {@code " #3"}, ...
 * up to {@code " #9"}, then a random
 * {@code "_<uid>"} suffix. The candidate is truncated first so that the
 * suffixed title still fits the maximum length.
 */
public class TitleDeduplicator {

    static final int MAX_NUMBERED_SUFFIX = 9;

    private final int maxLength;
    private final boolean caseInsensitive;
    private final Supplier<String> uidSupplier;
    private final Set<String> used = new HashSet<>();

    public TitleDeduplicator(int maxLength, boolean caseInsensitive, Supplier<String> uidSupplier) {
        this(maxLength, caseInsensitive, uidSupplier, Set.of());
    }

    /**
     * @param existingTitles titles already present in the folder before this run
     */
    public TitleDeduplicator(int maxLength, boolean caseInsensitive, Supplier<String> uidSupplier,
                             Collection<String> existingTitles) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive, got: " + maxLength);
        }
        this.maxLength = maxLength;
        this.caseInsensitive = caseInsensitive;
        this.uidSupplier = uidSupplier;
        for (String title : existingTitles) {
            used.add(key(title));
        }
    }

    /**
     * Returns a title not yet handed out for this folder and claims it.
     *
     * @throws AlertMigrationException with stage NAMING if no unique variant
     *         fits within the maximum length
     */
    public synchronized String deduplicate(String candidate) {
        String base = NameBuilder.truncate(candidate, maxLength);
        if (claim(base)) {
            return base;
        }

        for (int i = 2; i <= MAX_NUMBERED_SUFFIX; i++) {
            String title = withSuffix(candidate, " #" + i);
            if (title != null && claim(title)) {
                return title;
            }
        }

        String title = withSuffix(candidate, "_" + uidSupplier.get());
        if (title != null && claim(title)) {
            return title;
        }

        throw new AlertMigrationException(MigrationStage.NAMING,
                "failed to deduplicate title '" + candidate + "' within " + maxLength + " characters");
    }

    public synchronized boolean contains(String title) {
        return used.contains(key(title));
    }

    public synchronized int size() {
        return used.size();
    }

    private String withSuffix(String candidate, String suffix) {
        int room = maxLength - suffix.length();
        if (room < 0) {
            return null;
        }
        return NameBuilder.truncate(candidate, room) + suffix;
    }

    private boolean claim(String title) {
        return used.add(key(title));
    }

    private String key(String title) {
        return caseInsensitive ? title.toLowerCase(Locale.ROOT) : title;
    }
}
