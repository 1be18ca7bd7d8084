/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.model;

import java.util.List;

/**
 * Output of condition translation: the ref id of the query or expression
 * that decides firing, plus the ordered queries it depends on.
 */
public record TranslatedCondition(
        String condition,
        List<AlertQuery> queries
) {
    public TranslatedCondition {
        queries = queries == null ? List.of() : List.copyOf(queries);
    }
}
