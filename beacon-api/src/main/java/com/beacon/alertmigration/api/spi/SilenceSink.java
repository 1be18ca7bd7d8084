/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.spi;

import com.beacon.alertmigration.api.model.SilenceRecord;

/**
 * Receives silences created during migration. Persisting them is the
 * caller's business; any exception thrown here is logged and the rule is
 * still migrated.
 */
@FunctionalInterface
public interface SilenceSink {

    void accept(SilenceRecord silence);
}
