/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.core.silence;

import com.beacon.alertmigration.api.model.SilenceRecord;
import com.beacon.alertmigration.api.spi.SilenceSink;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps silences in memory so the caller can persist them once the
 * migration run is over.
 */
public class CollectingSilenceSink implements SilenceSink {

    private final List<SilenceRecord> silences = new ArrayList<>();

    @Override
    public synchronized void accept(SilenceRecord silence) {
        silences.add(silence);
    }

    public synchronized List<SilenceRecord> getSilences() {
        return List.copyOf(silences);
    }
}
