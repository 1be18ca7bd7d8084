/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.core.silence;

import com.beacon.alertmigration.api.model.DashboardAlertSettings;
import com.beacon.alertmigration.api.model.ExecutionErrorOption;
import com.beacon.alertmigration.api.model.MigratedAlertRule;
import com.beacon.alertmigration.api.model.MigrationLabels;
import com.beacon.alertmigration.api.model.MigrationStage;
import com.beacon.alertmigration.api.model.NoDataOption;
import com.beacon.alertmigration.api.model.SilenceRecord;
import com.beacon.alertmigration.api.spi.SilenceSink;
import com.beacon.alertmigration.core.MigrationDiagnostics;
import com.beacon.alertmigration.infra.config.MigrationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Creates silences that emulate legacy "keep last state".
 *
 * <p>A migrated rule maps keep-state to the error / no-data state, which
 * makes the unified engine raise a synthetic {@value #ERROR_ALERT_NAME} or
 * {@value #NO_DATA_ALERT_NAME} alert. The silence mutes exactly that alert
 * for that rule, matched through the rule uid label.
 */
public class SilenceSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(SilenceSynthesizer.class);

    public static final String ERROR_ALERT_NAME = "DatasourceError";
    public static final String NO_DATA_ALERT_NAME = "DatasourceNoData";

    private final MigrationConfig config;
    private final Clock clock;

    public SilenceSynthesizer(MigrationConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Builds the silences a rule needs: zero, one or two.
     */
    public List<SilenceRecord> synthesize(MigratedAlertRule rule, DashboardAlertSettings settings) {
        List<SilenceRecord> silences = new ArrayList<>(2);
        if (ExecutionErrorOption.KEEP_STATE.value().equals(settings.executionErrorState())) {
            silences.add(buildSilence(rule, SilenceRecord.Kind.ERROR));
        }
        if (NoDataOption.KEEP_STATE.value().equals(settings.noDataState())) {
            silences.add(buildSilence(rule, SilenceRecord.Kind.NO_DATA));
        }
        return silences;
    }

    /**
     * Builds the silences and hands each to the sink. A sink failure is
     * logged and recorded; it never fails the rule.
     *
     * @return the silences the sink accepted
     */
    public List<SilenceRecord> createSilences(MigratedAlertRule rule, DashboardAlertSettings settings,
                                              SilenceSink sink, MigrationDiagnostics diagnostics) {
        List<SilenceRecord> accepted = new ArrayList<>(2);
        for (SilenceRecord silence : synthesize(rule, settings)) {
            try {
                sink.accept(silence);
                accepted.add(silence);
            } catch (RuntimeException e) {
                logger.atError()
                        .addKeyValue("rule_name", rule.title())
                        .addKeyValue("kind", silence.kind().tag())
                        .setCause(e)
                        .log("Alert migration error: failed to create silence");
                diagnostics.degraded(MigrationStage.SILENCES,
                        "Failed to create " + silence.kind().tag() + " silence: " + e.getMessage());
            }
        }
        return accepted;
    }

    SilenceRecord buildSilence(MigratedAlertRule rule, SilenceRecord.Kind kind) {
        Instant now = clock.instant();
        String alertName;
        String stateName;
        if (kind == SilenceRecord.Kind.ERROR) {
            alertName = ERROR_ALERT_NAME;
            stateName = "Error";
        } else {
            alertName = NO_DATA_ALERT_NAME;
            stateName = "NoData";
        }
        return new SilenceRecord(
                UUID.randomUUID().toString(),
                kind,
                List.of(
                        SilenceRecord.Matcher.equal(MigrationLabels.ALERT_NAME_LABEL, alertName),
                        SilenceRecord.Matcher.equal(MigrationLabels.RULE_UID_LABEL, rule.uid())
                ),
                now,
                now.plus(config.getSilenceDuration()),
                config.getSilenceCreatedBy(),
                String.format("Created during migration to unified alerting to silence %s state for alert rule "
                                + "ID '%s' and Title '%s' because the option 'Keep Last State' was selected "
                                + "for %s state",
                        stateName, rule.uid(), rule.title(), stateName)
        );
    }
}
