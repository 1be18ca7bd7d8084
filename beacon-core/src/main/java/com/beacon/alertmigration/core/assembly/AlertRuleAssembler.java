/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.core.assembly;

import com.beacon.alertmigration.api.exceptions.AlertMigrationException;
import com.beacon.alertmigration.api.model.AlertQuery;
import com.beacon.alertmigration.api.model.DashboardAlertSettings;
import com.beacon.alertmigration.api.model.DashboardUpgradeInfo;
import com.beacon.alertmigration.api.model.ExecutionErrorState;
import com.beacon.alertmigration.api.model.LegacyAlert;
import com.beacon.alertmigration.api.model.MigratedAlertRule;
import com.beacon.alertmigration.api.model.MigrationLabels;
import com.beacon.alertmigration.api.model.MigrationResult;
import com.beacon.alertmigration.api.model.MigrationStage;
import com.beacon.alertmigration.api.model.NoDataState;
import com.beacon.alertmigration.api.model.NotificationChannel;
import com.beacon.alertmigration.api.model.NotificationChannelReference;
import com.beacon.alertmigration.api.model.SilenceRecord;
import com.beacon.alertmigration.api.model.TranslatedCondition;
import com.beacon.alertmigration.api.spi.ChannelResolver;
import com.beacon.alertmigration.api.spi.ConditionTranslator;
import com.beacon.alertmigration.api.spi.SilenceSink;
import com.beacon.alertmigration.core.MigrationDiagnostics;
import com.beacon.alertmigration.core.labels.LabelAnnotationBuilder;
import com.beacon.alertmigration.core.naming.NameBuilder;
import com.beacon.alertmigration.core.naming.TitleDeduplicator;
import com.beacon.alertmigration.core.query.QueryRepairer;
import com.beacon.alertmigration.core.silence.SilenceSynthesizer;
import com.beacon.alertmigration.core.state.StateTranslator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Turns one legacy alert into a unified alert rule.
 *
 * <p>The pipeline:
 * <ol>
 *   <li>parse settings (fatal on malformed JSON)</li>
 *   <li>translate conditions into queries (fatal on failure)</li>
 *   <li>resolve notification channels (best effort)</li>
 *   <li>build labels and annotations</li>
 *   <li>repair queries (fatal on an invalid model)</li>
 *   <li>compute the interval and the rule group name</li>
 *   <li>deduplicate the title within the target folder (fatal when exhausted)</li>
 *   <li>assemble the rule and add the rule uid label</li>
 *   <li>create compensating silences (best effort)</li>
 * </ol>
 * Nothing is produced when a fatal step fails. The title claim is the
 * only state change and comes after every other step that can fail.
 */
public class AlertRuleAssembler {

    private static final Logger logger = LoggerFactory.getLogger(AlertRuleAssembler.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final ConditionTranslator conditionTranslator;
    private final ChannelResolver channelResolver;
    private final StateTranslator stateTranslator;
    private final QueryRepairer queryRepairer;
    private final NameBuilder nameBuilder;
    private final LabelAnnotationBuilder labelAnnotationBuilder;
    private final SilenceSynthesizer silenceSynthesizer;
    private final SilenceSink silenceSink;
    private final Supplier<String> uidSupplier;
    private final Clock clock;

    public AlertRuleAssembler(ConditionTranslator conditionTranslator,
                              ChannelResolver channelResolver,
                              StateTranslator stateTranslator,
                              QueryRepairer queryRepairer,
                              NameBuilder nameBuilder,
                              LabelAnnotationBuilder labelAnnotationBuilder,
                              SilenceSynthesizer silenceSynthesizer,
                              SilenceSink silenceSink,
                              Supplier<String> uidSupplier,
                              Clock clock) {
        this.conditionTranslator = conditionTranslator;
        this.channelResolver = channelResolver;
        this.stateTranslator = stateTranslator;
        this.queryRepairer = queryRepairer;
        this.nameBuilder = nameBuilder;
        this.labelAnnotationBuilder = labelAnnotationBuilder;
        this.silenceSynthesizer = silenceSynthesizer;
        this.silenceSink = silenceSink;
        this.uidSupplier = uidSupplier;
        this.clock = clock;
    }

    /**
     * Migrates one alert.
     *
     * @param alert             legacy alert
     * @param info              target folder and dashboard
     * @param titleDeduplicator title scope of the target folder for this run
     * @throws AlertMigrationException identifying the failed stage
     */
    public MigrationResult assemble(LegacyAlert alert, DashboardUpgradeInfo info,
                                    TitleDeduplicator titleDeduplicator) {
        logger.atDebug()
                .addKeyValue("orgId", alert.orgId())
                .addKeyValue("alertId", alert.id())
                .addKeyValue("panelId", alert.panelId())
                .log("Migrating alert rule to unified alerting");

        MigrationDiagnostics diagnostics = new MigrationDiagnostics();

        DashboardAlertSettings settings = parseSettings(alert);
        TranslatedCondition condition = translateCondition(settings, alert.orgId());

        List<NotificationChannel> channels = extractChannels(alert, settings, diagnostics);

        Map<String, String> labels = labelAnnotationBuilder.buildLabels(settings, channels);
        Map<String, String> annotations =
                labelAnnotationBuilder.buildAnnotations(alert, info.dashboardUid(), diagnostics);

        List<AlertQuery> queries = queryRepairer.repair(condition.queries(), diagnostics);

        NoDataState noDataState = stateTranslator.translateNoData(settings.noDataState(), diagnostics);
        ExecutionErrorState execErrState =
                stateTranslator.translateExecError(settings.executionErrorState(), diagnostics);

        long interval = nameBuilder.adjustInterval(alert.frequency());
        String ruleGroup = nameBuilder.groupName(interval, info.dashboardName());

        // Claiming the title must stay the last step that can fail.
        String title = nameBuilder.dedupTitle(alert.name(), titleDeduplicator);
        if (!title.equals(alert.name())) {
            logger.atInfo()
                    .addKeyValue("old", alert.name())
                    .addKeyValue("new", title)
                    .log("Alert rule title modified to be unique within the folder and fit within the maximum length");
        }

        MigratedAlertRule rule = new MigratedAlertRule(
                alert.orgId(),
                uidSupplier.get(),
                title,
                condition.condition(),
                queries,
                interval,
                MigratedAlertRule.INITIAL_VERSION,
                info.newFolderUid(),
                info.dashboardUid(),
                alert.panelId(),
                ruleGroup,
                MigratedAlertRule.SINGLETON_GROUP_INDEX,
                alert.forDuration(),
                clock.instant(),
                labels,
                annotations,
                alert.isPaused(),
                noDataState,
                execErrState
        );

        // Label for routing and silences.
        rule = rule.withLabel(MigrationLabels.RULE_UID_LABEL, rule.uid());

        List<SilenceRecord> silences =
                silenceSynthesizer.createSilences(rule, settings, silenceSink, diagnostics);

        return new MigrationResult(rule, silences, diagnostics.issues());
    }

    private DashboardAlertSettings parseSettings(LegacyAlert alert) {
        DashboardAlertSettings settings;
        try {
            settings = objectMapper.readValue(alert.settings(), DashboardAlertSettings.class);
        } catch (JsonProcessingException e) {
            throw new AlertMigrationException(MigrationStage.SETTINGS, e.getOriginalMessage(), e);
        }
        if (settings == null) {
            return new DashboardAlertSettings(null, null, null, null, null);
        }
        return settings;
    }

    private TranslatedCondition translateCondition(DashboardAlertSettings settings, long orgId) {
        TranslatedCondition condition;
        try {
            condition = conditionTranslator.translate(settings, orgId);
        } catch (AlertMigrationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AlertMigrationException(MigrationStage.CONDITION, String.valueOf(e.getMessage()), e);
        }
        if (condition == null) {
            throw new AlertMigrationException(MigrationStage.CONDITION, "translator returned no condition");
        }
        return condition;
    }

    /**
     * Either id or uid can identify a channel; id is tried first.
     * Unresolvable references are skipped.
     */
    private List<NotificationChannel> extractChannels(LegacyAlert alert, DashboardAlertSettings settings,
                                                      MigrationDiagnostics diagnostics) {
        List<NotificationChannel> channels = new ArrayList<>(settings.notifications().size());
        for (NotificationChannelReference key : settings.notifications()) {
            Optional<NotificationChannel> channel = resolve(key);
            if (channel.isPresent()) {
                channels.add(channel.get());
                continue;
            }
            logger.atWarn()
                    .addKeyValue("alertId", alert.id())
                    .addKeyValue("notificationKey", key)
                    .log("Failed to get alert notification, skipping");
            diagnostics.degraded(MigrationStage.CHANNELS,
                    "Notification channel " + describe(key) + " not found, routing for it was dropped");
        }
        return channels;
    }

    private Optional<NotificationChannel> resolve(NotificationChannelReference key) {
        try {
            if (key.hasId()) {
                Optional<NotificationChannel> channel = channelResolver.byId(key.id());
                if (channel.isPresent()) {
                    return channel;
                }
            }
            if (key.hasUid()) {
                return channelResolver.byUid(key.uid());
            }
        } catch (RuntimeException e) {
            logger.atWarn()
                    .addKeyValue("notificationKey", key)
                    .setCause(e)
                    .log("Channel lookup failed");
        }
        return Optional.empty();
    }

    private static String describe(NotificationChannelReference key) {
        if (key.hasId()) {
            return "id=" + key.id() + (key.hasUid() ? ", uid=" + key.uid() : "");
        }
        return key.hasUid() ? "uid=" + key.uid() : "(empty reference)";
    }
}
