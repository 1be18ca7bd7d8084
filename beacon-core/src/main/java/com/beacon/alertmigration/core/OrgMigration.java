/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.core;

import com.beacon.alertmigration.api.IAlertMigrator;
import com.beacon.alertmigration.api.MigrationListener;
import com.beacon.alertmigration.api.exceptions.AlertMigrationException;
import com.beacon.alertmigration.api.model.AlertMigrationStatus;
import com.beacon.alertmigration.api.model.DashboardUpgradeInfo;
import com.beacon.alertmigration.api.model.LegacyAlert;
import com.beacon.alertmigration.api.model.MigrationReport;
import com.beacon.alertmigration.api.model.MigrationResult;
import com.beacon.alertmigration.api.spi.ChannelResolver;
import com.beacon.alertmigration.api.spi.ConditionTranslator;
import com.beacon.alertmigration.api.spi.MessageTemplateRenderer;
import com.beacon.alertmigration.api.spi.SilenceSink;
import com.beacon.alertmigration.core.assembly.AlertRuleAssembler;
import com.beacon.alertmigration.core.labels.LabelAnnotationBuilder;
import com.beacon.alertmigration.core.naming.NameBuilder;
import com.beacon.alertmigration.core.naming.ShortUidGenerator;
import com.beacon.alertmigration.core.naming.TitleDeduplicator;
import com.beacon.alertmigration.core.query.QueryRepairer;
import com.beacon.alertmigration.core.silence.CollectingSilenceSink;
import com.beacon.alertmigration.core.silence.SilenceSynthesizer;
import com.beacon.alertmigration.core.state.StateTranslator;
import com.beacon.alertmigration.infra.config.MigrationConfig;
import com.beacon.alertmigration.infra.template.LegacyMessageTemplateRenderer;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One migration run for one organisation.
 *
 * <p>Holds the per-folder title scopes, so titles stay unique across every
 * alert migrated through the same instance. Create a new instance for each
 * organisation and each run.
 *
 * <pre>
 * OrgMigration migration = OrgMigration.builder(orgId, conditionTranslator)
 *         .channelResolver(new InMemoryChannelResolver(channels))
 *         .tracer(openTelemetry.getTracer("alert-migration"))
 *         .build();
 * MigrationReport report = migration.migrateDashboardAlerts(alerts, info);
 * </pre>
 */
public class OrgMigration implements IAlertMigrator {

    private static final Logger logger = LoggerFactory.getLogger(OrgMigration.class);

    private final long orgId;
    private final MigrationConfig config;
    private final AlertRuleAssembler assembler;
    private final Tracer tracer;
    private final Supplier<String> uidSupplier;
    private final Function<String, Collection<String>> existingTitles;
    private final Map<String, TitleDeduplicator> titleScopes = new ConcurrentHashMap<>();
    private volatile MigrationListener listener;

    private OrgMigration(Builder builder) {
        this.orgId = builder.orgId;
        this.config = builder.config;
        this.tracer = builder.tracer;
        this.uidSupplier = builder.uidSupplier;
        this.existingTitles = builder.existingTitles;
        this.assembler = new AlertRuleAssembler(
                builder.conditionTranslator,
                builder.channelResolver,
                new StateTranslator(),
                new QueryRepairer(),
                new NameBuilder(builder.config),
                new LabelAnnotationBuilder(builder.templateRenderer),
                new SilenceSynthesizer(builder.config, builder.clock),
                builder.silenceSink,
                builder.uidSupplier,
                builder.clock
        );
    }

    public static Builder builder(long orgId, ConditionTranslator conditionTranslator) {
        return new Builder(orgId, conditionTranslator);
    }

    @Override
    public void setMigrationListener(MigrationListener listener) {
        this.listener = listener;
    }

    @Override
    public MigrationResult migrateAlert(LegacyAlert alert, DashboardUpgradeInfo info) {
        if (alert.orgId() != orgId) {
            throw new IllegalArgumentException(
                    "Alert " + alert.id() + " belongs to org " + alert.orgId() + ", this migration is for org " + orgId);
        }

        Span span = tracer.spanBuilder("migrate-alert").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("orgId", orgId);
            span.setAttribute("alertId", alert.id());
            span.setAttribute("panelId", alert.panelId());
            span.setAttribute("folderUid", info.newFolderUid());

            MigrationResult result = assembler.assemble(alert, info, titleScope(info.newFolderUid()));

            span.setAttribute("ruleUid", result.rule().uid());
            span.setAttribute("silenceCount", result.silences().size());
            span.setAttribute("issueCount", result.issues().size());

            MigrationListener current = listener;
            if (current != null) {
                current.onAlertMigrated(alert, result);
            }
            return result;
        } catch (AlertMigrationException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            MigrationListener current = listener;
            if (current != null) {
                current.onAlertFailed(alert, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public MigrationReport migrateDashboardAlerts(List<LegacyAlert> alerts, DashboardUpgradeInfo info) {
        List<AlertMigrationStatus> statuses = new ArrayList<>(alerts.size());
        for (LegacyAlert alert : alerts) {
            try {
                statuses.add(AlertMigrationStatus.migrated(alert, migrateAlert(alert, info)));
            } catch (AlertMigrationException e) {
                logger.atError()
                        .addKeyValue("orgId", orgId)
                        .addKeyValue("alertId", alert.id())
                        .addKeyValue("stage", e.getStage().label())
                        .setCause(e)
                        .log("Failed to migrate alert");
                statuses.add(AlertMigrationStatus.failed(alert, e.getStage(), e.getMessage()));
            }
        }

        MigrationReport report = MigrationReport.of(statuses);
        logger.atInfo()
                .addKeyValue("orgId", orgId)
                .addKeyValue("dashboardUid", info.dashboardUid())
                .addKeyValue("total", report.stats().total())
                .addKeyValue("migrated", report.stats().migrated())
                .addKeyValue("degraded", report.stats().degraded())
                .addKeyValue("failed", report.stats().failed())
                .log("Migrated dashboard alerts");
        return report;
    }

    /**
     * Titles already claimed in a folder during this run.
     */
    public boolean isTitleTaken(String folderUid, String title) {
        TitleDeduplicator scope = titleScopes.get(folderUid);
        return scope != null && scope.contains(title);
    }

    public long getOrgId() {
        return orgId;
    }

    public MigrationConfig getConfig() {
        return config;
    }

    private TitleDeduplicator titleScope(String folderUid) {
        return titleScopes.computeIfAbsent(folderUid, uid -> new TitleDeduplicator(
                config.getMaxTitleLength(),
                config.isCaseInsensitiveTitles(),
                uidSupplier,
                existingTitles.apply(uid)));
    }

    public static class Builder {
        private final long orgId;
        private final ConditionTranslator conditionTranslator;
        private MigrationConfig config = MigrationConfig.defaults();
        private ChannelResolver channelResolver;
        private MessageTemplateRenderer templateRenderer = new LegacyMessageTemplateRenderer();
        private SilenceSink silenceSink = new CollectingSilenceSink();
        private Tracer tracer = OpenTelemetry.noop().getTracer("alert-migration");
        private Clock clock = Clock.systemUTC();
        private Supplier<String> uidSupplier = new ShortUidGenerator();
        private Function<String, Collection<String>> existingTitles = folderUid -> Set.of();

        private Builder(long orgId, ConditionTranslator conditionTranslator) {
            this.orgId = orgId;
            this.conditionTranslator = Objects.requireNonNull(conditionTranslator, "conditionTranslator");
        }

        public Builder config(MigrationConfig config) {
            this.config = Objects.requireNonNull(config);
            return this;
        }

        public Builder channelResolver(ChannelResolver channelResolver) {
            this.channelResolver = channelResolver;
            return this;
        }

        public Builder templateRenderer(MessageTemplateRenderer templateRenderer) {
            this.templateRenderer = Objects.requireNonNull(templateRenderer);
            return this;
        }

        public Builder silenceSink(SilenceSink silenceSink) {
            this.silenceSink = Objects.requireNonNull(silenceSink);
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = Objects.requireNonNull(tracer);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public Builder uidSupplier(Supplier<String> uidSupplier) {
            this.uidSupplier = Objects.requireNonNull(uidSupplier);
            return this;
        }

        /**
         * Titles already present in a folder before this run, by folder uid.
         */
        public Builder existingTitles(Function<String, Collection<String>> existingTitles) {
            this.existingTitles = Objects.requireNonNull(existingTitles);
            return this;
        }

        public OrgMigration build() {
            if (channelResolver == null) {
                throw new IllegalStateException("channelResolver is required");
            }
            return new OrgMigration(this);
        }
    }
}
