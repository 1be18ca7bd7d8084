/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.core.labels;

import com.beacon.alertmigration.api.model.DashboardAlertSettings;
import com.beacon.alertmigration.api.model.LegacyAlert;
import com.beacon.alertmigration.api.model.MigrationLabels;
import com.beacon.alertmigration.api.model.MigrationStage;
import com.beacon.alertmigration.api.model.NotificationChannel;
import com.beacon.alertmigration.api.spi.MessageTemplateRenderer;
import com.beacon.alertmigration.core.MigrationDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the labels that drive routing and silencing of a migrated rule,
 * and the annotations that record where it came from.
 */
public class LabelAnnotationBuilder {

    private static final Logger logger = LoggerFactory.getLogger(LabelAnnotationBuilder.class);

    static final String TRUE = "true";

    private final MessageTemplateRenderer templateRenderer;

    public LabelAnnotationBuilder(MessageTemplateRenderer templateRenderer) {
        this.templateRenderer = templateRenderer;
    }

    /**
     * Legacy tags, the legacy-routing marker and one marker per resolved
     * channel. The rule uid label is added once the uid exists.
     */
    public Map<String, String> buildLabels(DashboardAlertSettings settings, List<NotificationChannel> channels) {
        Map<String, String> tags = settings.tags();
        Map<String, String> labels = new LinkedHashMap<>(tags.size() + channels.size() + 2);
        labels.putAll(tags);

        labels.put(MigrationLabels.USE_LEGACY_CHANNELS_LABEL, TRUE);
        for (NotificationChannel channel : channels) {
            labels.put(MigrationLabels.contactLabel(channel.name()), TRUE);
        }
        return labels;
    }

    /**
     * The four provenance annotations. Keys are always present, even with
     * empty values.
     */
    public Map<String, String> buildAnnotations(LegacyAlert alert, String dashboardUid,
                                                MigrationDiagnostics diagnostics) {
        Map<String, String> annotations = new LinkedHashMap<>(4);
        annotations.put(MigrationLabels.DASHBOARD_UID_ANNOTATION, dashboardUid == null ? "" : dashboardUid);
        annotations.put(MigrationLabels.PANEL_ID_ANNOTATION, Long.toString(alert.panelId()));
        annotations.put(MigrationLabels.ALERT_ID_ANNOTATION, Long.toString(alert.id()));
        annotations.put(MigrationLabels.MESSAGE_ANNOTATION, renderMessage(alert, diagnostics));
        return annotations;
    }

    private String renderMessage(LegacyAlert alert, MigrationDiagnostics diagnostics) {
        MessageTemplateRenderer.TemplateContext context = new MessageTemplateRenderer.TemplateContext(
                alert.orgId(), alert.id(), alert.name(), alert.panelId());
        try {
            return templateRenderer.render(alert.message(), context);
        } catch (RuntimeException e) {
            logger.atWarn()
                    .addKeyValue("field", "message")
                    .addKeyValue("alertId", alert.id())
                    .addKeyValue("err", e.getMessage())
                    .log("Failed to migrate message template, keeping original");
            diagnostics.degraded(MigrationStage.ANNOTATIONS,
                    "Message template could not be converted and was kept as is: " + e.getMessage());
            return alert.message();
        }
    }
}
