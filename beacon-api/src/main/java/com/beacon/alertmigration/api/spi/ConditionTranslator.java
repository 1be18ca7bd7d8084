/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.spi;

import com.beacon.alertmigration.api.exceptions.ConditionTranslationException;
import com.beacon.alertmigration.api.model.DashboardAlertSettings;
import com.beacon.alertmigration.api.model.TranslatedCondition;

/**
 * Translates legacy alert conditions into unified queries and expressions.
 */
public interface ConditionTranslator {

    /**
     * @param settings parsed legacy settings, conditions included
     * @param orgId    organisation the alert belongs to
     * @return condition ref id and the ordered queries it depends on
     * @throws ConditionTranslationException if the conditions cannot be expressed
     */
    TranslatedCondition translate(DashboardAlertSettings settings, long orgId);
}
