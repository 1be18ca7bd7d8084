/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.spi;

import com.beacon.alertmigration.api.exceptions.TemplateRenderingException;

/**
 * Rewrites a legacy alert message into the unified template syntax.
 */
public interface MessageTemplateRenderer {

    /**
     * @throws TemplateRenderingException if the template cannot be converted;
     *         migration then keeps the original message
     */
    String render(String template, TemplateContext context);

    /**
     * Alert identity available while rendering, mostly for diagnostics.
     */
    record TemplateContext(long orgId, long alertId, String alertName, long panelId) {}
}
