/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.exceptions;

public class TemplateRenderingException extends RuntimeException {

    public TemplateRenderingException(String message) {
        super(message);
    }
}
