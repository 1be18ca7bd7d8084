/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.api.exceptions;

/**
 * Thrown by condition translators for conditions they cannot express.
 */
public class ConditionTranslationException extends RuntimeException {

    public ConditionTranslationException(String message) {
        super(message);
    }

    public ConditionTranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
