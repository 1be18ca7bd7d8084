/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.core.naming;

import java.security.SecureRandom;
import java.util.function.Supplier;

/**
 * Generates short random alphanumeric identifiers for migrated rules.
 */
public class ShortUidGenerator implements Supplier<String> {

    private static final char[] ALPHABET =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();

    static final int DEFAULT_LENGTH = 14;

    private final SecureRandom random = new SecureRandom();
    private final int length;

    public ShortUidGenerator() {
        this(DEFAULT_LENGTH);
    }

    public ShortUidGenerator(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive, got: " + length);
        }
        this.length = length;
    }

    @Override
    public String get() {
        char[] uid = new char[length];
        for (int i = 0; i < length; i++) {
            uid[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(uid);
    }
}
