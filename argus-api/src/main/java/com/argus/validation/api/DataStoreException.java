/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.api;

/**
 * Failure reported by an {@link ExistenceStore}.
 *
 * Persistence-backed rules propagate this unchanged: a store that cannot be
 * read is never interpreted as "value is unique".
 */
public class DataStoreException extends RuntimeException {

    public DataStoreException(String message) {
        super(message);
    }

    public DataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
