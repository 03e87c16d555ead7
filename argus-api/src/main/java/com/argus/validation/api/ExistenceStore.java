/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.api;

import com.argus.validation.api.model.ExistenceQuery;

/**
 * Narrow read contract the persistence-backed rules need from a data store.
 *
 * <p>Implementations may target any table-oriented store:
 * <ul>
 *   <li>JDBC data sources (see {@code argus-jdbc})</li>
 *   <li>In-memory fixtures for tests</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> Implementations must be thread-safe. Rules hold a single
 * store instance and may be invoked concurrently.
 *
 * <p><b>Failure semantics:</b> Read errors must be reported by throwing
 * {@link DataStoreException}. Returning {@code false} on failure would make an
 * unreadable store look like an empty one.
 */
public interface ExistenceStore {

    /**
     * Checks whether at least one row matches the query.
     *
     * @param query table, column, value, optional row filter and connection group
     * @return true if a matching row exists
     * @throws DataStoreException if the store cannot be read
     */
    boolean exists(ExistenceQuery query);
}
