/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.jdbc;

import com.argus.validation.api.DataStoreException;
import com.argus.validation.core.config.ValidationConfig;

import javax.sql.DataSource;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Named data sources a submission can target through its reserved group key
 * (e.g. {@code DBGroup=reporting}).
 *
 * <p>Groups are registered explicitly by the application; nothing is looked up
 * globally. A null group name selects the default group.
 *
 * <p><b>Thread Safety:</b> registration and lookup may happen concurrently.
 */
public final class ConnectionGroups {

    private static final Logger logger = Logger.getLogger(ConnectionGroups.class.getName());

    private final Map<String, DataSource> groups = new ConcurrentHashMap<>();
    private final String defaultGroup;

    public ConnectionGroups(String defaultGroup) {
        if (defaultGroup == null || defaultGroup.isBlank()) {
            throw new IllegalArgumentException("defaultGroup must not be blank");
        }
        this.defaultGroup = defaultGroup;
    }

    public static ConnectionGroups fromConfig(ValidationConfig config) {
        return new ConnectionGroups(config.defaultConnectionGroup());
    }

    /**
     * Single-source setup: registers {@code dataSource} as the default group.
     */
    public static ConnectionGroups of(DataSource dataSource) {
        return new ConnectionGroups(ValidationConfig.DEFAULT_GROUP_NAME)
                .register(ValidationConfig.DEFAULT_GROUP_NAME, dataSource);
    }

    public ConnectionGroups register(String name, DataSource dataSource) {
        Objects.requireNonNull(name, "group name cannot be null");
        Objects.requireNonNull(dataSource, "dataSource cannot be null");
        DataSource previous = groups.put(name, dataSource);
        if (previous != null) {
            logger.warning("Connection group replaced: " + name);
        } else {
            logger.info("Connection group registered: " + name);
        }
        return this;
    }

    /**
     * @param group requested group, null for the default
     * @return the group's data source
     * @throws DataStoreException if no such group is registered
     */
    public DataSource resolve(String group) {
        String name = group == null ? defaultGroup : group;
        DataSource dataSource = groups.get(name);
        if (dataSource == null) {
            throw new DataStoreException("Unknown connection group: " + name);
        }
        return dataSource;
    }

    public boolean contains(String name) {
        return name != null && groups.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(groups.keySet());
    }

    public String defaultGroup() {
        return defaultGroup;
    }
}
