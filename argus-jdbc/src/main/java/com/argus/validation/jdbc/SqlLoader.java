/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.jdbc;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility for loading named SQL fragments from resource files.
 *
 * <p><b>Query Format:</b>
 * <pre>
 * -- @name: query_name
 * SELECT 1 FROM {table} WHERE {column} = ?
 * </pre>
 *
 * Multi-line queries are joined with single spaces; other comment lines and a
 * trailing semicolon are dropped.
 */
public final class SqlLoader {

    private static final Logger logger = Logger.getLogger(SqlLoader.class.getName());

    private static final String NAME_MARKER = "-- @name:";

    private SqlLoader() {
    }

    /**
     * Load all SQL queries from a resource file.
     *
     * @param resourcePath path to SQL file (e.g., "sql/existence-queries.sql")
     * @return map of query names to SQL strings
     */
    public static Map<String, String> loadQueries(String resourcePath) {
        InputStream is = SqlLoader.class.getClassLoader().getResourceAsStream(resourcePath);
        if (is == null) {
            throw new UncheckedIOException(new IOException("Resource not found: " + resourcePath));
        }

        Map<String, String> queries = new HashMap<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            String line;
            String currentQueryName = null;
            StringBuilder currentQuery = new StringBuilder();

            while ((line = reader.readLine()) != null) {
                line = line.trim();

                if (line.startsWith(NAME_MARKER)) {
                    store(queries, currentQueryName, currentQuery);
                    currentQueryName = line.substring(NAME_MARKER.length()).trim();
                    currentQuery = new StringBuilder();
                } else if (line.startsWith("--") || line.isEmpty()) {
                    continue;
                } else if (currentQueryName != null) {
                    if (currentQuery.length() > 0) {
                        currentQuery.append(' ');
                    }
                    currentQuery.append(line);
                }
            }
            store(queries, currentQueryName, currentQuery);

            logger.info("Loaded " + queries.size() + " SQL queries from " + resourcePath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load SQL queries from " + resourcePath, e);
            throw new UncheckedIOException("Failed to load SQL queries", e);
        }

        return queries;
    }

    private static void store(Map<String, String> queries, String name, StringBuilder query) {
        if (name == null || query.length() == 0) {
            return;
        }
        String sql = query.toString().trim();
        if (sql.endsWith(";")) {
            sql = sql.substring(0, sql.length() - 1).trim();
        }
        queries.put(name, sql);
    }
}
