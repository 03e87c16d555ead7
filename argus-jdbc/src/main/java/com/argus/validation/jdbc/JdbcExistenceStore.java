/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.jdbc;

import com.argus.validation.api.DataStoreException;
import com.argus.validation.api.ExistenceStore;
import com.argus.validation.api.model.ExistenceQuery;
import com.argus.validation.api.model.RowFilter;
import com.argus.validation.core.config.ValidationConfig;
import com.argus.validation.core.telemetry.TracingService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * JDBC-based {@link ExistenceStore} for H2, PostgreSQL or any SQL database with a
 * plain {@code SELECT ... WHERE} dialect.
 *
 * <p>One query per call, no caching and no retries:
 * <pre>
 * SELECT 1 FROM table WHERE column = ? [AND filter_column &lt;&gt; ? | AND filter_column = ?]
 * </pre>
 * The result is capped at one row with {@link java.sql.Statement#setMaxRows(int)}.
 * A null value is matched with {@code IS NULL}. Values are bound as strings and
 * the driver converts them to the column type.
 *
 * <p>Identifiers are interpolated into the SQL text, so they are re-checked here
 * against {@code [A-Za-z_][A-Za-z0-9_]*} even though the rule parser validates them too.
 *
 * <p><b>Failures:</b> any {@link SQLException} is logged and rethrown as
 * {@link DataStoreException}; it is never reported as "no row".
 *
 * <p><b>Thread Safety:</b> stateless apart from immutable SQL templates; connections
 * are borrowed per call.
 */
public class JdbcExistenceStore implements ExistenceStore {

    private static final Logger logger = Logger.getLogger(JdbcExistenceStore.class.getName());

    private static final Map<String, String> SQL = SqlLoader.loadQueries("sql/existence-queries.sql");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final ConnectionGroups groups;
    private final int queryTimeoutSeconds;
    private final Tracer tracer;

    public JdbcExistenceStore(ConnectionGroups groups, ValidationConfig config, Tracer tracer) {
        this.groups = Objects.requireNonNull(groups, "groups cannot be null");
        this.queryTimeoutSeconds = config.queryTimeoutSeconds();
        this.tracer = Objects.requireNonNull(tracer, "tracer cannot be null");
    }

    public JdbcExistenceStore(ConnectionGroups groups, ValidationConfig config) {
        this(groups, config, TracingService.tracerFor(config));
    }

    /**
     * Single data source with default settings.
     */
    public JdbcExistenceStore(DataSource dataSource) {
        this(ConnectionGroups.of(dataSource), ValidationConfig.fromEnvironment());
    }

    @Override
    public boolean exists(ExistenceQuery query) {
        Objects.requireNonNull(query, "query cannot be null");
        String sql = buildSql(query);

        Span span = tracer.spanBuilder("existence-query").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("db.sql.table", query.table());
            span.setAttribute("db.column", query.column());
            span.setAttribute("validation.filter", query.filter().getClass().getSimpleName());
            if (query.connectionGroup() != null) {
                span.setAttribute("validation.connection_group", query.connectionGroup());
            }

            DataSource dataSource = groups.resolve(query.connectionGroup());
            boolean found = execute(dataSource, sql, query);

            span.setAttribute("validation.row_found", found);
            logger.fine(() -> "Existence query [" + sql + "] found=" + found);
            return found;

        } catch (SQLException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            logger.log(Level.SEVERE, "Existence query failed: " + sql, e);
            throw new DataStoreException(
                    "Existence query failed for " + query.table() + "." + query.column(), e);
        } finally {
            span.end();
        }
    }

    private boolean execute(DataSource dataSource, String sql, ExistenceQuery query) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setMaxRows(1);
            if (queryTimeoutSeconds > 0) {
                stmt.setQueryTimeout(queryTimeoutSeconds);
            }

            int idx = 1;
            if (query.value() != null) {
                stmt.setString(idx++, query.value());
            }
            if (query.filter() instanceof RowFilter.Excluding excluding) {
                stmt.setString(idx, excluding.value());
            } else if (query.filter() instanceof RowFilter.Requiring requiring) {
                stmt.setString(idx, requiring.value());
            }

            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    String buildSql(ExistenceQuery query) {
        String base = SQL.get(query.value() == null ? "exists_by_null" : "exists_by_value")
                .replace("{table}", identifier(query.table()))
                .replace("{column}", identifier(query.column()));

        if (query.filter() instanceof RowFilter.Excluding excluding) {
            return base + " " + SQL.get("filter_excluding")
                    .replace("{filter_column}", identifier(excluding.column()));
        }
        if (query.filter() instanceof RowFilter.Requiring requiring) {
            return base + " " + SQL.get("filter_requiring")
                    .replace("{filter_column}", identifier(requiring.column()));
        }
        return base;
    }

    private static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Illegal SQL identifier: " + name);
        }
        return name;
    }
}
