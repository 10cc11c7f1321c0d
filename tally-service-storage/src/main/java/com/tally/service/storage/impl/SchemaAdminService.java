package com.tally.service.storage.impl;

import com.tally.service.core.config.TallyProperties;
import com.tally.service.core.support.ConfigurationException;
import com.tally.service.core.support.StoreErrors;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Administrative reset of the tally schema. Only ever invoked explicitly; nothing on the runtime
 * paths calls it.
 */
@Slf4j
@Service
public class SchemaAdminService {

    private static final Pattern IDENTIFIER_RE = Pattern.compile("^[a-z_][a-z0-9_]{0,62}$");

    private final JdbcTemplate jdbc;
    private final TransactionTemplate txTemplate;
    private final TallyProperties properties;

    public SchemaAdminService(JdbcTemplate jdbc, TransactionTemplate txTemplate, TallyProperties properties) {
        this.jdbc = jdbc;
        this.txTemplate = txTemplate;
        this.properties = properties;
    }

    /**
     * Drops every table of {@code schema}, cascading to dependent objects.
     *
     * @return the dropped table names
     * @throws ConfigurationException when resets are disabled or {@code schema} is not the configured one
     */
    public List<String> dropAllTables(String schema) {
        TallyProperties.Admin admin = properties.getAdmin();
        if (!admin.isResetEnabled()) {
            throw new ConfigurationException("Schema reset is disabled (tally.admin.reset-enabled=false)");
        }
        if (schema == null || !IDENTIFIER_RE.matcher(schema).matches()) {
            throw new ConfigurationException("Invalid schema name: " + schema);
        }
        if (!schema.equals(admin.getSchema())) {
            throw new ConfigurationException(
                    "Schema '" + schema + "' is not the configured namespace '" + admin.getSchema() + "'");
        }

        log.warn("Dropping all tables in schema {}", schema);
        try {
            List<String> dropped = txTemplate.execute(status -> {
                List<String> tables = jdbc.queryForList(
                        "select tablename from pg_tables where schemaname = ? order by tablename", String.class, schema);
                for (String table : tables) {
                    jdbc.execute("drop table if exists " + quote(schema) + "." + quote(table) + " cascade");
                }
                return tables;
            });
            log.warn("Dropped {} tables in schema {}: {}", dropped.size(), schema, dropped);
            return dropped;
        } catch (RuntimeException ex) {
            log.error("Schema reset of {} failed", schema, ex);
            throw StoreErrors.translate("Schema reset " + schema, ex);
        }
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
