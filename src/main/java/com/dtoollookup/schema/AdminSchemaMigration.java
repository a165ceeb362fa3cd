package com.dtoollookup.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Creates the admin store schema and relations on startup if they are missing.
 *
 * The schema is the one every pooled connection is opened in
 * ({@code spring.datasource.hikari.schema}); blank means the database default.
 */
@Service
public class AdminSchemaMigration implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminSchemaMigration.class);

    private final JdbcTemplate jdbc;
    private final AdminSchema adminSchema;
    private final String schema;

    public AdminSchemaMigration(
        JdbcTemplate jdbc,
        AdminSchema adminSchema,
        @Value("${spring.datasource.hikari.schema:}") String schema
    ) {
        this.jdbc = jdbc;
        this.adminSchema = adminSchema;
        this.schema = schema;
    }

    @Override
    public void run(String... args) {
        migrate();
    }

    /**
     * Create every admin relation that does not exist yet. Existing rows are kept.
     */
    public void migrate() {
        var statements = adminSchema.generateDdl(schema);
        log.info("Running admin store migration in schema '{}': {} SQL statements for {} tables",
            schema == null || schema.isBlank() ? "<default>" : schema,
            statements.size(), AdminSchema.TABLES.size());

        for (var sql : statements) {
            log.debug("Executing: {}", sql);
            jdbc.execute(sql);
        }

        log.info("Admin store migration complete");
    }
}
