package com.dtoollookup.schema;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * DDL for the admin store relations.
 *
 * <ul>
 *   <li>{@code users}: one row per username</li>
 *   <li>{@code base_uris}: canonical base URIs (no trailing slash)</li>
 *   <li>{@code datasets}: admin records, unique on {@code uri}</li>
 *   <li>{@code search_permissions}, {@code register_permissions}: user/base URI edges</li>
 * </ul>
 *
 * Statements are idempotent so they can run on every startup. Text columns carry
 * no length limit; the registration payload puts none on names or URIs.
 */
@Component
public class AdminSchema {

    public static final List<String> TABLES = List.of(
        "users", "base_uris", "datasets", "search_permissions", "register_permissions");

    /** PostgreSQL's default schema, always present. */
    static final String DEFAULT_SCHEMA = "public";

    private static final Pattern SCHEMA_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /** DDL for unqualified tables, created in the connection's current schema. */
    public List<String> generateDdl() {
        return generateDdl(null);
    }

    /**
     * DDL that creates {@code schema} if needed and places every table in it.
     * A null or blank schema leaves the tables unqualified.
     */
    public List<String> generateDdl(String schema) {
        var prefix = "";
        var statements = new ArrayList<String>();
        if (schema != null && !schema.isBlank()) {
            if (!SCHEMA_NAME.matcher(schema).matches()) {
                throw new IllegalStateException("Invalid admin store schema name: " + schema);
            }
            if (!DEFAULT_SCHEMA.equals(schema)) {
                statements.add("CREATE SCHEMA IF NOT EXISTS " + schema);
            }
            prefix = schema + ".";
        }

        statements.add("""
            CREATE TABLE IF NOT EXISTS %1$susers (
              id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
              username VARCHAR NOT NULL UNIQUE,
              is_admin BOOLEAN NOT NULL DEFAULT FALSE
            )""".formatted(prefix));
        statements.add("""
            CREATE TABLE IF NOT EXISTS %1$sbase_uris (
              id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
              base_uri VARCHAR NOT NULL UNIQUE
            )""".formatted(prefix));
        statements.add("""
            CREATE TABLE IF NOT EXISTS %1$sdatasets (
              id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
              uuid VARCHAR(36) NOT NULL,
              uri VARCHAR NOT NULL UNIQUE,
              base_uri_id BIGINT NOT NULL REFERENCES %1$sbase_uris (id),
              name VARCHAR NOT NULL
            )""".formatted(prefix));
        statements.add("CREATE INDEX IF NOT EXISTS datasets_uuid_idx ON %sdatasets (uuid)".formatted(prefix));
        statements.add(permissionTable(prefix, "search_permissions"));
        statements.add(permissionTable(prefix, "register_permissions"));
        return statements;
    }

    private static String permissionTable(String prefix, String table) {
        return """
            CREATE TABLE IF NOT EXISTS %1$s%2$s (
              user_id BIGINT NOT NULL REFERENCES %1$susers (id),
              base_uri_id BIGINT NOT NULL REFERENCES %1$sbase_uris (id),
              PRIMARY KEY (user_id, base_uri_id)
            )""".formatted(prefix, table);
    }
}
