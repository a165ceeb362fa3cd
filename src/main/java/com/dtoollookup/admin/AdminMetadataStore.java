package com.dtoollookup.admin;

import com.dtoollookup.errors.AuthenticationException;
import com.dtoollookup.errors.RegistrationConflictException;
import com.dtoollookup.errors.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Relational store for users, base URIs, dataset admin records and the
 * search/register permission relations.
 *
 * Relations are never loaded lazily: every collection a caller sees comes
 * from an explicit query issued by one of the methods below.
 */
@Repository
public class AdminMetadataStore {

    private static final Logger log = LoggerFactory.getLogger(AdminMetadataStore.class);

    static final String SEARCH_PERMISSIONS = "search_permissions";
    static final String REGISTER_PERMISSIONS = "register_permissions";

    private static final RowMapper<DatasetAdminRecord> DATASET_ROW = (rs, i) -> new DatasetAdminRecord(
        rs.getString("uuid"),
        rs.getString("base_uri"),
        rs.getString("uri"),
        rs.getString("name"));

    private static final String SELECT_DATASETS = """
        SELECT d.uuid, b.base_uri, d.uri, d.name
        FROM datasets d
        JOIN base_uris b ON b.id = d.base_uri_id
        """;

    private final JdbcTemplate jdbc;

    public AdminMetadataStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    // -----------------------------------------------------------------------
    // Users
    // -----------------------------------------------------------------------

    public boolean userExists(String username) {
        var count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM users WHERE username = ?", Integer.class, username);
        return count != null && count > 0;
    }

    /**
     * Load a user with its permission sets.
     *
     * @throws AuthenticationException if the username is not registered
     */
    public User getUser(String username) {
        var admin = jdbc.query(
            "SELECT is_admin FROM users WHERE username = ?",
            (rs, i) -> rs.getBoolean("is_admin"),
            username);
        if (admin.isEmpty()) {
            throw AuthenticationException.unknownUser(username);
        }
        return new User(username, admin.get(0), searchBaseUris(username), registerBaseUris(username));
    }

    /**
     * Register users, skipping any username that already exists.
     * {@code is_admin} of existing users is never touched here.
     *
     * @return the usernames that were skipped
     */
    public List<String> registerUsers(List<UserRegistration> users) {
        var skipped = new ArrayList<String>();
        for (var user : users) {
            if (userExists(user.username())) {
                skipped.add(user.username());
                continue;
            }
            try {
                jdbc.update("INSERT INTO users (username, is_admin) VALUES (?, ?)",
                    user.username(), user.adminOrDefault());
            } catch (DuplicateKeyException e) {
                // registered concurrently between the check and the insert
                log.debug("User {} registered concurrently", user.username());
                skipped.add(user.username());
            }
        }
        return skipped;
    }

    /** @return false if the user does not exist */
    public boolean setUserIsAdmin(String username, boolean admin) {
        return jdbc.update("UPDATE users SET is_admin = ? WHERE username = ?", admin, username) > 0;
    }

    public List<User> listUsers() {
        var usernames = jdbc.queryForList("SELECT username FROM users ORDER BY id", String.class);
        var users = new ArrayList<User>(usernames.size());
        for (var username : usernames) {
            users.add(getUser(username));
        }
        return users;
    }

    // -----------------------------------------------------------------------
    // Base URIs
    // -----------------------------------------------------------------------

    public boolean baseUriExists(String baseUri) {
        return findBaseUri(baseUri).isPresent();
    }

    /**
     * @throws ValidationException if the base URI has not been registered
     */
    public BaseUri getBaseUri(String baseUri) {
        return findBaseUri(baseUri).orElseThrow(() ->
            new ValidationException("Base URI %s not registered".formatted(baseUri)));
    }

    /**
     * Insert a base URI exactly as given. Callers canonicalize first.
     *
     * @throws ValidationException if the base URI is already registered
     */
    public void registerBaseUri(String baseUri) {
        try {
            jdbc.update("INSERT INTO base_uris (base_uri) VALUES (?)", baseUri);
        } catch (DuplicateKeyException e) {
            throw new ValidationException("Base URI %s already registered".formatted(baseUri));
        }
    }

    public List<String> listBaseUris() {
        return jdbc.queryForList("SELECT base_uri FROM base_uris ORDER BY id", String.class);
    }

    private Optional<BaseUri> findBaseUri(String baseUri) {
        return jdbc.query(
            "SELECT id, base_uri FROM base_uris WHERE base_uri = ?",
            (rs, i) -> new BaseUri(rs.getLong("id"), rs.getString("base_uri")),
            baseUri
        ).stream().findFirst();
    }

    // -----------------------------------------------------------------------
    // Dataset admin records
    // -----------------------------------------------------------------------

    public Optional<DatasetAdminRecord> getAdminRecordByUri(String uri) {
        return jdbc.query(SELECT_DATASETS + "WHERE d.uri = ?", DATASET_ROW, uri)
            .stream().findFirst();
    }

    /**
     * Insert an admin record. Relies on the unique constraint on {@code uri};
     * callers look the URI up first.
     *
     * @throws ValidationException if the base URI is not registered
     * @throws RegistrationConflictException if a record for {@code uri} already exists
     */
    public void insertAdminRecord(String uuid, String uri, String baseUri, String name) {
        var owner = getBaseUri(baseUri);
        try {
            jdbc.update("INSERT INTO datasets (uuid, uri, base_uri_id, name) VALUES (?, ?, ?, ?)",
                uuid, uri, owner.id(), name);
        } catch (DuplicateKeyException e) {
            throw new RegistrationConflictException(
                "Dataset %s was registered concurrently, retry the registration".formatted(uri), e);
        }
    }

    public List<DatasetAdminRecord> listDatasetsForBaseUri(String baseUri) {
        return jdbc.query(SELECT_DATASETS + "WHERE b.base_uri = ? ORDER BY d.id", DATASET_ROW, baseUri);
    }

    /**
     * Admin records with the given UUID whose base URI the user holds a search
     * grant on, resolved in one join.
     */
    public List<DatasetAdminRecord> lookupVisibleDatasets(String username, String uuid) {
        return jdbc.query(SELECT_DATASETS + """
                JOIN search_permissions p ON p.base_uri_id = d.base_uri_id
                JOIN users u ON u.id = p.user_id
                WHERE d.uuid = ? AND u.username = ?
                ORDER BY d.id
                """,
            DATASET_ROW, uuid, username);
    }

    public long countDatasets() {
        var count = jdbc.queryForObject("SELECT COUNT(*) FROM datasets", Long.class);
        return count != null ? count : 0L;
    }

    // -----------------------------------------------------------------------
    // Permissions
    // -----------------------------------------------------------------------

    /** @return true if a new edge was added */
    public boolean grantSearch(String username, String baseUri) {
        return grant(SEARCH_PERMISSIONS, username, baseUri);
    }

    /** @return true if a new edge was added */
    public boolean grantRegister(String username, String baseUri) {
        return grant(REGISTER_PERMISSIONS, username, baseUri);
    }

    public boolean hasSearchPermission(String username, String baseUri) {
        return hasEdge(SEARCH_PERMISSIONS, username, baseUri);
    }

    public boolean hasRegisterPermission(String username, String baseUri) {
        return hasEdge(REGISTER_PERMISSIONS, username, baseUri);
    }

    public List<String> searchBaseUris(String username) {
        return baseUrisFor(SEARCH_PERMISSIONS, username);
    }

    public List<String> registerBaseUris(String username) {
        return baseUrisFor(REGISTER_PERMISSIONS, username);
    }

    public List<String> usersWithSearchPermission(String baseUri) {
        return usersFor(SEARCH_PERMISSIONS, baseUri);
    }

    public List<String> usersWithRegisterPermission(String baseUri) {
        return usersFor(REGISTER_PERMISSIONS, baseUri);
    }

    /**
     * Add an edge. Missing users, missing base URIs and existing edges all
     * select no rows, so the insert is a no-op for them.
     */
    private boolean grant(String table, String username, String baseUri) {
        try {
            var inserted = jdbc.update("""
                INSERT INTO %1$s (user_id, base_uri_id)
                SELECT u.id, b.id FROM users u, base_uris b
                WHERE u.username = ? AND b.base_uri = ?
                AND NOT EXISTS (
                  SELECT 1 FROM %1$s p WHERE p.user_id = u.id AND p.base_uri_id = b.id)
                """.formatted(table), username, baseUri);
            if (inserted > 0) {
                log.debug("Granted {} on {} to {}", table, baseUri, username);
            }
            return inserted > 0;
        } catch (DuplicateKeyException e) {
            // same edge granted concurrently
            log.debug("Edge {} {} -> {} already present", table, username, baseUri);
            return false;
        }
    }

    private boolean hasEdge(String table, String username, String baseUri) {
        var count = jdbc.queryForObject("""
            SELECT COUNT(*) FROM %s p
            JOIN users u ON u.id = p.user_id
            JOIN base_uris b ON b.id = p.base_uri_id
            WHERE u.username = ? AND b.base_uri = ?
            """.formatted(table), Integer.class, username, baseUri);
        return count != null && count > 0;
    }

    private List<String> baseUrisFor(String table, String username) {
        return jdbc.queryForList("""
            SELECT b.base_uri FROM %s p
            JOIN users u ON u.id = p.user_id
            JOIN base_uris b ON b.id = p.base_uri_id
            WHERE u.username = ?
            ORDER BY b.id
            """.formatted(table), String.class, username);
    }

    private List<String> usersFor(String table, String baseUri) {
        return jdbc.queryForList("""
            SELECT u.username FROM %s p
            JOIN users u ON u.id = p.user_id
            JOIN base_uris b ON b.id = p.base_uri_id
            WHERE b.base_uri = ?
            ORDER BY u.id
            """.formatted(table), String.class, baseUri);
    }
}
