package com.dtoollookup.permission;

import com.dtoollookup.admin.AdminMetadataStore;
import com.dtoollookup.admin.BaseUriPermissions;
import com.dtoollookup.errors.AuthenticationException;
import com.dtoollookup.errors.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Grants and checks the search and register rights users hold on base URIs.
 */
@Service
public class PermissionEngine {

    private static final Logger log = LoggerFactory.getLogger(PermissionEngine.class);

    private final AdminMetadataStore store;

    public PermissionEngine(AdminMetadataStore store) {
        this.store = store;
    }

    public boolean checkSearch(String username, String baseUri) {
        return store.hasSearchPermission(username, baseUri);
    }

    public boolean checkRegister(String username, String baseUri) {
        return store.hasRegisterPermission(username, baseUri);
    }

    /**
     * Add the listed grants. Never revokes. Usernames that are not registered
     * are skipped and reported in the result.
     *
     * @throws ValidationException if the base URI is not registered or a username is null or blank;
     *     nothing is granted in that case
     */
    public PermissionUpdateResult updatePermissions(PermissionUpdate update) {
        var baseUri = store.getBaseUri(update.baseUri()).baseUri();
        requireUsernames(update.usersWithSearchPermissions());
        requireUsernames(update.usersWithRegisterPermissions());
        var skipped = new LinkedHashSet<String>();

        for (var username : update.usersWithSearchPermissions()) {
            if (store.userExists(username)) {
                store.grantSearch(username, baseUri);
            } else {
                skipped.add(username);
            }
        }
        for (var username : update.usersWithRegisterPermissions()) {
            if (store.userExists(username)) {
                store.grantRegister(username, baseUri);
            } else {
                skipped.add(username);
            }
        }

        if (!skipped.isEmpty()) {
            log.info("Permission update on {} skipped unregistered users: {}", baseUri, skipped);
        }
        log.info("Updated permissions on {}: search={}, register={}", baseUri,
            update.usersWithSearchPermissions(), update.usersWithRegisterPermissions());
        return new PermissionUpdateResult(baseUri, new ArrayList<>(skipped));
    }

    /**
     * @return the base URIs the user may search, in registration order
     * @throws AuthenticationException if the user is not registered
     */
    public List<String> resolveSearchScope(String username) {
        requireUser(username);
        return store.searchBaseUris(username);
    }

    /**
     * @return the base URIs the user may register datasets into
     * @throws AuthenticationException if the user is not registered
     */
    public List<String> resolveRegisterScope(String username) {
        requireUser(username);
        return store.registerBaseUris(username);
    }

    /**
     * @throws ValidationException if the base URI is not registered
     */
    public BaseUriPermissions showPermissions(String baseUri) {
        var registered = store.getBaseUri(baseUri).baseUri();
        return new BaseUriPermissions(
            registered,
            store.usersWithSearchPermission(registered),
            store.usersWithRegisterPermission(registered));
    }

    private static void requireUsernames(List<String> usernames) {
        for (var username : usernames) {
            if (username == null || username.isBlank()) {
                throw new ValidationException("Username must not be empty");
            }
        }
    }

    private void requireUser(String username) {
        if (!store.userExists(username)) {
            throw AuthenticationException.unknownUser(username);
        }
    }
}
