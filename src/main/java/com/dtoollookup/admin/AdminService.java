package com.dtoollookup.admin;

import com.dtoollookup.errors.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Administrative operations on users and base URIs.
 */
@Service
public class AdminService {

    private static final Logger log = LoggerFactory.getLogger(AdminService.class);

    private final AdminMetadataStore store;

    public AdminService(AdminMetadataStore store) {
        this.store = store;
    }

    /**
     * Register users; already registered usernames are skipped.
     *
     * @return the skipped usernames
     */
    public List<String> registerUsers(List<UserRegistration> users) {
        for (var user : users) {
            if (user.username() == null || user.username().isBlank()) {
                throw new ValidationException("Username must not be empty");
            }
        }
        var skipped = store.registerUsers(users);
        log.info("Registered {} users, skipped existing: {}", users.size() - skipped.size(), skipped);
        return skipped;
    }

    /** @return false if the user does not exist */
    public boolean setUserIsAdmin(String username, boolean admin) {
        var updated = store.setUserIsAdmin(username, admin);
        if (updated) {
            log.info("Set is_admin={} for {}", admin, username);
        }
        return updated;
    }

    public List<User> listUsers() {
        return store.listUsers();
    }

    public Optional<User> getUserInfo(String username) {
        if (!store.userExists(username)) {
            return Optional.empty();
        }
        return Optional.of(store.getUser(username));
    }

    /**
     * Register a base URI in canonical form.
     *
     * @return the canonical base URI that was stored
     */
    public String registerBaseUri(String baseUri) {
        var canonical = canonicalBaseUri(baseUri);
        store.registerBaseUri(canonical);
        log.info("Registered base URI {}", canonical);
        return canonical;
    }

    public List<String> listBaseUris() {
        return store.listBaseUris();
    }

    /** Strip trailing slashes: "s3://bucket/" → "s3://bucket" */
    static String canonicalBaseUri(String baseUri) {
        if (baseUri == null || baseUri.isBlank()) {
            throw new ValidationException("Base URI must not be empty");
        }
        var end = baseUri.length();
        while (end > 0 && baseUri.charAt(end - 1) == '/') {
            end--;
        }
        if (end == 0) {
            throw new ValidationException("Base URI must not be empty");
        }
        return baseUri.substring(0, end);
    }
}
