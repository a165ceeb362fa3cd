package com.dtoollookup.query;

import com.dtoollookup.admin.AdminMetadataStore;
import com.dtoollookup.admin.DatasetAdminRecord;
import com.dtoollookup.descriptive.DescriptiveMetadataStore;
import com.dtoollookup.errors.AuthenticationException;
import com.dtoollookup.errors.ValidationException;
import com.dtoollookup.permission.PermissionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dataset list, search and lookup, restricted to the base URIs a user may search.
 *
 * Every per-user operation fails with {@link AuthenticationException} for an
 * unknown username and returns an empty list for a user without search grants.
 */
@Service
public class QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    private final AdminMetadataStore adminStore;
    private final DescriptiveMetadataStore descriptiveStore;
    private final PermissionEngine permissions;

    public QueryEngine(
        AdminMetadataStore adminStore,
        DescriptiveMetadataStore descriptiveStore,
        PermissionEngine permissions
    ) {
        this.adminStore = adminStore;
        this.descriptiveStore = descriptiveStore;
        this.permissions = permissions;
    }

    /** Admin records of every dataset under the user's search scope. */
    public List<DatasetAdminRecord> listForUser(String username) {
        var datasets = new ArrayList<DatasetAdminRecord>();
        for (var baseUri : permissions.resolveSearchScope(username)) {
            datasets.addAll(adminStore.listDatasetsForBaseUri(baseUri));
        }
        return datasets;
    }

    /**
     * Run {@code query} against the descriptive store once per base URI in scope,
     * with {@code base_uri} pinned to that URI, and concatenate the results.
     */
    public List<Map<String, Object>> searchForUser(String username, Map<String, Object> query) {
        var scope = permissions.resolveSearchScope(username);
        var datasets = new ArrayList<Map<String, Object>>();
        for (var baseUri : scope) {
            var scoped = new LinkedHashMap<String, Object>(query != null ? query : Map.of());
            scoped.put("base_uri", baseUri);
            try (var found = descriptiveStore.findMany(scoped)) {
                found.forEach(datasets::add);
            }
        }
        log.debug("Search by {} over {} base URIs matched {} datasets", username, scope.size(), datasets.size());
        return datasets;
    }

    /** Admin records with this UUID that the user holds a search grant for. */
    public List<DatasetAdminRecord> lookupByUuid(String username, String uuid) {
        if (!adminStore.userExists(username)) {
            throw AuthenticationException.unknownUser(username);
        }
        return adminStore.lookupVisibleDatasets(username, uuid);
    }

    /**
     * Readme of the dataset at {@code uri}, if it is registered and the user may search its base URI.
     */
    public Optional<String> readmeForUser(String username, String uri) {
        if (!adminStore.userExists(username)) {
            throw AuthenticationException.unknownUser(username);
        }
        var record = adminStore.getAdminRecordByUri(uri);
        if (record.isEmpty() || !permissions.checkSearch(username, record.get().baseUri())) {
            return Optional.empty();
        }
        return descriptiveStore.findOne(Map.of("uuid", record.get().uuid(), "uri", uri))
            .map(document -> document.get("readme"))
            .map(String::valueOf);
    }

    /**
     * @throws ValidationException if the base URI is not registered
     */
    public List<DatasetAdminRecord> listAdminMetadataInBaseUri(String baseUri) {
        var registered = adminStore.getBaseUri(baseUri);
        return adminStore.listDatasetsForBaseUri(registered.baseUri());
    }

    public long countDatasets() {
        return adminStore.countDatasets();
    }
}
