package com.dtoollookup.registration;

import com.dtoollookup.admin.AdminMetadataStore;
import com.dtoollookup.descriptive.DescriptiveMetadataStore;
import com.dtoollookup.errors.RegistrationConflictException;
import com.dtoollookup.errors.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registers a dataset in both stores.
 *
 * Steps, in order:
 * <ol>
 *   <li>validate the payload</li>
 *   <li>resolve the base URI in the admin store</li>
 *   <li>insert the admin record unless one exists for the URI (existing records are immutable)</li>
 *   <li>upsert the descriptive document under (uuid, uri)</li>
 * </ol>
 *
 * Steps 1 and 2 fail before any write. The two stores share no transaction: if
 * step 4 fails the admin record stays and a retry of the same payload completes it.
 */
@Service
public class RegistrationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RegistrationCoordinator.class);

    private final AdminMetadataStore adminStore;
    private final DescriptiveMetadataStore descriptiveStore;

    public RegistrationCoordinator(AdminMetadataStore adminStore, DescriptiveMetadataStore descriptiveStore) {
        this.adminStore = adminStore;
        this.descriptiveStore = descriptiveStore;
    }

    /**
     * @return the URI of the registered dataset
     * @throws ValidationException if the payload is invalid or its base URI is not registered
     * @throws RegistrationConflictException if a concurrent registration inserted the same URI first
     */
    public String register(Map<String, Object> datasetInfo) {
        var problem = DatasetInfoValidator.problem(datasetInfo);
        if (problem.isPresent()) {
            throw new ValidationException(problem.get());
        }

        var payload = new LinkedHashMap<>(datasetInfo);
        payload.remove(DescriptiveMetadataStore.INTERNAL_ID);
        var uuid = (String) payload.get("uuid");
        var uri = (String) payload.get("uri");
        var baseUri = (String) payload.get("base_uri");

        if (!adminStore.baseUriExists(baseUri)) {
            throw new ValidationException("Base URI is not registered: " + baseUri);
        }

        if (adminStore.getAdminRecordByUri(uri).isEmpty()) {
            adminStore.insertAdminRecord(uuid, uri, baseUri, (String) payload.get("name"));
            log.info("Registered admin record for {} ({})", uri, uuid);
        } else {
            log.debug("Admin record for {} already present, refreshing descriptive metadata only", uri);
        }

        descriptiveStore.upsert(uuid, uri, payload);
        log.info("Registered dataset {}", uri);
        return uri;
    }
}
