package com.dtoollookup.web;

import com.dtoollookup.admin.DatasetAdminRecord;
import com.dtoollookup.query.QueryEngine;
import com.dtoollookup.registration.RegistrationCoordinator;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * Dataset registration and permission-scoped queries.
 */
@RestController
public class DatasetController {

    private final QueryEngine queryEngine;
    private final RegistrationCoordinator registration;
    private final UsernameResolver usernameResolver;

    public DatasetController(
        QueryEngine queryEngine,
        RegistrationCoordinator registration,
        UsernameResolver usernameResolver
    ) {
        this.queryEngine = queryEngine;
        this.registration = registration;
        this.usernameResolver = usernameResolver;
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public String index() {
        return "%d registered datasets".formatted(queryEngine.countDatasets());
    }

    @GetMapping("/lookup_datasets/{uuid}")
    public List<DatasetAdminRecord> lookupDatasets(@PathVariable String uuid, HttpServletRequest request) {
        return queryEngine.lookupByUuid(usernameResolver.resolve(request), uuid);
    }

    @GetMapping("/list_datasets")
    public List<DatasetAdminRecord> listDatasets(HttpServletRequest request) {
        return queryEngine.listForUser(usernameResolver.resolve(request));
    }

    @PostMapping("/search_for_datasets")
    public List<Map<String, Object>> searchForDatasets(
        @RequestBody(required = false) Map<String, Object> query,
        HttpServletRequest request
    ) {
        return queryEngine.searchForUser(usernameResolver.resolve(request), query);
    }

    @PostMapping(value = "/register_dataset", produces = MediaType.TEXT_PLAIN_VALUE)
    public String registerDataset(@RequestBody Map<String, Object> datasetInfo) {
        return registration.register(datasetInfo);
    }

    @GetMapping(value = "/dataset_readme", produces = MediaType.TEXT_PLAIN_VALUE)
    public String datasetReadme(@RequestParam String uri, HttpServletRequest request) {
        return queryEngine.readmeForUser(usernameResolver.resolve(request), uri)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No readme for " + uri));
    }
}
