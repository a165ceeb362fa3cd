package com.dtoollookup.registration;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks a dataset registration payload before anything is written.
 */
public final class DatasetInfoValidator {

    public static final List<String> REQUIRED_KEYS =
        List.of("uuid", "base_uri", "uri", "name", "type", "readme");

    static final int UUID_LENGTH = 36;

    private DatasetInfoValidator() {}

    public static boolean isValid(Map<String, Object> datasetInfo) {
        return problem(datasetInfo).isEmpty();
    }

    /**
     * @return a description of the first rule the payload breaks, or empty if it is valid
     */
    public static Optional<String> problem(Map<String, Object> datasetInfo) {
        if (datasetInfo == null) {
            return Optional.of("Dataset info missing");
        }
        for (var key : REQUIRED_KEYS) {
            if (!datasetInfo.containsKey(key)) {
                return Optional.of("Dataset info missing required key: " + key);
            }
        }

        // Only finalized datasets, protodatasets are rejected.
        if (!"dataset".equals(datasetInfo.get("type"))) {
            return Optional.of("Dataset info type must be 'dataset', got: " + datasetInfo.get("type"));
        }

        if (!(datasetInfo.get("uuid") instanceof String uuid) || uuid.length() != UUID_LENGTH) {
            return Optional.of("Dataset UUID must be a string of %d characters: %s"
                .formatted(UUID_LENGTH, datasetInfo.get("uuid")));
        }

        if (!(datasetInfo.get("base_uri") instanceof String baseUri) || baseUri.endsWith("/")) {
            return Optional.of("Base URI must be a string without trailing slash: " + datasetInfo.get("base_uri"));
        }

        if (!(datasetInfo.get("uri") instanceof String)) {
            return Optional.of("Dataset URI must be a string: " + datasetInfo.get("uri"));
        }

        if (!(datasetInfo.get("name") instanceof String)) {
            return Optional.of("Dataset name must be a string: " + datasetInfo.get("name"));
        }
        return Optional.empty();
    }
}
