package org.tenantwarehouse.models.transform;

import java.util.List;

/**
 * Looks the record's {@code on} field up against {@code lookupKey} of the auxiliary {@code dataset}
 * and copies {@code fields} onto the record.
 */
public record EnrichmentJoin(String dataset, String on, String lookupKey, List<String> fields) {

    public EnrichmentJoin {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static EnrichmentJoin of(String dataset, String on, List<String> fields) {
        return new EnrichmentJoin(dataset, on, on, fields);
    }

    public String effectiveLookupKey() {
        return lookupKey == null || lookupKey.isBlank() ? on : lookupKey;
    }
}
