package org.tenantwarehouse.service.transform;

import java.util.Map;

/**
 * Source of the lookup tables used by enrich steps.
 */
public interface AuxiliaryDataProvider {

    /**
     * Loads {@code dataset} for the tenant, indexed by the string form of {@code lookupKey}. When
     * several rows share a key the first one wins.
     *
     * @throws org.tenantwarehouse.exceptions.ConfigurationException if the dataset or key column
     *                                                               does not exist
     */
    Map<String, Map<String, Object>> load(String tenantId, String dataset, String lookupKey);
}
