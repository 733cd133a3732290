package org.tenantwarehouse.service.transform;

/**
 * Per-run information a transformation may need; enrichment datasets are resolved for {@code tenantId}.
 */
public record TransformContext(String tenantId) {

    private static final TransformContext NONE = new TransformContext(null);

    public static TransformContext none() {
        return NONE;
    }

    public static TransformContext forTenant(String tenantId) {
        return new TransformContext(tenantId);
    }
}
