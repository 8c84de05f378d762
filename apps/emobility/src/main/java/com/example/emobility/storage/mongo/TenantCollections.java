package com.example.emobility.storage.mongo;

import com.example.emobility.authz.resource.ResourceType;
import com.example.emobility.security.context.Tenant;

/**
 * Tenant data lives in collections prefixed with the tenant ID ({@code <tenantId>.sites});
 * global data (car catalogs) is not prefixed.
 */
public final class TenantCollections {

    private TenantCollections() {}

    public static String name(Tenant tenant, ResourceType<?> resource) {
        return resource.isTenantScoped() ? name(tenant, resource.getCollection()) : resource.getCollection();
    }

    public static String name(Tenant tenant, String collection) {
        return tenant.id() + "." + collection;
    }
}
