package com.example.emobility.authz.datasource;

import com.example.emobility.exception.SystemException;
import com.example.emobility.security.context.Tenant;
import com.example.emobility.security.context.UserToken;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Request-scoped memo of data source results for one (tenant, user) pair.
 *
 * <p>Each data source is fetched at most once per instance, even when several filters,
 * asserts or list rows need it concurrently. Instances must not outlive the request.
 */
public final class DynamicDataSources {

    private final Tenant tenant;
    private final UserToken user;
    private final Map<DataSourceName, Mono<DataSourceData>> cache = new ConcurrentHashMap<>();

    private DynamicDataSources(Tenant tenant, UserToken user) {
        this.tenant = tenant;
        this.user = user;
    }

    public static DynamicDataSources forRequest(Tenant tenant, UserToken user) {
        return new DynamicDataSources(tenant, user);
    }

    public Mono<DataSourceData> resolve(DynamicDataSource source) {
        return cache.computeIfAbsent(source.getName(), name -> Mono.defer(() -> source.fetch(tenant, user))
                .onErrorMap(e -> !(e instanceof SystemException),
                        e -> new SystemException("datasource", "Data source " + name + " failed", e))
                .cache());
    }

    public boolean isBoundTo(Tenant tenant, UserToken user) {
        return this.tenant.equals(tenant) && this.user.id().equals(user.id());
    }

    public boolean isResolved(DataSourceName name) {
        return cache.containsKey(name);
    }
}
