package com.example.emobility.authz.datasource;

import com.example.emobility.security.context.Tenant;
import com.example.emobility.security.context.UserToken;
import reactor.core.publisher.Mono;

/**
 * Fetches user-dependent data (assigned sites, companies...) that dynamic filters and asserts need.
 * Implementations are stateless; per-request memoization is done by {@link DynamicDataSources}.
 */
public interface DynamicDataSource {

    DataSourceName getName();

    Mono<DataSourceData> fetch(Tenant tenant, UserToken user);
}
