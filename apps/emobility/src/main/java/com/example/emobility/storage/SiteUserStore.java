package com.example.emobility.storage;

import com.example.emobility.security.context.Tenant;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

/**
 * User to site assignments of one tenant.
 */
public interface SiteUserStore {

    Flux<String> findSiteIds(Tenant tenant, String userId, SiteUserRole role);

    Flux<String> findCompanyIds(Tenant tenant, Collection<String> siteIds);

    Mono<Long> assignUsers(Tenant tenant, String siteId, Collection<String> userIds);

    Mono<Long> unassignUsers(Tenant tenant, String siteId, Collection<String> userIds);
}
