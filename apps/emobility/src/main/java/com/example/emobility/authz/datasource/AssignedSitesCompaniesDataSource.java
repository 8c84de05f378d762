package com.example.emobility.authz.datasource;

import com.example.emobility.authz.datasource.DataSourceData.CompanyIdsData;
import com.example.emobility.security.context.Tenant;
import com.example.emobility.security.context.UserToken;
import com.example.emobility.storage.SiteUserRole;
import com.example.emobility.storage.SiteUserStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Companies owning at least one site the user is assigned to.
 */
@Slf4j
@RequiredArgsConstructor
public class AssignedSitesCompaniesDataSource implements DynamicDataSource {

    private final SiteUserStore siteUserStore;

    @Override
    public DataSourceName getName() {
        return DataSourceName.ASSIGNED_SITES_COMPANIES;
    }

    @Override
    public Mono<DataSourceData> fetch(Tenant tenant, UserToken user) {
        return siteUserStore.findSiteIds(tenant, user.id(), SiteUserRole.ANY)
                .collectList()
                .flatMap(siteIds -> siteIds.isEmpty()
                        ? Mono.just(Set.<String>of())
                        : siteUserStore.findCompanyIds(tenant, siteIds)
                                .collect(Collectors.toSet()))
                .doOnNext(companyIds -> log.debug("Data source {} resolved {} companies for user {}",
                        getName(), companyIds.size(), user.id()))
                .map(CompanyIdsData::new);
    }
}
