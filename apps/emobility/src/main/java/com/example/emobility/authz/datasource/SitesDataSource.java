package com.example.emobility.authz.datasource;

import com.example.emobility.authz.datasource.DataSourceData.SiteIdsData;
import com.example.emobility.security.context.Tenant;
import com.example.emobility.security.context.UserToken;
import com.example.emobility.storage.SiteUserRole;
import com.example.emobility.storage.SiteUserStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

/**
 * Sites the user is assigned to with a given site-level role.
 */
@Slf4j
public class SitesDataSource implements DynamicDataSource {

    private final DataSourceName name;
    private final SiteUserRole role;
    private final SiteUserStore siteUserStore;

    public SitesDataSource(DataSourceName name, SiteUserRole role, SiteUserStore siteUserStore) {
        this.name = name;
        this.role = role;
        this.siteUserStore = siteUserStore;
    }

    @Override
    public DataSourceName getName() {
        return name;
    }

    @Override
    public Mono<DataSourceData> fetch(Tenant tenant, UserToken user) {
        return siteUserStore.findSiteIds(tenant, user.id(), role)
                .collect(Collectors.toSet())
                .doOnNext(siteIds -> log.debug("Data source {} resolved {} sites for user {}",
                        name, siteIds.size(), user.id()))
                .map(SiteIdsData::new);
    }
}
