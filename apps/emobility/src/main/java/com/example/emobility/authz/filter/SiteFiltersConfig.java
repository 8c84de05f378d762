package com.example.emobility.authz.filter;

import com.example.emobility.authz.datasource.DataSourceName;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SiteFiltersConfig {

    @Bean
    public DynamicFilter sitesAdminFilter() {
        return new SiteIdsFilter(DynamicFilterName.SITES_ADMIN, DataSourceName.SITES_ADMIN);
    }

    @Bean
    public DynamicFilter sitesOwnerFilter() {
        return new SiteIdsFilter(DynamicFilterName.SITES_OWNER, DataSourceName.SITES_OWNER);
    }

    @Bean
    public DynamicFilter assignedSitesFilter() {
        return new SiteIdsFilter(DynamicFilterName.ASSIGNED_SITES, DataSourceName.ASSIGNED_SITES);
    }
}
