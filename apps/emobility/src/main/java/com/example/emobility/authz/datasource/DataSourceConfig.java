package com.example.emobility.authz.datasource;

import com.example.emobility.storage.SiteUserRole;
import com.example.emobility.storage.SiteUserStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DataSourceConfig {

    @Bean
    public DynamicDataSource sitesAdminDataSource(SiteUserStore siteUserStore) {
        return new SitesDataSource(DataSourceName.SITES_ADMIN, SiteUserRole.ADMIN, siteUserStore);
    }

    @Bean
    public DynamicDataSource sitesOwnerDataSource(SiteUserStore siteUserStore) {
        return new SitesDataSource(DataSourceName.SITES_OWNER, SiteUserRole.OWNER, siteUserStore);
    }

    @Bean
    public DynamicDataSource assignedSitesDataSource(SiteUserStore siteUserStore) {
        return new SitesDataSource(DataSourceName.ASSIGNED_SITES, SiteUserRole.ANY, siteUserStore);
    }

    @Bean
    public DynamicDataSource assignedSitesCompaniesDataSource(SiteUserStore siteUserStore) {
        return new AssignedSitesCompaniesDataSource(siteUserStore);
    }

    @Bean
    public DynamicDataSource ownUserDataSource() {
        return new OwnUserDataSource();
    }
}
