package com.example.emobility.authz.datasource;

import java.util.Set;

/**
 * Payload produced by a {@link DynamicDataSource}.
 */
public interface DataSourceData {

    record SiteIdsData(Set<String> siteIds) implements DataSourceData {
        public SiteIdsData {
            siteIds = Set.copyOf(siteIds);
        }
    }

    record CompanyIdsData(Set<String> companyIds) implements DataSourceData {
        public CompanyIdsData {
            companyIds = Set.copyOf(companyIds);
        }
    }

    record UserIdData(String userId) implements DataSourceData {}
}
