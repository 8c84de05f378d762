package com.example.emobility.authz.filter;

import com.example.emobility.authz.datasource.DataSourceData;
import com.example.emobility.authz.datasource.DataSourceData.CompanyIdsData;
import com.example.emobility.authz.datasource.DataSourceName;
import com.example.emobility.authz.model.AuthorizationContext;
import com.example.emobility.authz.model.FilterParam;
import com.example.emobility.authz.model.FilterParams;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Restricts a query to companies owning one of the user's assigned sites.
 */
@Component
public class AssignedSitesCompaniesFilter implements DynamicFilter {

    @Override
    public DynamicFilterName getName() {
        return DynamicFilterName.ASSIGNED_SITES_COMPANIES;
    }

    @Override
    public Optional<DataSourceName> getDataSourceName() {
        return Optional.of(DataSourceName.ASSIGNED_SITES_COMPANIES);
    }

    @Override
    public FilterFragment apply(DataSourceData data, AuthorizationContext hint) {
        Set<String> companyIds = require(data, CompanyIdsData.class).companyIds();
        if (companyIds.isEmpty()) {
            return FilterFragment.unsatisfiable("user has no assigned site companies");
        }
        if (!hint.hasCompanyHint()) {
            return FilterFragment.of(FilterParams.of(FilterParam.COMPANY_IDS, companyIds));
        }
        Set<String> reachable = new LinkedHashSet<>(hint.companyIds());
        reachable.retainAll(companyIds);
        if (reachable.isEmpty()) {
            return FilterFragment.unsatisfiable("requested companies are outside assigned site companies");
        }
        return FilterFragment.of(FilterParams.of(FilterParam.COMPANY_IDS, reachable));
    }

    @Override
    public FilterFragment applyToEntity(DataSourceData data, AuthorizationContext entityContext) {
        if (!entityContext.hasCompanyHint()) {
            return FilterFragment.unsatisfiable("entity belongs to no company");
        }
        return apply(data, entityContext);
    }
}
