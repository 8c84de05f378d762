package com.example.emobility.authz.filter;

import com.example.emobility.authz.datasource.DataSourceData;
import com.example.emobility.authz.datasource.DataSourceData.SiteIdsData;
import com.example.emobility.authz.datasource.DataSourceName;
import com.example.emobility.authz.model.AuthorizationContext;
import com.example.emobility.authz.model.FilterParam;
import com.example.emobility.authz.model.FilterParams;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Restricts a query to a set of sites resolved for the user.
 *
 * <p>Without data (no sites) the filter is unsatisfiable. With a site hint, only the hinted
 * sites the user can reach are kept; none left means unsatisfiable. A loaded entity without
 * any site never matches.
 */
public class SiteIdsFilter implements DynamicFilter {

    private final DynamicFilterName name;
    private final DataSourceName dataSourceName;

    public SiteIdsFilter(DynamicFilterName name, DataSourceName dataSourceName) {
        this.name = name;
        this.dataSourceName = dataSourceName;
    }

    @Override
    public DynamicFilterName getName() {
        return name;
    }

    @Override
    public Optional<DataSourceName> getDataSourceName() {
        return Optional.of(dataSourceName);
    }

    @Override
    public FilterFragment apply(DataSourceData data, AuthorizationContext hint) {
        Set<String> siteIds = require(data, SiteIdsData.class).siteIds();
        if (siteIds.isEmpty()) {
            return FilterFragment.unsatisfiable("user has no " + dataSourceName + " sites");
        }
        if (!hint.hasSiteHint()) {
            return FilterFragment.of(FilterParams.of(FilterParam.SITE_IDS, siteIds));
        }
        Set<String> reachable = new LinkedHashSet<>(hint.siteIds());
        reachable.retainAll(siteIds);
        if (reachable.isEmpty()) {
            return FilterFragment.unsatisfiable("requested sites are outside " + dataSourceName);
        }
        return FilterFragment.of(FilterParams.of(FilterParam.SITE_IDS, reachable));
    }

    @Override
    public FilterFragment applyToEntity(DataSourceData data, AuthorizationContext entityContext) {
        if (!entityContext.hasSiteHint()) {
            return FilterFragment.unsatisfiable("entity is attached to no site");
        }
        return apply(data, entityContext);
    }
}
