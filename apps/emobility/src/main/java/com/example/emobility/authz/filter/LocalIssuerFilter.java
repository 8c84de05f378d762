package com.example.emobility.authz.filter;

import com.example.emobility.authz.datasource.DataSourceData;
import com.example.emobility.authz.datasource.DataSourceName;
import com.example.emobility.authz.model.AuthorizationContext;
import com.example.emobility.authz.model.FilterParams;
import org.springframework.stereotype.Component;

import java.util.Optional;

// Keeps only entities issued by the local organization.
@Component
public class LocalIssuerFilter implements DynamicFilter {

    @Override
    public DynamicFilterName getName() {
        return DynamicFilterName.LOCAL_ISSUER;
    }

    @Override
    public Optional<DataSourceName> getDataSourceName() {
        return Optional.empty();
    }

    @Override
    public FilterFragment apply(DataSourceData data, AuthorizationContext hint) {
        return FilterFragment.of(FilterParams.issuer(true));
    }
}
