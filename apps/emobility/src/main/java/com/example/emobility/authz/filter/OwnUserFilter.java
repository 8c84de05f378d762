package com.example.emobility.authz.filter;

import com.example.emobility.authz.datasource.DataSourceData;
import com.example.emobility.authz.datasource.DataSourceData.UserIdData;
import com.example.emobility.authz.datasource.DataSourceName;
import com.example.emobility.authz.model.AuthorizationContext;
import com.example.emobility.authz.model.FilterParam;
import com.example.emobility.authz.model.FilterParams;
import org.springframework.stereotype.Component;

import java.util.Optional;

// Restricts a query to entities owned by the requesting user.
@Component
public class OwnUserFilter implements DynamicFilter {

    @Override
    public DynamicFilterName getName() {
        return DynamicFilterName.OWN_USER;
    }

    @Override
    public Optional<DataSourceName> getDataSourceName() {
        return Optional.of(DataSourceName.OWN_USER);
    }

    @Override
    public FilterFragment apply(DataSourceData data, AuthorizationContext hint) {
        String userId = require(data, UserIdData.class).userId();
        if (hint.owner() != null && !hint.owner().equals(userId)) {
            return FilterFragment.unsatisfiable("entity is owned by another user");
        }
        return FilterFragment.of(FilterParams.of(FilterParam.USER_IDS, userId));
    }

    @Override
    public FilterFragment applyToEntity(DataSourceData data, AuthorizationContext entityContext) {
        if (entityContext.owner() == null) {
            return FilterFragment.unsatisfiable("entity has no owner");
        }
        return apply(data, entityContext);
    }
}
