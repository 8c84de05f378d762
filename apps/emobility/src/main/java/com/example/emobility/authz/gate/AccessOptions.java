package com.example.emobility.authz.gate;

import com.example.emobility.authz.datasource.DynamicDataSources;
import com.example.emobility.authz.model.AuthorizationContext;
import com.example.emobility.authz.model.FilterParams;
import org.springframework.lang.Nullable;

/**
 * Per-call options of {@link EntityAccessGate}.
 *
 * @param additionalFilters  caller constraints ANDed with the authorization filters
 * @param applyProjectFields load only the fields the role may see
 * @param checkIssuer        refuse entities issued by another organization
 * @param hint               overrides the hint derived from the requested ID
 * @param dataSources        data source memo to share with other checks of the same request
 */
public record AccessOptions(
        FilterParams additionalFilters,
        boolean applyProjectFields,
        boolean checkIssuer,
        @Nullable AuthorizationContext hint,
        @Nullable DynamicDataSources dataSources
) {
    private static final AccessOptions DEFAULTS = new AccessOptions(FilterParams.none(), false, true, null, null);

    public AccessOptions {
        if (additionalFilters == null) {
            additionalFilters = FilterParams.none();
        }
    }

    public static AccessOptions defaults() {
        return DEFAULTS;
    }

    public AccessOptions withAdditionalFilters(FilterParams filters) {
        return new AccessOptions(filters, applyProjectFields, checkIssuer, hint, dataSources);
    }

    public AccessOptions withProjectFields() {
        return new AccessOptions(additionalFilters, true, checkIssuer, hint, dataSources);
    }

    public AccessOptions withoutIssuerCheck() {
        return new AccessOptions(additionalFilters, applyProjectFields, false, hint, dataSources);
    }

    public AccessOptions withHint(AuthorizationContext context) {
        return new AccessOptions(additionalFilters, applyProjectFields, checkIssuer, context, dataSources);
    }

    public AccessOptions withDataSources(DynamicDataSources sources) {
        return new AccessOptions(additionalFilters, applyProjectFields, checkIssuer, hint, sources);
    }
}
