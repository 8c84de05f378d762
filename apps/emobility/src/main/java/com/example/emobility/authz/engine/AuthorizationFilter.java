package com.example.emobility.authz.engine;

import com.example.emobility.authz.datasource.DynamicDataSources;
import com.example.emobility.authz.model.AuthorizableEntity;
import com.example.emobility.authz.model.FilterParams;
import lombok.Getter;

import java.util.List;

/**
 * Outcome of a dynamic authorization evaluation for one (entity kind, action) pair.
 *
 * <p>When authorized, {@link #getFilters()} must be ANDed into the storage query and the
 * staged asserts must hold for each fetched entity.
 */
@Getter
public final class AuthorizationFilter {

    private final boolean authorized;
    private final FilterParams filters;
    private final List<String> projectFields;
    private final boolean dynamicallyFiltered;
    private final List<List<ResolvedAssert>> asserts;
    private final DynamicDataSources dataSources;
    private final String reason;

    private AuthorizationFilter(boolean authorized, FilterParams filters, List<String> projectFields,
            boolean dynamicallyFiltered, List<List<ResolvedAssert>> asserts,
            DynamicDataSources dataSources, String reason) {
        this.authorized = authorized;
        this.filters = filters;
        this.projectFields = List.copyOf(projectFields);
        this.dynamicallyFiltered = dynamicallyFiltered;
        this.asserts = asserts.stream().map(List::copyOf).toList();
        this.dataSources = dataSources;
        this.reason = reason;
    }

    public static AuthorizationFilter denied(String reason, DynamicDataSources dataSources) {
        return new AuthorizationFilter(false, FilterParams.none(), List.of(), false, List.of(), dataSources, reason);
    }

    public static AuthorizationFilter granted(List<String> projectFields, FilterParams filters,
            boolean dynamicallyFiltered, List<List<ResolvedAssert>> asserts, DynamicDataSources dataSources) {
        return new AuthorizationFilter(true, filters, projectFields, dynamicallyFiltered, asserts, dataSources, "granted");
    }

    /**
     * All assert groups must hold; within a group one passing alternative is enough.
     */
    public boolean assertsPass(AuthorizableEntity entity) {
        return asserts.stream().allMatch(group -> group.stream().anyMatch(a -> a.test(entity)));
    }

    @Override
    public String toString() {
        return "AuthorizationFilter{authorized=" + authorized + ", filters=" + filters
                + ", projectFields=" + projectFields + ", asserts=" + asserts.size() + ", reason=" + reason + "}";
    }
}
