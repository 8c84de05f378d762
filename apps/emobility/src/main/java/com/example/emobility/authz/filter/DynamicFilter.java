package com.example.emobility.authz.filter;

import com.example.emobility.authz.datasource.DataSourceData;
import com.example.emobility.authz.datasource.DataSourceName;
import com.example.emobility.authz.model.AuthorizationContext;
import org.springframework.lang.Nullable;

import java.util.Optional;

/**
 * Turns user data into query constraints, optionally checked against the caller's hints.
 */
public interface DynamicFilter {

    DynamicFilterName getName();

    /**
     * Data source this filter needs, or empty when it works without user data.
     */
    Optional<DataSourceName> getDataSourceName();

    FilterFragment apply(@Nullable DataSourceData data, AuthorizationContext hint);

    /**
     * Applies the filter to the context of an already loaded entity. That context describes the
     * entity itself, so a filter narrowing on a key the entity does not carry must not match.
     */
    default FilterFragment applyToEntity(@Nullable DataSourceData data, AuthorizationContext entityContext) {
        return apply(data, entityContext);
    }

    default <D extends DataSourceData> D require(@Nullable DataSourceData data, Class<D> type) {
        if (!type.isInstance(data)) {
            throw new IllegalStateException("Filter " + getName() + " expected " + type.getSimpleName()
                    + " but got " + (data == null ? "nothing" : data.getClass().getSimpleName()));
        }
        return type.cast(data);
    }
}
