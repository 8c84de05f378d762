package com.example.emobility.authz.engine;

import com.example.emobility.authz.assertion.DynamicAssert;
import com.example.emobility.authz.datasource.DataSourceData;
import com.example.emobility.authz.model.AuthorizableEntity;
import org.springframework.lang.Nullable;

/**
 * An assert bound to the data it needs, ready to run against fetched entities.
 */
public record ResolvedAssert(DynamicAssert assertion, @Nullable DataSourceData data) {

    public boolean test(AuthorizableEntity entity) {
        return assertion.test(data, entity);
    }
}
