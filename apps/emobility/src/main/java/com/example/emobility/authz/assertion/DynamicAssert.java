package com.example.emobility.authz.assertion;

import com.example.emobility.authz.datasource.DataSourceData;
import com.example.emobility.authz.datasource.DataSourceName;
import com.example.emobility.authz.model.AuthorizableEntity;
import org.springframework.lang.Nullable;

import java.util.Optional;

/**
 * Predicate evaluated against an already fetched entity.
 */
public interface DynamicAssert {

    DynamicAssertName getName();

    Optional<DataSourceName> getDataSourceName();

    boolean test(@Nullable DataSourceData data, AuthorizableEntity entity);
}
