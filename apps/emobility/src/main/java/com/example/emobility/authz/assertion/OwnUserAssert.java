package com.example.emobility.authz.assertion;

import com.example.emobility.authz.datasource.DataSourceData;
import com.example.emobility.authz.datasource.DataSourceData.UserIdData;
import com.example.emobility.authz.datasource.DataSourceName;
import com.example.emobility.authz.model.AuthorizableEntity;
import org.springframework.stereotype.Component;

import java.util.Optional;

// Passes when the entity is owned by the requesting user.
@Component
public class OwnUserAssert implements DynamicAssert {

    @Override
    public DynamicAssertName getName() {
        return DynamicAssertName.OWN_USER;
    }

    @Override
    public Optional<DataSourceName> getDataSourceName() {
        return Optional.of(DataSourceName.OWN_USER);
    }

    @Override
    public boolean test(DataSourceData data, AuthorizableEntity entity) {
        String owner = entity.ownerId();
        return owner != null && data instanceof UserIdData user && owner.equals(user.userId());
    }
}
