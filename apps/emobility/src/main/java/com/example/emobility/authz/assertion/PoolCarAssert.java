package com.example.emobility.authz.assertion;

import com.example.emobility.authz.datasource.DataSourceData;
import com.example.emobility.authz.datasource.DataSourceData.SiteIdsData;
import com.example.emobility.authz.datasource.DataSourceName;
import com.example.emobility.authz.model.AuthorizableEntity;
import com.example.emobility.model.Car;
import com.example.emobility.model.CarType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Passes when the entity is a pool car shared with at least one of the user's sites.
 */
@Component
public class PoolCarAssert implements DynamicAssert {

    @Override
    public DynamicAssertName getName() {
        return DynamicAssertName.POOL_CAR;
    }

    @Override
    public Optional<DataSourceName> getDataSourceName() {
        return Optional.of(DataSourceName.ASSIGNED_SITES);
    }

    @Override
    public boolean test(DataSourceData data, AuthorizableEntity entity) {
        if (!(entity instanceof Car car) || car.getType() != CarType.POOL_CAR || car.getSiteIDs() == null) {
            return false;
        }
        if (!(data instanceof SiteIdsData sites)) {
            return false;
        }
        return car.getSiteIDs().stream().anyMatch(sites.siteIds()::contains);
    }
}
