package com.example.emobility.authz.datasource;

import com.example.emobility.authz.datasource.DataSourceData.UserIdData;
import com.example.emobility.security.context.Tenant;
import com.example.emobility.security.context.UserToken;
import reactor.core.publisher.Mono;

public class OwnUserDataSource implements DynamicDataSource {

    @Override
    public DataSourceName getName() {
        return DataSourceName.OWN_USER;
    }

    @Override
    public Mono<DataSourceData> fetch(Tenant tenant, UserToken user) {
        return Mono.just(new UserIdData(user.id()));
    }
}
