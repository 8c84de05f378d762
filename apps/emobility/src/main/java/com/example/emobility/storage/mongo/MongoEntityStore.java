package com.example.emobility.storage.mongo;

import com.example.emobility.authz.model.AuthorizableEntity;
import com.example.emobility.authz.model.FilterParams;
import com.example.emobility.authz.resource.ResourceType;
import com.example.emobility.exception.SystemException;
import com.example.emobility.security.context.Tenant;
import com.example.emobility.storage.EntityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class MongoEntityStore implements EntityStore {

    private final ReactiveMongoTemplate mongoTemplate;
    private final MongoQueryFactory queryFactory;

    @Override
    public <T extends AuthorizableEntity> Mono<T> findOne(Tenant tenant, ResourceType<T> resource,
            FilterParams filters, List<String> projection) {
        return find(tenant, resource, filters, projection, 1).next();
    }

    @Override
    public <T extends AuthorizableEntity> Flux<T> find(Tenant tenant, ResourceType<T> resource,
            FilterParams filters, List<String> projection, int limit) {
        if (filters.matchesNothing()) {
            log.debug("Skipping {} query, filters match nothing: {}", resource.getEntity(), filters);
            return Flux.empty();
        }
        String collection = TenantCollections.name(tenant, resource);

        return Flux.defer(() -> {
                    if (queryFactory.requiresLookup(resource, filters)) {
                        return mongoTemplate.aggregate(
                                queryFactory.aggregation(tenant, resource, filters, projection, limit),
                                collection, resource.getType());
                    }
                    return mongoTemplate.find(
                            queryFactory.query(resource, filters, projection, limit),
                            resource.getType(), collection);
                })
                .onErrorMap(DataAccessException.class,
                        e -> new SystemException("mongodb", "Failed to read " + collection, e));
    }
}
