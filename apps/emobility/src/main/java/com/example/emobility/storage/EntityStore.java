package com.example.emobility.storage;

import com.example.emobility.authz.model.AuthorizableEntity;
import com.example.emobility.authz.model.FilterParams;
import com.example.emobility.authz.resource.ResourceType;
import com.example.emobility.security.context.Tenant;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Tenant-aware read access to authorizable entities.
 *
 * <p>Implementations must apply every parameter of {@code filters}; a parameter the resource
 * cannot map is an error, never silently ignored.
 */
public interface EntityStore {

    /**
     * @param projection fields to load; empty loads the whole document
     * @return the single matching entity, or empty when nothing matches
     */
    <T extends AuthorizableEntity> Mono<T> findOne(Tenant tenant, ResourceType<T> resource,
            FilterParams filters, List<String> projection);

    <T extends AuthorizableEntity> Flux<T> find(Tenant tenant, ResourceType<T> resource,
            FilterParams filters, List<String> projection, int limit);
}
