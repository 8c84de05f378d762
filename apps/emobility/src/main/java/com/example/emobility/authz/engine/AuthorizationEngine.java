package com.example.emobility.authz.engine;

import com.example.emobility.authz.assertion.DynamicAssert;
import com.example.emobility.authz.assertion.DynamicAssertName;
import com.example.emobility.authz.datasource.DataSourceData;
import com.example.emobility.authz.datasource.DynamicDataSources;
import com.example.emobility.authz.filter.DynamicFilter;
import com.example.emobility.authz.filter.DynamicFilterName;
import com.example.emobility.authz.filter.FilterFragment;
import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.AuthorizableEntity;
import com.example.emobility.authz.model.AuthorizationActions;
import com.example.emobility.authz.model.AuthorizationContext;
import com.example.emobility.authz.model.Entity;
import com.example.emobility.authz.model.FilterParams;
import com.example.emobility.authz.model.Role;
import com.example.emobility.authz.policy.AuthorizationDefinition;
import com.example.emobility.authz.policy.DynamicCondition;
import com.example.emobility.authz.policy.Grant;
import com.example.emobility.authz.resource.ResourceType;
import com.example.emobility.security.context.Tenant;
import com.example.emobility.security.context.UserToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dynamic authorization engine.
 *
 * <p>Evaluation runs in two steps:
 * <ol>
 *   <li>static lookup of a grant for (role, entity, action); no grant means deny and no data is fetched</li>
 *   <li>for conditional grants, filter groups are resolved in order (AND across groups, first
 *       satisfiable alternative within a group) and asserts are bound to their data for later use</li>
 * </ol>
 *
 * <p>Data sources are resolved through the caller's {@link DynamicDataSources}, so sharing one
 * instance across calls of the same request fetches each source only once. Storage failures
 * propagate as errors and are never turned into a denial.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthorizationEngine {

    private final AuthorizationDefinition definition;
    private final DynamicAuthorizationRegistry registry;

    public Optional<Grant> resolveStatic(Role role, Entity entity, Action action) {
        return definition.resolveGrant(role, entity, action);
    }

    public Mono<AuthorizationFilter> evaluate(Tenant tenant, UserToken user, Entity entity, Action action,
            @Nullable AuthorizationContext hint, DynamicDataSources dataSources) {
        return evaluate(tenant, user, entity, action, hint, dataSources, false);
    }

    private Mono<AuthorizationFilter> evaluate(Tenant tenant, UserToken user, Entity entity, Action action,
            @Nullable AuthorizationContext hint, DynamicDataSources dataSources, boolean entityContext) {
        return Mono.defer(() -> {
            if (!dataSources.isBoundTo(tenant, user)) {
                return Mono.error(new IllegalStateException("Data sources belong to another request"));
            }

            Optional<Grant> grant = resolveStatic(user.role(), entity, action);
            if (grant.isEmpty()) {
                log.debug("No grant: role={}, entity={}, action={}, user={}", user.role(), entity, action, user.id());
                return Mono.just(AuthorizationFilter.denied("no grant for role " + user.role(), dataSources));
            }

            Grant granted = grant.get();
            if (!granted.isConditional()) {
                return Mono.just(AuthorizationFilter.granted(
                        granted.attributes(), FilterParams.none(), false, List.of(), dataSources));
            }

            DynamicCondition condition = granted.condition();
            AuthorizationContext context = hint == null ? AuthorizationContext.empty() : hint;

            return Flux.fromIterable(condition.filters())
                    .concatMap(group -> resolveFilterGroup(group, context, entityContext, dataSources))
                    .takeUntil(fragment -> !fragment.satisfiable())
                    .collectList()
                    .flatMap(fragments -> {
                        Optional<FilterFragment> rejected = fragments.stream()
                                .filter(fragment -> !fragment.satisfiable())
                                .findFirst();
                        if (rejected.isPresent()) {
                            log.debug("Dynamic filter rejected: entity={}, action={}, user={}, reason={}",
                                    entity, action, user.id(), rejected.get().reason());
                            return Mono.just(AuthorizationFilter.denied(rejected.get().reason(), dataSources));
                        }
                        FilterParams filters = fragments.stream()
                                .map(FilterFragment::params)
                                .reduce(FilterParams.none(), FilterParams::and);

                        return resolveAsserts(condition.asserts(), dataSources)
                                .map(asserts -> AuthorizationFilter.granted(granted.attributes(), filters,
                                        !condition.filters().isEmpty(), asserts, dataSources));
                    });
        });
    }

    /**
     * Evaluate an action against one already fetched entity, using the entity's own context as hint.
     * A filter narrowing on a key the entity does not carry denies the action.
     */
    public <T extends AuthorizableEntity> Mono<Boolean> canPerformAction(Tenant tenant, UserToken user,
            ResourceType<T> resource, Action action, T entity, DynamicDataSources dataSources) {
        return evaluate(tenant, user, resource.getEntity(), action, resource.contextOf(entity), dataSources, true)
                .map(result -> result.isAuthorized() && result.assertsPass(entity));
    }

    /**
     * Compute the resource's capability flags, plus the flag of {@code requestedAction}, and attach them.
     */
    public <T extends AuthorizableEntity> Mono<T> addAuthorizations(Tenant tenant, UserToken user,
            ResourceType<T> resource, T entity, @Nullable Action requestedAction, DynamicDataSources dataSources) {
        Set<Action> actions = new LinkedHashSet<>(resource.getFlaggedActions());
        if (requestedAction != null) {
            actions.add(requestedAction);
        }
        return Flux.fromIterable(actions)
                .concatMap(action -> canPerformAction(tenant, user, resource, action, entity, dataSources)
                        .map(allowed -> Map.entry(action, allowed)))
                .collect(() -> new EnumMap<Action, Boolean>(Action.class),
                        (flags, entry) -> flags.put(entry.getKey(), entry.getValue()))
                .map(flags -> {
                    entity.setAuthorizations(new AuthorizationActions(flags));
                    return entity;
                });
    }

    /**
     * Read a flag previously attached by {@link #addAuthorizations}. Missing flags read as false.
     */
    public static boolean canPerformAction(AuthorizableEntity entity, Action action) {
        AuthorizationActions authorizations = entity.getAuthorizations();
        return authorizations != null && authorizations.can(action);
    }

    private Mono<FilterFragment> resolveFilterGroup(List<DynamicFilterName> group, AuthorizationContext hint,
            boolean entityContext, DynamicDataSources dataSources) {
        return Flux.fromIterable(group)
                .concatMap(name -> applyFilter(registry.filter(name), hint, entityContext, dataSources))
                .takeUntil(FilterFragment::satisfiable)
                .last();
    }

    private Mono<FilterFragment> applyFilter(DynamicFilter filter, AuthorizationContext hint, boolean entityContext,
            DynamicDataSources dataSources) {
        return filter.getDataSourceName()
                .map(name -> dataSources.resolve(registry.dataSource(name))
                        .map(data -> applyFilter(filter, data, hint, entityContext)))
                .orElseGet(() -> Mono.fromCallable(() -> applyFilter(filter, null, hint, entityContext)));
    }

    private static FilterFragment applyFilter(DynamicFilter filter, @Nullable DataSourceData data,
            AuthorizationContext hint, boolean entityContext) {
        return entityContext ? filter.applyToEntity(data, hint) : filter.apply(data, hint);
    }

    private Mono<List<List<ResolvedAssert>>> resolveAsserts(List<List<DynamicAssertName>> groups,
            DynamicDataSources dataSources) {
        return Flux.fromIterable(groups)
                .concatMap(group -> Flux.fromIterable(group)
                        .concatMap(name -> resolveAssert(registry.assertion(name), dataSources))
                        .collectList())
                .collectList();
    }

    private Mono<ResolvedAssert> resolveAssert(DynamicAssert assertion, DynamicDataSources dataSources) {
        return assertion.getDataSourceName()
                .map(name -> dataSources.resolve(registry.dataSource(name))
                        .map(data -> new ResolvedAssert(assertion, data)))
                .orElseGet(() -> Mono.just(new ResolvedAssert(assertion, null)));
    }
}
