package com.example.emobility.authz.gate;

import com.example.emobility.authz.audit.AccessAuditService;
import com.example.emobility.authz.datasource.DynamicDataSources;
import com.example.emobility.authz.engine.AuthorizationEngine;
import com.example.emobility.authz.engine.AuthorizationFilter;
import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.AuthorizableEntity;
import com.example.emobility.authz.model.AuthorizationContext;
import com.example.emobility.authz.model.Entity;
import com.example.emobility.authz.model.FilterParam;
import com.example.emobility.authz.model.FilterParams;
import com.example.emobility.authz.resource.ResourceType;
import com.example.emobility.authz.resource.Resources;
import com.example.emobility.config.properties.AuthorizationProperties;
import com.example.emobility.exception.AccessException;
import com.example.emobility.exception.ExternalEntityException;
import com.example.emobility.exception.ForbiddenException;
import com.example.emobility.exception.NotFoundException;
import com.example.emobility.exception.SystemException;
import com.example.emobility.exception.ValidationException;
import com.example.emobility.model.Asset;
import com.example.emobility.model.Car;
import com.example.emobility.model.CarCatalog;
import com.example.emobility.model.ChargingStation;
import com.example.emobility.model.Company;
import com.example.emobility.model.Site;
import com.example.emobility.model.SiteArea;
import com.example.emobility.model.Tag;
import com.example.emobility.model.User;
import com.example.emobility.observability.metrics.AuthorizationMetrics;
import com.example.emobility.security.context.Tenant;
import com.example.emobility.security.context.UserToken;
import com.example.emobility.storage.EntityStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Single entry point used by API handlers to load an entity the caller is allowed to act on.
 *
 * <p>Every check runs the same pipeline:
 * <ol>
 *   <li>validate the request (ID present and well formed, caller belongs to the tenant)</li>
 *   <li>dynamic authorization of (entity, action); refusal is {@link ForbiddenException}</li>
 *   <li>fetch with caller filters AND authorization filters, projected when asked</li>
 *   <li>existence, issuer and logical deletion checks</li>
 *   <li>capability flags are attached and the requested action is re-checked on the loaded entity</li>
 * </ol>
 * Storage failures surface as {@link SystemException} and are never reported as denials.
 */
@Slf4j
@Service
public class EntityAccessGate {

    private final AuthorizationEngine engine;
    private final EntityStore entityStore;
    private final AuthorizationProperties properties;
    private final AuthorizationMetrics metrics;

    @Nullable
    private final AccessAuditService auditService;

    public EntityAccessGate(
            AuthorizationEngine engine,
            EntityStore entityStore,
            AuthorizationProperties properties,
            AuthorizationMetrics metrics,
            @Nullable AccessAuditService auditService) {
        this.engine = engine;
        this.entityStore = entityStore;
        this.properties = properties;
        this.metrics = metrics;
        this.auditService = auditService;
    }

    public Mono<Company> checkAndGetCompanyAuthorization(Tenant tenant, UserToken user, String id, Action action,
            AccessOptions options) {
        return checkAndGet(tenant, user, Resources.COMPANY, id, action, options);
    }

    public Mono<Site> checkAndGetSiteAuthorization(Tenant tenant, UserToken user, String id, Action action,
            AccessOptions options) {
        return checkAndGet(tenant, user, Resources.SITE, id, action, options);
    }

    public Mono<SiteArea> checkAndGetSiteAreaAuthorization(Tenant tenant, UserToken user, String id, Action action,
            AccessOptions options) {
        return checkAndGet(tenant, user, Resources.SITE_AREA, id, action, options);
    }

    public Mono<ChargingStation> checkAndGetChargingStationAuthorization(Tenant tenant, UserToken user, String id, Action action,
            AccessOptions options) {
        return checkAndGet(tenant, user, Resources.CHARGING_STATION, id, action, options);
    }

    public Mono<User> checkAndGetUserAuthorization(Tenant tenant, UserToken user, String id, Action action,
            AccessOptions options) {
        return checkAndGet(tenant, user, Resources.USER, id, action, options);
    }

    public Mono<Car> checkAndGetCarAuthorization(Tenant tenant, UserToken user, String id, Action action,
            AccessOptions options) {
        return checkAndGet(tenant, user, Resources.CAR, id, action, options);
    }

    public Mono<CarCatalog> checkAndGetCarCatalogAuthorization(Tenant tenant, UserToken user, @Nullable Integer id, Action action,
            AccessOptions options) {
        return checkAndGet(tenant, user, Resources.CAR_CATALOG, id == null ? null : id.toString(), action, options);
    }

    public Mono<Tag> checkAndGetTagAuthorization(Tenant tenant, UserToken user, String id, Action action,
            AccessOptions options) {
        return checkAndGet(tenant, user, Resources.TAG, id, action, options);
    }

    public Mono<Tag> checkAndGetTagByVisualIdAuthorization(Tenant tenant, UserToken user, String visualId, Action action,
            AccessOptions options) {
        return checkAndGet(tenant, user, Resources.TAG, FilterParam.VISUAL_IDS, visualId, action, options);
    }

    public Mono<Asset> checkAndGetAssetAuthorization(Tenant tenant, UserToken user, String id, Action action,
            AccessOptions options) {
        return checkAndGet(tenant, user, Resources.ASSET, id, action, options);
    }

    public <T extends AuthorizableEntity> Mono<T> checkAndGet(Tenant tenant, UserToken user,
            ResourceType<T> resource, @Nullable String id, Action action, AccessOptions options) {
        return checkAndGet(tenant, user, resource, FilterParam.IDS, id, action, options);
    }

    private <T extends AuthorizableEntity> Mono<T> checkAndGet(Tenant tenant, UserToken user,
            ResourceType<T> resource, FilterParam lookupParam, @Nullable String id, Action action,
            AccessOptions options) {
        Entity entity = resource.getEntity();
        return Mono.<T>defer(() -> {
                    if (id == null || id.isBlank()) {
                        return this.<T>refuse(tenant, user, new ValidationException(
                                "The " + resource.getDisplayName() + " ID must be provided", entity, action, user.id()));
                    }
                    if (lookupParam == FilterParam.IDS) {
                        try {
                            resource.convertId(id);
                        } catch (IllegalArgumentException e) {
                            return this.<T>refuse(tenant, user,
                                    new ValidationException(e.getMessage(), entity, action, user.id()));
                        }
                    }
                    if (!user.belongsTo(tenant)) {
                        return this.<T>refuse(tenant, user, new ForbiddenException(
                                "User does not belong to tenant '" + tenant.id() + "'", entity, id, action, user.id()));
                    }

                    DynamicDataSources dataSources = options.dataSources() != null
                            ? options.dataSources()
                            : DynamicDataSources.forRequest(tenant, user);
                    AuthorizationContext hint = options.hint() != null
                            ? options.hint()
                            : lookupParam == FilterParam.IDS ? resource.hintForId(id) : AuthorizationContext.empty();

                    return engine.evaluate(tenant, user, entity, action, hint, dataSources)
                            .flatMap(authorization -> {
                                if (!authorization.isAuthorized()) {
                                    return this.<T>refuse(tenant, user, forbidden(resource, id, action, user));
                                }
                                return fetch(tenant, user, resource, lookupParam, id, action, options, authorization);
                            });
                })
                .doOnError(SystemException.class, e -> systemError(tenant, user, entity, id, action, e));
    }

    private <T extends AuthorizableEntity> Mono<T> fetch(Tenant tenant, UserToken user, ResourceType<T> resource,
            FilterParam lookupParam, String id, Action action, AccessOptions options,
            AuthorizationFilter authorization) {
        Entity entity = resource.getEntity();
        FilterParams filters = options.additionalFilters()
                .and(FilterParams.of(lookupParam, id))
                .and(authorization.getFilters());
        List<String> projection = options.applyProjectFields()
                ? resource.projection(authorization.getProjectFields())
                : List.of();

        return entityStore.findOne(tenant, resource, filters, projection)
                .switchIfEmpty(Mono.defer(() -> this.<T>refuse(tenant, user, absent(resource, id, action, user, authorization))))
                .flatMap(found -> {
                    if (options.checkIssuer() && resource.isIssuerChecked() && !found.isIssuer()) {
                        return this.<T>refuse(tenant, user, new ExternalEntityException(
                                resource.getDisplayName() + " '" + id + "' not issued by the organization",
                                entity, id, action, user.id()));
                    }
                    if (resource.isLogicallyDeleted(found)) {
                        return this.<T>refuse(tenant, user, new NotFoundException(
                                resource.getDisplayName() + " ID '" + id + "' is logically deleted",
                                entity, id, action, user.id()));
                    }
                    return engine.addAuthorizations(tenant, user, resource, found, action,
                            authorization.getDataSources());
                })
                .flatMap(found -> {
                    if (!AuthorizationEngine.canPerformAction(found, action)) {
                        return this.<T>refuse(tenant, user, forbidden(resource, id, action, user));
                    }
                    granted(tenant, user, entity, id, action);
                    return Mono.just(found);
                });
    }

    /**
     * Check that the caller may assign or unassign the given users to or from a site,
     * and that every one of them is visible to the caller and locally issued.
     *
     * <p>Batch checks take their hint from the parent entity; {@link AccessOptions#hint()} is ignored.
     */
    public Mono<List<User>> checkSiteUsersAuthorization(Tenant tenant, UserToken user, Site site, Action action,
            List<String> userIds, AccessOptions options) {
        return checkAssignment(tenant, user, Entity.USERS_SITES, action,
                AuthorizationContext.forSite(site.getId()).withCompany(site.getCompanyID()),
                Resources.USER, userIds, false, options);
    }

    /**
     * Check that the caller may assign or unassign a user to or from the given sites.
     * The sites themselves must lie within the scope of the assignment grant.
     */
    public Mono<List<Site>> checkUserSitesAuthorization(Tenant tenant, UserToken user, User target, Action action,
            List<String> siteIds, AccessOptions options) {
        AuthorizationContext hint = AuthorizationContext.forOwner(target.getId())
                .withSites(siteIds == null ? null : new LinkedHashSet<>(siteIds));
        return checkAssignment(tenant, user, Entity.USERS_SITES, action, hint, Resources.SITE, siteIds, true, options);
    }

    public Mono<List<Asset>> checkSiteAreaAssetsAuthorization(Tenant tenant, UserToken user, SiteArea siteArea,
            Action action, List<String> assetIds, AccessOptions options) {
        return checkAssignment(tenant, user, Entity.SITE_AREA, action, Resources.SITE_AREA.contextOf(siteArea),
                Resources.ASSET, assetIds, false, options);
    }

    public Mono<List<ChargingStation>> checkSiteAreaChargingStationsAuthorization(Tenant tenant, UserToken user,
            SiteArea siteArea, Action action, List<String> chargingStationIds, AccessOptions options) {
        return checkAssignment(tenant, user, Entity.SITE_AREA, action, Resources.SITE_AREA.contextOf(siteArea),
                Resources.CHARGING_STATION, chargingStationIds, false, options);
    }

    private <C extends AuthorizableEntity> Mono<List<C>> checkAssignment(Tenant tenant, UserToken user,
            Entity assignment, Action action, AuthorizationContext parentHint, ResourceType<C> children,
            @Nullable List<String> childIds, boolean scopeChildrenByAssignment, AccessOptions options) {
        return Mono.<List<C>>defer(() -> {
                    if (childIds == null || childIds.isEmpty()) {
                        return this.<List<C>>refuse(tenant, user, new ValidationException(
                                "The " + children.getDisplayName() + "'s IDs must be provided",
                                assignment, action, user.id()));
                    }
                    if (childIds.size() > properties.batch().maxIds()) {
                        return this.<List<C>>refuse(tenant, user, new ValidationException(
                                "At most " + properties.batch().maxIds() + " " + children.getDisplayName()
                                        + " IDs can be processed at once", assignment, action, user.id()));
                    }
                    if (childIds.stream().anyMatch(childId -> childId == null || childId.isBlank())) {
                        return this.<List<C>>refuse(tenant, user, new ValidationException(
                                "The " + children.getDisplayName() + "'s IDs must not be blank",
                                assignment, action, user.id()));
                    }
                    if (!user.belongsTo(tenant)) {
                        return this.<List<C>>refuse(tenant, user, new ForbiddenException(
                                "User does not belong to tenant '" + tenant.id() + "'",
                                assignment, null, action, user.id()));
                    }

                    Set<String> requested = new LinkedHashSet<>(childIds);
                    DynamicDataSources dataSources = options.dataSources() != null
                            ? options.dataSources()
                            : DynamicDataSources.forRequest(tenant, user);

                    return engine.evaluate(tenant, user, assignment, action, parentHint, dataSources)
                            .flatMap(assignmentAuth -> {
                                if (!assignmentAuth.isAuthorized()) {
                                    return this.<List<C>>refuse(tenant, user, new ForbiddenException(
                                            "Not authorized to perform '" + action.getValue() + "' on "
                                                    + assignment.getValue(), assignment, null, action, user.id()));
                                }
                                FilterParams scope = scopeChildrenByAssignment
                                        ? assignmentAuth.getFilters()
                                        : FilterParams.none();
                                return loadChildren(tenant, user, assignment, action, children, requested, scope,
                                        options, dataSources);
                            });
                })
                .doOnError(SystemException.class, e -> systemError(tenant, user, assignment, null, action, e));
    }

    private <C extends AuthorizableEntity> Mono<List<C>> loadChildren(Tenant tenant, UserToken user,
            Entity assignment, Action action, ResourceType<C> children, Set<String> requested,
            FilterParams assignmentScope, AccessOptions options, DynamicDataSources dataSources) {
        return engine.evaluate(tenant, user, children.getEntity(), Action.LIST, AuthorizationContext.empty(), dataSources)
                .flatMap(childAuth -> {
                    if (!childAuth.isAuthorized()) {
                        return this.<List<C>>refuse(tenant, user, new ForbiddenException(
                                "Not authorized to list " + children.getDisplayName() + " entities",
                                assignment, null, action, user.id()));
                    }
                    FilterParams filters = options.additionalFilters()
                            .and(FilterParams.of(FilterParam.IDS, requested))
                            .and(childAuth.getFilters())
                            .and(assignmentScope);
                    List<String> projection = options.applyProjectFields()
                            ? children.projection(childAuth.getProjectFields())
                            : List.of();

                    return entityStore.find(tenant, children, filters, projection, requested.size())
                            .filter(child -> !children.isLogicallyDeleted(child))
                            .filter(childAuth::assertsPass)
                            .collectList()
                            .flatMap(found -> {
                                if (found.size() != requested.size()) {
                                    log.debug("Batch check found {} of {} {} entities for user {}",
                                            found.size(), requested.size(), children.getEntity(), user.id());
                                    return this.<List<C>>refuse(tenant, user, new ForbiddenException(
                                            "Not authorized to perform '" + action.getValue() + "' on all requested "
                                                    + children.getDisplayName() + " entities",
                                            assignment, null, action, user.id()));
                                }
                                for (C child : found) {
                                    if (options.checkIssuer() && children.isIssuerChecked() && !child.isIssuer()) {
                                        return this.<List<C>>refuse(tenant, user, new ExternalEntityException(
                                                children.getDisplayName() + " '" + child.getId()
                                                        + "' not issued by the organization",
                                                children.getEntity(), String.valueOf(child.getId()), action,
                                                user.id()));
                                    }
                                }
                                granted(tenant, user, assignment, null, action);
                                return Mono.just(found);
                            });
                });
    }

    /**
     * List entities visible to the caller, each annotated with its capability flags.
     * A role without a list grant is refused; a role whose filters match nothing gets an empty result.
     */
    public <T extends AuthorizableEntity> Flux<T> listAuthorized(Tenant tenant, UserToken user,
            ResourceType<T> resource, FilterParams additionalFilters) {
        Entity entity = resource.getEntity();
        return Flux.<T>defer(() -> {
                    if (!user.belongsTo(tenant)) {
                        return this.<T>refuse(tenant, user, new ForbiddenException(
                                "User does not belong to tenant '" + tenant.id() + "'",
                                entity, null, Action.LIST, user.id()));
                    }
                    if (engine.resolveStatic(user.role(), entity, Action.LIST).isEmpty()) {
                        return this.<T>refuse(tenant, user, new ForbiddenException(
                                "Not authorized to list " + resource.getDisplayName() + " entities",
                                entity, null, Action.LIST, user.id()));
                    }

                    DynamicDataSources dataSources = DynamicDataSources.forRequest(tenant, user);
                    return engine.evaluate(tenant, user, entity, Action.LIST, AuthorizationContext.empty(), dataSources)
                            .flatMapMany(authorization -> {
                                if (!authorization.isAuthorized()) {
                                    log.debug("List of {} is empty for user {}: {}",
                                            entity, user.id(), authorization.getReason());
                                    return Flux.<T>empty();
                                }
                                FilterParams filters = additionalFilters.and(authorization.getFilters());
                                return entityStore.find(tenant, resource, filters,
                                                resource.projection(authorization.getProjectFields()),
                                                properties.list().maxResults())
                                        .filter(found -> !resource.isLogicallyDeleted(found))
                                        .filter(authorization::assertsPass)
                                        .concatMap(found -> engine.addAuthorizations(
                                                tenant, user, resource, found, null, dataSources));
                            });
                })
                .doOnError(SystemException.class, e -> systemError(tenant, user, entity, null, Action.LIST, e));
    }

    private <T extends AuthorizableEntity> AccessException absent(ResourceType<T> resource, String id, Action action,
            UserToken user, AuthorizationFilter authorization) {
        // A narrowed query cannot tell missing from out of scope.
        if (authorization.isDynamicallyFiltered()) {
            return forbidden(resource, id, action, user);
        }
        return new NotFoundException(resource.getDisplayName() + " ID '" + id + "' does not exist",
                resource.getEntity(), id, action, user.id());
    }

    private static ForbiddenException forbidden(ResourceType<?> resource, String id, Action action, UserToken user) {
        return new ForbiddenException(
                "Not authorized to perform '" + action.getValue() + "' on " + resource.getDisplayName() + " '" + id + "'",
                resource.getEntity(), id, action, user.id());
    }

    private <R> Mono<R> refuse(Tenant tenant, UserToken user, AccessException error) {
        Entity entity = error.getEntity() != null ? error.getEntity() : Entity.TENANT;
        Action action = error.getAction() != null ? error.getAction() : Action.READ;

        log.warn("Access refused ({}): user={}, role={}, entity={}, id={}, action={}, reason={}",
                error.getErrorCode(), user.id(), user.role(), entity, error.getEntityId(), action, error.getMessage());
        metrics.recordRefused(entity, action, error.getErrorCode());
        if (auditService != null) {
            auditService.logDenied(tenant, user, entity, error.getEntityId(), action, error.getMessage());
        }
        return Mono.error(error);
    }

    private void granted(Tenant tenant, UserToken user, Entity entity, @Nullable String id, Action action) {
        log.debug("Access granted: user={}, role={}, entity={}, id={}, action={}",
                user.id(), user.role(), entity, id, action);
        metrics.recordGranted(entity, action);
        if (auditService != null) {
            auditService.logAllowed(tenant, user, entity, id, action);
        }
    }

    private void systemError(Tenant tenant, UserToken user, Entity entity, @Nullable String id, Action action,
            SystemException error) {
        log.error("Access check failed: user={}, entity={}, id={}, action={}, error={}",
                user.id(), entity, id, action, error.getMessage());
        metrics.recordSystemError(entity);
        if (auditService != null) {
            auditService.logError(tenant, user, entity, id, action, error.getMessage());
        }
    }
}
