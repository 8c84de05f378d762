package com.example.emobility.authz.gate;

import com.example.emobility.authz.audit.AccessAuditService;
import com.example.emobility.authz.datasource.DynamicDataSources;
import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.Entity;
import com.example.emobility.authz.model.FilterParam;
import com.example.emobility.authz.model.FilterParams;
import com.example.emobility.authz.model.Role;
import com.example.emobility.authz.resource.Resources;
import com.example.emobility.config.properties.AuthorizationProperties;
import com.example.emobility.exception.ExternalEntityException;
import com.example.emobility.exception.ForbiddenException;
import com.example.emobility.exception.NotFoundException;
import com.example.emobility.exception.SystemException;
import com.example.emobility.exception.ValidationException;
import com.example.emobility.model.Car;
import com.example.emobility.model.CarType;
import com.example.emobility.model.ChargingStation;
import com.example.emobility.model.Company;
import com.example.emobility.model.Site;
import com.example.emobility.model.Tag;
import com.example.emobility.model.User;
import com.example.emobility.observability.metrics.AuthorizationMetrics;
import com.example.emobility.security.context.Tenant;
import com.example.emobility.security.context.UserToken;
import com.example.emobility.storage.EntityStore;
import com.example.emobility.storage.SiteUserRole;
import com.example.emobility.storage.SiteUserStore;
import com.example.emobility.util.AuthorizationEngineTestFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import static com.example.emobility.util.UserTokenTestBuilder.aBasicUser;
import static com.example.emobility.util.UserTokenTestBuilder.aTenant;
import static com.example.emobility.util.UserTokenTestBuilder.aUser;
import static com.example.emobility.util.UserTokenTestBuilder.anAdmin;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EntityAccessGate")
class EntityAccessGateTest {

    @Mock
    private EntityStore entityStore;

    @Mock
    private SiteUserStore siteUserStore;

    @Mock
    private AccessAuditService auditService;

    private SimpleMeterRegistry meterRegistry;
    private EntityAccessGate gate;
    private Tenant tenant;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        gate = new EntityAccessGate(
                AuthorizationEngineTestFactory.engine(siteUserStore),
                entityStore,
                AuthorizationProperties.defaults(),
                new AuthorizationMetrics(meterRegistry),
                auditService);
        tenant = aTenant();
    }

    private void assignSites(UserToken user, String... siteIds) {
        when(siteUserStore.findSiteIds(tenant, user.id(), SiteUserRole.ANY)).thenReturn(Flux.just(siteIds));
    }

    @SuppressWarnings("unchecked")
    private ArgumentCaptor<List<String>> projectionCaptor() {
        return ArgumentCaptor.forClass(List.class);
    }

    @Nested
    @DisplayName("Request validation")
    class RequestValidation {

        @Test
        @DisplayName("should reject a missing ID before any lookup")
        void shouldRejectMissingId() {
            StepVerifier.create(gate.checkAndGetSiteAuthorization(tenant, anAdmin(), " ", Action.READ, AccessOptions.defaults()))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(ValidationException.class);
                        assertThat(error.getMessage()).isEqualTo("The Site ID must be provided");
                    })
                    .verify();

            verifyNoInteractions(entityStore, siteUserStore);
        }

        @Test
        @DisplayName("should reject a non numeric car catalog ID")
        void shouldRejectNonNumericCarCatalogId() {
            StepVerifier.create(gate.checkAndGet(tenant, anAdmin(), Resources.CAR_CATALOG, "abc", Action.READ,
                            AccessOptions.defaults()))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(ValidationException.class);
                        assertThat(error.getMessage()).contains("must be a number");
                    })
                    .verify();
        }

        @Test
        @DisplayName("should refuse a user from another tenant")
        void shouldRefuseUserFromAnotherTenant() {
            UserToken stranger = aUser().withRole(Role.ADMIN).withTenantId("tenant-b").build();

            StepVerifier.create(gate.checkAndGetSiteAuthorization(tenant, stranger, "s1", Action.READ, AccessOptions.defaults()))
                    .expectError(ForbiddenException.class)
                    .verify();

            verifyNoInteractions(entityStore);
        }
    }

    @Nested
    @DisplayName("Single entity checks")
    class SingleEntity {

        @Test
        @DisplayName("should return the site with capability flags for an admin")
        void shouldReturnSiteForAdmin() {
            UserToken admin = anAdmin();
            Site site = Site.builder().id("s1").companyID("c1").name("Main").build();
            ArgumentCaptor<FilterParams> filters = ArgumentCaptor.forClass(FilterParams.class);
            when(entityStore.findOne(eq(tenant), eq(Resources.SITE), filters.capture(), any()))
                    .thenReturn(Mono.just(site));

            StepVerifier.create(gate.checkAndGetSiteAuthorization(tenant, admin, "s1", Action.READ, AccessOptions.defaults()))
                    .assertNext(found -> {
                        assertThat(found.getAuthorizations().can(Action.READ)).isTrue();
                        assertThat(found.getAuthorizations().can(Action.DELETE)).isTrue();
                        assertThat(found.getAuthorizations().can(Action.ASSIGN_USERS_TO_SITE)).isTrue();
                    })
                    .verifyComplete();

            assertThat(filters.getValue()).isEqualTo(FilterParams.of(FilterParam.IDS, "s1"));
            assertThat(meterRegistry.counter("authz.access", "result", "granted").count()).isEqualTo(1.0);
            verify(auditService).logAllowed(tenant, admin, Entity.SITE, "s1", Action.READ);
        }

        @Test
        @DisplayName("should narrow the query and project public fields for a basic user")
        void shouldNarrowQueryForBasicUser() {
            UserToken basic = aBasicUser();
            assignSites(basic, "s1", "s2");
            Site site = Site.builder().id("s1").companyID("c1").build();
            ArgumentCaptor<FilterParams> filters = ArgumentCaptor.forClass(FilterParams.class);
            ArgumentCaptor<List<String>> projection = projectionCaptor();
            when(entityStore.findOne(eq(tenant), eq(Resources.SITE), filters.capture(), projection.capture()))
                    .thenReturn(Mono.just(site));

            StepVerifier.create(gate.checkAndGetSiteAuthorization(tenant, basic, "s1", Action.READ,
                            AccessOptions.defaults().withProjectFields()))
                    .assertNext(found -> {
                        assertThat(found.getAuthorizations().can(Action.READ)).isTrue();
                        assertThat(found.getAuthorizations().can(Action.UPDATE)).isFalse();
                    })
                    .verifyComplete();

            assertThat(filters.getValue().ids(FilterParam.IDS)).contains(Set.of("s1"));
            assertThat(filters.getValue().ids(FilterParam.SITE_IDS)).contains(Set.of("s1"));
            assertThat(projection.getValue()).contains("id", "name", "companyID").doesNotContain("autoUserSiteAssignment");
            verify(siteUserStore, times(1)).findSiteIds(tenant, basic.id(), SiteUserRole.ANY);
        }

        @Test
        @DisplayName("should refuse a basic user on a site they are not assigned to without fetching it")
        void shouldRefuseUnassignedSite() {
            UserToken basic = aBasicUser();
            assignSites(basic, "s2");

            StepVerifier.create(gate.checkAndGetSiteAuthorization(tenant, basic, "s1", Action.READ, AccessOptions.defaults()))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(ForbiddenException.class);
                        assertThat(error.getMessage()).isEqualTo("Not authorized to perform 'Read' on Site 's1'");
                    })
                    .verify();

            verify(entityStore, never()).findOne(any(), any(), any(), any());
            verify(auditService).logDenied(eq(tenant), eq(basic), eq(Entity.SITE), eq("s1"), eq(Action.READ), anyString());
            assertThat(meterRegistry.counter("authz.access", "result", "denied").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should report a missing entity as not found when the query was not narrowed")
        void shouldReportMissingEntityAsNotFound() {
            when(entityStore.findOne(eq(tenant), eq(Resources.SITE), any(), any())).thenReturn(Mono.empty());

            StepVerifier.create(gate.checkAndGetSiteAuthorization(tenant, anAdmin(), "s1", Action.READ, AccessOptions.defaults()))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(NotFoundException.class);
                        assertThat(error.getMessage()).isEqualTo("Site ID 's1' does not exist");
                    })
                    .verify();
        }

        @Test
        @DisplayName("should report a missing entity as forbidden when the query was narrowed")
        void shouldReportMissingEntityAsForbiddenWhenNarrowed() {
            UserToken basic = aBasicUser();
            assignSites(basic, "s1");
            when(entityStore.findOne(eq(tenant), eq(Resources.SITE), any(), any())).thenReturn(Mono.empty());

            StepVerifier.create(gate.checkAndGetSiteAuthorization(tenant, basic, "s1", Action.READ, AccessOptions.defaults()))
                    .expectError(ForbiddenException.class)
                    .verify();
        }

        @Test
        @DisplayName("should report a logically deleted charging station as not found")
        void shouldReportDeletedChargingStation() {
            ChargingStation station = ChargingStation.builder().id("cs1").siteID("s1").deleted(true).build();
            when(entityStore.findOne(eq(tenant), eq(Resources.CHARGING_STATION), any(), any()))
                    .thenReturn(Mono.just(station));

            StepVerifier.create(gate.checkAndGetChargingStationAuthorization(tenant, anAdmin(), "cs1", Action.READ,
                            AccessOptions.defaults()))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(NotFoundException.class);
                        assertThat(error.getMessage()).contains("logically deleted");
                    })
                    .verify();
        }

        @Test
        @DisplayName("should report a deleted external charging station as external before deleted")
        void shouldCheckIssuerBeforeDeletion() {
            ChargingStation station = ChargingStation.builder().id("cs1").siteID("s1")
                    .issuer(false).deleted(true).build();
            when(entityStore.findOne(eq(tenant), eq(Resources.CHARGING_STATION), any(), any()))
                    .thenReturn(Mono.just(station));

            StepVerifier.create(gate.checkAndGetChargingStationAuthorization(tenant, anAdmin(), "cs1", Action.UPDATE,
                            AccessOptions.defaults()))
                    .expectError(ExternalEntityException.class)
                    .verify();
        }

        @Test
        @DisplayName("should refuse an entity issued by another organization")
        void shouldRefuseExternalEntity() {
            Site site = Site.builder().id("s1").issuer(false).build();
            when(entityStore.findOne(eq(tenant), eq(Resources.SITE), any(), any())).thenReturn(Mono.just(site));

            StepVerifier.create(gate.checkAndGetSiteAuthorization(tenant, anAdmin(), "s1", Action.UPDATE, AccessOptions.defaults()))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(ExternalEntityException.class);
                        assertThat(error.getMessage()).isEqualTo("Site 's1' not issued by the organization");
                    })
                    .verify();
        }

        @Test
        @DisplayName("should accept an external entity when the issuer check is disabled")
        void shouldAcceptExternalEntityWithoutIssuerCheck() {
            Site site = Site.builder().id("s1").issuer(false).build();
            when(entityStore.findOne(eq(tenant), eq(Resources.SITE), any(), any())).thenReturn(Mono.just(site));

            StepVerifier.create(gate.checkAndGetSiteAuthorization(tenant, anAdmin(), "s1", Action.READ,
                            AccessOptions.defaults().withoutIssuerCheck()))
                    .expectNext(site)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse when the loaded entity fails the final action check")
        void shouldRefuseWhenFinalCheckFails() {
            UserToken basic = aBasicUser();
            assignSites(basic, "s1");
            Car car = Car.builder().id("car1").userID("someone-else").type(CarType.PRIVATE)
                    .siteIDs(List.of("s1")).build();
            when(entityStore.findOne(eq(tenant), eq(Resources.CAR), any(), any())).thenReturn(Mono.just(car));

            StepVerifier.create(gate.checkAndGetCarAuthorization(tenant, basic, "car1", Action.READ, AccessOptions.defaults()))
                    .expectError(ForbiddenException.class)
                    .verify();
        }

        @Test
        @DisplayName("should find a tag by visual ID for its owner")
        void shouldFindTagByVisualId() {
            UserToken basic = aBasicUser();
            Tag tag = Tag.builder().id("t1").visualID("V-1").userID(basic.id()).build();
            ArgumentCaptor<FilterParams> filters = ArgumentCaptor.forClass(FilterParams.class);
            when(entityStore.findOne(eq(tenant), eq(Resources.TAG), filters.capture(), any())).thenReturn(Mono.just(tag));

            StepVerifier.create(gate.checkAndGetTagByVisualIdAuthorization(tenant, basic, "V-1", Action.READ,
                            AccessOptions.defaults()))
                    .assertNext(found -> assertThat(found.getAuthorizations().can(Action.UPDATE)).isTrue())
                    .verifyComplete();

            assertThat(filters.getValue().ids(FilterParam.VISUAL_IDS)).contains(Set.of("V-1"));
            assertThat(filters.getValue().ids(FilterParam.USER_IDS)).contains(Set.of(basic.id()));
        }

        @Test
        @DisplayName("should propagate storage failures as system errors")
        void shouldPropagateStorageFailures() {
            when(entityStore.findOne(eq(tenant), eq(Resources.SITE), any(), any()))
                    .thenReturn(Mono.error(new SystemException("mongodb", "timeout", null)));

            StepVerifier.create(gate.checkAndGetSiteAuthorization(tenant, anAdmin(), "s1", Action.READ, AccessOptions.defaults()))
                    .expectError(SystemException.class)
                    .verify();

            assertThat(meterRegistry.counter("authz.access.errors", "entity", "site").count()).isEqualTo(1.0);
            verify(auditService, never()).logDenied(any(), any(), any(), any(), any(), any());
        }
    }

    @Nested
    @DisplayName("Batch assignment checks")
    class BatchAssignment {

        private final Site site = Site.builder().id("s1").companyID("c1").build();

        @Test
        @DisplayName("should require at least one user ID")
        void shouldRequireUserIds() {
            StepVerifier.create(gate.checkSiteUsersAuthorization(tenant, anAdmin(), site, Action.ASSIGN, List.of(),
                            AccessOptions.defaults()))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(ValidationException.class);
                        assertThat(error.getMessage()).isEqualTo("The User's IDs must be provided");
                    })
                    .verify();
        }

        @Test
        @DisplayName("should return every requested user when all are accessible")
        void shouldReturnAllUsers() {
            User first = User.builder().id("u1").build();
            User second = User.builder().id("u2").build();
            when(entityStore.find(eq(tenant), eq(Resources.USER), any(), any(), anyInt()))
                    .thenReturn(Flux.just(first, second));

            StepVerifier.create(gate.checkSiteUsersAuthorization(tenant, anAdmin(), site, Action.ASSIGN,
                            List.of("u1", "u2", "u1"), AccessOptions.defaults()))
                    .assertNext(users -> assertThat(users).extracting(User::getId).containsExactly("u1", "u2"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse the whole batch when one user is not visible")
        void shouldRefuseWhenOneUserMissing() {
            when(entityStore.find(eq(tenant), eq(Resources.USER), any(), any(), anyInt()))
                    .thenReturn(Flux.just(User.builder().id("u1").build()));

            StepVerifier.create(gate.checkSiteUsersAuthorization(tenant, anAdmin(), site, Action.ASSIGN,
                            List.of("u1", "u2"), AccessOptions.defaults()))
                    .expectError(ForbiddenException.class)
                    .verify();
        }

        @Test
        @DisplayName("should refuse a batch containing an external user")
        void shouldRefuseExternalUser() {
            when(entityStore.find(eq(tenant), eq(Resources.USER), any(), any(), anyInt()))
                    .thenReturn(Flux.just(User.builder().id("u1").issuer(false).build()));

            StepVerifier.create(gate.checkSiteUsersAuthorization(tenant, anAdmin(), site, Action.UNASSIGN,
                            List.of("u1"), AccessOptions.defaults()))
                    .expectError(ExternalEntityException.class)
                    .verify();
        }

        @Test
        @DisplayName("should refuse a site admin assigning users to a site they do not administer")
        void shouldRefuseSiteAdminOutsideTheirSites() {
            UserToken siteAdmin = aUser().withId("sa1").withRole(Role.SITE_ADMIN).build();
            when(siteUserStore.findSiteIds(tenant, "sa1", SiteUserRole.ADMIN)).thenReturn(Flux.just("s9"));

            StepVerifier.create(gate.checkSiteUsersAuthorization(tenant, siteAdmin, site, Action.ASSIGN,
                            List.of("u1"), AccessOptions.defaults()))
                    .expectError(ForbiddenException.class)
                    .verify();

            verify(entityStore, never()).find(any(), any(), any(), any(), anyInt());
        }

        @Test
        @DisplayName("should scope sites by the assignment grant when assigning sites to a user")
        void shouldScopeSitesByAssignmentGrant() {
            UserToken siteAdmin = aUser().withId("sa1").withRole(Role.SITE_ADMIN).build();
            when(siteUserStore.findSiteIds(tenant, "sa1", SiteUserRole.ADMIN)).thenReturn(Flux.just("s1", "s2"));
            when(siteUserStore.findSiteIds(tenant, "sa1", SiteUserRole.ANY)).thenReturn(Flux.just("s1", "s2", "s3"));
            ArgumentCaptor<FilterParams> filters = ArgumentCaptor.forClass(FilterParams.class);
            when(entityStore.find(eq(tenant), eq(Resources.SITE), filters.capture(), any(), anyInt()))
                    .thenReturn(Flux.just(Site.builder().id("s1").build()));
            User target = User.builder().id("u7").build();

            StepVerifier.create(gate.checkUserSitesAuthorization(tenant, siteAdmin, target, Action.ASSIGN,
                            List.of("s1"), AccessOptions.defaults()))
                    .assertNext(sites -> assertThat(sites).hasSize(1))
                    .verifyComplete();

            assertThat(filters.getValue().ids(FilterParam.SITE_IDS)).contains(Set.of("s1"));
        }

        @Test
        @DisplayName("should fetch each data source once across the site check and the user batch")
        void shouldShareDataSourcesWithSiteCheck() {
            UserToken siteAdmin = aUser().withId("sa1").withRole(Role.SITE_ADMIN).build();
            when(siteUserStore.findSiteIds(tenant, "sa1", SiteUserRole.ADMIN)).thenReturn(Flux.just("s1"));
            when(siteUserStore.findSiteIds(tenant, "sa1", SiteUserRole.ANY)).thenReturn(Flux.just("s1"));
            when(entityStore.findOne(eq(tenant), eq(Resources.SITE), any(), any())).thenReturn(Mono.just(site));
            when(entityStore.find(eq(tenant), eq(Resources.USER), any(), any(), anyInt()))
                    .thenReturn(Flux.just(User.builder().id("u1").build()));
            AccessOptions options = AccessOptions.defaults()
                    .withDataSources(DynamicDataSources.forRequest(tenant, siteAdmin));

            StepVerifier.create(gate.checkAndGetSiteAuthorization(tenant, siteAdmin, "s1", Action.ASSIGN_USERS_TO_SITE,
                                    options)
                            .flatMap(found -> gate.checkSiteUsersAuthorization(tenant, siteAdmin, found, Action.ASSIGN,
                                    List.of("u1"), options)))
                    .assertNext(users -> assertThat(users).extracting(User::getId).containsExactly("u1"))
                    .verifyComplete();

            verify(siteUserStore, times(1)).findSiteIds(tenant, "sa1", SiteUserRole.ADMIN);
            verify(siteUserStore, times(1)).findSiteIds(tenant, "sa1", SiteUserRole.ANY);
        }

        @Test
        @DisplayName("should apply additional filters and projection to the requested children")
        void shouldApplyOptionsToChildren() {
            UserToken siteAdmin = aUser().withId("sa1").withRole(Role.SITE_ADMIN).build();
            when(siteUserStore.findSiteIds(tenant, "sa1", SiteUserRole.ADMIN)).thenReturn(Flux.just("s1"));
            ArgumentCaptor<FilterParams> filters = ArgumentCaptor.forClass(FilterParams.class);
            ArgumentCaptor<List<String>> projection = projectionCaptor();
            when(entityStore.find(eq(tenant), eq(Resources.USER), filters.capture(), projection.capture(), anyInt()))
                    .thenReturn(Flux.just(User.builder().id("u1").build()));

            StepVerifier.create(gate.checkSiteUsersAuthorization(tenant, siteAdmin, site, Action.ASSIGN, List.of("u1"),
                            AccessOptions.defaults().withAdditionalFilters(FilterParams.issuer(true)).withProjectFields()))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(filters.getValue().flag(FilterParam.ISSUER)).contains(true);
            assertThat(filters.getValue().ids(FilterParam.IDS)).contains(Set.of("u1"));
            assertThat(filters.getValue().ids(FilterParam.SITE_IDS)).contains(Set.of("s1"));
            assertThat(projection.getValue()).contains("id", "name", "email").doesNotContain("password");
        }

        @Test
        @DisplayName("should refuse data sources opened for another user")
        void shouldRefuseForeignDataSources() {
            UserToken admin = anAdmin();
            AccessOptions options = AccessOptions.defaults()
                    .withDataSources(DynamicDataSources.forRequest(tenant, aBasicUser()));

            StepVerifier.create(gate.checkSiteUsersAuthorization(tenant, admin, site, Action.ASSIGN, List.of("u1"),
                            options))
                    .expectError(IllegalStateException.class)
                    .verify();

            verifyNoInteractions(entityStore);
        }
    }

    @Nested
    @DisplayName("Listing")
    class Listing {

        @Test
        @DisplayName("should refuse a role without a list grant")
        void shouldRefuseWithoutListGrant() {
            UserToken demo = aUser().withRole(Role.DEMO).build();

            StepVerifier.create(gate.listAuthorized(tenant, demo, Resources.TAG, FilterParams.none()))
                    .expectError(ForbiddenException.class)
                    .verify();
        }

        @Test
        @DisplayName("should return nothing when the user reaches no site")
        void shouldReturnNothingWithoutSites() {
            UserToken basic = aBasicUser();
            when(siteUserStore.findSiteIds(tenant, basic.id(), SiteUserRole.ANY)).thenReturn(Flux.empty());

            StepVerifier.create(gate.listAuthorized(tenant, basic, Resources.SITE, FilterParams.none()))
                    .verifyComplete();

            verifyNoInteractions(entityStore);
        }

        @Test
        @DisplayName("should annotate every row while fetching data sources once")
        void shouldAnnotateRowsWithSharedDataSources() {
            UserToken basic = aBasicUser();
            assignSites(basic, "s1", "s2");
            when(entityStore.find(eq(tenant), eq(Resources.SITE), any(), any(), anyInt()))
                    .thenReturn(Flux.just(Site.builder().id("s1").build(), Site.builder().id("s2").build()));

            StepVerifier.create(gate.listAuthorized(tenant, basic, Resources.SITE, FilterParams.none()))
                    .assertNext(site -> assertThat(site.getAuthorizations().can(Action.READ)).isTrue())
                    .assertNext(site -> assertThat(site.getAuthorizations().can(Action.READ)).isTrue())
                    .verifyComplete();

            verify(siteUserStore, times(1)).findSiteIds(tenant, basic.id(), SiteUserRole.ANY);
        }

        @Test
        @DisplayName("should only list locally issued tags for admins")
        void shouldListLocalTagsForAdmins() {
            ArgumentCaptor<FilterParams> filters = ArgumentCaptor.forClass(FilterParams.class);
            when(entityStore.find(eq(tenant), eq(Resources.TAG), filters.capture(), any(), anyInt()))
                    .thenReturn(Flux.empty());

            StepVerifier.create(gate.listAuthorized(tenant, anAdmin(), Resources.TAG, FilterParams.none()))
                    .verifyComplete();

            assertThat(filters.getValue().flag(FilterParam.ISSUER)).contains(true);
        }
    }

    @Nested
    @DisplayName("Reference behaviours")
    class ReferenceBehaviours {

        @Test
        @DisplayName("should refuse a site admin reading a site area of a site they are not assigned to")
        void shouldRefuseSiteAdminOnForeignSiteArea() {
            UserToken siteAdmin = aUser().withId("sa1").withRole(Role.SITE_ADMIN).build();
            assignSites(siteAdmin, "S1");
            ArgumentCaptor<FilterParams> filters = ArgumentCaptor.forClass(FilterParams.class);
            when(entityStore.findOne(eq(tenant), eq(Resources.SITE_AREA), filters.capture(), any()))
                    .thenReturn(Mono.empty());

            StepVerifier.create(gate.checkAndGetSiteAreaAuthorization(tenant, siteAdmin, "area-in-S2", Action.READ,
                            AccessOptions.defaults()))
                    .expectError(ForbiddenException.class)
                    .verify();

            assertThat(filters.getValue().ids(FilterParam.SITE_IDS)).contains(Set.of("S1"));
        }

        @Test
        @DisplayName("should let a basic user read their own user with the read flag set")
        void shouldLetBasicUserReadThemselves() {
            UserToken basic = aBasicUser();
            User self = User.builder().id(basic.id()).name("Self").build();
            when(entityStore.findOne(eq(tenant), eq(Resources.USER), any(), any())).thenReturn(Mono.just(self));

            StepVerifier.create(gate.checkAndGetUserAuthorization(tenant, basic, basic.id(), Action.READ,
                            AccessOptions.defaults()))
                    .assertNext(found -> {
                        assertThat(found.getAuthorizations().can(Action.READ)).isTrue();
                        assertThat(found.getAuthorizations().can(Action.DELETE)).isFalse();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse another user's profile to a basic user without fetching it")
        void shouldRefuseOtherUserProfile() {
            StepVerifier.create(gate.checkAndGetUserAuthorization(tenant, aBasicUser(), "someone-else", Action.READ,
                            AccessOptions.defaults()))
                    .expectError(ForbiddenException.class)
                    .verify();

            verifyNoInteractions(entityStore);
        }

        @Test
        @DisplayName("should refuse an admin an external charging station despite the unconditional grant")
        void shouldRefuseAdminExternalChargingStation() {
            ChargingStation station = ChargingStation.builder().id("cs1").siteID("s1").issuer(false).build();
            when(entityStore.findOne(eq(tenant), eq(Resources.CHARGING_STATION), any(), any()))
                    .thenReturn(Mono.just(station));

            StepVerifier.create(gate.checkAndGetChargingStationAuthorization(tenant, anAdmin(), "cs1", Action.READ,
                            AccessOptions.defaults()))
                    .expectError(ExternalEntityException.class)
                    .verify();
        }

        @Test
        @DisplayName("should fetch assigned site companies once while annotating fifty rows")
        void shouldFetchCompaniesOnceForFiftyRows() {
            UserToken basic = aBasicUser();
            List<String> companyIds = IntStream.range(0, 50).mapToObj(i -> "c" + i).toList();
            when(siteUserStore.findSiteIds(tenant, basic.id(), SiteUserRole.ANY)).thenReturn(Flux.just("s1"));
            when(siteUserStore.findCompanyIds(eq(tenant), any())).thenReturn(Flux.fromIterable(companyIds));
            when(entityStore.find(eq(tenant), eq(Resources.COMPANY), any(), any(), anyInt()))
                    .thenReturn(Flux.fromIterable(companyIds).map(id -> Company.builder().id(id).build()));

            StepVerifier.create(gate.listAuthorized(tenant, basic, Resources.COMPANY, FilterParams.none()))
                    .thenConsumeWhile(company -> company.getAuthorizations().can(Action.READ))
                    .verifyComplete();

            verify(siteUserStore, times(1)).findSiteIds(tenant, basic.id(), SiteUserRole.ANY);
            verify(siteUserStore, times(1)).findCompanyIds(eq(tenant), any());
        }

        @Test
        @DisplayName("should refuse a batch of three users when the third is invisible")
        void shouldRefuseBatchWithInvisibleUser() {
            Site site = Site.builder().id("s1").companyID("c1").build();
            when(entityStore.find(eq(tenant), eq(Resources.USER), any(), any(), anyInt()))
                    .thenReturn(Flux.just(User.builder().id("u1").build(), User.builder().id("u2").build()));

            StepVerifier.create(gate.checkSiteUsersAuthorization(tenant, anAdmin(), site, Action.ASSIGN,
                            List.of("u1", "u2", "u3"), AccessOptions.defaults()))
                    .expectError(ForbiddenException.class)
                    .verify();
        }
    }
}
